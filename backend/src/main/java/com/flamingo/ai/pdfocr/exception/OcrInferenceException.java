package com.flamingo.ai.pdfocr.exception;

/** Exception thrown when the inference server cannot recognize a page. */
public class OcrInferenceException extends RuntimeException {

  public OcrInferenceException(String message) {
    super(message);
  }

  public OcrInferenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
