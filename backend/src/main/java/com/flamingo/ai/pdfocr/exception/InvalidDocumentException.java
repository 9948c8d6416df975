package com.flamingo.ai.pdfocr.exception;

/** Exception thrown when an uploaded document is rejected before a job is created. */
public class InvalidDocumentException extends RuntimeException {

  private final String userMessage;

  public InvalidDocumentException(String message, String userMessage) {
    super(message);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
