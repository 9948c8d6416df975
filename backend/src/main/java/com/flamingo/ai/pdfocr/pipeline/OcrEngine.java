package com.flamingo.ai.pdfocr.pipeline;

import java.awt.image.BufferedImage;

/** The external page recognizer. Calls may block for a long time or fail. */
public interface OcrEngine {

  /**
   * Recognizes one page.
   *
   * @throws com.flamingo.ai.pdfocr.exception.OcrInferenceException if the page cannot be
   *     recognized
   */
  OcrPageResult infer(BufferedImage page);

  /** Whether the recognizer is loaded and reachable. */
  boolean isReady();
}
