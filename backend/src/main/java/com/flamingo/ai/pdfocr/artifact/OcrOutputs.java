package com.flamingo.ai.pdfocr.artifact;

import java.util.Map;

/**
 * The full output set of a job, published in one step.
 *
 * @param markdown primary text
 * @param annotatedMarkdown text with grounding annotations
 * @param layoutPdf rendered layout document, {@code null} when every page was skipped
 * @param images cropped images keyed by file name
 */
public record OcrOutputs(
    String markdown, String annotatedMarkdown, byte[] layoutPdf, Map<String, byte[]> images) {

  public OcrOutputs {
    images = Map.copyOf(images);
  }
}
