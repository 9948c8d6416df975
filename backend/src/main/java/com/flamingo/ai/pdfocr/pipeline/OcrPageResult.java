package com.flamingo.ai.pdfocr.pipeline;

import java.util.List;

/**
 * Recognition result for one page.
 *
 * @param text recognized text with grounding tags, end-of-sequence marker removed
 * @param regions layout regions parsed from the grounding tags
 * @param complete false when generation stopped before the end-of-sequence marker
 */
public record OcrPageResult(String text, List<LayoutRegion> regions, boolean complete) {

  public OcrPageResult {
    regions = List.copyOf(regions);
  }
}
