package com.flamingo.ai.pdfocr.pipeline;

import java.awt.image.BufferedImage;

/**
 * A rasterized page with its recognition result.
 *
 * @param pageIndex zero-based page number
 * @param included false when the page was recognized but left out of the outputs
 */
public record RecognizedPage(
    int pageIndex, BufferedImage image, OcrPageResult result, boolean included) {}
