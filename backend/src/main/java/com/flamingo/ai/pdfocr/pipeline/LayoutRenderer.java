package com.flamingo.ai.pdfocr.pipeline;

import java.awt.image.BufferedImage;
import java.util.List;

/** Draws detected layout regions onto a page image. */
public interface LayoutRenderer {

  /** Returns a new image; {@code page} is left untouched. */
  BufferedImage renderLayout(BufferedImage page, List<LayoutRegion> regions);
}
