package com.flamingo.ai.pdfocr.pipeline;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;

/** Turns a PDF into one RGB image per page, in page order. */
public interface PdfRasterizer {

  List<BufferedImage> rasterize(byte[] pdf) throws IOException;
}
