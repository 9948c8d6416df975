package com.flamingo.ai.pdfocr.pipeline;

import com.flamingo.ai.pdfocr.config.OcrConfig;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;

/** Renders PDF pages with PDFBox at the configured DPI. */
@Component
@RequiredArgsConstructor
@Slf4j
public class PdfBoxRasterizer implements PdfRasterizer {

  private final OcrConfig ocrConfig;

  @Override
  public List<BufferedImage> rasterize(byte[] pdf) throws IOException {
    float dpi = ocrConfig.getRasterization().getDpi();
    try (PDDocument document = Loader.loadPDF(pdf)) {
      PDFRenderer renderer = new PDFRenderer(document);
      int pageCount = document.getNumberOfPages();
      List<BufferedImage> pages = new ArrayList<>(pageCount);
      for (int i = 0; i < pageCount; i++) {
        // RGB drops alpha so pages can be JPEG encoded later
        pages.add(renderer.renderImageWithDPI(i, dpi, ImageType.RGB));
      }
      log.debug("Rasterized {} pages at {} DPI", pageCount, dpi);
      return pages;
    }
  }
}
