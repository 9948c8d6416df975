package com.flamingo.ai.pdfocr.pipeline;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.JPEGFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.springframework.stereotype.Component;

/** Combines page images into a PDF, one image per page sized to the image. */
@Component
public class LayoutPdfWriter {

  private static final float JPEG_QUALITY = 0.9f;

  public byte[] write(List<BufferedImage> pages) throws IOException {
    if (pages.isEmpty()) {
      throw new IllegalArgumentException("Cannot write a layout PDF without pages");
    }
    try (PDDocument document = new PDDocument()) {
      for (BufferedImage image : pages) {
        PDRectangle size = new PDRectangle(image.getWidth(), image.getHeight());
        PDPage page = new PDPage(size);
        document.addPage(page);
        PDImageXObject xObject = JPEGFactory.createFromImage(document, image, JPEG_QUALITY);
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
          content.drawImage(xObject, 0, 0, size.getWidth(), size.getHeight());
        }
      }
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      document.save(out);
      return out.toByteArray();
    }
  }
}
