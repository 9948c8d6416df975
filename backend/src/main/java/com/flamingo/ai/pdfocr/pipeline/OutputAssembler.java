package com.flamingo.ai.pdfocr.pipeline;

import com.flamingo.ai.pdfocr.artifact.OcrOutputs;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.imageio.ImageIO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds the published outputs of a job from its recognized pages: clean markdown, markdown with
 * grounding tags, the layout PDF and the cropped figures.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutputAssembler {

  static final String PAGE_SPLIT = "\n<--- Page Split --->";
  static final String IMAGE_DIR = "images/";

  private final LayoutRenderer layoutRenderer;
  private final LayoutPdfWriter layoutPdfWriter;

  public OcrOutputs assemble(List<RecognizedPage> pages) throws IOException {
    StringBuilder markdown = new StringBuilder();
    StringBuilder annotated = new StringBuilder();
    Map<String, byte[]> images = new LinkedHashMap<>();
    List<BufferedImage> layoutPages = new ArrayList<>(pages.size());

    for (RecognizedPage page : pages) {
      if (!page.included()) {
        continue;
      }
      String text = page.result().text();
      String clean = text;
      int imageIndex = 0;
      for (LayoutRegion region : page.result().regions()) {
        StringBuilder replacement = new StringBuilder();
        if (region.isImage()) {
          for (LayoutRegion.Box box : region.boxes()) {
            BufferedImage crop = crop(page.image(), box);
            if (crop == null) {
              continue;
            }
            String name = page.pageIndex() + "_" + imageIndex++ + ".jpg";
            images.put(name, encodeJpeg(crop));
            replacement.append("![](").append(IMAGE_DIR).append(name).append(")\n");
          }
        }
        clean = replaceFirst(clean, region.tag(), replacement.toString());
      }
      annotated.append(text).append('\n').append(PAGE_SPLIT).append('\n');
      markdown.append(cleanup(clean)).append('\n').append(PAGE_SPLIT).append('\n');
      layoutPages.add(layoutRenderer.renderLayout(page.image(), page.result().regions()));
    }

    log.debug(
        "Assembled outputs: {} of {} pages, {} images",
        layoutPages.size(),
        pages.size(),
        images.size());
    byte[] layoutPdf = layoutPages.isEmpty() ? null : layoutPdfWriter.write(layoutPages);
    return new OcrOutputs(markdown.toString(), annotated.toString(), layoutPdf, images);
  }

  static String cleanup(String text) {
    return text.replace("\\coloneqq", ":=")
        .replace("\\eqqcolon", "=:")
        .replace("\n\n\n\n", "\n\n")
        .replace("\n\n\n", "\n\n");
  }

  private static String replaceFirst(String text, String target, String replacement) {
    int at = text.indexOf(target);
    if (at < 0) {
      return text;
    }
    return text.substring(0, at) + replacement + text.substring(at + target.length());
  }

  private static BufferedImage crop(BufferedImage page, LayoutRegion.Box box) {
    LayoutRegion.PixelBox px = box.toPixels(page.getWidth(), page.getHeight());
    if (px.isEmpty()) {
      return null;
    }
    return page.getSubimage(px.x1(), px.y1(), px.width(), px.height());
  }

  private static byte[] encodeJpeg(BufferedImage image) throws IOException {
    BufferedImage rgb = image;
    if (image.getType() != BufferedImage.TYPE_INT_RGB) {
      rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
      Graphics2D g = rgb.createGraphics();
      g.drawImage(image, 0, 0, null);
      g.dispose();
    }
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    if (!ImageIO.write(rgb, "jpg", out)) {
      throw new IOException("No JPEG writer available");
    }
    return out.toByteArray();
  }
}
