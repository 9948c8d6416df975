package com.flamingo.ai.pdfocr.pipeline;

import java.util.List;

/**
 * A labelled region the recognizer grounded on the page.
 *
 * @param label region type, e.g. {@code title}, {@code text}, {@code image}
 * @param boxes bounding boxes in coordinates normalised to 0..999
 * @param tag the raw grounding tag as it appears in the recognized text
 */
public record LayoutRegion(String label, List<Box> boxes, String tag) {

  public static final String IMAGE_LABEL = "image";
  public static final String TITLE_LABEL = "title";

  /** Largest normalised coordinate value. */
  public static final double COORDINATE_SCALE = 999.0;

  public LayoutRegion {
    boxes = List.copyOf(boxes);
  }

  public boolean isImage() {
    return IMAGE_LABEL.equals(label);
  }

  /** Bounding box with normalised corners. */
  public record Box(double x1, double y1, double x2, double y2) {

    /** Scales the box to pixel coordinates of a {@code width x height} image, clamped. */
    public PixelBox toPixels(int width, int height) {
      return new PixelBox(
          clamp(x1 / COORDINATE_SCALE * width, width),
          clamp(y1 / COORDINATE_SCALE * height, height),
          clamp(x2 / COORDINATE_SCALE * width, width),
          clamp(y2 / COORDINATE_SCALE * height, height));
    }

    private static int clamp(double value, int max) {
      return (int) Math.max(0, Math.min(max, value));
    }
  }

  /** Bounding box in pixels. */
  public record PixelBox(int x1, int y1, int x2, int y2) {

    public int width() {
      return x2 - x1;
    }

    public int height() {
      return y2 - y1;
    }

    public boolean isEmpty() {
      return width() <= 0 || height() <= 0;
    }
  }
}
