package com.flamingo.ai.pdfocr.pipeline;

import java.awt.AlphaComposite;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.List;
import org.springframework.stereotype.Component;

/** Draws region outlines, a translucent fill and the region label with Java2D. */
@Component
public class Java2dLayoutRenderer implements LayoutRenderer {

  private static final Color[] PALETTE = {
    new Color(230, 25, 75),
    new Color(60, 180, 75),
    new Color(0, 130, 200),
    new Color(245, 130, 48),
    new Color(145, 30, 180),
    new Color(70, 200, 200),
    new Color(240, 50, 230),
    new Color(128, 128, 0)
  };

  private static final float FILL_ALPHA = 0.08f;
  private static final Font LABEL_FONT = new Font(Font.SANS_SERIF, Font.BOLD, 14);

  @Override
  public BufferedImage renderLayout(BufferedImage page, List<LayoutRegion> regions) {
    BufferedImage canvas =
        new BufferedImage(page.getWidth(), page.getHeight(), BufferedImage.TYPE_INT_RGB);
    Graphics2D g = canvas.createGraphics();
    try {
      g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
      g.drawImage(page, 0, 0, null);
      g.setFont(LABEL_FONT);
      for (LayoutRegion region : regions) {
        Color color = colorFor(region.label());
        float width = LayoutRegion.TITLE_LABEL.equals(region.label()) ? 4f : 2f;
        for (LayoutRegion.Box box : region.boxes()) {
          LayoutRegion.PixelBox px = box.toPixels(page.getWidth(), page.getHeight());
          if (px.isEmpty()) {
            continue;
          }
          g.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, FILL_ALPHA));
          g.setColor(color);
          g.fillRect(px.x1(), px.y1(), px.width(), px.height());

          g.setComposite(AlphaComposite.SrcOver);
          g.setStroke(new BasicStroke(width));
          g.drawRect(px.x1(), px.y1(), px.width(), px.height());

          int textY = Math.max(g.getFontMetrics().getAscent(), px.y1() - 4);
          g.drawString(region.label(), px.x1(), textY);
        }
      }
    } finally {
      g.dispose();
    }
    return canvas;
  }

  // stable per label so the same region type always gets the same color
  static Color colorFor(String label) {
    return PALETTE[Math.floorMod(label.hashCode(), PALETTE.length)];
  }
}
