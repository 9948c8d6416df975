package com.flamingo.ai.pdfocr.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import java.awt.image.BufferedImage;
import java.util.List;
import org.junit.jupiter.api.Test;

class Java2dLayoutRendererTest {

  private final Java2dLayoutRenderer renderer = new Java2dLayoutRenderer();

  @Test
  void shouldReturnNewImageOfSameSize() {
    BufferedImage page = new BufferedImage(120, 80, BufferedImage.TYPE_INT_RGB);
    page.setRGB(5, 5, 0x00FF00);

    BufferedImage rendered = renderer.renderLayout(page, List.of());

    assertThat(rendered).isNotSameAs(page);
    assertThat(rendered.getWidth()).isEqualTo(120);
    assertThat(rendered.getHeight()).isEqualTo(80);
    assertThat(rendered.getRGB(5, 5) & 0xFFFFFF).isEqualTo(0x00FF00);
  }

  @Test
  void sameLabelShouldAlwaysGetSameColor() {
    assertThat(Java2dLayoutRenderer.colorFor("table"))
        .isEqualTo(Java2dLayoutRenderer.colorFor("table"));
  }
}
