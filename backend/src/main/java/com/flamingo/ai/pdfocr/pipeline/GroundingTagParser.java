package com.flamingo.ai.pdfocr.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Extracts layout regions from grounding tags of the form {@code
 * <|ref|>label<|/ref|><|det|>[[x1, y1, x2, y2], ...]<|/det|>}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GroundingTagParser {

  static final Pattern GROUNDING_TAG =
      Pattern.compile("(<\\|ref\\|>(.*?)<\\|/ref\\|><\\|det\\|>(.*?)<\\|/det\\|>)", Pattern.DOTALL);

  private final ObjectMapper objectMapper;

  /** Returns the regions in order of appearance. Tags with unreadable coordinates have no boxes. */
  public List<LayoutRegion> parse(String text) {
    List<LayoutRegion> regions = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return regions;
    }
    Matcher matcher = GROUNDING_TAG.matcher(text);
    while (matcher.find()) {
      String label = matcher.group(2).trim();
      regions.add(new LayoutRegion(label, parseBoxes(matcher.group(3)), matcher.group(1)));
    }
    return regions;
  }

  List<LayoutRegion.Box> parseBoxes(String coordinates) {
    List<LayoutRegion.Box> boxes = new ArrayList<>();
    double[][] points;
    try {
      String trimmed = coordinates.trim();
      if (trimmed.startsWith("[[")) {
        points = objectMapper.readValue(trimmed, double[][].class);
      } else {
        points = new double[][] {objectMapper.readValue(trimmed, double[].class)};
      }
    } catch (JsonProcessingException e) {
      log.warn("Ignoring unreadable grounding coordinates '{}': {}", coordinates, e.getMessage());
      return boxes;
    }
    for (double[] point : points) {
      if (point == null || point.length != 4) {
        log.warn("Ignoring grounding box with {} values", point == null ? 0 : point.length);
        continue;
      }
      boxes.add(new LayoutRegion.Box(point[0], point[1], point[2], point[3]));
    }
    return boxes;
  }
}
