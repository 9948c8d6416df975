package com.flamingo.ai.pdfocr.api.rest;

import com.flamingo.ai.pdfocr.pipeline.OcrEngine;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. Not behind authentication. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final OcrEngine ocrEngine;

  /** Liveness plus whether the inference server is up. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "pdf-ocr");
    health.put("modelLoaded", ocrEngine.isReady());
    return ResponseEntity.ok(health);
  }
}
