package com.flamingo.ai.pdfocr.pipeline;

import com.flamingo.ai.pdfocr.config.OcrConfig;
import com.flamingo.ai.pdfocr.exception.OcrInferenceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.netty.channel.ChannelOption;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Base64;
import javax.imageio.ImageIO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * HTTP client for the OCR inference server. Sends each page as a base64 PNG together with the
 * grounding prompt and parses the returned text.
 */
@Component
@Slf4j
public class HttpOcrEngine implements OcrEngine {

  /** Emitted by the model when generation finished normally. */
  static final String END_OF_SENTENCE = "<｜end▁of▁sentence｜>";

  private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(5);

  private final WebClient webClient;
  private final GroundingTagParser groundingTagParser;
  private final String prompt;
  private final int readTimeoutMs;

  public HttpOcrEngine(OcrConfig ocrConfig, GroundingTagParser groundingTagParser) {
    OcrConfig.Inference inference = ocrConfig.getInference();
    this.groundingTagParser = groundingTagParser;
    this.prompt = inference.getPrompt();
    this.readTimeoutMs = inference.getReadTimeoutMs();
    HttpClient httpClient =
        HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, inference.getConnectTimeoutMs());
    this.webClient =
        WebClient.builder()
            .baseUrl(inference.getBaseUrl())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
            .build();
    log.info("OCR inference client initialized: baseUrl={}", inference.getBaseUrl());
  }

  @Override
  @Timed(value = "ocr.inference", description = "Time to recognize one page")
  @CircuitBreaker(name = "ocr-inference")
  @Retry(name = "ocr-inference")
  public OcrPageResult infer(BufferedImage page) {
    InferRequest request = new InferRequest(encodePng(page), prompt);
    InferResponse response;
    try {
      response =
          webClient
              .post()
              .uri("/infer")
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(request)
              .retrieve()
              .bodyToMono(InferResponse.class)
              .timeout(Duration.ofMillis(readTimeoutMs))
              .block();
    } catch (RuntimeException e) {
      // covers WebClientException and the timeout that block() rethrows unchecked
      throw new OcrInferenceException("Inference request failed: " + e.getMessage(), e);
    }
    if (response == null || response.text() == null) {
      throw new OcrInferenceException("Inference server returned no text");
    }
    return toPageResult(response.text());
  }

  OcrPageResult toPageResult(String rawText) {
    boolean complete = rawText.contains(END_OF_SENTENCE);
    String text = complete ? rawText.replace(END_OF_SENTENCE, "") : rawText;
    return new OcrPageResult(text, groundingTagParser.parse(text), complete);
  }

  @Override
  public boolean isReady() {
    try {
      webClient
          .get()
          .uri("/health")
          .retrieve()
          .toBodilessEntity()
          .timeout(HEALTH_TIMEOUT)
          .block();
      return true;
    } catch (RuntimeException e) {
      log.debug("Inference server not ready: {}", e.getMessage());
      return false;
    }
  }

  private static String encodePng(BufferedImage page) {
    try {
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      ImageIO.write(page, "png", out);
      return Base64.getEncoder().encodeToString(out.toByteArray());
    } catch (IOException e) {
      throw new OcrInferenceException("Failed to encode page image", e);
    }
  }

  record InferRequest(String image, String prompt) {}

  /** Inference server response. */
  record InferResponse(String text) {}
}
