package com.flamingo.ai.pdfocr.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the OCR job service. */
@Configuration
@ConfigurationProperties(prefix = "ocr")
@Getter
@Setter
public class OcrConfig {

  private Storage storage = new Storage();
  private Dispatcher dispatcher = new Dispatcher();
  private Rasterization rasterization = new Rasterization();
  private Inference inference = new Inference();
  private Upload upload = new Upload();
  private Auth auth = new Auth();
  private Maintenance maintenance = new Maintenance();

  /** Where job artifacts are kept on disk. */
  @Getter
  @Setter
  public static class Storage {
    private String basePath = "data/jobs";
  }

  @Getter
  @Setter
  public static class Dispatcher {
    /** Maximum number of jobs processed at the same time. */
    private int maxConcurrentJobs = 1;

    private int shutdownAwaitSeconds = 60;
  }

  @Getter
  @Setter
  public static class Rasterization {
    private float dpi = 144f;
  }

  /** Configuration for the external OCR inference server. */
  @Getter
  @Setter
  public static class Inference {
    private String baseUrl = "http://localhost:8001";
    private String prompt = "<image>\n<|grounding|>Convert the document to markdown.";
    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 300000;

    /** Leave pages whose generation did not finish out of the outputs instead of failing. */
    private boolean skipIncompletePages = true;
  }

  @Getter
  @Setter
  public static class Upload {
    private long maxFileSizeBytes = 100L * 1024 * 1024;
  }

  @Getter
  @Setter
  public static class Auth {
    /** Bearer token required on every endpoint but /health. Blank disables the check. */
    private String token = "";

    public boolean isEnabled() {
      return token != null && !token.isBlank();
    }
  }

  @Getter
  @Setter
  public static class Maintenance {
    /** Jobs older than this many days are purged. 0 keeps jobs forever. */
    private int retentionDays = 7;

    /** Processing jobs without progress for this many minutes are failed. 0 disables. */
    private int stalledJobTimeoutMinutes = 0;

    private long sweepIntervalMs = 600000;
  }
}
