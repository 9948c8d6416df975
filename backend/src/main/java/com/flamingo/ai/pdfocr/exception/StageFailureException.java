package com.flamingo.ai.pdfocr.exception;

import com.flamingo.ai.pdfocr.pipeline.PipelineStage;

/** Exception thrown when a pipeline stage cannot complete for a job. */
public class StageFailureException extends RuntimeException {

  private final String jobId;
  private final PipelineStage stage;

  public StageFailureException(String jobId, PipelineStage stage, String message) {
    super(message);
    this.jobId = jobId;
    this.stage = stage;
  }

  public StageFailureException(
      String jobId, PipelineStage stage, String message, Throwable cause) {
    super(message, cause);
    this.jobId = jobId;
    this.stage = stage;
  }

  public String getJobId() {
    return jobId;
  }

  public PipelineStage getStage() {
    return stage;
  }

  /** Message stored on the failed job. */
  public String getUserMessage() {
    return stage.getDisplayName() + " failed: " + getMessage();
  }
}
