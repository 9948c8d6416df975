package com.flamingo.ai.pdfocr.exception;

/** Exception thrown when a write-once artifact or namespace is written a second time. */
public class ArtifactAlreadyExistsException extends RuntimeException {

  private final String jobId;

  public ArtifactAlreadyExistsException(String jobId, String artifact) {
    super(String.format("Artifact '%s' already exists for job %s", artifact, jobId));
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}
