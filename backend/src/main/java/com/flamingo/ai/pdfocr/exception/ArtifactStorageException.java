package com.flamingo.ai.pdfocr.exception;

/** Exception thrown when artifact I/O fails. */
public class ArtifactStorageException extends RuntimeException {

  private final String jobId;

  public ArtifactStorageException(String jobId, String message, Throwable cause) {
    super(message, cause);
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}
