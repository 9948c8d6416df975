package com.flamingo.ai.pdfocr.exception;

/** Exception thrown when a job is created with an id that is or was already in use. */
public class DuplicateJobIdException extends RuntimeException {

  private final String jobId;

  public DuplicateJobIdException(String jobId) {
    super("Job id already used: " + jobId);
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}
