package com.flamingo.ai.pdfocr.exception;

import com.flamingo.ai.pdfocr.domain.enums.JobStatus;

/** Exception thrown when an update would break the job lifecycle rules. */
public class IllegalJobTransitionException extends RuntimeException {

  private final String jobId;
  private final JobStatus from;
  private final JobStatus to;

  public IllegalJobTransitionException(String jobId, JobStatus from, JobStatus to, String reason) {
    super(String.format("Illegal update of job %s (%s -> %s): %s", jobId, from, to, reason));
    this.jobId = jobId;
    this.from = from;
    this.to = to;
  }

  public String getJobId() {
    return jobId;
  }

  public JobStatus getFrom() {
    return from;
  }

  public JobStatus getTo() {
    return to;
  }
}
