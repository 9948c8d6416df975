package com.flamingo.ai.pdfocr.exception;

/** Exception thrown when a job's artifact namespace, result kind or image does not exist. */
public class ArtifactNotFoundException extends RuntimeException {

  private final String jobId;
  private final String artifact;

  public ArtifactNotFoundException(String jobId, String artifact) {
    super(String.format("Artifact '%s' not found for job %s", artifact, jobId));
    this.jobId = jobId;
    this.artifact = artifact;
  }

  public String getJobId() {
    return jobId;
  }

  public String getArtifact() {
    return artifact;
  }
}
