package com.flamingo.ai.pdfocr.domain.enums;

/** Defines the lifecycle status of an OCR job. */
public enum JobStatus {
  /** Job has been accepted and is waiting for a worker. */
  PENDING,

  /** Job is being rasterized, recognized and assembled. */
  PROCESSING,

  /** All stages finished and the outputs are published. */
  COMPLETED,

  /** A stage failed; the job carries an error message. */
  FAILED;

  /** Returns true for states that admit no further transitions. */
  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /**
   * Checks whether a job in this state may move to {@code target}.
   *
   * <p>Only {@code PENDING -> PROCESSING}, {@code PROCESSING -> COMPLETED} and {@code PROCESSING
   * -> FAILED} are legal. Restating {@code PROCESSING} is allowed so progress updates may carry the
   * current status.
   */
  public boolean canTransitionTo(JobStatus target) {
    return switch (this) {
      case PENDING -> target == PROCESSING;
      case PROCESSING -> target == PROCESSING || target == COMPLETED || target == FAILED;
      case COMPLETED, FAILED -> false;
    };
  }

  /** Lower-case name used on the wire and in query filters. */
  public String wireName() {
    return name().toLowerCase();
  }

  /**
   * Parses a status filter value, case-insensitively.
   *
   * @throws IllegalArgumentException if the value names no status
   */
  public static JobStatus fromWireName(String value) {
    for (JobStatus status : values()) {
      if (status.name().equalsIgnoreCase(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown job status: " + value);
  }
}
