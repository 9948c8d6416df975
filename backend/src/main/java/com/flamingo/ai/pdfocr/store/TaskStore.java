package com.flamingo.ai.pdfocr.store;

import com.flamingo.ai.pdfocr.domain.entity.JobUpdate;
import com.flamingo.ai.pdfocr.domain.entity.OcrJob;
import com.flamingo.ai.pdfocr.domain.enums.JobStatus;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Durable registry of job records and the single source of truth for job state.
 *
 * <p>Implementations must serialize writes per job id, never block readers on writers, and persist
 * every mutation before returning. Returned jobs are detached snapshots.
 */
public interface TaskStore {

  /**
   * Inserts a new pending job.
   *
   * @param id job id, never used before
   * @param filename original document name
   * @param fileHash SHA-256 of the document, may be null
   * @return the stored job
   * @throws com.flamingo.ai.pdfocr.exception.DuplicateJobIdException if the id exists or was
   *     deleted earlier
   */
  OcrJob create(String id, String filename, String fileHash);

  default OcrJob create(String id, String filename) {
    return create(id, filename, null);
  }

  /**
   * Atomically merges a partial update and refreshes {@code updatedAt}.
   *
   * @return the job after the update
   * @throws com.flamingo.ai.pdfocr.exception.JobNotFoundException if the id is absent
   * @throws com.flamingo.ai.pdfocr.exception.IllegalJobTransitionException if the update breaks
   *     the lifecycle rules
   */
  OcrJob update(String id, JobUpdate update);

  /**
   * Reads one job.
   *
   * @throws com.flamingo.ai.pdfocr.exception.JobNotFoundException if the id is absent
   */
  OcrJob get(String id);

  boolean exists(String id);

  /**
   * Lists jobs newest first.
   *
   * @param status optional filter, null for all jobs
   */
  List<OcrJob> list(JobStatus status);

  /** Lists jobs created before the cutoff. */
  List<OcrJob> listCreatedBefore(LocalDateTime cutoff);

  /** Lists jobs in {@code status} whose last update is older than the cutoff. */
  List<OcrJob> listNotUpdatedSince(JobStatus status, LocalDateTime cutoff);

  /**
   * Removes a job record. Idempotent: unknown ids are ignored.
   *
   * @return true if a record was removed
   */
  boolean delete(String id);
}
