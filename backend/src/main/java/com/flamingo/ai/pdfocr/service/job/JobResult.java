package com.flamingo.ai.pdfocr.service.job;

import com.flamingo.ai.pdfocr.domain.enums.JobStatus;

/**
 * Outcome of reading a job's results. Only {@link Ready} carries content; the other variants
 * describe why there is none.
 *
 * @param <T> type of the content
 */
public sealed interface JobResult<T> permits JobResult.Ready, JobResult.NotReady, JobResult.Failed {

  /** The job completed and the content was read. */
  record Ready<T>(T content) implements JobResult<T> {}

  /** The job is still pending or processing. */
  record NotReady<T>(JobStatus status) implements JobResult<T> {}

  /** The job failed; there is no content to return. */
  record Failed<T>(String errorMessage) implements JobResult<T> {}
}
