package com.flamingo.ai.pdfocr.domain.entity;

import com.flamingo.ai.pdfocr.domain.enums.JobStatus;
import lombok.Builder;

/**
 * Partial update merged into a job record by the task store. Null fields are left untouched.
 *
 * @param status new status, or null to keep the current one
 * @param totalPages number of pages discovered by rasterization
 * @param processedPages number of pages finished so far
 * @param errorMessage failure cause; only valid together with {@link JobStatus#FAILED}
 */
@Builder
public record JobUpdate(
    JobStatus status, Integer totalPages, Integer processedPages, String errorMessage) {

  public static JobUpdate status(JobStatus status) {
    return JobUpdate.builder().status(status).build();
  }

  public static JobUpdate totalPages(int totalPages) {
    return JobUpdate.builder().totalPages(totalPages).build();
  }

  public static JobUpdate processedPages(int processedPages) {
    return JobUpdate.builder().processedPages(processedPages).build();
  }

  public static JobUpdate failed(String errorMessage) {
    return JobUpdate.builder().status(JobStatus.FAILED).errorMessage(errorMessage).build();
  }

  boolean touchesProgress() {
    return totalPages != null || processedPages != null;
  }
}
