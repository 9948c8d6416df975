package com.flamingo.ai.pdfocr.api.dto.response;

import com.flamingo.ai.pdfocr.domain.entity.OcrJob;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for job state. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {

  private String id;
  private String filename;
  private String fileHash;
  private String status;
  private int totalPages;
  private int processedPages;
  private String errorMessage;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;

  /** Creates a JobResponse from an OcrJob entity. */
  public static JobResponse fromEntity(OcrJob job) {
    return JobResponse.builder()
        .id(job.getId())
        .filename(job.getFilename())
        .fileHash(job.getFileHash())
        .status(job.getStatus().wireName())
        .totalPages(job.getTotalPages())
        .processedPages(job.getProcessedPages())
        .errorMessage(job.getErrorMessage())
        .createdAt(job.getCreatedAt())
        .updatedAt(job.getUpdatedAt())
        .build();
  }
}
