package com.flamingo.ai.pdfocr.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO returned when a document is accepted. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitJobResponse {

  private String id;
  private String status;
  private String message;

  /** One-based position among waiting jobs, 0 if a worker already picked it up. */
  private int queuePosition;
}
