package com.flamingo.ai.pdfocr.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Returned instead of a result while the job is unfinished or after it failed. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResultStatusResponse {

  private String id;
  private String status;
  private String message;
}
