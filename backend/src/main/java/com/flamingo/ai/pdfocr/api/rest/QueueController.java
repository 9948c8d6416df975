package com.flamingo.ai.pdfocr.api.rest;

import com.flamingo.ai.pdfocr.api.dto.response.QueueStatusResponse;
import com.flamingo.ai.pdfocr.config.OcrConfig;
import com.flamingo.ai.pdfocr.service.job.JobService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller exposing the dispatcher queue. */
@RestController
@RequestMapping("/queue")
@RequiredArgsConstructor
public class QueueController {

  private final JobService jobService;
  private final OcrConfig ocrConfig;

  @GetMapping("/status")
  public ResponseEntity<QueueStatusResponse> queueStatus() {
    return ResponseEntity.ok(
        QueueStatusResponse.from(
            jobService.getQueueStatus(), ocrConfig.getDispatcher().getMaxConcurrentJobs()));
  }
}
