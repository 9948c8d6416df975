package com.flamingo.ai.pdfocr.api.rest;

import com.flamingo.ai.pdfocr.api.dto.response.JobResponse;
import com.flamingo.ai.pdfocr.api.dto.response.ResultStatusResponse;
import com.flamingo.ai.pdfocr.api.dto.response.SubmitJobResponse;
import com.flamingo.ai.pdfocr.domain.enums.JobStatus;
import com.flamingo.ai.pdfocr.exception.InvalidDocumentException;
import com.flamingo.ai.pdfocr.service.job.ArtifactContent;
import com.flamingo.ai.pdfocr.service.job.JobResult;
import com.flamingo.ai.pdfocr.service.job.JobService;
import java.io.IOException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for OCR jobs. */
@RestController
@RequestMapping("/jobs")
@RequiredArgsConstructor
public class JobController {

  private final JobService jobService;

  /** Accepts a PDF and queues it for OCR. */
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<SubmitJobResponse> submitJob(@RequestParam("file") MultipartFile file) {
    byte[] document;
    try {
      document = file.getBytes();
    } catch (IOException e) {
      throw new InvalidDocumentException(
          "Failed to read upload: " + e.getMessage(), "Could not read the uploaded file");
    }
    String jobId = jobService.submitJob(file.getOriginalFilename(), document);
    int position = jobService.getQueuePosition(jobId);
    String message =
        position > 0 ? "Job queued at position " + position : "Job accepted for processing";
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(
            SubmitJobResponse.builder()
                .id(jobId)
                .status(JobStatus.PENDING.wireName())
                .message(message)
                .queuePosition(position)
                .build());
  }

  /** Lists jobs newest first, optionally filtered by status. */
  @GetMapping
  public ResponseEntity<List<JobResponse>> listJobs(
      @RequestParam(value = "status", required = false) String status) {
    JobStatus filter = status == null || status.isBlank() ? null : JobStatus.fromWireName(status);
    return ResponseEntity.ok(
        jobService.listJobs(filter).stream().map(JobResponse::fromEntity).toList());
  }

  @GetMapping("/{jobId}/status")
  public ResponseEntity<JobResponse> getStatus(@PathVariable String jobId) {
    return ResponseEntity.ok(JobResponse.fromEntity(jobService.getStatus(jobId)));
  }

  /** Serves one result file: {@code markdown}, {@code markdown_det} or {@code layout_pdf}. */
  @GetMapping("/{jobId}/result/{kind}")
  public ResponseEntity<?> getResult(@PathVariable String jobId, @PathVariable String kind) {
    return toResponse(jobId, jobService.getResult(jobId, kind));
  }

  @GetMapping("/{jobId}/result/images")
  public ResponseEntity<?> listImages(@PathVariable String jobId) {
    JobResult<List<String>> result = jobService.listImages(jobId);
    if (result instanceof JobResult.Ready<List<String>> ready) {
      return ResponseEntity.ok(ready.content());
    }
    return notReadyOrFailed(jobId, result);
  }

  @GetMapping("/{jobId}/result/images/{imageName}")
  public ResponseEntity<?> getImage(@PathVariable String jobId, @PathVariable String imageName) {
    return toResponse(jobId, jobService.getImage(jobId, imageName));
  }

  /** Deletes a job and all of its files. */
  @DeleteMapping("/{jobId}")
  public ResponseEntity<Void> deleteJob(@PathVariable String jobId) {
    jobService.deleteJob(jobId);
    return ResponseEntity.noContent().build();
  }

  private ResponseEntity<?> toResponse(String jobId, JobResult<ArtifactContent> result) {
    if (result instanceof JobResult.Ready<ArtifactContent> ready) {
      ArtifactContent content = ready.content();
      return ResponseEntity.ok()
          .contentType(MediaType.parseMediaType(content.mediaType()))
          .header(
              HttpHeaders.CONTENT_DISPOSITION,
              ContentDisposition.inline().filename(content.fileName()).build().toString())
          .body(content.bytes());
    }
    return notReadyOrFailed(jobId, result);
  }

  private ResponseEntity<ResultStatusResponse> notReadyOrFailed(
      String jobId, JobResult<?> result) {
    if (result instanceof JobResult.Failed<?> failed) {
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
          .body(
              ResultStatusResponse.builder()
                  .id(jobId)
                  .status(JobStatus.FAILED.wireName())
                  .message(failed.errorMessage())
                  .build());
    }
    JobStatus status = ((JobResult.NotReady<?>) result).status();
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(
            ResultStatusResponse.builder()
                .id(jobId)
                .status(status.wireName())
                .message("Job is " + status.wireName() + ", result not ready yet")
                .build());
  }
}
