package com.flamingo.ai.pdfocr.service.job;

import com.flamingo.ai.pdfocr.dispatch.QueueSnapshot;
import com.flamingo.ai.pdfocr.domain.entity.OcrJob;
import com.flamingo.ai.pdfocr.domain.enums.JobStatus;
import java.util.List;

/** Service interface for OCR job management. */
public interface JobService {

  /**
   * Registers a document for OCR and queues it. Returns as soon as the job is durably recorded;
   * processing happens in the background.
   *
   * @param filename original document name
   * @param document document bytes
   * @return the new job id
   * @throws com.flamingo.ai.pdfocr.exception.InvalidDocumentException if the upload is rejected
   */
  String submitJob(String filename, byte[] document);

  /**
   * Gets the current state of a job.
   *
   * @throws com.flamingo.ai.pdfocr.exception.JobNotFoundException if not found
   */
  OcrJob getStatus(String jobId);

  /**
   * Reads one output of a job.
   *
   * @param kind result kind path name, e.g. {@code markdown}
   * @throws com.flamingo.ai.pdfocr.exception.JobNotFoundException if the job is unknown
   * @throws com.flamingo.ai.pdfocr.exception.ArtifactNotFoundException if the kind is unknown
   */
  JobResult<ArtifactContent> getResult(String jobId, String kind);

  /** Names of the images extracted from a completed job. */
  JobResult<List<String>> listImages(String jobId);

  JobResult<ArtifactContent> getImage(String jobId, String imageName);

  /**
   * Deletes a job record and its artifacts.
   *
   * @throws com.flamingo.ai.pdfocr.exception.JobNotFoundException if the job is unknown, including
   *     when it was deleted already
   */
  void deleteJob(String jobId);

  /**
   * Lists jobs newest first.
   *
   * @param status optional filter, null for all
   */
  List<OcrJob> listJobs(JobStatus status);

  /** One-based queue position of a waiting job, 0 once it is running or finished. */
  int getQueuePosition(String jobId);

  QueueSnapshot getQueueStatus();
}
