package com.flamingo.ai.pdfocr.service.job;

import com.flamingo.ai.pdfocr.artifact.ArtifactKind;
import com.flamingo.ai.pdfocr.artifact.ArtifactStore;
import com.flamingo.ai.pdfocr.config.OcrConfig;
import com.flamingo.ai.pdfocr.dispatch.JobDispatcher;
import com.flamingo.ai.pdfocr.dispatch.QueueSnapshot;
import com.flamingo.ai.pdfocr.domain.entity.OcrJob;
import com.flamingo.ai.pdfocr.domain.enums.JobStatus;
import com.flamingo.ai.pdfocr.exception.ArtifactStorageException;
import com.flamingo.ai.pdfocr.exception.InvalidDocumentException;
import com.flamingo.ai.pdfocr.exception.JobNotFoundException;
import com.flamingo.ai.pdfocr.store.TaskStore;
import com.google.common.hash.Hashing;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the JobService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobServiceImpl implements JobService {

  private final TaskStore taskStore;
  private final ArtifactStore artifactStore;
  private final JobDispatcher jobDispatcher;
  private final OcrConfig ocrConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "job.submit", description = "Time to register and queue a job")
  public String submitJob(String filename, byte[] document) {
    validateDocument(filename, document);

    String jobId = UUID.randomUUID().toString();
    String fileHash = Hashing.sha256().hashBytes(document).toString();
    taskStore.create(jobId, filename, fileHash);
    try {
      artifactStore.allocate(jobId);
      artifactStore.writeInput(jobId, document);
    } catch (RuntimeException e) {
      log.error("Failed to store input for job {}, rolling back: {}", jobId, e.getMessage());
      rollbackSubmission(jobId);
      throw e;
    }

    if (!jobDispatcher.submit(jobId)) {
      log.warn("Job {} stays pending until the next restart picks it up", jobId);
    }
    meterRegistry.counter("job.submitted").increment();
    log.info("Submitted job {} for {} ({} bytes)", jobId, filename, document.length);
    return jobId;
  }

  @Override
  public OcrJob getStatus(String jobId) {
    return taskStore.get(jobId);
  }

  @Override
  @Timed(value = "job.result", description = "Time to read a job result")
  public JobResult<ArtifactContent> getResult(String jobId, String kind) {
    OcrJob job = taskStore.get(jobId);
    ArtifactKind artifactKind = ArtifactKind.fromPathName(jobId, kind);
    return whenCompleted(
        job,
        () ->
            new ArtifactContent(
                artifactStore.readOutput(jobId, artifactKind),
                artifactKind.getMediaType(),
                artifactKind.getFileName()));
  }

  @Override
  public JobResult<List<String>> listImages(String jobId) {
    OcrJob job = taskStore.get(jobId);
    return whenCompleted(job, () -> List.copyOf(artifactStore.listImages(jobId)));
  }

  @Override
  public JobResult<ArtifactContent> getImage(String jobId, String imageName) {
    OcrJob job = taskStore.get(jobId);
    return whenCompleted(
        job,
        () ->
            new ArtifactContent(
                artifactStore.readImage(jobId, imageName),
                ArtifactKind.IMAGES.getMediaType(),
                imageName));
  }

  @Override
  @Timed(value = "job.delete", description = "Time to delete a job")
  public void deleteJob(String jobId) {
    if (!taskStore.delete(jobId)) {
      throw new JobNotFoundException(jobId);
    }
    try {
      artifactStore.remove(jobId);
    } catch (ArtifactStorageException e) {
      // the record is gone; the maintenance sweep removes the orphaned namespace later
      log.error("Deleted job {} but could not remove its artifacts: {}", jobId, e.getMessage());
      meterRegistry.counter("job.delete.orphaned").increment();
    }
    meterRegistry.counter("job.deleted").increment();
    log.info("Deleted job {}", jobId);
  }

  @Override
  public List<OcrJob> listJobs(JobStatus status) {
    return taskStore.list(status);
  }

  @Override
  public int getQueuePosition(String jobId) {
    return jobDispatcher.queuePosition(jobId);
  }

  @Override
  public QueueSnapshot getQueueStatus() {
    return jobDispatcher.snapshot();
  }

  private static <T> JobResult<T> whenCompleted(OcrJob job, Supplier<T> reader) {
    return switch (job.getStatus()) {
      case PENDING, PROCESSING -> new JobResult.NotReady<>(job.getStatus());
      case FAILED -> new JobResult.Failed<>(job.getErrorMessage());
      case COMPLETED -> new JobResult.Ready<>(reader.get());
    };
  }

  private void rollbackSubmission(String jobId) {
    taskStore.delete(jobId);
    try {
      artifactStore.remove(jobId);
    } catch (ArtifactStorageException e) {
      log.warn("Could not clean up artifacts of rejected job {}: {}", jobId, e.getMessage());
    }
  }

  private void validateDocument(String filename, byte[] document) {
    if (filename == null || filename.isBlank()) {
      throw new InvalidDocumentException("Missing filename", "Please upload a PDF file");
    }
    if (!filename.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
      throw new InvalidDocumentException(
          "Unsupported file type: " + filename, "Only PDF files are supported");
    }
    if (document == null || document.length == 0) {
      throw new InvalidDocumentException("File is empty", "Please upload a non-empty PDF file");
    }
    long maxBytes = ocrConfig.getUpload().getMaxFileSizeBytes();
    if (document.length > maxBytes) {
      throw new InvalidDocumentException(
          "File too large: " + document.length,
          "Maximum file size is " + (maxBytes / (1024 * 1024)) + "MB");
    }
  }
}
