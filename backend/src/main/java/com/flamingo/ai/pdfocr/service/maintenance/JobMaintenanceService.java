package com.flamingo.ai.pdfocr.service.maintenance;

import com.flamingo.ai.pdfocr.artifact.ArtifactStore;
import com.flamingo.ai.pdfocr.config.OcrConfig;
import com.flamingo.ai.pdfocr.domain.entity.JobUpdate;
import com.flamingo.ai.pdfocr.domain.entity.OcrJob;
import com.flamingo.ai.pdfocr.domain.enums.JobStatus;
import com.flamingo.ai.pdfocr.exception.JobNotFoundException;
import com.flamingo.ai.pdfocr.service.job.JobService;
import com.flamingo.ai.pdfocr.store.TaskStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDateTime;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/** Periodic cleanup: retention purge, orphaned artifact sweep and stalled-job timeout. */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobMaintenanceService {

  static final String STALLED_MESSAGE = "Processing timed out after %d minutes without progress";

  private final TaskStore taskStore;
  private final ArtifactStore artifactStore;
  private final JobService jobService;
  private final OcrConfig ocrConfig;
  private final MeterRegistry meterRegistry;

  @Scheduled(
      fixedDelayString = "${ocr.maintenance.sweep-interval-ms:600000}",
      initialDelayString = "${ocr.maintenance.sweep-interval-ms:600000}")
  public void sweep() {
    try {
      purgeExpired(LocalDateTime.now());
      removeOrphanedArtifacts();
      failStalled(LocalDateTime.now());
    } catch (RuntimeException e) {
      log.error("Maintenance sweep failed: {}", e.getMessage(), e);
    }
  }

  /** Deletes jobs created more than the retention period before {@code now}. */
  int purgeExpired(LocalDateTime now) {
    int retentionDays = ocrConfig.getMaintenance().getRetentionDays();
    if (retentionDays <= 0) {
      return 0;
    }
    int purged = 0;
    for (OcrJob job : taskStore.listCreatedBefore(now.minusDays(retentionDays))) {
      if (job.getStatus() == JobStatus.PROCESSING) {
        continue;
      }
      try {
        jobService.deleteJob(job.getId());
        purged++;
      } catch (JobNotFoundException e) {
        log.debug("Job {} already deleted", job.getId());
      }
    }
    if (purged > 0) {
      meterRegistry.counter("job.purged").increment(purged);
      log.info("Purged {} jobs older than {} days", purged, retentionDays);
    }
    return purged;
  }

  /** Removes artifact namespaces that have no job record. */
  int removeOrphanedArtifacts() {
    Set<String> namespaces = artifactStore.listNamespaces();
    int removed = 0;
    for (String jobId : namespaces) {
      if (taskStore.exists(jobId)) {
        continue;
      }
      try {
        artifactStore.remove(jobId);
        removed++;
      } catch (RuntimeException e) {
        log.warn("Could not remove orphaned artifacts {}: {}", jobId, e.getMessage());
      }
    }
    if (removed > 0) {
      log.info("Removed {} orphaned artifact namespaces", removed);
    }
    return removed;
  }

  /** Fails processing jobs without progress for the configured timeout. Disabled when 0. */
  int failStalled(LocalDateTime now) {
    int timeoutMinutes = ocrConfig.getMaintenance().getStalledJobTimeoutMinutes();
    if (timeoutMinutes <= 0) {
      return 0;
    }
    int failed = 0;
    LocalDateTime cutoff = now.minusMinutes(timeoutMinutes);
    String message = String.format(STALLED_MESSAGE, timeoutMinutes);
    for (OcrJob job : taskStore.listNotUpdatedSince(JobStatus.PROCESSING, cutoff)) {
      try {
        taskStore.update(job.getId(), JobUpdate.failed(message));
        failed++;
        log.warn("Job {} stalled since {}, marked failed", job.getId(), job.getUpdatedAt());
      } catch (RuntimeException e) {
        log.warn("Could not fail stalled job {}: {}", job.getId(), e.getMessage());
      }
    }
    if (failed > 0) {
      meterRegistry.counter("job.stalled").increment(failed);
    }
    return failed;
  }
}
