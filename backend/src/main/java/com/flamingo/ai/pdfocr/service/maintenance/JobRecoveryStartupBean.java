package com.flamingo.ai.pdfocr.service.maintenance;

import com.flamingo.ai.pdfocr.dispatch.JobDispatcher;
import com.flamingo.ai.pdfocr.domain.entity.JobUpdate;
import com.flamingo.ai.pdfocr.domain.entity.OcrJob;
import com.flamingo.ai.pdfocr.domain.enums.JobStatus;
import com.flamingo.ai.pdfocr.store.TaskStore;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Startup bean that picks up jobs left behind by the previous process.
 *
 * <p>This bean runs once on application startup and:
 *
 * <ul>
 *   <li>Fails jobs that were {@code PROCESSING} when the process stopped
 *   <li>Resubmits {@code PENDING} jobs to the dispatcher, oldest first
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobRecoveryStartupBean implements CommandLineRunner {

  static final String INTERRUPTED_MESSAGE = "Processing was interrupted by a service restart";

  private final TaskStore taskStore;
  private final JobDispatcher jobDispatcher;

  @Override
  public void run(String... args) {
    try {
      int interrupted = failInterrupted();
      int resubmitted = resubmitPending();
      log.info(
          "Job recovery complete: {} interrupted jobs failed, {} pending jobs resubmitted",
          interrupted,
          resubmitted);
    } catch (Exception e) {
      // Don't fail application startup if recovery fails
      log.error("Job recovery failed: {}", e.getMessage(), e);
    }
  }

  private int failInterrupted() {
    int count = 0;
    for (OcrJob job : taskStore.list(JobStatus.PROCESSING)) {
      try {
        taskStore.update(job.getId(), JobUpdate.failed(INTERRUPTED_MESSAGE));
        count++;
      } catch (RuntimeException e) {
        log.warn("Could not fail interrupted job {}: {}", job.getId(), e.getMessage());
      }
    }
    return count;
  }

  private int resubmitPending() {
    // list() is newest first
    List<OcrJob> pending = taskStore.list(JobStatus.PENDING);
    int count = 0;
    for (int i = pending.size() - 1; i >= 0; i--) {
      if (jobDispatcher.submit(pending.get(i).getId())) {
        count++;
      }
    }
    return count;
  }
}
