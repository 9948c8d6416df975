package com.flamingo.ai.pdfocr.dispatch;

import com.flamingo.ai.pdfocr.domain.enums.JobStatus;
import com.flamingo.ai.pdfocr.exception.JobNotFoundException;
import com.flamingo.ai.pdfocr.pipeline.PipelineRunner;
import com.flamingo.ai.pdfocr.store.TaskStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Hands pending jobs to the worker pool.
 *
 * <p>A job id is accepted at most once while its run is outstanding, and only while the job is
 * {@code PENDING}, so no two pipeline runs ever mutate the same job. Concurrency and FIFO ordering
 * come from the executor.
 */
@Component
@Slf4j
public class JobDispatcher {

  private final TaskStore taskStore;
  private final PipelineRunner pipelineRunner;
  private final TaskExecutor executor;
  private final MeterRegistry meterRegistry;

  private final Set<String> accepted = ConcurrentHashMap.newKeySet();
  private final ConcurrentLinkedDeque<String> queued = new ConcurrentLinkedDeque<>();
  private final Set<String> running = ConcurrentHashMap.newKeySet();

  public JobDispatcher(
      TaskStore taskStore,
      PipelineRunner pipelineRunner,
      @Qualifier("jobDispatchExecutor") TaskExecutor executor,
      MeterRegistry meterRegistry) {
    this.taskStore = taskStore;
    this.pipelineRunner = pipelineRunner;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Queues a job for processing and returns without waiting.
   *
   * @return false if the job was already accepted, is not pending, or the pool is shut down
   */
  public boolean submit(String jobId) {
    if (!accepted.add(jobId)) {
      log.warn("Job {} is already queued or running, ignoring submission", jobId);
      return false;
    }
    try {
      JobStatus status = taskStore.get(jobId).getStatus();
      if (status != JobStatus.PENDING) {
        log.warn("Job {} is {}, only pending jobs can be submitted", jobId, status.wireName());
        accepted.remove(jobId);
        return false;
      }
    } catch (JobNotFoundException e) {
      log.warn("Job {} does not exist, ignoring submission", jobId);
      accepted.remove(jobId);
      return false;
    }

    queued.addLast(jobId);
    try {
      executor.execute(new JobTask(jobId));
    } catch (RejectedExecutionException e) {
      // job stays pending and is picked up again on the next start
      log.error("Worker pool rejected job {}: {}", jobId, e.getMessage());
      queued.remove(jobId);
      accepted.remove(jobId);
      return false;
    }
    meterRegistry.counter("job.dispatched").increment();
    log.debug("Job {} queued", jobId);
    return true;
  }

  /** One-based position of a job among waiting jobs, 0 if it is not waiting. */
  public int queuePosition(String jobId) {
    int position = 1;
    for (String id : queued) {
      if (id.equals(jobId)) {
        return position;
      }
      position++;
    }
    return 0;
  }

  public boolean isActive(String jobId) {
    return accepted.contains(jobId);
  }

  public QueueSnapshot snapshot() {
    return new QueueSnapshot(new ArrayList<>(queued), List.copyOf(running));
  }

  /** Unit of work executed by a pool thread. */
  private final class JobTask implements Runnable {

    private final String jobId;

    private JobTask(String jobId) {
      this.jobId = jobId;
    }

    @Override
    public void run() {
      queued.remove(jobId);
      running.add(jobId);
      try {
        pipelineRunner.run(jobId);
      } catch (RuntimeException e) {
        log.error("Pipeline run for job {} escaped with an error", jobId, e);
      } catch (Error e) {
        log.error("Worker for job {} hit a fatal error", jobId, e);
        throw e;
      } finally {
        running.remove(jobId);
        accepted.remove(jobId);
      }
    }
  }
}
