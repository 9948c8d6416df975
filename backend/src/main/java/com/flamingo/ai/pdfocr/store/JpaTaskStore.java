package com.flamingo.ai.pdfocr.store;

import com.flamingo.ai.pdfocr.domain.entity.JobTombstone;
import com.flamingo.ai.pdfocr.domain.entity.JobUpdate;
import com.flamingo.ai.pdfocr.domain.entity.OcrJob;
import com.flamingo.ai.pdfocr.domain.enums.JobStatus;
import com.flamingo.ai.pdfocr.domain.repository.JobTombstoneRepository;
import com.flamingo.ai.pdfocr.domain.repository.OcrJobRepository;
import com.flamingo.ai.pdfocr.exception.DuplicateJobIdException;
import com.flamingo.ai.pdfocr.exception.JobNotFoundException;
import com.google.common.util.concurrent.Striped;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * SQLite-backed task store.
 *
 * <p>Writers take a per-id striped lock and run a read-merge-save inside their own transaction,
 * committing before the lock is released. Readers go straight to the database; with WAL journaling
 * they see the last committed version of a row and never wait for a writer.
 */
@Service
@Slf4j
public class JpaTaskStore implements TaskStore {

  private static final int MAX_RETRIES = 3;
  private static final long RETRY_DELAY_MS = 100;
  private static final int LOCK_STRIPES = 64;

  private final OcrJobRepository jobRepository;
  private final JobTombstoneRepository tombstoneRepository;
  private final TransactionTemplate transactionTemplate;
  private final Striped<Lock> writeLocks = Striped.lock(LOCK_STRIPES);

  public JpaTaskStore(
      OcrJobRepository jobRepository,
      JobTombstoneRepository tombstoneRepository,
      PlatformTransactionManager transactionManager) {
    this.jobRepository = jobRepository;
    this.tombstoneRepository = tombstoneRepository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  @Override
  public OcrJob create(String id, String filename, String fileHash) {
    return writeWithRetry(
        id,
        () -> {
          if (jobRepository.existsById(id) || tombstoneRepository.existsById(id)) {
            throw new DuplicateJobIdException(id);
          }
          OcrJob job = OcrJob.newPending(id, filename, fileHash, LocalDateTime.now());
          OcrJob saved = jobRepository.saveAndFlush(job);
          log.debug("Created job {} for {}", id, filename);
          return saved.snapshot();
        });
  }

  @Override
  public OcrJob update(String id, JobUpdate update) {
    return writeWithRetry(
        id,
        () -> {
          OcrJob job = jobRepository.findById(id).orElseThrow(() -> new JobNotFoundException(id));
          job.apply(update, LocalDateTime.now());
          return jobRepository.saveAndFlush(job).snapshot();
        });
  }

  @Override
  public OcrJob get(String id) {
    return jobRepository
        .findById(id)
        .map(OcrJob::snapshot)
        .orElseThrow(() -> new JobNotFoundException(id));
  }

  @Override
  public boolean exists(String id) {
    return jobRepository.existsById(id);
  }

  @Override
  public List<OcrJob> list(JobStatus status) {
    List<OcrJob> jobs =
        status == null
            ? jobRepository.findAllByOrderByCreatedAtDesc()
            : jobRepository.findByStatusOrderByCreatedAtDesc(status);
    return jobs.stream().map(OcrJob::snapshot).toList();
  }

  @Override
  public List<OcrJob> listCreatedBefore(LocalDateTime cutoff) {
    return jobRepository.findByCreatedAtBefore(cutoff).stream().map(OcrJob::snapshot).toList();
  }

  @Override
  public List<OcrJob> listNotUpdatedSince(JobStatus status, LocalDateTime cutoff) {
    return jobRepository.findByStatusAndUpdatedAtBefore(status, cutoff).stream()
        .map(OcrJob::snapshot)
        .toList();
  }

  @Override
  public boolean delete(String id) {
    return writeWithRetry(
        id,
        () -> {
          if (!jobRepository.existsById(id)) {
            return false;
          }
          jobRepository.deleteById(id);
          tombstoneRepository.save(new JobTombstone(id, LocalDateTime.now()));
          jobRepository.flush();
          log.debug("Deleted job record {}", id);
          return true;
        });
  }

  /** Runs a write under the id's lock in a fresh transaction, retrying SQLite lock contention. */
  private <T> T writeWithRetry(String id, Supplier<T> write) {
    Lock lock = writeLocks.get(id);
    lock.lock();
    try {
      for (int attempt = 1; ; attempt++) {
        try {
          return transactionTemplate.execute(status -> write.get());
        } catch (CannotAcquireLockException e) {
          if (attempt == MAX_RETRIES) {
            log.error("Failed to write job {} after {} retries", id, MAX_RETRIES);
            throw e;
          }
          log.warn("SQLite lock contention on job {}, retry {}/{}", id, attempt, MAX_RETRIES);
          sleepBeforeRetry(attempt);
        }
      }
    } finally {
      lock.unlock();
    }
  }

  private void sleepBeforeRetry(int attempt) {
    try {
      Thread.sleep(RETRY_DELAY_MS * attempt);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted during retry", ie);
    }
  }
}
