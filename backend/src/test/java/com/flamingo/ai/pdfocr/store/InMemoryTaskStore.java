package com.flamingo.ai.pdfocr.store;

import com.flamingo.ai.pdfocr.domain.entity.JobUpdate;
import com.flamingo.ai.pdfocr.domain.entity.OcrJob;
import com.flamingo.ai.pdfocr.domain.enums.JobStatus;
import com.flamingo.ai.pdfocr.exception.DuplicateJobIdException;
import com.flamingo.ai.pdfocr.exception.JobNotFoundException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Task store for tests. Applies the same lifecycle validation as the JPA store and records every
 * successful update so tests can assert on the sequence of observed states.
 */
public class InMemoryTaskStore implements TaskStore {

  private final Map<String, OcrJob> jobs = new LinkedHashMap<>();
  private final Set<String> deleted = new HashSet<>();
  private final List<OcrJob> history = new CopyOnWriteArrayList<>();
  private LocalDateTime clock = LocalDateTime.of(2024, 1, 1, 0, 0);

  @Override
  public synchronized OcrJob create(String id, String filename, String fileHash) {
    if (jobs.containsKey(id) || deleted.contains(id)) {
      throw new DuplicateJobIdException(id);
    }
    OcrJob job = OcrJob.newPending(id, filename, fileHash, tick());
    jobs.put(id, job);
    history.add(job.snapshot());
    return job.snapshot();
  }

  @Override
  public synchronized OcrJob update(String id, JobUpdate update) {
    OcrJob job = jobs.get(id);
    if (job == null) {
      throw new JobNotFoundException(id);
    }
    OcrJob working = job.snapshot();
    working.apply(update, tick());
    jobs.put(id, working);
    history.add(working.snapshot());
    return working.snapshot();
  }

  @Override
  public synchronized OcrJob get(String id) {
    OcrJob job = jobs.get(id);
    if (job == null) {
      throw new JobNotFoundException(id);
    }
    return job.snapshot();
  }

  @Override
  public synchronized boolean exists(String id) {
    return jobs.containsKey(id);
  }

  @Override
  public synchronized List<OcrJob> list(JobStatus status) {
    return jobs.values().stream()
        .filter(job -> status == null || job.getStatus() == status)
        .sorted(Comparator.comparing(OcrJob::getCreatedAt).reversed())
        .map(OcrJob::snapshot)
        .toList();
  }

  @Override
  public synchronized List<OcrJob> listCreatedBefore(LocalDateTime cutoff) {
    return jobs.values().stream()
        .filter(job -> job.getCreatedAt().isBefore(cutoff))
        .map(OcrJob::snapshot)
        .toList();
  }

  @Override
  public synchronized List<OcrJob> listNotUpdatedSince(JobStatus status, LocalDateTime cutoff) {
    return jobs.values().stream()
        .filter(job -> job.getStatus() == status && job.getUpdatedAt().isBefore(cutoff))
        .map(OcrJob::snapshot)
        .toList();
  }

  @Override
  public synchronized boolean delete(String id) {
    if (jobs.remove(id) == null) {
      return false;
    }
    deleted.add(id);
    return true;
  }

  /** Every state the store has held, oldest first, across all jobs. */
  public List<OcrJob> history(String id) {
    List<OcrJob> result = new ArrayList<>();
    for (OcrJob job : history) {
      if (job.getId().equals(id)) {
        result.add(job);
      }
    }
    return result;
  }

  // strictly increasing timestamps keep creation order unambiguous
  private LocalDateTime tick() {
    clock = clock.plusSeconds(1);
    return clock;
  }
}
