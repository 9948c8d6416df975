package com.flamingo.ai.pdfocr.domain.repository;

import com.flamingo.ai.pdfocr.domain.entity.OcrJob;
import com.flamingo.ai.pdfocr.domain.enums.JobStatus;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for OCR job records. */
@Repository
public interface OcrJobRepository extends JpaRepository<OcrJob, String> {

  /** Finds all jobs, newest first. */
  List<OcrJob> findAllByOrderByCreatedAtDesc();

  /** Finds jobs in the given status, newest first. */
  List<OcrJob> findByStatusOrderByCreatedAtDesc(JobStatus status);

  /** Finds jobs created before the cutoff. */
  List<OcrJob> findByCreatedAtBefore(LocalDateTime cutoff);

  /** Finds jobs in the given status whose last update is older than the cutoff. */
  List<OcrJob> findByStatusAndUpdatedAtBefore(JobStatus status, LocalDateTime cutoff);
}
