package com.flamingo.ai.pdfocr.domain.entity;

import com.flamingo.ai.pdfocr.domain.enums.JobStatus;
import com.flamingo.ai.pdfocr.exception.IllegalJobTransitionException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Durable record of one submitted document and its progress through the OCR pipeline. */
@Entity
@Table(
    name = "ocr_jobs",
    indexes = {
      @Index(name = "idx_ocr_jobs_status", columnList = "status"),
      @Index(name = "idx_ocr_jobs_created_at", columnList = "createdAt")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class OcrJob {

  @Id
  @Column(length = 64)
  private String id;

  @Column(nullable = false)
  private String filename;

  /** SHA-256 of the uploaded document, hex encoded. */
  @Column(length = 64)
  private String fileHash;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 16)
  @Builder.Default
  private JobStatus status = JobStatus.PENDING;

  /** Number of pages found by rasterization; 0 until known. */
  @Builder.Default private int totalPages = 0;

  @Builder.Default private int processedPages = 0;

  @Column(columnDefinition = "TEXT")
  private String errorMessage;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(nullable = false)
  private LocalDateTime updatedAt;

  /** Creates a fresh pending job stamped with {@code now}. */
  public static OcrJob newPending(String id, String filename, String fileHash, LocalDateTime now) {
    return OcrJob.builder()
        .id(id)
        .filename(filename)
        .fileHash(fileHash)
        .status(JobStatus.PENDING)
        .createdAt(now)
        .updatedAt(now)
        .build();
  }

  /**
   * Merges a partial update into this record after checking the lifecycle rules.
   *
   * <p>This is the only place job state changes are validated; every store implementation routes
   * mutations through it.
   *
   * @throws IllegalJobTransitionException if the update breaks the state machine or the progress
   *     bounds
   */
  public void apply(JobUpdate update, LocalDateTime now) {
    if (status.isTerminal()) {
      throw new IllegalJobTransitionException(id, status, update.status(), "job is terminal");
    }

    JobStatus target = update.status() != null ? update.status() : status;
    if (!status.canTransitionTo(target) && target != status) {
      throw new IllegalJobTransitionException(id, status, target, "transition not allowed");
    }

    if (update.touchesProgress() && status != JobStatus.PROCESSING) {
      throw new IllegalJobTransitionException(
          id, status, target, "progress can only change while processing");
    }

    int newTotal = update.totalPages() != null ? update.totalPages() : totalPages;
    int newProcessed = update.processedPages() != null ? update.processedPages() : processedPages;
    if (newTotal < 0 || newProcessed < processedPages) {
      throw new IllegalJobTransitionException(
          id, status, target, "page counters must not decrease below zero or go backwards");
    }
    if (newTotal > 0 && newProcessed > newTotal) {
      throw new IllegalJobTransitionException(
          id,
          status,
          target,
          String.format("processed pages %d exceed total %d", newProcessed, newTotal));
    }

    if (target == JobStatus.COMPLETED && newProcessed != newTotal) {
      throw new IllegalJobTransitionException(
          id,
          status,
          target,
          String.format("only %d of %d pages processed", newProcessed, newTotal));
    }

    boolean hasError = update.errorMessage() != null && !update.errorMessage().isBlank();
    if (target == JobStatus.FAILED && !hasError) {
      throw new IllegalJobTransitionException(id, status, target, "failure needs a message");
    }
    if (target != JobStatus.FAILED && update.errorMessage() != null) {
      throw new IllegalJobTransitionException(
          id, status, target, "error message is only allowed on failure");
    }

    this.status = target;
    this.totalPages = newTotal;
    this.processedPages = newProcessed;
    if (hasError) {
      this.errorMessage = update.errorMessage();
    }
    this.updatedAt = now;
  }

  /** Returns a detached copy, safe to hand to other threads. */
  public OcrJob snapshot() {
    return toBuilder().build();
  }
}
