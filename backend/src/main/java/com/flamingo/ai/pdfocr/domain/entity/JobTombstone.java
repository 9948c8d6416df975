package com.flamingo.ai.pdfocr.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** Marks a deleted job id so it is never handed out again. */
@Entity
@Table(name = "job_tombstones")
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class JobTombstone {

  @Id
  @Column(length = 64)
  private String jobId;

  @Column(nullable = false)
  private LocalDateTime deletedAt;
}
