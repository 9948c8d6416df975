package com.flamingo.ai.pdfocr.domain.repository;

import com.flamingo.ai.pdfocr.domain.entity.JobTombstone;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for ids of deleted jobs. */
@Repository
public interface JobTombstoneRepository extends JpaRepository<JobTombstone, String> {}
