package com.flamingo.ai.docextract.domain.repository;

import com.flamingo.ai.docextract.domain.entity.ExtractionFile;
import com.flamingo.ai.docextract.domain.enums.ExtractionStatus;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Repository for extraction files and their job state. */
@Repository
public interface ExtractionFileRepository
    extends JpaRepository<ExtractionFile, UUID>, ExtractionFileStateUpdates {

  /** Finds a file owned by the given user. */
  Optional<ExtractionFile> findByIdAndUserId(UUID id, String userId);

  /**
   * Marks a job as processing with both pipelines pending, unless it is already processing.
   *
   * @return 1 if the job was started, 0 if it was already processing or does not exist
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      "UPDATE ExtractionFile f SET f.extractionStatus = :processing, "
          + "f.fullTextStatus = :pending, f.layoutStatus = :pending, "
          + "f.errorMessage = NULL, f.completedAt = NULL, f.updatedAt = :now "
          + "WHERE f.id = :id AND (f.extractionStatus IS NULL OR f.extractionStatus <> :processing)")
  int markProcessingIfIdle(
      @Param("id") UUID id,
      @Param("processing") ExtractionStatus processing,
      @Param("pending") ExtractionStatus pending,
      @Param("now") LocalDateTime now);
}
