package com.flamingo.ai.docextract.service.extraction;

import com.flamingo.ai.docextract.domain.entity.ExtractionFile;
import com.flamingo.ai.docextract.domain.enums.ExtractionStatus;
import com.flamingo.ai.docextract.domain.repository.ExtractionFileRepository;
import com.flamingo.ai.docextract.exception.JobPersistenceException;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Job state in the {@code document_extraction_files} table. Updates write only the columns they
 * carry, in one statement. SQLite allows one writer at a time, so writes are retried on lock
 * contention before giving up.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaJobStateStore implements JobStateStore {

  private static final int MAX_RETRIES = 3;
  private static final long RETRY_DELAY_MS = 100;

  private final ExtractionFileRepository repository;

  @Override
  @Transactional(readOnly = true)
  public Optional<ExtractionFile> findFile(UUID fileId, String userId) {
    return repository.findByIdAndUserId(fileId, userId);
  }

  @Override
  public boolean tryStartExtraction(UUID fileId) {
    int updated =
        withRetry(
            fileId,
            "start extraction",
            () ->
                repository.markProcessingIfIdle(
                    fileId,
                    ExtractionStatus.PROCESSING,
                    ExtractionStatus.PENDING,
                    LocalDateTime.now()));
    return updated > 0;
  }

  @Override
  public void update(UUID fileId, JobStatusUpdate update) {
    withRetry(
        fileId,
        "update status",
        () -> {
          int updated = repository.updateColumns(fileId, update.changes());
          return updated > 0 ? updated : insert(fileId, update);
        });
  }

  /** Creates the record for an update that found none; a concurrent insert falls back to update. */
  private int insert(UUID fileId, JobStatusUpdate update) {
    ExtractionFile file = ExtractionFile.builder().id(fileId).build();
    update.applyTo(file);
    try {
      repository.saveAndFlush(file);
      return 1;
    } catch (DataIntegrityViolationException e) {
      log.debug("Record for file {} was created concurrently, updating it", fileId);
      return repository.updateColumns(fileId, update.changes());
    }
  }

  private <T> T withRetry(UUID fileId, String operation, Supplier<T> write) {
    for (int attempt = 1; ; attempt++) {
      try {
        return write.get();
      } catch (CannotAcquireLockException e) {
        if (attempt == MAX_RETRIES) {
          log.error("Failed to {} for file {} after {} retries", operation, fileId, MAX_RETRIES);
          throw new JobPersistenceException(
              fileId, "Failed to " + operation + ": database is locked", e);
        }
        log.warn(
            "SQLite lock contention on file {}, retry {}/{}", fileId, attempt, MAX_RETRIES);
        try {
          Thread.sleep(RETRY_DELAY_MS * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new JobPersistenceException(fileId, "Interrupted during retry", ie);
        }
      } catch (DataAccessException e) {
        log.error("Failed to {} for file {}: {}", operation, fileId, e.getMessage());
        throw new JobPersistenceException(fileId, "Failed to " + operation, e);
      }
    }
  }
}
