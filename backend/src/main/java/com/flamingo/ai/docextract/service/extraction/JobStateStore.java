package com.flamingo.ai.docextract.service.extraction;

import com.flamingo.ai.docextract.domain.entity.ExtractionFile;
import java.util.Optional;
import java.util.UUID;

/** Read/write access to extraction job state, keyed by file id. */
public interface JobStateStore {

  /** Finds a file owned by the user. */
  Optional<ExtractionFile> findFile(UUID fileId, String userId);

  /**
   * Atomically marks the job as processing with both pipelines pending.
   *
   * @return false if the job is already processing
   */
  boolean tryStartExtraction(UUID fileId);

  /**
   * Applies an update, creating the record when it does not exist yet.
   *
   * @throws com.flamingo.ai.docextract.exception.JobPersistenceException if the write fails
   */
  void update(UUID fileId, JobStatusUpdate update);
}
