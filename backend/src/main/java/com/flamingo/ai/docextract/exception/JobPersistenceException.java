package com.flamingo.ai.docextract.exception;

import java.util.UUID;

/**
 * Exception thrown when the job-state store cannot be written. A job whose final write fails is
 * left in {@code processing} and has to be reconciled externally.
 */
public class JobPersistenceException extends RuntimeException {

  private final UUID fileId;

  public JobPersistenceException(UUID fileId, String message, Throwable cause) {
    super(message, cause);
    this.fileId = fileId;
  }

  public UUID getFileId() {
    return fileId;
  }
}
