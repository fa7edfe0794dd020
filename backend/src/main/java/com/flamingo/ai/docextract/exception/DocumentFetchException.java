package com.flamingo.ai.docextract.exception;

import java.util.UUID;

/** Exception thrown when the source file cannot be retrieved from object storage. */
public class DocumentFetchException extends RuntimeException {

  private final UUID fileId;

  public DocumentFetchException(UUID fileId, String message) {
    super(message);
    this.fileId = fileId;
  }

  public DocumentFetchException(UUID fileId, String message, Throwable cause) {
    super(message, cause);
    this.fileId = fileId;
  }

  public UUID getFileId() {
    return fileId;
  }
}
