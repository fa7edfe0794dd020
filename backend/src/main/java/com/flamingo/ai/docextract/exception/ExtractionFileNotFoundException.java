package com.flamingo.ai.docextract.exception;

import java.util.UUID;

/** Exception thrown when a file does not exist or is not owned by the requesting user. */
public class ExtractionFileNotFoundException extends RuntimeException {

  private final UUID fileId;

  public ExtractionFileNotFoundException(UUID fileId) {
    super("File not found: " + fileId);
    this.fileId = fileId;
  }

  public UUID getFileId() {
    return fileId;
  }
}
