package com.flamingo.ai.docextract.service.extraction;

import java.util.UUID;

/**
 * Summary of one extraction request.
 *
 * @param fileId the job's file
 * @param success overall status is {@code completed}
 * @param fullTextSuccess the whole-document pipeline succeeded
 * @param layoutSuccess the layout pipeline succeeded
 * @param message error or informational message, null on plain success
 */
public record ExtractionOutcome(
    UUID fileId, boolean success, boolean fullTextSuccess, boolean layoutSuccess, String message) {

  public static final String ALREADY_IN_PROGRESS = "Extraction already in progress";
  public static final String QUEUE_FULL = "Extraction queue is full, try again later";

  public static ExtractionOutcome alreadyInProgress(UUID fileId) {
    return new ExtractionOutcome(fileId, false, false, false, ALREADY_IN_PROGRESS);
  }

  public static ExtractionOutcome failed(UUID fileId, String message) {
    return new ExtractionOutcome(fileId, false, false, false, message);
  }

  public boolean isAlreadyInProgress() {
    return ALREADY_IN_PROGRESS.equals(message) && !success;
  }
}
