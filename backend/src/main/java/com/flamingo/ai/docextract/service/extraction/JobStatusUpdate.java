package com.flamingo.ai.docextract.service.extraction;

import com.flamingo.ai.docextract.domain.entity.ExtractionFile;
import com.flamingo.ai.docextract.domain.enums.ExtractionStatus;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * A partial update of a job's state. Null fields are left unchanged, so each pipeline writes only
 * its own columns.
 */
@Getter
@Builder
public class JobStatusUpdate {

  private final ExtractionStatus extractionStatus;
  private final ExtractionStatus fullTextStatus;
  private final ExtractionStatus layoutStatus;
  private final String layoutData;
  private final String extractedText;
  private final String fullText;
  private final String errorMessage;
  private final String fullTextErrorMessage;
  private final String layoutErrorMessage;
  private final LocalDateTime completedAt;

  /** Clears the overall error message when {@code errorMessage} is null. */
  private final boolean clearErrorMessage;

  /** Copies the non-null fields onto the entity. */
  public void applyTo(ExtractionFile file) {
    if (extractionStatus != null) {
      file.setExtractionStatus(extractionStatus);
    }
    if (fullTextStatus != null) {
      file.setFullTextStatus(fullTextStatus);
    }
    if (layoutStatus != null) {
      file.setLayoutStatus(layoutStatus);
    }
    if (layoutData != null) {
      file.setLayoutData(layoutData);
    }
    if (extractedText != null) {
      file.setExtractedText(extractedText);
    }
    if (fullText != null) {
      file.setFullText(fullText);
    }
    if (errorMessage != null || clearErrorMessage) {
      file.setErrorMessage(errorMessage);
    }
    if (fullTextErrorMessage != null) {
      file.setFullTextErrorMessage(fullTextErrorMessage);
    }
    if (layoutErrorMessage != null) {
      file.setLayoutErrorMessage(layoutErrorMessage);
    }
    if (completedAt != null) {
      file.setCompletedAt(completedAt);
    }
  }

  /**
   * The columns this update writes, keyed by entity attribute name. Mirrors {@link
   * #applyTo(ExtractionFile)}.
   */
  public Map<String, Object> changes() {
    Map<String, Object> changes = new LinkedHashMap<>();
    putIfPresent(changes, "extractionStatus", extractionStatus);
    putIfPresent(changes, "fullTextStatus", fullTextStatus);
    putIfPresent(changes, "layoutStatus", layoutStatus);
    putIfPresent(changes, "layoutData", layoutData);
    putIfPresent(changes, "extractedText", extractedText);
    putIfPresent(changes, "fullText", fullText);
    if (errorMessage != null || clearErrorMessage) {
      changes.put("errorMessage", errorMessage);
    }
    putIfPresent(changes, "fullTextErrorMessage", fullTextErrorMessage);
    putIfPresent(changes, "layoutErrorMessage", layoutErrorMessage);
    putIfPresent(changes, "completedAt", completedAt);
    return changes;
  }

  private static void putIfPresent(Map<String, Object> changes, String attribute, Object value) {
    if (value != null) {
      changes.put(attribute, value);
    }
  }
}
