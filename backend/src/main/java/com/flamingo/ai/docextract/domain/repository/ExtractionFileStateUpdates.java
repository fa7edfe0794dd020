package com.flamingo.ai.docextract.domain.repository;

import java.util.Map;
import java.util.UUID;

/** Column-targeted writes of job state. */
public interface ExtractionFileStateUpdates {

  /**
   * Sets the given attributes of one file in a single {@code UPDATE} statement. Attributes absent
   * from {@code changes} keep their stored values, so concurrent writers touching different columns
   * do not overwrite each other.
   *
   * @param id file id
   * @param changes entity attribute name to new value; a null value clears the column
   * @return number of rows updated, 0 when the file does not exist
   */
  int updateColumns(UUID id, Map<String, Object> changes);
}
