package com.flamingo.ai.docextract.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** Status of an extraction job or of one of its sub-pipelines. */
public enum ExtractionStatus {
  /** Accepted but not started. */
  PENDING("pending"),

  /** Currently running. */
  PROCESSING("processing"),

  /** Finished with a usable result. */
  COMPLETED("completed"),

  /** Finished without a usable result. */
  ERROR("error");

  private final String value;

  ExtractionStatus(String value) {
    this.value = value;
  }

  /** Wire/storage representation. */
  @JsonValue
  public String getValue() {
    return value;
  }

  public static ExtractionStatus fromValue(String value) {
    return Arrays.stream(values())
        .filter(s -> s.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown extraction status: " + value));
  }
}
