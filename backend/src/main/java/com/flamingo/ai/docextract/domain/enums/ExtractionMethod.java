package com.flamingo.ai.docextract.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** Layout provider chosen for a job. The choice applies to the whole document, never per page. */
public enum ExtractionMethod {
  /** dots.ocr on Replicate, called per page image. */
  DOTS_OCR("dots-ocr"),

  /** Datalab Marker, which also accepts whole PDFs. */
  DATALAB("datalab");

  private final String value;

  ExtractionMethod(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Parses a request value such as {@code dots-ocr}, {@code dotsocr} or {@code DATALAB}.
   *
   * @throws IllegalArgumentException for unknown methods
   */
  public static ExtractionMethod fromValue(String value) {
    String normalized = value == null ? "" : value.trim().toLowerCase().replace('_', '-');
    return Arrays.stream(values())
        .filter(m -> m.value.equals(normalized) || m.value.replace("-", "").equals(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown extraction method: " + value));
  }
}
