package com.flamingo.ai.docextract.domain.enums;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ExtractionMethodTest {

  @ParameterizedTest
  @ValueSource(strings = {"dots-ocr", "dotsocr", "DOTS_OCR", " Dots-OCR "})
  void shouldParseDotsOcrSpellings(String value) {
    assertThat(ExtractionMethod.fromValue(value)).isEqualTo(ExtractionMethod.DOTS_OCR);
  }

  @Test
  void shouldParseDatalab() {
    assertThat(ExtractionMethod.fromValue("DATALAB")).isEqualTo(ExtractionMethod.DATALAB);
  }

  @Test
  void shouldRejectUnknownMethod() {
    assertThatThrownBy(() -> ExtractionMethod.fromValue("tesseract"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unknown extraction method: tesseract");
  }
}
