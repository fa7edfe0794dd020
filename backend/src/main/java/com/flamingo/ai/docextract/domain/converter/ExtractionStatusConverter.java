package com.flamingo.ai.docextract.domain.converter;

import com.flamingo.ai.docextract.domain.enums.ExtractionStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Persists {@link ExtractionStatus} as its lowercase value ({@code pending}, {@code error}, ...). */
@Converter
public class ExtractionStatusConverter implements AttributeConverter<ExtractionStatus, String> {

  @Override
  public String convertToDatabaseColumn(ExtractionStatus attribute) {
    return attribute == null ? null : attribute.getValue();
  }

  @Override
  public ExtractionStatus convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return null;
    }
    return ExtractionStatus.fromValue(dbData);
  }
}
