package com.flamingo.ai.docextract.api.dto.response;

import com.flamingo.ai.docextract.domain.entity.ExtractionFile;
import com.flamingo.ai.docextract.domain.enums.ExtractionStatus;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the state of an extraction job. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionStatusResponse {

  private UUID fileId;
  private String name;
  private String mimeType;
  private ExtractionStatus extractionStatus;
  private ExtractionStatus fullTextStatus;
  private ExtractionStatus layoutStatus;
  private String errorMessage;
  private String fullTextErrorMessage;
  private String layoutErrorMessage;
  private LocalDateTime updatedAt;
  private LocalDateTime completedAt;

  /** Creates an ExtractionStatusResponse from an ExtractionFile entity. */
  public static ExtractionStatusResponse fromEntity(ExtractionFile file) {
    return ExtractionStatusResponse.builder()
        .fileId(file.getId())
        .name(file.getName())
        .mimeType(file.getMimeType())
        .extractionStatus(file.getExtractionStatus())
        .fullTextStatus(file.getFullTextStatus())
        .layoutStatus(file.getLayoutStatus())
        .errorMessage(file.getErrorMessage())
        .fullTextErrorMessage(file.getFullTextErrorMessage())
        .layoutErrorMessage(file.getLayoutErrorMessage())
        .updatedAt(file.getUpdatedAt())
        .completedAt(file.getCompletedAt())
        .build();
  }
}
