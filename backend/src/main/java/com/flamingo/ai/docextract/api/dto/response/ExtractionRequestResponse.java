package com.flamingo.ai.docextract.api.dto.response;

import com.flamingo.ai.docextract.domain.enums.ExtractionMethod;
import com.flamingo.ai.docextract.domain.enums.ExtractionStatus;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an extraction request. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionRequestResponse {

  private UUID fileId;
  private ExtractionStatus status;
  private ExtractionMethod method;
  private String message;
}
