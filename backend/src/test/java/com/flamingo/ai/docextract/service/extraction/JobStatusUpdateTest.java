package com.flamingo.ai.docextract.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docextract.domain.entity.ExtractionFile;
import com.flamingo.ai.docextract.domain.enums.ExtractionStatus;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

class JobStatusUpdateTest {

  @Test
  void shouldKeepErrorMessage_whenNotCleared() {
    ExtractionFile file = ExtractionFile.builder().errorMessage("old failure").build();

    JobStatusUpdate.builder().fullTextStatus(ExtractionStatus.COMPLETED).build().applyTo(file);

    assertThat(file.getErrorMessage()).isEqualTo("old failure");
    assertThat(file.getFullTextStatus()).isEqualTo(ExtractionStatus.COMPLETED);
  }

  @Test
  void shouldClearErrorMessage_onSuccessfulFinish() {
    ExtractionFile file = ExtractionFile.builder().errorMessage("old failure").build();
    LocalDateTime now = LocalDateTime.now();

    JobStatusUpdate.builder()
        .extractionStatus(ExtractionStatus.COMPLETED)
        .clearErrorMessage(true)
        .completedAt(now)
        .build()
        .applyTo(file);

    assertThat(file.getErrorMessage()).isNull();
    assertThat(file.getExtractionStatus()).isEqualTo(ExtractionStatus.COMPLETED);
    assertThat(file.getCompletedAt()).isEqualTo(now);
  }

  @Test
  void shouldListOnlyCarriedColumns() {
    JobStatusUpdate update =
        JobStatusUpdate.builder()
            .layoutStatus(ExtractionStatus.COMPLETED)
            .layoutData("{}")
            .extractedText("[]")
            .build();

    assertThat(update.changes())
        .containsOnlyKeys("layoutStatus", "layoutData", "extractedText")
        .containsEntry("layoutStatus", ExtractionStatus.COMPLETED);
  }

  @Test
  void shouldListNullErrorMessage_whenCleared() {
    JobStatusUpdate update =
        JobStatusUpdate.builder()
            .extractionStatus(ExtractionStatus.COMPLETED)
            .clearErrorMessage(true)
            .build();

    assertThat(update.changes()).containsEntry("errorMessage", null).hasSize(2);
  }
}
