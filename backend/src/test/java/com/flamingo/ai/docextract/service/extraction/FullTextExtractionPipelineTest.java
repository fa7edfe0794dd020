package com.flamingo.ai.docextract.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docextract.domain.enums.ExtractionStatus;
import com.flamingo.ai.docextract.exception.JobPersistenceException;
import com.flamingo.ai.docextract.exception.ProviderCallException;
import com.flamingo.ai.docextract.service.extraction.model.SourceDocument;
import com.flamingo.ai.docextract.service.extraction.vision.FullDocumentExtractor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FullTextExtractionPipelineTest {

  @Mock private FullDocumentExtractor fullDocumentExtractor;
  @Mock private JobStateStore store;

  private SimpleMeterRegistry meterRegistry;
  private FullTextExtractionPipeline pipeline;

  private final UUID fileId = UUID.randomUUID();
  private final SourceDocument document =
      new SourceDocument(new byte[] {1}, "application/pdf", "a.pdf");

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    pipeline = new FullTextExtractionPipeline(fullDocumentExtractor, meterRegistry);
  }

  private List<JobStatusUpdate> updates(int expected) {
    ArgumentCaptor<JobStatusUpdate> captor = ArgumentCaptor.forClass(JobStatusUpdate.class);
    verify(store, times(expected)).update(eq(fileId), captor.capture());
    return captor.getAllValues();
  }

  @Test
  void shouldMarkProcessing_thenStoreText() {
    // Given
    when(fullDocumentExtractor.transcribeDocument(document)).thenReturn("## Page 1\n\nHello");

    // When
    PipelineOutcome outcome = pipeline.run(fileId, document, store);

    // Then
    assertThat(outcome.success()).isTrue();
    List<JobStatusUpdate> updates = updates(2);
    assertThat(updates.get(0).getFullTextStatus()).isEqualTo(ExtractionStatus.PROCESSING);
    assertThat(updates.get(1).getFullTextStatus()).isEqualTo(ExtractionStatus.COMPLETED);
    assertThat(updates.get(1).getFullText()).isEqualTo("## Page 1\n\nHello");
    assertThat(updates.get(1).getExtractionStatus()).isNull();
  }

  @Test
  void shouldRecordError_whenTranscriptionFails() {
    // Given
    when(fullDocumentExtractor.transcribeDocument(document))
        .thenThrow(new ProviderCallException("vision", "Vision model call failed: 503"));

    // When
    PipelineOutcome outcome = pipeline.run(fileId, document, store);

    // Then
    assertThat(outcome.success()).isFalse();
    assertThat(outcome.error()).isEqualTo("Vision model call failed: 503");
    JobStatusUpdate last = updates(2).get(1);
    assertThat(last.getFullTextStatus()).isEqualTo(ExtractionStatus.ERROR);
    assertThat(last.getFullTextErrorMessage()).isEqualTo("Vision model call failed: 503");
    assertThat(
            meterRegistry.counter("extraction.pipeline.failure", "pipeline", "fulltext").count())
        .isEqualTo(1.0);
  }

  @Test
  void shouldPropagate_whenFinalStateCannotBeWritten() {
    // Given
    when(fullDocumentExtractor.transcribeDocument(document)).thenReturn("text");
    doNothing()
        .doThrow(new JobPersistenceException(fileId, "Failed to update status", null))
        .when(store)
        .update(eq(fileId), any());

    // When / Then
    assertThatThrownBy(() -> pipeline.run(fileId, document, store))
        .isInstanceOf(JobPersistenceException.class);
  }
}
