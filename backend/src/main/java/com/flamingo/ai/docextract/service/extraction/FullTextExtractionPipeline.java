package com.flamingo.ai.docextract.service.extraction;

import com.flamingo.ai.docextract.domain.enums.ExtractionStatus;
import com.flamingo.ai.docextract.exception.JobPersistenceException;
import com.flamingo.ai.docextract.exception.ProviderErrors;
import com.flamingo.ai.docextract.service.extraction.model.SourceDocument;
import com.flamingo.ai.docextract.service.extraction.vision.FullDocumentExtractor;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Whole-document pipeline: transcribes every page with the vision model into one markdown text. */
@Service
@RequiredArgsConstructor
@Slf4j
public class FullTextExtractionPipeline {

  static final String PIPELINE = "fulltext";

  private final FullDocumentExtractor fullDocumentExtractor;
  private final MeterRegistry meterRegistry;

  /**
   * Runs the pipeline and persists its status and text. Extraction failures are recorded and
   * reported in the outcome.
   *
   * @throws JobPersistenceException if the final state cannot be written
   */
  @Timed(value = "extraction.pipeline.fulltext", description = "Time to transcribe a document")
  public PipelineOutcome run(UUID fileId, SourceDocument document, JobStateStore store) {
    markProcessing(fileId, store);

    String fullText;
    try {
      fullText = fullDocumentExtractor.transcribeDocument(document);
    } catch (RuntimeException e) {
      String error = ProviderErrors.describe(e);
      log.error("Whole-document extraction failed for {}: {}", fileId, error, e);
      meterRegistry.counter("extraction.pipeline.failure", "pipeline", PIPELINE).increment();
      store.update(
          fileId,
          JobStatusUpdate.builder()
              .fullTextStatus(ExtractionStatus.ERROR)
              .fullTextErrorMessage(error)
              .build());
      return PipelineOutcome.failed(error);
    }

    store.update(
        fileId,
        JobStatusUpdate.builder()
            .fullText(fullText)
            .fullTextStatus(ExtractionStatus.COMPLETED)
            .build());
    meterRegistry.counter("extraction.pipeline.success", "pipeline", PIPELINE).increment();
    log.info("Whole-document extraction completed for {} ({} chars)", fileId, fullText.length());
    return PipelineOutcome.succeeded();
  }

  private void markProcessing(UUID fileId, JobStateStore store) {
    try {
      store.update(
          fileId, JobStatusUpdate.builder().fullTextStatus(ExtractionStatus.PROCESSING).build());
    } catch (JobPersistenceException e) {
      log.warn("Failed to mark whole-document pipeline processing for {}: {}", fileId, e.getMessage());
    }
  }
}
