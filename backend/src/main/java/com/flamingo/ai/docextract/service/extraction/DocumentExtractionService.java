package com.flamingo.ai.docextract.service.extraction;

import com.flamingo.ai.docextract.config.ExtractionProperties;
import com.flamingo.ai.docextract.domain.entity.ExtractionFile;
import com.flamingo.ai.docextract.domain.enums.ExtractionMethod;
import com.flamingo.ai.docextract.domain.enums.ExtractionStatus;
import com.flamingo.ai.docextract.exception.DocumentFetchException;
import com.flamingo.ai.docextract.exception.ExtractionFileNotFoundException;
import com.flamingo.ai.docextract.exception.JobPersistenceException;
import com.flamingo.ai.docextract.exception.ProviderErrors;
import com.flamingo.ai.docextract.service.extraction.model.SourceDocument;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs an extraction job: the whole-document pipeline and the layout pipeline side by side.
 *
 * <p>The pipelines are isolated from each other. The job completes when at least one of them
 * succeeds and fails only when both fail or the source file cannot be downloaded. A job that is
 * already processing is not started twice.
 */
@Service
@Slf4j
public class DocumentExtractionService {

  private final JobStateStore jobStateStore;
  private final DocumentFetcher documentFetcher;
  private final FullTextExtractionPipeline fullTextPipeline;
  private final LayoutExtractionPipeline layoutPipeline;
  private final Executor pipelineExecutor;
  private final ExtractionProperties properties;
  private final MeterRegistry meterRegistry;

  public DocumentExtractionService(
      JobStateStore jobStateStore,
      DocumentFetcher documentFetcher,
      FullTextExtractionPipeline fullTextPipeline,
      LayoutExtractionPipeline layoutPipeline,
      @Qualifier("extractionPipelineExecutor") Executor pipelineExecutor,
      ExtractionProperties properties,
      MeterRegistry meterRegistry) {
    this.jobStateStore = jobStateStore;
    this.documentFetcher = documentFetcher;
    this.fullTextPipeline = fullTextPipeline;
    this.layoutPipeline = layoutPipeline;
    this.pipelineExecutor = pipelineExecutor;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
  }

  /** Runs a job to completion against the application's job-state store. */
  public ExtractionOutcome extractDocumentFile(
      UUID fileId, String userId, ExtractionMethod method) {
    return extractDocumentFile(fileId, userId, jobStateStore, method);
  }

  /**
   * Runs a job to completion.
   *
   * @param fileId file to extract
   * @param userId owner of the file
   * @param store job-state store to read and write
   * @param method layout provider, or null for the configured default
   * @throws ExtractionFileNotFoundException if the user has no such file
   * @throws JobPersistenceException if job state cannot be written
   */
  public ExtractionOutcome extractDocumentFile(
      UUID fileId, String userId, JobStateStore store, ExtractionMethod method) {
    Optional<ExtractionFile> file = startExtraction(fileId, userId, store);
    if (file.isEmpty()) {
      return ExtractionOutcome.alreadyInProgress(fileId);
    }
    return runExtraction(file.get(), store, method);
  }

  /**
   * Claims a job for processing.
   *
   * @return the file, or empty if its extraction is already in progress
   * @throws ExtractionFileNotFoundException if the user has no such file
   */
  public Optional<ExtractionFile> startExtraction(UUID fileId, String userId, JobStateStore store) {
    ExtractionFile file =
        store
            .findFile(fileId, userId)
            .orElseThrow(() -> new ExtractionFileNotFoundException(fileId));
    if (file.isProcessing() || !store.tryStartExtraction(fileId)) {
      log.info("Extraction already in progress for {}", fileId);
      return Optional.empty();
    }
    log.info("Starting extraction for {} ({})", fileId, file.getName());
    return Optional.of(file);
  }

  /**
   * Runs both pipelines for a claimed job and persists the overall status.
   *
   * @throws JobPersistenceException if job state cannot be written
   */
  public ExtractionOutcome runExtraction(
      ExtractionFile file, JobStateStore store, ExtractionMethod method) {
    UUID fileId = file.getId();
    ExtractionMethod layoutMethod = method != null ? method : properties.getDefaultMethod();

    SourceDocument document;
    try {
      document = documentFetcher.fetch(file);
    } catch (DocumentFetchException e) {
      log.error("Extraction failed for {}: {}", fileId, e.getMessage());
      finish(fileId, store, ExtractionStatus.ERROR, e.getMessage());
      return ExtractionOutcome.failed(fileId, e.getMessage());
    }

    CompletableFuture<Settled> fullText =
        CompletableFuture.supplyAsync(
                () -> fullTextPipeline.run(fileId, document, store), pipelineExecutor)
            .handle(Settled::of);
    CompletableFuture<Settled> layout =
        CompletableFuture.supplyAsync(
                () -> layoutPipeline.run(fileId, document, layoutMethod, store), pipelineExecutor)
            .handle(Settled::of);
    CompletableFuture.allOf(fullText, layout).join();

    Settled fullTextResult = fullText.join();
    Settled layoutResult = layout.join();
    fullTextResult.rethrowPersistenceError();
    layoutResult.rethrowPersistenceError();

    boolean fullTextSuccess = fullTextResult.outcome().success();
    boolean layoutSuccess = layoutResult.outcome().success();
    String errorMessage = null;
    ExtractionStatus overall = ExtractionStatus.COMPLETED;
    if (!fullTextSuccess && !layoutSuccess) {
      overall = ExtractionStatus.ERROR;
      errorMessage =
          String.format(
              "Whole-document: %s; Layout: %s",
              fullTextResult.errorOrUnknown(), layoutResult.errorOrUnknown());
    }
    finish(fileId, store, overall, errorMessage);

    log.info(
        "Extraction finished for {}: {} (whole-document: {}, layout: {})",
        fileId,
        overall.getValue(),
        fullTextSuccess ? "success" : "failed",
        layoutSuccess ? "success" : "failed");
    return new ExtractionOutcome(
        fileId, overall == ExtractionStatus.COMPLETED, fullTextSuccess, layoutSuccess, errorMessage);
  }

  /**
   * Ends a claimed job that could not be started, so that a later request can claim it again.
   *
   * @throws JobPersistenceException if job state cannot be written
   */
  public ExtractionOutcome abandonExtraction(UUID fileId, JobStateStore store, String reason) {
    log.warn("Extraction for {} could not be started: {}", fileId, reason);
    finish(fileId, store, ExtractionStatus.ERROR, reason);
    return ExtractionOutcome.failed(fileId, reason);
  }

  private void finish(
      UUID fileId, JobStateStore store, ExtractionStatus status, String errorMessage) {
    store.update(
        fileId,
        JobStatusUpdate.builder()
            .extractionStatus(status)
            .errorMessage(errorMessage)
            .clearErrorMessage(errorMessage == null)
            .completedAt(LocalDateTime.now())
            .build());
    String counter =
        status == ExtractionStatus.COMPLETED ? "extraction.job.completed" : "extraction.job.error";
    meterRegistry.counter(counter).increment();
  }

  /** A pipeline's outcome, or the persistence failure that ended it. */
  private record Settled(PipelineOutcome outcome, JobPersistenceException persistenceError) {

    static Settled of(PipelineOutcome outcome, Throwable error) {
      if (error == null) {
        return new Settled(outcome, null);
      }
      Throwable cause =
          error instanceof CompletionException && error.getCause() != null
              ? error.getCause()
              : error;
      if (cause instanceof JobPersistenceException persistenceError) {
        return new Settled(PipelineOutcome.failed(cause.getMessage()), persistenceError);
      }
      return new Settled(PipelineOutcome.failed(ProviderErrors.describe(cause)), null);
    }

    void rethrowPersistenceError() {
      if (persistenceError != null) {
        throw persistenceError;
      }
    }

    String errorOrUnknown() {
      return outcome.error() != null ? outcome.error() : "unknown";
    }
  }
}
