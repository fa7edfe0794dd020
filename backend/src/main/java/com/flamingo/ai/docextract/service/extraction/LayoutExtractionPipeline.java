package com.flamingo.ai.docextract.service.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.docextract.config.ExtractionProperties;
import com.flamingo.ai.docextract.domain.enums.ExtractionMethod;
import com.flamingo.ai.docextract.domain.enums.ExtractionStatus;
import com.flamingo.ai.docextract.exception.JobPersistenceException;
import com.flamingo.ai.docextract.exception.ProviderErrors;
import com.flamingo.ai.docextract.service.extraction.block.BlockTextExtractionScheduler;
import com.flamingo.ai.docextract.service.extraction.block.ConcurrencyController;
import com.flamingo.ai.docextract.service.extraction.layout.LayoutExtractionChain;
import com.flamingo.ai.docextract.service.extraction.model.Block;
import com.flamingo.ai.docextract.service.extraction.model.BlockExtractionResult;
import com.flamingo.ai.docextract.service.extraction.model.BlockExtractionTask;
import com.flamingo.ai.docextract.service.extraction.model.ExtractedText;
import com.flamingo.ai.docextract.service.extraction.model.LayoutPage;
import com.flamingo.ai.docextract.service.extraction.model.LayoutResult;
import com.flamingo.ai.docextract.service.extraction.model.PageImage;
import com.flamingo.ai.docextract.service.extraction.model.SourceDocument;
import com.flamingo.ai.docextract.service.extraction.vision.FullDocumentExtractor;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Layout pipeline: block layout from the extraction chain, then per-block text refinement.
 *
 * <p>Blocks without area keep their provider text. A layout without any block is transcribed page
 * by page instead, one whole-page block each.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LayoutExtractionPipeline {

  static final String PIPELINE = "layout";

  private final LayoutExtractionChain layoutExtractionChain;
  private final BlockTextExtractionScheduler blockScheduler;
  private final FullDocumentExtractor fullDocumentExtractor;
  private final ExtractionProperties properties;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  /**
   * Runs the pipeline and persists layout, extracted text and status. Extraction failures are
   * recorded and reported in the outcome.
   *
   * @throws JobPersistenceException if the final state cannot be written
   */
  @Timed(value = "extraction.pipeline.layout", description = "Time to extract layout and blocks")
  public PipelineOutcome run(
      UUID fileId, SourceDocument document, ExtractionMethod method, JobStateStore store) {
    markProcessing(fileId, store);

    String layoutJson;
    String extractedJson;
    int blockCount;
    try {
      LayoutResult layout = layoutExtractionChain.extract(document, method);
      List<BlockExtractionResult> results;
      if (layout.fromFallback()) {
        results = passthrough(layout);
      } else if (layout.totalBlocks() == 0) {
        log.info("No blocks detected for {}, transcribing pages instead", fileId);
        layout = fullDocumentExtractor.transcribePages(pageImages(layout));
        results = passthrough(layout);
      } else {
        results = refine(layout);
      }

      layoutJson = objectMapper.writeValueAsString(withExtractedText(layout, results));
      extractedJson = objectMapper.writeValueAsString(ExtractedText.group(layout, results));
      blockCount = results.size();
    } catch (JsonProcessingException e) {
      return fail(fileId, store, "Failed to serialize layout: " + e.getOriginalMessage(), e);
    } catch (RuntimeException e) {
      return fail(fileId, store, ProviderErrors.describe(e), e);
    }

    store.update(
        fileId,
        JobStatusUpdate.builder()
            .layoutData(layoutJson)
            .extractedText(extractedJson)
            .layoutStatus(ExtractionStatus.COMPLETED)
            .build());
    meterRegistry.counter("extraction.pipeline.success", "pipeline", PIPELINE).increment();
    log.info("Layout extraction completed for {} ({} blocks)", fileId, blockCount);
    return PipelineOutcome.succeeded();
  }

  /** Refines blocks with a usable region; the rest pass through. Ordered by global index. */
  List<BlockExtractionResult> refine(LayoutResult layout) {
    List<BlockExtractionTask> tasks = new ArrayList<>();
    List<BlockExtractionResult> results = new ArrayList<>();
    for (LayoutPage page : layout.pages()) {
      for (Block block : page.blocks()) {
        if (block.bbox() != null && block.bbox().isValidRegion()) {
          tasks.add(BlockExtractionTask.of(block, page));
        } else {
          results.add(BlockExtractionResult.passthrough(block, page.pageIndex()));
        }
      }
    }
    if (!results.isEmpty()) {
      log.debug("{} blocks without a usable region keep their provider text", results.size());
    }

    ConcurrencyController controller = new ConcurrencyController(properties.getConcurrency());
    results.addAll(blockScheduler.extractAll(tasks, controller));
    results.sort(Comparator.comparingInt(BlockExtractionResult::globalBlockIndex));
    return results;
  }

  private static List<BlockExtractionResult> passthrough(LayoutResult layout) {
    List<BlockExtractionResult> results = new ArrayList<>();
    for (LayoutPage page : layout.pages()) {
      for (Block block : page.blocks()) {
        results.add(BlockExtractionResult.passthrough(block, page.pageIndex()));
      }
    }
    return results;
  }

  private static List<PageImage> pageImages(LayoutResult layout) {
    return layout.pages().stream().map(LayoutPage::image).toList();
  }

  /** Layout for storage, each block carrying its final text. */
  static LayoutResult withExtractedText(LayoutResult layout, List<BlockExtractionResult> results) {
    Map<Integer, String> texts = new HashMap<>();
    for (BlockExtractionResult result : results) {
      texts.put(result.globalBlockIndex(), result.text());
    }
    List<LayoutPage> pages = new ArrayList<>();
    for (LayoutPage page : layout.pages()) {
      pages.add(
          page.withBlocks(
              page.blocks().stream()
                  .map(b -> b.withExtractedText(texts.getOrDefault(b.globalBlockIndex(), b.text())))
                  .toList()));
    }
    return new LayoutResult(
        pages, layout.totalPages(), layout.totalBlocks(), layout.markdown(), layout.fromFallback());
  }

  private PipelineOutcome fail(UUID fileId, JobStateStore store, String error, Exception cause) {
    log.error("Layout extraction failed for {}: {}", fileId, error, cause);
    meterRegistry.counter("extraction.pipeline.failure", "pipeline", PIPELINE).increment();
    store.update(
        fileId,
        JobStatusUpdate.builder()
            .layoutStatus(ExtractionStatus.ERROR)
            .layoutErrorMessage(error)
            .build());
    return PipelineOutcome.failed(error);
  }

  private void markProcessing(UUID fileId, JobStateStore store) {
    try {
      store.update(
          fileId, JobStatusUpdate.builder().layoutStatus(ExtractionStatus.PROCESSING).build());
    } catch (JobPersistenceException e) {
      log.warn("Failed to mark layout pipeline processing for {}: {}", fileId, e.getMessage());
    }
  }
}
