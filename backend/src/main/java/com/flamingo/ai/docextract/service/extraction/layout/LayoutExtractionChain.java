package com.flamingo.ai.docextract.service.extraction.layout;

import com.flamingo.ai.docextract.config.ExtractionProperties;
import com.flamingo.ai.docextract.domain.enums.ExtractionMethod;
import com.flamingo.ai.docextract.service.extraction.model.Block;
import com.flamingo.ai.docextract.service.extraction.model.LayoutPage;
import com.flamingo.ai.docextract.service.extraction.model.LayoutRequest;
import com.flamingo.ai.docextract.service.extraction.model.LayoutResult;
import com.flamingo.ai.docextract.service.extraction.model.PageImage;
import com.flamingo.ai.docextract.service.extraction.model.ProviderBlock;
import com.flamingo.ai.docextract.service.extraction.model.ProviderLayout;
import com.flamingo.ai.docextract.service.extraction.model.ProviderLayout.PageSize;
import com.flamingo.ai.docextract.service.extraction.model.QualityStats;
import com.flamingo.ai.docextract.service.extraction.model.SourceDocument;
import com.flamingo.ai.docextract.service.extraction.quality.OcrQualityAssessor;
import com.flamingo.ai.docextract.service.extraction.render.PageRasterizer;
import com.flamingo.ai.docextract.service.extraction.vision.FullDocumentExtractor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Produces the block layout of a document.
 *
 * <p>Each page goes to the job's layout provider. Output judged low quality gets one more attempt
 * on an upscaled page image; if upscaling or the second attempt fails, the first output stands. A
 * failing provider call (or rendering) sends the whole document to whole-page vision transcription
 * instead.
 */
@Service
@Slf4j
public class LayoutExtractionChain {

  private static final String PAGE_SEPARATOR = FullDocumentExtractor.PAGE_SEPARATOR;

  private final PageRasterizer pageRasterizer;
  private final LayoutProviderRouter providerRouter;
  private final OcrQualityAssessor qualityAssessor;
  private final ImageUpscaler imageUpscaler;
  private final FullDocumentExtractor fallbackExtractor;
  private final int upscaleScale;

  private final Counter upscaleAttempts;
  private final Counter upscaleFailures;
  private final Counter fallbacks;

  public LayoutExtractionChain(
      PageRasterizer pageRasterizer,
      LayoutProviderRouter providerRouter,
      OcrQualityAssessor qualityAssessor,
      ImageUpscaler imageUpscaler,
      FullDocumentExtractor fallbackExtractor,
      ExtractionProperties properties,
      MeterRegistry meterRegistry) {
    this.pageRasterizer = pageRasterizer;
    this.providerRouter = providerRouter;
    this.qualityAssessor = qualityAssessor;
    this.imageUpscaler = imageUpscaler;
    this.fallbackExtractor = fallbackExtractor;
    this.upscaleScale = properties.getUpscale().getScale();
    this.upscaleAttempts = meterRegistry.counter("extraction.layout.upscale.attempts");
    this.upscaleFailures = meterRegistry.counter("extraction.layout.upscale.failures");
    this.fallbacks = meterRegistry.counter("extraction.layout.fallback");
  }

  /**
   * Extracts the layout of a document.
   *
   * @param document source document
   * @param method layout provider for the whole document
   * @return layout with global block indexes assigned in page order
   * @throws RuntimeException when both structured extraction and the fallback transcription fail
   */
  public LayoutResult extract(SourceDocument document, ExtractionMethod method) {
    List<PageImage> pages = null;
    try {
      pages = pageRasterizer.rasterize(document);
      LayoutProvider provider = providerRouter.route(method);
      Analysis analysis =
          provider.acceptsDocuments() && document.isPdf()
              ? analyzeDocument(provider, document, pages)
              : analyzePages(provider, document, pages);
      LayoutResult result =
          LayoutResult.of(assignGlobalIndexes(analysis.pages()), analysis.markdown(), false);
      log.info(
          "Layout via {}: {} pages, {} blocks",
          method.getValue(),
          result.totalPages(),
          result.totalBlocks());
      return result;
    } catch (RuntimeException e) {
      fallbacks.increment();
      log.warn(
          "Layout extraction via {} failed for {}, falling back to full-page transcription: {}",
          method.getValue(),
          document.fileName(),
          e.getMessage());
      return fallbackExtractor.extractLayout(document, pages);
    }
  }

  /**
   * Page-scoped calls. PDF markdown is collected per page under a {@code ## Page N} heading; a
   * single image keeps the provider markdown as is.
   */
  private Analysis analyzePages(
      LayoutProvider provider, SourceDocument document, List<PageImage> pages) {
    List<LayoutPage> layoutPages = new ArrayList<>();
    List<String> markdownParts = new ArrayList<>();
    String singleMarkdown = null;
    for (PageImage page : pages) {
      PageAnalysis analysis = analyzePage(provider, document, page);
      layoutPages.add(analysis.page());
      if (hasText(analysis.markdown())) {
        markdownParts.add("## Page " + page.pageNumber() + "\n\n" + analysis.markdown());
        singleMarkdown = analysis.markdown();
      }
    }
    if (!document.isPdf()) {
      return new Analysis(layoutPages, singleMarkdown);
    }
    return new Analysis(
        layoutPages, markdownParts.isEmpty() ? null : String.join(PAGE_SEPARATOR, markdownParts));
  }

  /** One provider call for the page, plus at most one upscaled retry when quality is low. */
  PageAnalysis analyzePage(LayoutProvider provider, SourceDocument document, PageImage page) {
    ProviderLayout layout = provider.analyze(LayoutRequest.forPage(page, document.fileName()));
    PageImage usedImage = page;

    QualityStats stats = qualityAssessor.assess(layout);
    if (stats.lowQuality()) {
      log.info(
          "Low-quality layout on page {} (blocks={}, text={}, emptyRatio={}), retrying upscaled",
          page.pageNumber(),
          stats.blockCount(),
          stats.totalTextLength(),
          String.format("%.2f", stats.emptyBlockRatio()));
      upscaleAttempts.increment();
      try {
        PageImage upscaled = imageUpscaler.upscale(page, upscaleScale);
        layout = provider.analyze(LayoutRequest.forPage(upscaled, document.fileName()));
        usedImage = upscaled;
      } catch (RuntimeException e) {
        upscaleFailures.increment();
        log.warn(
            "Upscaled retry failed on page {}, keeping original output: {}",
            page.pageNumber(),
            e.getMessage());
      }
    }

    List<Block> blocks = new ArrayList<>();
    for (ProviderBlock providerBlock : layout.blocks()) {
      blocks.add(providerBlock.toBlock(blocks.size()));
    }
    LayoutPage layoutPage =
        new LayoutPage(
            page.pageIndex(),
            page.pageNumber(),
            usedImage.width(),
            usedImage.height(),
            usedImage,
            blocks);
    return new PageAnalysis(layoutPage, layout.markdown());
  }

  /**
   * One call for the whole document. Blocks land on the page the provider tagged them with;
   * untagged blocks land on the first page.
   */
  private Analysis analyzeDocument(
      LayoutProvider provider, SourceDocument document, List<PageImage> pages) {
    ProviderLayout layout = provider.analyze(LayoutRequest.forDocument(document));
    Map<Integer, PageSize> sizes = layout.pageSizes();

    List<LayoutPage> layoutPages = new ArrayList<>();
    for (PageImage page : pages) {
      List<Block> blocks = new ArrayList<>();
      for (ProviderBlock providerBlock : layout.blocks()) {
        int blockPage = providerBlock.pageIndex() != null ? providerBlock.pageIndex() : 0;
        if (blockPage == page.pageIndex()) {
          blocks.add(providerBlock.toBlock(blocks.size()));
        }
      }
      PageSize size = sizes.get(page.pageIndex());
      layoutPages.add(
          new LayoutPage(
              page.pageIndex(),
              page.pageNumber(),
              size != null ? size.width() : page.width(),
              size != null ? size.height() : page.height(),
              page,
              blocks));
    }
    return new Analysis(layoutPages, layout.markdown());
  }

  /** Numbers blocks across the document in (page, block) order. */
  static List<LayoutPage> assignGlobalIndexes(List<LayoutPage> pages) {
    List<LayoutPage> indexed = new ArrayList<>();
    int next = 0;
    for (LayoutPage page : pages) {
      List<Block> blocks = new ArrayList<>();
      for (Block block : page.blocks()) {
        blocks.add(block.withGlobalBlockIndex(next++));
      }
      indexed.add(page.withBlocks(blocks));
    }
    return indexed;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isEmpty();
  }

  record PageAnalysis(LayoutPage page, String markdown) {}

  private record Analysis(List<LayoutPage> pages, String markdown) {}
}
