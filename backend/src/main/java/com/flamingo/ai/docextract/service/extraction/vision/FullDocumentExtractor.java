package com.flamingo.ai.docextract.service.extraction.vision;

import com.flamingo.ai.docextract.service.extraction.model.Block;
import com.flamingo.ai.docextract.service.extraction.model.BoundingBox;
import com.flamingo.ai.docextract.service.extraction.model.LayoutPage;
import com.flamingo.ai.docextract.service.extraction.model.LayoutResult;
import com.flamingo.ai.docextract.service.extraction.model.PageImage;
import com.flamingo.ai.docextract.service.extraction.model.SourceDocument;
import com.flamingo.ai.docextract.service.extraction.render.PageRasterizer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Whole-page transcription with the vision model, used by the whole-document pipeline and as the
 * fallback when structured layout is unavailable. Pages are transcribed one after another.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FullDocumentExtractor {

  public static final String PAGE_SEPARATOR = "\n\n---\n\n";
  public static final String FALLBACK_BLOCK_TYPE = "text";

  private final PageRasterizer pageRasterizer;
  private final VisionTranscriptionClient visionClient;

  /**
   * Transcribes a document to markdown. PDF pages are headed {@code ## Page N}; a single image is
   * returned as transcribed.
   */
  public String transcribeDocument(SourceDocument document) {
    if (!document.isPdf()) {
      return visionClient.transcribePage(pageRasterizer.rasterize(document).get(0));
    }
    List<PageImage> pages = pageRasterizer.rasterize(document);
    List<String> sections = new ArrayList<>();
    for (PageImage page : pages) {
      String text = visionClient.transcribePage(page);
      sections.add("## Page " + page.pageNumber() + "\n\n" + text);
      log.debug("Transcribed page {}/{} ({} chars)", page.pageNumber(), pages.size(), text.length());
    }
    log.info("Transcribed {} pages of {}", pages.size(), document.fileName());
    return String.join(PAGE_SEPARATOR, sections);
  }

  /**
   * Builds a layout with one synthetic block per page holding the page transcription.
   *
   * @param document the source document
   * @param pages already rendered pages, or null to render them here
   */
  public LayoutResult extractLayout(SourceDocument document, List<PageImage> pages) {
    List<PageImage> pageImages = pages != null ? pages : pageRasterizer.rasterize(document);
    return transcribePages(pageImages);
  }

  /** Transcribes the given pages into a fallback layout. */
  public LayoutResult transcribePages(List<PageImage> pages) {
    List<LayoutPage> layoutPages = new ArrayList<>();
    List<String> texts = new ArrayList<>();
    for (PageImage page : pages) {
      String text = visionClient.transcribePage(page);
      texts.add(text);
      Block block =
          new Block(
              0,
              layoutPages.size(),
              FALLBACK_BLOCK_TYPE,
              FALLBACK_BLOCK_TYPE,
              text,
              text,
              BoundingBox.EMPTY,
              null,
              null);
      layoutPages.add(
          new LayoutPage(
              page.pageIndex(), page.pageNumber(), page.width(), page.height(), page, List.of(block)));
    }
    log.info("Fallback transcription produced {} whole-page blocks", layoutPages.size());
    return LayoutResult.of(layoutPages, String.join(PAGE_SEPARATOR, texts), true);
  }
}
