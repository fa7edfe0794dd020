package com.flamingo.ai.docextract.service.extraction.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Refined text of a document, grouped per page, stored as the {@code extracted_text} column. */
public record ExtractedText(List<ExtractedPage> pages, int totalBlocks) {

  /** Results of one page ordered by global block index. */
  public record ExtractedPage(int pageIndex, int pageNumber, List<BlockExtractionResult> blocks) {}

  /** Groups results onto the layout's pages; results of unknown pages are dropped. */
  public static ExtractedText group(LayoutResult layout, List<BlockExtractionResult> results) {
    List<ExtractedPage> pages = new ArrayList<>();
    int total = 0;
    for (LayoutPage page : layout.pages()) {
      List<BlockExtractionResult> pageResults =
          results.stream()
              .filter(r -> r.pageIndex() == page.pageIndex())
              .sorted(Comparator.comparingInt(BlockExtractionResult::globalBlockIndex))
              .toList();
      total += pageResults.size();
      pages.add(new ExtractedPage(page.pageIndex(), page.pageNumber(), pageResults));
    }
    return new ExtractedText(pages, total);
  }
}
