package com.flamingo.ai.docextract.service.extraction.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/**
 * Layout of a whole document.
 *
 * @param pages pages in rendering order
 * @param totalPages number of pages
 * @param totalBlocks sum of block counts over all pages
 * @param markdown document markdown, may be null
 * @param fromFallback true when produced by whole-page transcription instead of a layout provider
 */
public record LayoutResult(
    List<LayoutPage> pages,
    int totalPages,
    int totalBlocks,
    String markdown,
    @JsonIgnore boolean fromFallback) {

  public LayoutResult {
    pages = pages == null ? List.of() : List.copyOf(pages);
  }

  public static LayoutResult of(List<LayoutPage> pages, String markdown, boolean fromFallback) {
    int blocks = pages.stream().mapToInt(p -> p.blocks().size()).sum();
    return new LayoutResult(pages, pages.size(), blocks, markdown, fromFallback);
  }
}
