package com.flamingo.ai.docextract.service.extraction.model;

/** A block queued for region refinement together with its page image and OCR seed text. */
public record BlockExtractionTask(Block block, int pageIndex, PageImage pageImage, String ocrText) {

  public static BlockExtractionTask of(Block block, LayoutPage page) {
    return new BlockExtractionTask(block, page.pageIndex(), page.image(), block.text());
  }

  public int globalBlockIndex() {
    return block.globalBlockIndex();
  }
}
