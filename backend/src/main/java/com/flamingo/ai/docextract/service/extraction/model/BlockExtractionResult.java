package com.flamingo.ai.docextract.service.extraction.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Final text of one block. A failed refinement keeps the OCR seed as {@code text} and records the
 * failure in {@code error}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BlockExtractionResult(
    int blockIndex,
    int globalBlockIndex,
    @JsonIgnore int pageIndex,
    String type,
    String text,
    String ocrText,
    BoundingBox bbox,
    String error) {

  public static BlockExtractionResult success(BlockExtractionTask task, String text) {
    return of(task.block(), task.pageIndex(), text, task.ocrText(), null);
  }

  public static BlockExtractionResult degraded(BlockExtractionTask task, String error) {
    return of(task.block(), task.pageIndex(), task.ocrText(), task.ocrText(), error);
  }

  /** Result for a block that skips refinement and keeps its provider text. */
  public static BlockExtractionResult passthrough(Block block, int pageIndex) {
    return of(block, pageIndex, block.text(), block.text(), null);
  }

  private static BlockExtractionResult of(
      Block block, int pageIndex, String text, String ocrText, String error) {
    return new BlockExtractionResult(
        block.blockIndex(),
        block.globalBlockIndex(),
        pageIndex,
        block.type(),
        text,
        ocrText,
        block.bbox(),
        error);
  }

  @JsonIgnore
  public boolean isDegraded() {
    return error != null;
  }
}
