package com.flamingo.ai.docextract.service.extraction.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * A detected region of a page.
 *
 * @param blockIndex index within the page
 * @param globalBlockIndex index across the document, increasing in (page, block) order
 * @param type block type reported by the provider
 * @param category provider category, often equal to {@code type}
 * @param content raw provider text
 * @param extractedText refined text once block extraction ran, otherwise null
 * @param bbox {@code [x, y, width, height]}
 * @param originalBbox provider corners {@code [x1, y1, x2, y2]}, when available
 * @param polygon flattened polygon points, when available
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Block(
    int blockIndex,
    int globalBlockIndex,
    String type,
    String category,
    String content,
    String extractedText,
    BoundingBox bbox,
    List<Double> originalBbox,
    List<Double> polygon) {

  public static final String TEXT_TYPE = "text";

  /** Raw provider text, never null. */
  public String text() {
    return content == null ? "" : content;
  }

  public Block withGlobalBlockIndex(int index) {
    return new Block(
        blockIndex, index, type, category, content, extractedText, bbox, originalBbox, polygon);
  }

  public Block withExtractedText(String text) {
    return new Block(
        blockIndex, globalBlockIndex, type, category, content, text, bbox, originalBbox, polygon);
  }
}
