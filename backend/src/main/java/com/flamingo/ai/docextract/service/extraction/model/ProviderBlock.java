package com.flamingo.ai.docextract.service.extraction.model;

import java.util.List;

/**
 * A block as returned by a layout provider after normalization, before it is placed on a page.
 *
 * @param pageIndex page the provider assigned the block to, null for page-scoped calls
 */
public record ProviderBlock(
    String type,
    String category,
    String content,
    BoundingBox bbox,
    List<Double> originalBbox,
    List<Double> polygon,
    Integer pageIndex) {

  public Block toBlock(int blockIndex) {
    return new Block(
        blockIndex, 0, type, category, content, null, bbox, originalBbox, polygon);
  }
}
