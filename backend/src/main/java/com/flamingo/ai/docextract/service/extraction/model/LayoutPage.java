package com.flamingo.ai.docextract.service.extraction.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** A page of a layout result with its blocks. */
public record LayoutPage(
    int pageIndex,
    int pageNumber,
    Integer width,
    Integer height,
    @JsonIgnore PageImage image,
    List<Block> blocks) {

  public LayoutPage {
    blocks = blocks == null ? List.of() : List.copyOf(blocks);
  }

  @JsonProperty("imageDataUrl")
  public String imageDataUrl() {
    return image == null ? null : image.dataUrl();
  }

  public LayoutPage withBlocks(List<Block> newBlocks) {
    return new LayoutPage(pageIndex, pageNumber, width, height, image, newBlocks);
  }
}
