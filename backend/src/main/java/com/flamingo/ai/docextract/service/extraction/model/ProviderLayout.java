package com.flamingo.ai.docextract.service.extraction.model;

import java.util.List;
import java.util.Map;

/**
 * Normalized response of a layout provider.
 *
 * @param blocks detected blocks, possibly empty
 * @param markdown markdown the provider produced, may be null
 * @param pageSizes pixel sizes per page index, when the provider reports them
 */
public record ProviderLayout(
    List<ProviderBlock> blocks, String markdown, Map<Integer, PageSize> pageSizes) {

  public ProviderLayout {
    blocks = blocks == null ? List.of() : List.copyOf(blocks);
    pageSizes = pageSizes == null ? Map.of() : Map.copyOf(pageSizes);
  }

  public static ProviderLayout markdownOnly(String markdown) {
    return new ProviderLayout(List.of(), markdown, Map.of());
  }

  /** Page dimensions reported by a provider. */
  public record PageSize(int width, int height) {}
}
