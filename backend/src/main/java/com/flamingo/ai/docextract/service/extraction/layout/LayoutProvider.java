package com.flamingo.ai.docextract.service.extraction.layout;

import com.flamingo.ai.docextract.domain.enums.ExtractionMethod;
import com.flamingo.ai.docextract.service.extraction.model.LayoutRequest;
import com.flamingo.ai.docextract.service.extraction.model.ProviderLayout;

/**
 * An external service that detects blocks with bounding boxes on a page image. Implementations
 * normalize their response into {@link ProviderLayout}; provider field names do not leave the
 * implementation.
 */
public interface LayoutProvider {

  /** The extraction method this provider serves. */
  ExtractionMethod method();

  /**
   * Whether the provider takes a whole multi-page PDF in one call. Such providers tag each block
   * with its page index.
   */
  default boolean acceptsDocuments() {
    return false;
  }

  /**
   * Analyzes one page image, or a whole document when {@link #acceptsDocuments()} is true.
   *
   * @throws com.flamingo.ai.docextract.exception.ProviderCallException if the call fails
   */
  ProviderLayout analyze(LayoutRequest request);
}
