package com.flamingo.ai.docextract.service.extraction.layout;

import com.flamingo.ai.docextract.domain.enums.ExtractionMethod;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Routes an {@link ExtractionMethod} to the {@link LayoutProvider} serving it. The method is chosen
 * once per job, so every page of a document goes to the same provider.
 */
@Service
@RequiredArgsConstructor
public class LayoutProviderRouter {

  private final List<LayoutProvider> providers;

  /**
   * @throws IllegalStateException if no provider serves the method
   */
  public LayoutProvider route(ExtractionMethod method) {
    return providers.stream()
        .filter(p -> p.method() == method)
        .findFirst()
        .orElseThrow(
            () -> new IllegalStateException("No LayoutProvider found for method: " + method));
  }
}
