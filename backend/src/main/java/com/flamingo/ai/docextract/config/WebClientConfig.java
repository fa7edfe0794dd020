package com.flamingo.ai.docextract.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/** Shared WebClient for downloads from object storage and provider result URLs. */
@Configuration
public class WebClientConfig {

  @Bean
  public WebClient storageWebClient(
      WebClient.Builder builder, ExtractionProperties extractionProperties) {
    int maxInMemorySize = extractionProperties.getStorage().getMaxInMemorySize();
    return builder
        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxInMemorySize))
        .build();
  }
}
