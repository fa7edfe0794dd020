package com.flamingo.ai.docextract.service.extraction.layout;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.docextract.config.ExtractionProperties;
import com.flamingo.ai.docextract.domain.enums.ExtractionMethod;
import com.flamingo.ai.docextract.exception.ProviderCallException;
import com.flamingo.ai.docextract.service.extraction.block.Sleeper;
import com.flamingo.ai.docextract.service.extraction.model.LayoutRequest;
import com.flamingo.ai.docextract.service.extraction.model.ProviderLayout;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.net.URI;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Secondary layout provider: Datalab Marker in accurate mode. Takes whole PDFs in one request and
 * tags blocks with their page index.
 */
@Service
@Slf4j
public class DatalabLayoutProvider implements LayoutProvider {

  static final String PROVIDER = "datalab";
  private static final String API_KEY_HEADER = "X-API-Key";

  private final WebClient webClient;
  private final DatalabResponseParser parser;
  private final Sleeper sleeper;
  private final ExtractionProperties.Datalab settings;

  @Autowired
  public DatalabLayoutProvider(
      WebClient.Builder webClientBuilder,
      ObjectMapper objectMapper,
      ExtractionProperties properties) {
    this(webClientBuilder, objectMapper, properties, Sleeper.THREAD_SLEEP);
  }

  DatalabLayoutProvider(
      WebClient.Builder webClientBuilder,
      ObjectMapper objectMapper,
      ExtractionProperties properties,
      Sleeper sleeper) {
    this.settings = properties.getDatalab();
    this.parser = new DatalabResponseParser(objectMapper);
    this.sleeper = sleeper;
    this.webClient =
        webClientBuilder
            .clone()
            .baseUrl(settings.getBaseUrl())
            .defaultHeader(API_KEY_HEADER, settings.getApiKey())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(32 * 1024 * 1024))
            .build();
    log.info("Datalab client initialized: baseUrl={}", settings.getBaseUrl());
  }

  @Override
  public ExtractionMethod method() {
    return ExtractionMethod.DATALAB;
  }

  @Override
  public boolean acceptsDocuments() {
    return true;
  }

  @Override
  @CircuitBreaker(name = "datalab")
  public ProviderLayout analyze(LayoutRequest request) {
    log.debug(
        "Calling Datalab Marker for {} ({}, {} KB)",
        request.fileName(),
        request.mimeType(),
        request.content().length / 1024);
    JsonNode response = submit(request);
    if (response.hasNonNull("request_id") && response.hasNonNull("request_check_url")) {
      response = poll(response.get("request_check_url").asText());
    }
    ProviderLayout layout = parser.parse(response);
    log.info("Datalab returned {} blocks for {}", layout.blocks().size(), request.fileName());
    return layout;
  }

  private JsonNode submit(LayoutRequest request) {
    MultipartBodyBuilder body = new MultipartBodyBuilder();
    body.part(
            "file",
            new ByteArrayResource(request.content()) {
              @Override
              public String getFilename() {
                return request.fileName();
              }
            })
        .contentType(MediaType.parseMediaType(request.mimeType()));
    body.part("output_format", "json");
    body.part("mode", settings.getMode());

    return call(
        "Datalab API error",
        () ->
            webClient
                .post()
                .uri("/api/v1/marker")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(body.build()))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(settings.getTimeout()));
  }

  /** Polls the check URL until the request completes, fails, or the poll budget runs out. */
  private JsonNode poll(String checkUrl) {
    for (int pollCount = 1; pollCount <= settings.getMaxPolls(); pollCount++) {
      try {
        sleeper.sleep(settings.getPollInterval().toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new ProviderCallException(PROVIDER, "Interrupted while polling Datalab");
      }

      JsonNode result =
          call(
              "Datalab polling error",
              () ->
                  webClient
                      .get()
                      .uri(URI.create(checkUrl))
                      .retrieve()
                      .bodyToMono(JsonNode.class)
                      .block(settings.getTimeout()));

      String status = result.path("status").asText("");
      if ("complete".equals(status)) {
        log.debug("Datalab processing completed after {} polls", pollCount);
        return result;
      }
      if ("failed".equals(status)) {
        throw new ProviderCallException(
            PROVIDER, "Datalab processing failed: " + result.path("error").asText("Unknown error"));
      }
      log.debug("Polling Datalab ({}/{}), status: {}", pollCount, settings.getMaxPolls(), status);
    }
    throw new ProviderCallException(PROVIDER, "Datalab processing timed out");
  }

  private static JsonNode call(String errorPrefix, Supplier<JsonNode> request) {
    try {
      JsonNode response = request.get();
      if (response == null) {
        throw new ProviderCallException(PROVIDER, errorPrefix + ": empty response");
      }
      return response;
    } catch (WebClientResponseException e) {
      throw new ProviderCallException(
          PROVIDER,
          String.format(
              "%s (%d): %s", errorPrefix, e.getStatusCode().value(), e.getResponseBodyAsString()),
          e);
    } catch (WebClientException | IllegalStateException e) {
      throw new ProviderCallException(PROVIDER, errorPrefix + ": " + e.getMessage(), e);
    }
  }
}
