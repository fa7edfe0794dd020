package com.flamingo.ai.docextract.service.extraction.layout;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.docextract.config.ExtractionProperties;
import com.flamingo.ai.docextract.exception.ProviderCallException;
import com.flamingo.ai.docextract.service.extraction.block.Sleeper;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * HTTP client for the Replicate predictions API. Creates a prediction for the latest version of a
 * model and polls it until it settles.
 */
@Component
@Slf4j
public class ReplicateClient {

  static final String PROVIDER = "replicate";

  private static final String STATUS_STARTING = "starting";
  private static final String STATUS_PROCESSING = "processing";
  private static final String STATUS_SUCCEEDED = "succeeded";
  private static final int PROGRESS_LOG_INTERVAL = 10;

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final Sleeper sleeper;
  private final Duration startingPollInterval;
  private final Duration processingPollInterval;
  private final Map<String, String> versionCache = new ConcurrentHashMap<>();

  @Autowired
  public ReplicateClient(
      WebClient.Builder webClientBuilder,
      ExtractionProperties properties,
      ObjectMapper objectMapper) {
    this(webClientBuilder, properties, objectMapper, Sleeper.THREAD_SLEEP);
  }

  ReplicateClient(
      WebClient.Builder webClientBuilder,
      ExtractionProperties properties,
      ObjectMapper objectMapper,
      Sleeper sleeper) {
    ExtractionProperties.Replicate replicate = properties.getReplicate();
    this.objectMapper = objectMapper;
    this.sleeper = sleeper;
    this.startingPollInterval = replicate.getStartingPollInterval();
    this.processingPollInterval = replicate.getProcessingPollInterval();
    this.webClient =
        webClientBuilder
            .clone()
            .baseUrl(replicate.getBaseUrl())
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Token " + replicate.getApiToken())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
            .build();
    log.info("Replicate client initialized: baseUrl={}", replicate.getBaseUrl());
  }

  /**
   * Runs a prediction to completion.
   *
   * @param modelSlug model such as {@code owner/name}
   * @param input model input
   * @param timeout limit on the time spent polling
   * @return the prediction's {@code output}
   * @throws ProviderCallException on HTTP errors, failed or canceled predictions, and timeouts
   */
  public JsonNode runPrediction(String modelSlug, ObjectNode input, Duration timeout) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("version", resolveVersion(modelSlug));
    body.set("input", input);

    JsonNode prediction =
        call(
            () ->
                webClient
                    .post()
                    .uri("/predictions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(timeout));

    long startedAt = System.nanoTime();
    int pollCount = 0;
    while (isRunning(prediction)) {
      Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
      if (elapsed.compareTo(timeout) > 0) {
        throw new ProviderCallException(
            PROVIDER,
            String.format(
                "Replicate prediction timed out after %ds (limit: %ds)",
                elapsed.toSeconds(), timeout.toSeconds()));
      }
      pollCount++;
      if (pollCount % PROGRESS_LOG_INTERVAL == 0) {
        log.info(
            "Replicate {} still {} ({}s elapsed)",
            modelSlug,
            prediction.path("status").asText(),
            elapsed.toSeconds());
      }
      pause(
          STATUS_PROCESSING.equals(status(prediction))
              ? processingPollInterval
              : startingPollInterval);

      String getUrl = prediction.path("urls").path("get").asText(null);
      if (getUrl == null) {
        throw new ProviderCallException(PROVIDER, "Replicate prediction missing get URL");
      }
      prediction =
          call(
              () ->
                  webClient
                      .get()
                      .uri(URI.create(getUrl))
                      .retrieve()
                      .bodyToMono(JsonNode.class)
                      .block(timeout));

      String status = status(prediction);
      if ("failed".equals(status) || "canceled".equals(status)) {
        String error = prediction.path("error").asText("");
        throw new ProviderCallException(
            PROVIDER, error.isEmpty() ? "Replicate prediction " + status : error);
      }
    }

    JsonNode output = prediction.get("output");
    if (!STATUS_SUCCEEDED.equals(status(prediction)) || output == null || output.isNull()) {
      throw new ProviderCallException(
          PROVIDER, "Replicate prediction did not succeed: " + status(prediction));
    }
    log.debug("Replicate {} succeeded after {} polls", modelSlug, pollCount);
    return output;
  }

  /** Latest version id of a model, cached per slug for the lifetime of the client. */
  String resolveVersion(String modelSlug) {
    String cached = versionCache.get(modelSlug);
    if (cached != null) {
      return cached;
    }
    JsonNode versions =
        call(
            () ->
                webClient
                    .get()
                    .uri("/models/" + modelSlug + "/versions")
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(Duration.ofSeconds(30)));
    String version = versions.path("results").path(0).path("id").asText(null);
    if (version == null) {
      throw new ProviderCallException(PROVIDER, "No versions found for model " + modelSlug);
    }
    versionCache.put(modelSlug, version);
    return version;
  }

  private static boolean isRunning(JsonNode prediction) {
    String status = status(prediction);
    return STATUS_STARTING.equals(status) || STATUS_PROCESSING.equals(status);
  }

  private static String status(JsonNode prediction) {
    return prediction == null ? "" : prediction.path("status").asText("");
  }

  private void pause(Duration interval) {
    try {
      sleeper.sleep(interval.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProviderCallException(PROVIDER, "Interrupted while polling Replicate");
    }
  }

  private JsonNode call(Supplier<JsonNode> request) {
    try {
      JsonNode response = request.get();
      if (response == null) {
        throw new ProviderCallException(PROVIDER, "Empty response from Replicate");
      }
      return response;
    } catch (WebClientResponseException e) {
      throw new ProviderCallException(
          PROVIDER,
          String.format(
              "Replicate API error (%d): %s",
              e.getStatusCode().value(), e.getResponseBodyAsString()),
          e);
    } catch (WebClientException | IllegalStateException e) {
      throw new ProviderCallException(PROVIDER, "Replicate request failed: " + e.getMessage(), e);
    }
  }
}
