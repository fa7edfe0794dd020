package com.flamingo.ai.docextract.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the vision-language model used for page transcription and block refinement.
 * The endpoint is any OpenAI-compatible gateway (OpenRouter by default).
 */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.vision.base-url:https://openrouter.ai/api/v1}")
  private String baseUrl;

  @Value("${langchain4j.vision.api-key:}")
  private String apiKey;

  @Value("${langchain4j.vision.model-name:google/gemini-2.5-pro-preview}")
  private String modelName;

  @Value("${langchain4j.vision.temperature:0.1}")
  private double temperature;

  @Value("${langchain4j.vision.timeout-seconds:180}")
  private long timeoutSeconds;

  /** Vision chat model. Client-side retries are off; the block scheduler owns retry and backoff. */
  @Bean
  public ChatModel visionChatModel() {
    validateApiKey();

    return OpenAiChatModel.builder()
        .baseUrl(baseUrl)
        .apiKey(apiKey)
        .modelName(modelName)
        .temperature(temperature)
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .maxRetries(0)
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  private void validateApiKey() {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException(
          "Vision model API key is required. Set OPENROUTER_API_KEY environment variable.");
    }
  }
}
