package com.flamingo.ai.docextract.exception;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/** Classification of provider failures. */
public final class ProviderErrors {

  private static final int TOO_MANY_REQUESTS = 429;

  private ProviderErrors() {}

  /**
   * Returns true when the failure is a rate-limit signal: an HTTP 429 or a message mentioning rate
   * limiting, too many requests or an exceeded quota anywhere along the cause chain.
   */
  public static boolean isRateLimited(Throwable error) {
    Set<Throwable> seen = new HashSet<>();
    Throwable current = error;
    while (current != null && seen.add(current)) {
      if (current instanceof ProviderCallException providerError && providerError.isRateLimited()) {
        return true;
      }
      if (current instanceof WebClientResponseException responseError
          && responseError.getStatusCode().value() == TOO_MANY_REQUESTS) {
        return true;
      }
      if (messageSignalsRateLimit(current.getMessage())) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  /** Message of the error, or its class name when it carries none. */
  public static String describe(Throwable error) {
    if (error == null) {
      return "unknown";
    }
    String message = error.getMessage();
    return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
  }

  private static boolean messageSignalsRateLimit(String message) {
    if (message == null) {
      return false;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    return lower.contains("rate limit")
        || lower.contains("too many requests")
        || lower.contains("quota exceeded")
        || lower.contains("status code 429")
        || lower.contains("(429)");
  }
}
