package com.flamingo.ai.docextract.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;

class ProviderErrorsTest {

  @Nested
  @DisplayName("isRateLimited")
  class IsRateLimited {

    @Test
    void shouldDetectHttp429() {
      WebClientResponseException tooMany =
          WebClientResponseException.create(
              429, "Too Many Requests", HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8);

      assertThat(ProviderErrors.isRateLimited(tooMany)).isTrue();
    }

    @Test
    void shouldDetectRateLimitMessages() {
      assertThat(ProviderErrors.isRateLimited(new RuntimeException("Rate limit exceeded")))
          .isTrue();
      assertThat(ProviderErrors.isRateLimited(new RuntimeException("429 TOO MANY REQUESTS")))
          .isTrue();
      assertThat(ProviderErrors.isRateLimited(new RuntimeException("Quota exceeded for model")))
          .isTrue();
    }

    @Test
    void shouldLookThroughCauses() {
      RuntimeException root = new RuntimeException("rate limit reached");
      RuntimeException wrapped = new IllegalStateException("call failed", root);

      assertThat(ProviderErrors.isRateLimited(wrapped)).isTrue();
    }

    @Test
    void shouldHonorExplicitFlag() {
      assertThat(ProviderErrors.isRateLimited(new ProviderCallException("vision", "busy", true)))
          .isTrue();
      assertThat(ProviderErrors.isRateLimited(new ProviderCallException("vision", "busy", false)))
          .isFalse();
    }

    @Test
    void shouldIgnoreOtherFailures() {
      WebClientResponseException serverError =
          WebClientResponseException.create(
              500, "Internal Server Error", HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8);

      assertThat(ProviderErrors.isRateLimited(serverError)).isFalse();
      assertThat(ProviderErrors.isRateLimited(new RuntimeException("timeout"))).isFalse();
      assertThat(ProviderErrors.isRateLimited(null)).isFalse();
    }
  }

  @Test
  void shouldDescribeErrorsWithoutMessageByClassName() {
    assertThat(ProviderErrors.describe(new IllegalStateException()))
        .isEqualTo("IllegalStateException");
    assertThat(ProviderErrors.describe(new RuntimeException("boom"))).isEqualTo("boom");
    assertThat(ProviderErrors.describe(null)).isEqualTo("unknown");
  }
}
