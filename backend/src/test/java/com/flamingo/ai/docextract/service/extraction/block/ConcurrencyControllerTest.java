package com.flamingo.ai.docextract.service.extraction.block;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.docextract.config.ExtractionProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConcurrencyControllerTest {

  private static ConcurrencyController defaults() {
    return new ConcurrencyController(new ExtractionProperties.Concurrency());
  }

  @Test
  void shouldStartAtInitialLimit() {
    assertThat(defaults().current()).isEqualTo(5);
  }

  @Test
  void shouldClampInitialLimitIntoBounds() {
    assertThat(new ConcurrencyController(20, 2, 10, 5, 0.6).current()).isEqualTo(10);
    assertThat(new ConcurrencyController(1, 2, 10, 5, 0.6).current()).isEqualTo(2);
  }

  @Test
  void shouldRejectInvalidBounds() {
    assertThatThrownBy(() -> new ConcurrencyController(5, 6, 4, 5, 0.6))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Nested
  @DisplayName("onSuccess")
  class OnSuccess {

    @Test
    @DisplayName("five consecutive successes raise the limit by one")
    void shouldIncreaseAfterFiveSuccesses() {
      ConcurrencyController controller = defaults();

      for (int i = 0; i < 4; i++) {
        controller.onSuccess();
      }
      assertThat(controller.current()).isEqualTo(5);

      controller.onSuccess();
      assertThat(controller.current()).isEqualTo(6);
      assertThat(controller.consecutiveSuccesses()).isZero();
    }

    @Test
    @DisplayName("never grows beyond max")
    void shouldCapAtMax() {
      ConcurrencyController controller = defaults();

      for (int i = 0; i < 100; i++) {
        controller.onSuccess();
      }

      assertThat(controller.current()).isEqualTo(10);
    }

    @Test
    @DisplayName("an error breaks the success streak")
    void shouldResetStreakOnError() {
      ConcurrencyController controller = defaults();

      for (int i = 0; i < 4; i++) {
        controller.onSuccess();
      }
      controller.onError();
      controller.onSuccess();

      assertThat(controller.current()).isEqualTo(5);
      assertThat(controller.consecutiveSuccesses()).isEqualTo(1);
      assertThat(controller.consecutiveFailures()).isZero();
    }
  }

  @Nested
  @DisplayName("onRateLimit")
  class OnRateLimit {

    @Test
    @DisplayName("multiplies the limit by 0.6 and floors it")
    void shouldDecreaseMultiplicatively() {
      ConcurrencyController controller = defaults();

      controller.onRateLimit();

      assertThat(controller.current()).isEqualTo(3);
      assertThat(controller.consecutiveFailures()).isEqualTo(1);
    }

    @Test
    @DisplayName("never drops below min")
    void shouldFloorAtMin() {
      ConcurrencyController controller = defaults();

      controller.onRateLimit();
      controller.onRateLimit();
      controller.onRateLimit();

      assertThat(controller.current()).isEqualTo(2);
    }
  }

  @Test
  void shouldNotChangeLimitOnGenericError() {
    ConcurrencyController controller = defaults();

    controller.onError();
    controller.onError();

    assertThat(controller.current()).isEqualTo(5);
    assertThat(controller.consecutiveFailures()).isEqualTo(2);
  }

  @Test
  void shouldStayWithinBoundsUnderConcurrentUpdates() throws Exception {
    ConcurrencyController controller = defaults();
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < 8; t++) {
        final boolean rateLimiter = t % 4 == 0;
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < 1000; i++) {
                    if (rateLimiter && i % 50 == 0) {
                      controller.onRateLimit();
                    } else {
                      controller.onSuccess();
                    }
                    int current = controller.current();
                    assertThat(current).isBetween(2, 10);
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get();
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(controller.current()).isBetween(2, 10);
  }
}
