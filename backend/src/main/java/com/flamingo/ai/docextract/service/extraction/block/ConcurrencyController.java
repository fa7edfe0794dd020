package com.flamingo.ai.docextract.service.extraction.block;

import com.flamingo.ai.docextract.config.ExtractionProperties;
import lombok.extern.slf4j.Slf4j;

/**
 * Additive-increase/multiplicative-decrease limit on concurrent block refinement calls. One
 * instance per extraction run, shared by all of its block tasks.
 *
 * <p>The limit grows by one after a streak of successes, shrinks by a factor on a rate-limit signal,
 * and ignores generic errors. It always stays within {@code [min, max]}.
 */
@Slf4j
public class ConcurrencyController {

  private final int min;
  private final int max;
  private final int increaseAfterSuccesses;
  private final double decreaseFactor;

  private int current;
  private int consecutiveSuccesses;
  private int consecutiveFailures;

  public ConcurrencyController(ExtractionProperties.Concurrency settings) {
    this(
        settings.getInitial(),
        settings.getMin(),
        settings.getMax(),
        settings.getIncreaseAfterSuccesses(),
        settings.getDecreaseFactor());
  }

  public ConcurrencyController(
      int initial, int min, int max, int increaseAfterSuccesses, double decreaseFactor) {
    if (min < 1 || max < min) {
      throw new IllegalArgumentException(
          "Invalid concurrency bounds: min=" + min + ", max=" + max);
    }
    this.min = min;
    this.max = max;
    this.increaseAfterSuccesses = increaseAfterSuccesses;
    this.decreaseFactor = decreaseFactor;
    this.current = Math.max(min, Math.min(max, initial));
  }

  public synchronized int current() {
    return current;
  }

  public synchronized void onSuccess() {
    consecutiveSuccesses++;
    consecutiveFailures = 0;
    if (consecutiveSuccesses >= increaseAfterSuccesses) {
      consecutiveSuccesses = 0;
      if (current < max) {
        current++;
        log.info("Increased block concurrency to {}", current);
      }
    }
  }

  public synchronized void onRateLimit() {
    consecutiveFailures++;
    consecutiveSuccesses = 0;
    int previous = current;
    current = Math.max(min, (int) Math.floor(current * decreaseFactor));
    if (current != previous) {
      log.warn("Rate limited, decreased block concurrency from {} to {}", previous, current);
    }
  }

  /** Generic failures are not treated as a load signal: only the streaks change. */
  public synchronized void onError() {
    consecutiveFailures++;
    consecutiveSuccesses = 0;
  }

  synchronized int consecutiveSuccesses() {
    return consecutiveSuccesses;
  }

  synchronized int consecutiveFailures() {
    return consecutiveFailures;
  }
}
