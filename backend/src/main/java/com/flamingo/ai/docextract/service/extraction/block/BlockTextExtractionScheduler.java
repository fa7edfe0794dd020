package com.flamingo.ai.docextract.service.extraction.block;

import com.flamingo.ai.docextract.config.ExtractionProperties;
import com.flamingo.ai.docextract.exception.ProviderErrors;
import com.flamingo.ai.docextract.service.extraction.model.BlockExtractionResult;
import com.flamingo.ai.docextract.service.extraction.model.BlockExtractionTask;
import com.flamingo.ai.docextract.service.extraction.vision.VisionTranscriptionClient;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Refines block text with the vision model under bounded, adaptive parallelism.
 *
 * <p>Tasks are admitted while the number in flight is below the controller's current limit; the
 * scheduler then waits for any one task to finish and admits again. A task that keeps failing
 * degrades to its OCR seed text and never fails the batch. Results come back sorted by global block
 * index.
 */
@Service
@Slf4j
public class BlockTextExtractionScheduler {

  private static final int PROGRESS_LOG_INTERVAL = 10;

  private final VisionTranscriptionClient visionClient;
  private final Executor executor;
  private final Sleeper sleeper;
  private final int maxRetries;
  private final long baseBackoffMs;

  private final Counter successCounter;
  private final Counter degradedCounter;
  private final Counter rateLimitedCounter;

  @Autowired
  public BlockTextExtractionScheduler(
      VisionTranscriptionClient visionClient,
      @Qualifier("blockExtractionExecutor") Executor executor,
      ExtractionProperties properties,
      MeterRegistry meterRegistry) {
    this(visionClient, executor, properties, meterRegistry, Sleeper.THREAD_SLEEP);
  }

  BlockTextExtractionScheduler(
      VisionTranscriptionClient visionClient,
      Executor executor,
      ExtractionProperties properties,
      MeterRegistry meterRegistry,
      Sleeper sleeper) {
    this.visionClient = visionClient;
    this.executor = executor;
    this.sleeper = sleeper;
    this.maxRetries = properties.getRetry().getMaxRetries();
    this.baseBackoffMs = properties.getRetry().getBaseBackoffMs();
    this.successCounter = meterRegistry.counter("extraction.block.success");
    this.degradedCounter = meterRegistry.counter("extraction.block.degraded");
    this.rateLimitedCounter = meterRegistry.counter("extraction.block.rate_limited");
  }

  /**
   * Runs all tasks and returns one result per task, ordered by global block index.
   *
   * @param tasks blocks with a valid region
   * @param controller concurrency state of this run
   */
  public List<BlockExtractionResult> extractAll(
      List<BlockExtractionTask> tasks, ConcurrencyController controller) {
    if (tasks.isEmpty()) {
      return List.of();
    }
    int total = tasks.size();
    Deque<BlockExtractionTask> pending = new ArrayDeque<>(tasks);
    List<CompletableFuture<BlockExtractionResult>> inFlight = new ArrayList<>();
    List<BlockExtractionResult> results = new ArrayList<>(total);
    AtomicInteger completed = new AtomicInteger();

    log.info("Extracting text for {} blocks (initial concurrency {})", total, controller.current());

    while (!pending.isEmpty() || !inFlight.isEmpty()) {
      while (!pending.isEmpty() && inFlight.size() < controller.current()) {
        BlockExtractionTask task = pending.poll();
        inFlight.add(
            CompletableFuture.supplyAsync(() -> extractWithRetry(task, controller), executor)
                .whenComplete((r, e) -> logProgress(completed.incrementAndGet(), total, controller)));
      }

      CompletableFuture.anyOf(inFlight.toArray(new CompletableFuture[0])).join();

      List<CompletableFuture<BlockExtractionResult>> stillRunning = new ArrayList<>();
      for (CompletableFuture<BlockExtractionResult> future : inFlight) {
        if (future.isDone()) {
          results.add(future.join());
        } else {
          stillRunning.add(future);
        }
      }
      inFlight = stillRunning;
    }

    results.sort(Comparator.comparingInt(BlockExtractionResult::globalBlockIndex));
    return results;
  }

  /**
   * Calls the vision model for one block, retrying with exponential backoff. Rate-limit failures
   * shrink the shared limit, other failures leave it alone. Never throws.
   */
  BlockExtractionResult extractWithRetry(
      BlockExtractionTask task, ConcurrencyController controller) {
    for (int attempt = 0; ; attempt++) {
      try {
        String text =
            visionClient.transcribeRegion(task.pageImage(), task.block().bbox(), task.ocrText());
        controller.onSuccess();
        successCounter.increment();
        return BlockExtractionResult.success(task, text);
      } catch (RuntimeException e) {
        boolean rateLimited = ProviderErrors.isRateLimited(e);
        if (rateLimited) {
          controller.onRateLimit();
          rateLimitedCounter.increment();
        } else {
          controller.onError();
        }

        if (attempt >= maxRetries) {
          log.warn(
              "Block {} failed after {} retries, keeping OCR text: {}",
              task.globalBlockIndex(),
              maxRetries,
              e.getMessage());
          degradedCounter.increment();
          return BlockExtractionResult.degraded(task, ProviderErrors.describe(e));
        }

        long delay = baseBackoffMs * (1L << attempt);
        log.debug(
            "Block {} attempt {} failed ({}), retrying in {}ms",
            task.globalBlockIndex(),
            attempt + 1,
            rateLimited ? "rate limited" : e.getMessage(),
            delay);
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          degradedCounter.increment();
          return BlockExtractionResult.degraded(task, "Interrupted while waiting to retry");
        }
      }
    }
  }

  private void logProgress(int done, int total, ConcurrencyController controller) {
    if (done % PROGRESS_LOG_INTERVAL == 0 || done == total) {
      log.info("Block extraction progress: {}/{} (concurrency {})", done, total, controller.current());
    }
  }
}
