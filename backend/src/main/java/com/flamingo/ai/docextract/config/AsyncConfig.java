package com.flamingo.ai.docextract.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async operations. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /** Runs accepted extraction jobs off the request thread. */
  @Bean(name = "extractionExecutor")
  public Executor extractionExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("extract-job-");
    executor.initialize();
    return executor;
  }

  /** Runs the two sub-pipelines of a job side by side. */
  @Bean(name = "extractionPipelineExecutor")
  public Executor extractionPipelineExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("extract-pipe-");
    executor.initialize();
    return executor;
  }

  /**
   * Worker pool for block refinement calls. Sized to the concurrency ceiling; admission below that
   * ceiling is decided by the per-job concurrency controller.
   */
  @Bean(name = "blockExtractionExecutor")
  public Executor blockExtractionExecutor(ExtractionProperties properties) {
    int max = properties.getConcurrency().getMax();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(max);
    executor.setMaxPoolSize(max * 2);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("extract-block-");
    executor.initialize();
    return executor;
  }
}
