package com.flamingo.ai.docextract.service.extraction;

import com.flamingo.ai.docextract.domain.entity.ExtractionFile;
import com.flamingo.ai.docextract.domain.enums.ExtractionMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/** Runs claimed extraction jobs off the request thread. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExtractionJobLauncher {

  private final DocumentExtractionService extractionService;
  private final JobStateStore jobStateStore;

  @Async("extractionExecutor")
  public void launch(ExtractionFile file, ExtractionMethod method) {
    try {
      ExtractionOutcome outcome = extractionService.runExtraction(file, jobStateStore, method);
      log.debug("Extraction job {} done: success={}", file.getId(), outcome.success());
    } catch (RuntimeException e) {
      // The job may be left in processing and needs reconciling.
      log.error("Extraction job {} aborted: {}", file.getId(), e.getMessage(), e);
    }
  }
}
