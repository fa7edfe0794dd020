package com.flamingo.ai.docextract.api.rest;

import com.flamingo.ai.docextract.api.dto.response.ExtractionRequestResponse;
import com.flamingo.ai.docextract.api.dto.response.ExtractionStatusResponse;
import com.flamingo.ai.docextract.config.ExtractionProperties;
import com.flamingo.ai.docextract.domain.entity.ExtractionFile;
import com.flamingo.ai.docextract.domain.enums.ExtractionMethod;
import com.flamingo.ai.docextract.domain.enums.ExtractionStatus;
import com.flamingo.ai.docextract.exception.ExtractionFileNotFoundException;
import com.flamingo.ai.docextract.service.extraction.DocumentExtractionService;
import com.flamingo.ai.docextract.service.extraction.ExtractionJobLauncher;
import com.flamingo.ai.docextract.service.extraction.ExtractionOutcome;
import com.flamingo.ai.docextract.service.extraction.JobStateStore;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for document extraction jobs. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DocumentExtractionController {

  static final String USER_HEADER = "X-User-Id";

  private final DocumentExtractionService extractionService;
  private final ExtractionJobLauncher jobLauncher;
  private final JobStateStore jobStateStore;
  private final ExtractionProperties extractionProperties;

  /**
   * Starts extraction of a file. Returns 202 once the job is claimed; the job then runs in the
   * background. A job that is already processing is reported with 409 and not started again; a
   * job the executor cannot take is marked as failed and reported with 503.
   */
  @PostMapping("/extraction-files/{fileId}/extract")
  public ResponseEntity<ExtractionRequestResponse> extract(
      @PathVariable UUID fileId,
      @RequestHeader(USER_HEADER) String userId,
      @RequestParam(value = "method", required = false) String method) {
    ExtractionMethod extractionMethod =
        method == null || method.isBlank()
            ? extractionProperties.getDefaultMethod()
            : ExtractionMethod.fromValue(method);

    Optional<ExtractionFile> file =
        extractionService.startExtraction(fileId, userId, jobStateStore);
    if (file.isEmpty()) {
      return ResponseEntity.status(HttpStatus.CONFLICT)
          .body(
              ExtractionRequestResponse.builder()
                  .fileId(fileId)
                  .status(ExtractionStatus.PROCESSING)
                  .method(extractionMethod)
                  .message(ExtractionOutcome.ALREADY_IN_PROGRESS)
                  .build());
    }

    try {
      jobLauncher.launch(file.get(), extractionMethod);
    } catch (TaskRejectedException e) {
      ExtractionOutcome outcome =
          extractionService.abandonExtraction(fileId, jobStateStore, ExtractionOutcome.QUEUE_FULL);
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
          .body(
              ExtractionRequestResponse.builder()
                  .fileId(fileId)
                  .status(ExtractionStatus.ERROR)
                  .method(extractionMethod)
                  .message(outcome.message())
                  .build());
    }
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(
            ExtractionRequestResponse.builder()
                .fileId(fileId)
                .status(ExtractionStatus.PROCESSING)
                .method(extractionMethod)
                .message("Extraction started")
                .build());
  }

  /** Gets the state of a file's extraction job. */
  @GetMapping("/extraction-files/{fileId}/status")
  public ResponseEntity<ExtractionStatusResponse> getStatus(
      @PathVariable UUID fileId, @RequestHeader(USER_HEADER) String userId) {
    ExtractionFile file =
        jobStateStore
            .findFile(fileId, userId)
            .orElseThrow(() -> new ExtractionFileNotFoundException(fileId));
    return ResponseEntity.ok(ExtractionStatusResponse.fromEntity(file));
  }
}
