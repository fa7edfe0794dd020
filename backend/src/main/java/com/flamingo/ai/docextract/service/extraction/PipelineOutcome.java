package com.flamingo.ai.docextract.service.extraction;

/** Result of one sub-pipeline of a job. */
public record PipelineOutcome(boolean success, String error) {

  public static PipelineOutcome succeeded() {
    return new PipelineOutcome(true, null);
  }

  public static PipelineOutcome failed(String error) {
    return new PipelineOutcome(false, error);
  }
}
