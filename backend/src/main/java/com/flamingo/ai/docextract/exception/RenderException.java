package com.flamingo.ai.docextract.exception;

/**
 * Exception thrown when a PDF cannot be rasterized. Rendering is all-or-nothing: a failure on any
 * page discards the pages rendered so far.
 */
public class RenderException extends RuntimeException {

  /** 1-based number of the failing page, or -1 when the document itself could not be opened. */
  private final int pageNumber;

  public RenderException(String message, Throwable cause) {
    super(message, cause);
    this.pageNumber = -1;
  }

  public RenderException(int pageNumber, String message, Throwable cause) {
    super(message, cause);
    this.pageNumber = pageNumber;
  }

  public int getPageNumber() {
    return pageNumber;
  }
}
