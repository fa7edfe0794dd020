package com.flamingo.ai.docextract.service.extraction.model;

import java.util.Locale;

/**
 * Raw bytes of an uploaded file, owned by one extraction run.
 *
 * @param content file bytes
 * @param mimeType MIME type, never null
 * @param fileName original file name, never null
 */
public record SourceDocument(byte[] content, String mimeType, String fileName) {

  public static final String DEFAULT_MIME_TYPE = "image/png";
  public static final String DEFAULT_FILE_NAME = "document";

  public SourceDocument {
    if (content == null) {
      throw new IllegalArgumentException("content must not be null");
    }
    mimeType = mimeType == null || mimeType.isBlank() ? DEFAULT_MIME_TYPE : mimeType;
    fileName = fileName == null || fileName.isBlank() ? DEFAULT_FILE_NAME : fileName;
  }

  public boolean isPdf() {
    String mime = mimeType.toLowerCase(Locale.ROOT);
    return mime.equals("application/pdf")
        || mime.equals("application/x-pdf")
        || fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
  }
}
