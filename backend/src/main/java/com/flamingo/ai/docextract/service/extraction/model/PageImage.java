package com.flamingo.ai.docextract.service.extraction.model;

import java.util.Base64;

/**
 * A rendered page, or the single page of an image upload.
 *
 * @param pageIndex 0-based index
 * @param pageNumber 1-based number for display
 * @param width pixel width, null when unknown
 * @param height pixel height, null when unknown
 * @param image encoded image bytes
 * @param mimeType MIME type of {@code image}
 */
public record PageImage(
    int pageIndex, int pageNumber, Integer width, Integer height, byte[] image, String mimeType) {

  public static PageImage single(byte[] image, String mimeType, Integer width, Integer height) {
    return new PageImage(0, 1, width, height, image, mimeType);
  }

  public String base64() {
    return Base64.getEncoder().encodeToString(image);
  }

  public String dataUrl() {
    return "data:" + mimeType + ";base64," + base64();
  }

  /** Same page with a replacement image whose dimensions are the originals times {@code scale}. */
  public PageImage upscaled(byte[] upscaledImage, String upscaledMimeType, int scale) {
    return new PageImage(
        pageIndex,
        pageNumber,
        width == null ? null : width * scale,
        height == null ? null : height * scale,
        upscaledImage,
        upscaledMimeType);
  }
}
