package com.flamingo.ai.docextract.service.extraction.model;

import java.util.Base64;

/** Input of a layout provider call: a page image or a whole document. */
public record LayoutRequest(byte[] content, String fileName, String mimeType) {

  public static LayoutRequest forPage(PageImage page, String fileName) {
    return new LayoutRequest(page.image(), fileName, page.mimeType());
  }

  public static LayoutRequest forDocument(SourceDocument document) {
    return new LayoutRequest(document.content(), document.fileName(), document.mimeType());
  }

  public String dataUrl() {
    return "data:" + mimeType + ";base64," + Base64.getEncoder().encodeToString(content);
  }
}
