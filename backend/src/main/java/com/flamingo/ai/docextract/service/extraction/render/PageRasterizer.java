package com.flamingo.ai.docextract.service.extraction.render;

import com.flamingo.ai.docextract.config.ExtractionProperties;
import com.flamingo.ai.docextract.exception.RenderException;
import com.flamingo.ai.docextract.service.extraction.model.PageImage;
import com.flamingo.ai.docextract.service.extraction.model.SourceDocument;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Service;

/**
 * Converts source documents into page images. PDFs are rendered page by page at the configured
 * scale; images pass through as a single page.
 */
@Service
@Slf4j
public class PageRasterizer {

  private static final String PNG = "image/png";

  private final float scale;

  public PageRasterizer(ExtractionProperties properties) {
    this.scale = properties.getRender().getScale();
  }

  /**
   * Returns the pages of a document. For non-PDF input this is the input itself as page 1.
   *
   * @throws RenderException if any PDF page fails to render
   */
  public List<PageImage> rasterize(SourceDocument document) {
    if (!document.isPdf()) {
      return List.of(asSinglePage(document));
    }
    return renderPdf(document.content());
  }

  /**
   * Renders every page of a PDF to PNG. The document is closed before returning, also on failure.
   *
   * @throws RenderException if the document cannot be opened or a page cannot be rendered
   */
  public List<PageImage> renderPdf(byte[] pdfBytes) {
    List<PageImage> pages = new ArrayList<>();
    try (PDDocument document = Loader.loadPDF(pdfBytes)) {
      PDFRenderer renderer = new PDFRenderer(document);
      int pageCount = document.getNumberOfPages();
      for (int i = 0; i < pageCount; i++) {
        pages.add(renderPage(renderer, i));
      }
      log.info("Rendered {} PDF pages at scale {}", pageCount, scale);
      return pages;
    } catch (RenderException e) {
      throw e;
    } catch (IOException e) {
      throw new RenderException("Failed to open PDF: " + e.getMessage(), e);
    }
  }

  private PageImage renderPage(PDFRenderer renderer, int pageIndex) {
    try {
      BufferedImage image = renderer.renderImage(pageIndex, scale);
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      ImageIO.write(image, "png", out);
      log.debug(
          "Rendered page {} ({}x{}, {} KB)",
          pageIndex + 1,
          image.getWidth(),
          image.getHeight(),
          out.size() / 1024);
      return new PageImage(
          pageIndex, pageIndex + 1, image.getWidth(), image.getHeight(), out.toByteArray(), PNG);
    } catch (IOException | RuntimeException e) {
      throw new RenderException(
          pageIndex + 1, "Failed to render page " + (pageIndex + 1) + ": " + e.getMessage(), e);
    }
  }

  private PageImage asSinglePage(SourceDocument document) {
    Integer width = null;
    Integer height = null;
    try {
      BufferedImage image = ImageIO.read(new ByteArrayInputStream(document.content()));
      if (image != null) {
        width = image.getWidth();
        height = image.getHeight();
      }
    } catch (IOException e) {
      log.debug("Could not read dimensions of {}: {}", document.fileName(), e.getMessage());
    }
    return PageImage.single(document.content(), document.mimeType(), width, height);
  }
}
