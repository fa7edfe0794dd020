package com.flamingo.ai.docextract.service.extraction.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docextract.config.ExtractionProperties;
import com.flamingo.ai.docextract.domain.enums.ExtractionMethod;
import com.flamingo.ai.docextract.exception.ProviderCallException;
import com.flamingo.ai.docextract.exception.RenderException;
import com.flamingo.ai.docextract.service.extraction.model.BoundingBox;
import com.flamingo.ai.docextract.service.extraction.model.LayoutPage;
import com.flamingo.ai.docextract.service.extraction.model.LayoutRequest;
import com.flamingo.ai.docextract.service.extraction.model.LayoutResult;
import com.flamingo.ai.docextract.service.extraction.model.PageImage;
import com.flamingo.ai.docextract.service.extraction.model.ProviderBlock;
import com.flamingo.ai.docextract.service.extraction.model.ProviderLayout;
import com.flamingo.ai.docextract.service.extraction.model.ProviderLayout.PageSize;
import com.flamingo.ai.docextract.service.extraction.model.SourceDocument;
import com.flamingo.ai.docextract.service.extraction.quality.OcrQualityAssessor;
import com.flamingo.ai.docextract.service.extraction.render.PageRasterizer;
import com.flamingo.ai.docextract.service.extraction.vision.FullDocumentExtractor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LayoutExtractionChainTest {

  @Mock private PageRasterizer pageRasterizer;
  @Mock private LayoutProviderRouter providerRouter;
  @Mock private LayoutProvider provider;
  @Mock private ImageUpscaler imageUpscaler;
  @Mock private FullDocumentExtractor fallbackExtractor;

  private SimpleMeterRegistry meterRegistry;
  private LayoutExtractionChain chain;

  private final SourceDocument image =
      new SourceDocument(new byte[] {1}, "image/png", "receipt.png");
  private final SourceDocument pdf =
      new SourceDocument(new byte[] {2}, "application/pdf", "report.pdf");
  private final PageImage page0 = new PageImage(0, 1, 1000, 1400, new byte[] {10}, "image/png");
  private final PageImage page1 = new PageImage(1, 2, 1000, 1400, new byte[] {11}, "image/png");

  @BeforeEach
  void setUp() {
    ExtractionProperties properties = new ExtractionProperties();
    meterRegistry = new SimpleMeterRegistry();
    chain =
        new LayoutExtractionChain(
            pageRasterizer,
            providerRouter,
            new OcrQualityAssessor(properties),
            imageUpscaler,
            fallbackExtractor,
            properties,
            meterRegistry);
  }

  private static ProviderBlock block(String text) {
    return new ProviderBlock(
        "Text", "Text", text, new BoundingBox(5, 5, 200, 20), null, null, null);
  }

  private static ProviderBlock block(String text, Integer pageIndex) {
    return new ProviderBlock(
        "Text", "Text", text, new BoundingBox(5, 5, 200, 20), null, null, pageIndex);
  }

  private static ProviderLayout goodLayout(String prefix) {
    return new ProviderLayout(
        List.of(
            block(prefix + " Invoice number 2024-0042"),
            block(prefix + " Customer: Example Trading Ltd")),
        null,
        Map.of());
  }

  @Nested
  @DisplayName("Per-page providers")
  class PerPage {

    @Test
    void shouldNotUpscale_whenQualityIsAcceptable() {
      // Given
      when(pageRasterizer.rasterize(image)).thenReturn(List.of(page0));
      when(providerRouter.route(ExtractionMethod.DOTS_OCR)).thenReturn(provider);
      when(provider.analyze(any())).thenReturn(goodLayout("p1"));

      // When
      LayoutResult result = chain.extract(image, ExtractionMethod.DOTS_OCR);

      // Then
      assertThat(result.fromFallback()).isFalse();
      assertThat(result.totalPages()).isEqualTo(1);
      assertThat(result.totalBlocks()).isEqualTo(2);
      verify(imageUpscaler, never()).upscale(any(), eq(2));
      assertThat(meterRegistry.counter("extraction.layout.upscale.attempts").count()).isZero();
    }

    @Test
    void shouldRetryOnUpscaledImage_whenQualityIsLow() {
      // Given
      PageImage upscaled = page0.upscaled(new byte[] {99}, "image/png", 2);
      when(pageRasterizer.rasterize(image)).thenReturn(List.of(page0));
      when(providerRouter.route(ExtractionMethod.DOTS_OCR)).thenReturn(provider);
      when(provider.analyze(any()))
          .thenReturn(new ProviderLayout(List.of(block("a"), block(""), block("")), null, null))
          .thenReturn(goodLayout("upscaled"));
      when(imageUpscaler.upscale(page0, 2)).thenReturn(upscaled);

      // When
      LayoutResult result = chain.extract(image, ExtractionMethod.DOTS_OCR);

      // Then
      ArgumentCaptor<LayoutRequest> requests = ArgumentCaptor.forClass(LayoutRequest.class);
      verify(provider, times(2)).analyze(requests.capture());
      assertThat(requests.getAllValues().get(1).content()).containsExactly(99);
      LayoutPage page = result.pages().get(0);
      assertThat(page.width()).isEqualTo(2000);
      assertThat(page.height()).isEqualTo(2800);
      assertThat(page.blocks().get(0).content()).startsWith("upscaled");
      assertThat(meterRegistry.counter("extraction.layout.upscale.attempts").count())
          .isEqualTo(1.0);
    }

    @Test
    void shouldKeepOriginalOutput_whenUpscalingFails() {
      // Given
      ProviderLayout sparse = new ProviderLayout(List.of(block("Total")), null, null);
      when(pageRasterizer.rasterize(image)).thenReturn(List.of(page0));
      when(providerRouter.route(ExtractionMethod.DOTS_OCR)).thenReturn(provider);
      when(provider.analyze(any())).thenReturn(sparse);
      when(imageUpscaler.upscale(page0, 2))
          .thenThrow(new ProviderCallException("real-esrgan", "model unavailable"));

      // When
      LayoutResult result = chain.extract(image, ExtractionMethod.DOTS_OCR);

      // Then
      assertThat(result.fromFallback()).isFalse();
      assertThat(result.totalBlocks()).isEqualTo(1);
      assertThat(result.pages().get(0).blocks().get(0).content()).isEqualTo("Total");
      assertThat(result.pages().get(0).width()).isEqualTo(1000);
      assertThat(meterRegistry.counter("extraction.layout.upscale.failures").count())
          .isEqualTo(1.0);
      verify(fallbackExtractor, never()).extractLayout(any(), any());
    }

    @Test
    void shouldKeepOriginalOutput_whenUpscaledAnalysisFails() {
      // Given
      ProviderLayout sparse = new ProviderLayout(List.of(block("Total")), null, null);
      when(pageRasterizer.rasterize(image)).thenReturn(List.of(page0));
      when(providerRouter.route(ExtractionMethod.DOTS_OCR)).thenReturn(provider);
      when(provider.analyze(any()))
          .thenReturn(sparse)
          .thenThrow(new ProviderCallException("dots.ocr", "timeout"));
      when(imageUpscaler.upscale(page0, 2))
          .thenReturn(page0.upscaled(new byte[] {7}, "image/png", 2));

      // When
      LayoutResult result = chain.extract(image, ExtractionMethod.DOTS_OCR);

      // Then
      assertThat(result.pages().get(0).blocks()).hasSize(1);
      assertThat(result.pages().get(0).image()).isSameAs(page0);
    }

    @Test
    void shouldAssignGlobalIndexesInPageOrder_andHeadPdfMarkdown() {
      // Given
      when(pageRasterizer.rasterize(pdf)).thenReturn(List.of(page0, page1));
      when(providerRouter.route(ExtractionMethod.DOTS_OCR)).thenReturn(provider);
      when(provider.analyze(any()))
          .thenReturn(
              new ProviderLayout(
                  List.of(
                      block("first page heading text"),
                      block("first page body paragraph"),
                      block("first page footer")),
                  "# One",
                  null))
          .thenReturn(
              new ProviderLayout(
                  List.of(block("second page long paragraph"), block("second page closing line")),
                  "# Two",
                  null));

      // When
      LayoutResult result = chain.extract(pdf, ExtractionMethod.DOTS_OCR);

      // Then
      assertThat(result.totalBlocks()).isEqualTo(5);
      assertThat(result.pages().get(0).blocks())
          .extracting(b -> b.globalBlockIndex())
          .containsExactly(0, 1, 2);
      assertThat(result.pages().get(1).blocks())
          .extracting(b -> b.globalBlockIndex())
          .containsExactly(3, 4);
      assertThat(result.pages().get(1).blocks())
          .extracting(b -> b.blockIndex())
          .containsExactly(0, 1);
      assertThat(result.markdown()).isEqualTo("## Page 1\n\n# One\n\n---\n\n## Page 2\n\n# Two");
    }
  }

  @Nested
  @DisplayName("Whole-document providers")
  class WholeDocument {

    @Test
    void shouldGroupBlocksByTaggedPage() {
      // Given
      when(pageRasterizer.rasterize(pdf)).thenReturn(List.of(page0, page1));
      when(providerRouter.route(ExtractionMethod.DATALAB)).thenReturn(provider);
      when(provider.acceptsDocuments()).thenReturn(true);
      when(provider.analyze(any()))
          .thenReturn(
              new ProviderLayout(
                  List.of(
                      block("Quarterly report for the northern region", 0),
                      block("Revenue grew eleven percent year over year", 1),
                      block("Untagged caption text for the cover", null)),
                  "# Report",
                  Map.of(1, new PageSize(612, 792))));

      // When
      LayoutResult result = chain.extract(pdf, ExtractionMethod.DATALAB);

      // Then
      verify(provider, times(1)).analyze(any());
      assertThat(result.pages().get(0).blocks()).hasSize(2);
      assertThat(result.pages().get(1).blocks()).hasSize(1);
      assertThat(result.pages().get(1).blocks().get(0).globalBlockIndex()).isEqualTo(2);
      assertThat(result.pages().get(0).width()).isEqualTo(1000);
      assertThat(result.pages().get(1).width()).isEqualTo(612);
      assertThat(result.markdown()).isEqualTo("# Report");
    }
  }

  @Nested
  @DisplayName("Fallback")
  class Fallback {

    @Test
    void shouldFallBackToTranscription_whenProviderFails() {
      // Given
      LayoutResult fallback = LayoutResult.of(List.of(), "text", true);
      when(pageRasterizer.rasterize(image)).thenReturn(List.of(page0));
      when(providerRouter.route(ExtractionMethod.DOTS_OCR)).thenReturn(provider);
      when(provider.analyze(any())).thenThrow(new ProviderCallException("dots.ocr", "502"));
      when(fallbackExtractor.extractLayout(image, List.of(page0))).thenReturn(fallback);

      // When
      LayoutResult result = chain.extract(image, ExtractionMethod.DOTS_OCR);

      // Then
      assertThat(result).isSameAs(fallback);
      assertThat(meterRegistry.counter("extraction.layout.fallback").count()).isEqualTo(1.0);
    }

    @Test
    void shouldFallBackWithoutPages_whenRenderingFails() {
      // Given
      LayoutResult fallback = LayoutResult.of(List.of(), "text", true);
      when(pageRasterizer.rasterize(pdf))
          .thenThrow(new RenderException("Failed to open PDF", new IllegalStateException()));
      when(fallbackExtractor.extractLayout(pdf, null)).thenReturn(fallback);

      // When
      LayoutResult result = chain.extract(pdf, ExtractionMethod.DOTS_OCR);

      // Then
      assertThat(result).isSameAs(fallback);
      verify(providerRouter, never()).route(any());
    }

    @Test
    void shouldPropagate_whenFallbackAlsoFails() {
      // Given
      when(pageRasterizer.rasterize(image)).thenReturn(List.of(page0));
      when(providerRouter.route(ExtractionMethod.DOTS_OCR)).thenReturn(provider);
      when(provider.analyze(any())).thenThrow(new ProviderCallException("dots.ocr", "502"));
      when(fallbackExtractor.extractLayout(image, List.of(page0)))
          .thenThrow(new ProviderCallException("vision", "vision model down"));

      // When / Then
      assertThatThrownBy(() -> chain.extract(image, ExtractionMethod.DOTS_OCR))
          .isInstanceOf(ProviderCallException.class)
          .hasMessage("vision model down");
    }
  }
}
