package com.flamingo.ai.docextract.service.extraction.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flamingo.ai.docextract.config.ExtractionProperties;
import com.flamingo.ai.docextract.exception.ProviderCallException;
import com.flamingo.ai.docextract.service.extraction.DocumentFetcher;
import com.flamingo.ai.docextract.service.extraction.model.PageImage;
import com.flamingo.ai.docextract.service.extraction.model.SourceDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RealEsrganUpscalerTest {

  @Mock private ReplicateClient replicateClient;
  @Mock private DocumentFetcher documentFetcher;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final PageImage page = new PageImage(2, 3, 600, 800, new byte[] {1}, "image/png");
  private RealEsrganUpscaler upscaler;

  @BeforeEach
  void setUp() {
    upscaler =
        new RealEsrganUpscaler(
            replicateClient, documentFetcher, objectMapper, new ExtractionProperties());
  }

  @Test
  void shouldDownloadUpscaledImage_andScaleDimensions() {
    // Given
    when(replicateClient.runPrediction(eq("nightmareai/real-esrgan"), any(), any()))
        .thenReturn(TextNode.valueOf("https://replicate.delivery/out.png"));
    when(documentFetcher.download("https://replicate.delivery/out.png", "image/png"))
        .thenReturn(new SourceDocument(new byte[] {7, 7}, "image/png", null));

    // When
    PageImage upscaled = upscaler.upscale(page, 2);

    // Then
    assertThat(upscaled.pageIndex()).isEqualTo(2);
    assertThat(upscaled.pageNumber()).isEqualTo(3);
    assertThat(upscaled.width()).isEqualTo(1200);
    assertThat(upscaled.height()).isEqualTo(1600);
    assertThat(upscaled.image()).containsExactly(7, 7);

    ArgumentCaptor<ObjectNode> input = ArgumentCaptor.forClass(ObjectNode.class);
    verify(replicateClient).runPrediction(eq("nightmareai/real-esrgan"), input.capture(), any());
    assertThat(input.getValue().get("scale").asInt()).isEqualTo(2);
    assertThat(input.getValue().get("image").asText()).startsWith("data:image/png;base64,");
  }

  @Test
  void shouldThrow_whenOutputHasNoUrl() {
    // Given
    when(replicateClient.runPrediction(any(), any(), any()))
        .thenReturn(objectMapper.createObjectNode());

    // When / Then
    assertThatThrownBy(() -> upscaler.upscale(page, 2))
        .isInstanceOf(ProviderCallException.class)
        .hasMessageContaining("image URL");
  }

  @Test
  void shouldFindImageUrl_inAllOutputShapes() throws Exception {
    assertThat(RealEsrganUpscaler.imageUrl(TextNode.valueOf("https://a"))).isEqualTo("https://a");
    assertThat(RealEsrganUpscaler.imageUrl(objectMapper.readTree("[1, \"https://b\"]")))
        .isEqualTo("https://b");
    assertThat(RealEsrganUpscaler.imageUrl(objectMapper.readTree("{\"image\": \"https://c\"}")))
        .isEqualTo("https://c");
    assertThat(RealEsrganUpscaler.imageUrl(objectMapper.readTree("[]"))).isNull();
    assertThat(RealEsrganUpscaler.imageUrl(null)).isNull();
  }
}
