package com.flamingo.ai.docextract.service.extraction.layout;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flamingo.ai.docextract.service.extraction.model.BoundingBox;
import com.flamingo.ai.docextract.service.extraction.model.ProviderBlock;
import com.flamingo.ai.docextract.service.extraction.model.ProviderLayout;
import org.junit.jupiter.api.Test;

class DotsOcrOutputParserTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final DotsOcrOutputParser parser = new DotsOcrOutputParser(objectMapper);

  @Test
  void shouldConvertCornerBoxes_fromJsonString() {
    // Given
    String raw =
        """
        [{"bbox": [100, 50, 400, 90], "category": "Title", "text": "Annual Report"},
         {"bbox": [100, 120, 700, 400], "category": "Text", "text": "Revenue grew."}]
        """;

    // When
    ProviderLayout layout = parser.parse(TextNode.valueOf(raw));

    // Then
    assertThat(layout.blocks()).hasSize(2);
    ProviderBlock title = layout.blocks().get(0);
    assertThat(title.type()).isEqualTo("Title");
    assertThat(title.content()).isEqualTo("Annual Report");
    assertThat(title.bbox()).isEqualTo(new BoundingBox(100, 50, 300, 40));
    assertThat(title.originalBbox()).containsExactly(100.0, 50.0, 400.0, 90.0);
    assertThat(title.pageIndex()).isNull();
    assertThat(layout.markdown()).isNull();
  }

  @Test
  void shouldReadBlocksFromWrapperObject() throws Exception {
    // Given
    String raw = "{\"elements\": [{\"bbox\": [0, 0, 10, 10], \"text\": \"a\"}]}";

    // When
    ProviderLayout layout = parser.parse(objectMapper.readTree(raw));

    // Then
    assertThat(layout.blocks()).hasSize(1);
    assertThat(layout.blocks().get(0).type()).isEqualTo("TEXT");
    assertThat(layout.blocks().get(0).category()).isNull();
  }

  @Test
  void shouldTreatSingleObjectStringAsOneBlock() {
    // When
    ProviderLayout layout =
        parser.parse(TextNode.valueOf("{\"category\": \"Text\", \"text\": \"Hello\"}"));

    // Then
    assertThat(layout.blocks()).hasSize(1);
    assertThat(layout.blocks().get(0).bbox()).isEqualTo(BoundingBox.EMPTY);
    assertThat(layout.blocks().get(0).originalBbox()).isNull();
  }

  @Test
  void shouldKeepNonJsonOutputAsMarkdown() {
    // When
    ProviderLayout layout = parser.parse(TextNode.valueOf("# Heading\n\nSome text"));

    // Then
    assertThat(layout.blocks()).isEmpty();
    assertThat(layout.markdown()).isEqualTo("# Heading\n\nSome text");
  }

  @Test
  void shouldReturnNoBlocks_forUnexpectedObject() throws Exception {
    assertThat(parser.parse(objectMapper.readTree("{\"status\": \"ok\"}")).blocks()).isEmpty();
  }

  @Test
  void shouldReturnNoBlocks_whenOutputIsNotAContainer() {
    // When
    ProviderLayout layout = parser.parse(IntNode.valueOf(42));

    // Then
    assertThat(layout.blocks()).isEmpty();
    assertThat(layout.markdown()).isNull();
  }
}
