package com.flamingo.ai.docextract.service.extraction.layout;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.docextract.service.extraction.model.BoundingBox;
import com.flamingo.ai.docextract.service.extraction.model.ProviderBlock;
import com.flamingo.ai.docextract.service.extraction.model.ProviderLayout;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Normalizes dots.ocr prediction output. The model usually returns a JSON string holding an array
 * of {@code {bbox: [x1, y1, x2, y2], category, text}} objects, but may wrap them in an object or
 * answer with plain markdown.
 */
@Slf4j
public class DotsOcrOutputParser {

  static final String DEFAULT_TYPE = "TEXT";

  private final ObjectMapper objectMapper;

  public DotsOcrOutputParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public ProviderLayout parse(JsonNode output) {
    JsonNode blocks;
    if (output.isTextual()) {
      String raw = output.asText();
      JsonNode parsed;
      try {
        parsed = objectMapper.readTree(raw);
      } catch (JsonProcessingException e) {
        log.debug("dots.ocr output is not JSON, treating it as markdown");
        return ProviderLayout.markdownOnly(raw);
      }
      if (parsed == null || parsed.isMissingNode() || parsed.isValueNode()) {
        return ProviderLayout.markdownOnly(raw);
      }
      blocks = blockArray(parsed, true);
    } else {
      blocks = blockArray(output, false);
    }

    List<ProviderBlock> result = new ArrayList<>();
    for (JsonNode node : blocks) {
      result.add(toBlock(node));
    }
    log.debug("Parsed {} dots.ocr blocks", result.size());
    return new ProviderLayout(result, null, null);
  }

  /**
   * Finds the block list. A parsed JSON object without {@code blocks} or {@code elements} is itself
   * a single block.
   */
  private JsonNode blockArray(JsonNode node, boolean objectIsBlock) {
    if (node.isArray()) {
      return node;
    }
    if (node.isObject()) {
      if (node.path("blocks").isArray()) {
        return node.get("blocks");
      }
      if (node.path("elements").isArray()) {
        return node.get("elements");
      }
      if (objectIsBlock) {
        return objectMapper.createArrayNode().add(node);
      }
    }
    return objectMapper.createArrayNode();
  }

  private static ProviderBlock toBlock(JsonNode node) {
    List<Double> corners = numbers(node.path("bbox"));
    BoundingBox bbox =
        corners.size() == 4
            ? BoundingBox.fromCorners(corners.get(0), corners.get(1), corners.get(2), corners.get(3))
            : BoundingBox.EMPTY;
    String category = node.hasNonNull("category") ? node.get("category").asText() : null;
    String text = node.hasNonNull("text") ? node.get("text").asText() : null;
    return new ProviderBlock(
        category != null ? category : DEFAULT_TYPE,
        category,
        text,
        bbox,
        corners.size() == 4 ? corners : null,
        null,
        null);
  }

  static List<Double> numbers(JsonNode array) {
    List<Double> values = new ArrayList<>();
    if (array.isArray()) {
      for (JsonNode value : array) {
        if (value.isNumber()) {
          values.add(value.asDouble());
        }
      }
    }
    return values;
  }
}
