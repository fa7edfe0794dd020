package com.flamingo.ai.docextract.service.extraction.layout;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.docextract.service.extraction.model.BoundingBox;
import com.flamingo.ai.docextract.service.extraction.model.ProviderBlock;
import com.flamingo.ai.docextract.service.extraction.model.ProviderLayout;
import com.flamingo.ai.docextract.service.extraction.model.ProviderLayout.PageSize;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Normalizes Datalab Marker responses.
 *
 * <p>Blocks are taken from the first source that yields any: the {@code json} block tree, a flat
 * {@code blocks} list, per-page {@code pages[].blocks} or {@code pages[].markdown}, the document
 * {@code markdown}, and finally the text of {@code html}.
 */
@Slf4j
public class DatalabResponseParser {

  static final String DEFAULT_TYPE = "TEXT";

  /** Tree nodes that only group other blocks. */
  private static final Set<String> CONTAINER_TYPES = Set.of("Document", "Page");

  private static final Pattern HTML_TAG = Pattern.compile("<[^>]*>");

  private final ObjectMapper objectMapper;

  public DatalabResponseParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public ProviderLayout parse(JsonNode response) {
    String markdown = textOrNull(response, "markdown");
    return new ProviderLayout(extractBlocks(response), markdown, pageSizes(response));
  }

  List<ProviderBlock> extractBlocks(JsonNode response) {
    List<ProviderBlock> blocks = fromJsonTree(response.path("json"));
    if (!blocks.isEmpty()) {
      log.debug("Extracted {} blocks from Datalab json tree", blocks.size());
      return blocks;
    }

    JsonNode flat = response.path("blocks");
    if (flat.isArray() && !flat.isEmpty()) {
      for (JsonNode node : flat) {
        blocks.add(flatBlock(node, null));
      }
      return blocks;
    }

    JsonNode pages = response.path("pages");
    if (pages.isArray()) {
      int pageIndex = 0;
      for (JsonNode page : pages) {
        if (page.path("blocks").isArray()) {
          for (JsonNode node : page.get("blocks")) {
            blocks.add(flatBlock(node, pageIndex));
          }
        } else if (hasText(page, "markdown")) {
          blocks.add(textBlock(page.get("markdown").asText(), pageIndex));
        }
        pageIndex++;
      }
      if (!blocks.isEmpty()) {
        return blocks;
      }
    }

    if (hasText(response, "markdown")) {
      return List.of(textBlock(response.get("markdown").asText(), null));
    }

    String html = textOrNull(response, "html");
    if (html != null) {
      String text = HTML_TAG.matcher(html).replaceAll("").trim();
      if (!text.isEmpty()) {
        return List.of(textBlock(text, null));
      }
    }

    log.warn("Datalab response has no blocks, markdown or html");
    return List.of();
  }

  private List<ProviderBlock> fromJsonTree(JsonNode json) {
    JsonNode tree = json;
    if (json.isTextual()) {
      try {
        tree = objectMapper.readTree(json.asText());
      } catch (JsonProcessingException e) {
        log.warn("Failed to parse Datalab json field: {}", e.getOriginalMessage());
        return new ArrayList<>();
      }
    }
    List<ProviderBlock> blocks = new ArrayList<>();
    if (tree == null) {
      return blocks;
    }
    if (tree.isArray()) {
      int pageIndex = 0;
      for (JsonNode page : tree) {
        collect(page, pageIndex++, blocks);
      }
    } else if (tree.isObject()) {
      if ("Document".equals(tree.path("block_type").asText()) && tree.path("children").isArray()) {
        int pageIndex = 0;
        for (JsonNode page : tree.get("children")) {
          collect(page, pageIndex++, blocks);
        }
      } else {
        collect(tree, null, blocks);
      }
    }
    return blocks;
  }

  private void collect(JsonNode node, Integer pageIndex, List<ProviderBlock> out) {
    if (node == null || !node.isObject()) {
      return;
    }
    String blockType = textOrNull(node, "block_type");
    if (blockType != null && !CONTAINER_TYPES.contains(blockType)) {
      out.add(treeBlock(node, blockType, pageIndex));
    }
    if (node.path("children").isArray()) {
      for (JsonNode child : node.get("children")) {
        collect(child, pageIndex, out);
      }
    }
  }

  /** Tree nodes carry a polygon (nested or flat points) or a corner bbox. */
  private ProviderBlock treeBlock(JsonNode node, String blockType, Integer pageIndex) {
    String content = firstText(node, "html", "markdown", "text");
    JsonNode polygonNode = node.path("polygon");
    List<Double> corners = DotsOcrOutputParser.numbers(node.path("bbox"));

    if (polygonNode.isArray() && polygonNode.size() >= 4) {
      List<Double> polygon = new ArrayList<>();
      List<Double> xs = new ArrayList<>();
      List<Double> ys = new ArrayList<>();
      if (polygonNode.get(0).isArray()) {
        for (JsonNode point : polygonNode) {
          double x = point.path(0).asDouble();
          double y = point.path(1).asDouble();
          polygon.add(x);
          polygon.add(y);
          xs.add(x);
          ys.add(y);
        }
      } else {
        List<Double> flat = DotsOcrOutputParser.numbers(polygonNode);
        for (int i = 0; i + 1 < flat.size(); i += 2) {
          xs.add(flat.get(i));
          ys.add(flat.get(i + 1));
        }
        polygon.addAll(flat);
      }
      BoundingBox bbox = BoundingBox.EMPTY;
      if (!xs.isEmpty()) {
        double minX = xs.stream().mapToDouble(Double::doubleValue).min().orElse(0);
        double minY = ys.stream().mapToDouble(Double::doubleValue).min().orElse(0);
        double maxX = xs.stream().mapToDouble(Double::doubleValue).max().orElse(0);
        double maxY = ys.stream().mapToDouble(Double::doubleValue).max().orElse(0);
        bbox = BoundingBox.fromCorners(minX, minY, maxX, maxY);
      }
      return new ProviderBlock(
          blockType, blockType, content, bbox, originalBbox(bbox), polygon, pageIndex);
    }

    if (corners.size() == 4) {
      double x1 = corners.get(0);
      double y1 = corners.get(1);
      double x2 = corners.get(2);
      double y2 = corners.get(3);
      return new ProviderBlock(
          blockType,
          blockType,
          content,
          BoundingBox.fromCorners(x1, y1, x2, y2),
          corners,
          List.of(x1, y1, x2, y1, x2, y2, x1, y2),
          pageIndex);
    }

    return new ProviderBlock(blockType, blockType, content, BoundingBox.EMPTY, null, null, pageIndex);
  }

  /** Flat-list blocks already use {@code [x, y, width, height]}. */
  private ProviderBlock flatBlock(JsonNode node, Integer pageIndex) {
    String type = textOrNull(node, "type");
    String resolvedType = type != null ? type : DEFAULT_TYPE;
    List<Double> box = DotsOcrOutputParser.numbers(node.path("bbox"));
    BoundingBox bbox =
        box.size() == 4 ? new BoundingBox(box.get(0), box.get(1), box.get(2), box.get(3)) : null;
    Integer page = pageIndex;
    if (page == null && node.path("pageIndex").canConvertToInt()) {
      page = node.get("pageIndex").asInt();
    }
    return new ProviderBlock(
        resolvedType,
        type,
        firstText(node, "content", "text"),
        bbox != null ? bbox : BoundingBox.EMPTY,
        bbox != null ? originalBbox(bbox) : null,
        null,
        page);
  }

  private static ProviderBlock textBlock(String content, Integer pageIndex) {
    return new ProviderBlock(
        DEFAULT_TYPE, DEFAULT_TYPE, content, BoundingBox.EMPTY, null, null, pageIndex);
  }

  private static List<Double> originalBbox(BoundingBox bbox) {
    return List.of(bbox.x(), bbox.y(), bbox.x() + bbox.width(), bbox.y() + bbox.height());
  }

  /** Page dimensions from {@code metadata.page_stats}, keyed by page index. */
  static Map<Integer, PageSize> pageSizes(JsonNode response) {
    Map<Integer, PageSize> sizes = new HashMap<>();
    JsonNode stats = response.path("metadata").path("page_stats");
    if (stats.isArray()) {
      int index = 0;
      for (JsonNode page : stats) {
        int width = page.path("width").asInt(0);
        int height = page.path("height").asInt(0);
        if (width > 0 && height > 0) {
          sizes.put(index, new PageSize(width, height));
        }
        index++;
      }
    }
    return sizes;
  }

  private static String firstText(JsonNode node, String... fields) {
    for (String field : fields) {
      String value = textOrNull(node, field);
      if (value != null && !value.isEmpty()) {
        return value;
      }
    }
    return "";
  }

  private static boolean hasText(JsonNode node, String field) {
    String value = textOrNull(node, field);
    return value != null && !value.isEmpty();
  }

  private static String textOrNull(JsonNode node, String field) {
    JsonNode value = node.path(field);
    return value.isTextual() ? value.asText() : null;
  }
}
