package com.flamingo.ai.docextract.service.extraction.layout;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.docextract.config.ExtractionProperties;
import com.flamingo.ai.docextract.domain.enums.ExtractionMethod;
import com.flamingo.ai.docextract.service.extraction.model.LayoutRequest;
import com.flamingo.ai.docextract.service.extraction.model.ProviderLayout;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Primary layout provider: the dots.ocr model on Replicate, one call per page image. */
@Service
@Slf4j
public class DotsOcrLayoutProvider implements LayoutProvider {

  static final String LAYOUT_PROMPT =
      """
      Please output the major content regions from this document image, including each region's \
      bbox, its category, and the corresponding text content within the bbox.

      1. Bbox format: [x1, y1, x2, y2]

      2. Categories: The possible categories are ['Title', 'Text', 'Table', 'Picture', 'Formula'].

      3. Grouping Rules:
          - Group related content together into unified blocks
          - Lists (bullet points, numbered items) should be a SINGLE Text block, not separate items
          - Consecutive paragraphs on the same topic should be merged into one Text block
          - Section headers and their content can be grouped together
          - Only create separate blocks for visually distinct major regions

      4. Text Extraction & Formatting Rules:
          - Picture: For the 'Picture' category, the text field should be omitted.
          - Formula: Format its text as LaTeX.
          - Table: Format its text as HTML (include the full table structure).
          - Text/Title: Format as Markdown (preserve lists, headers, formatting).

      5. Constraints:
          - The output text must be the original text from the image, with no translation.
          - All content regions must be sorted according to human reading order.
          - Aim for fewer, larger blocks rather than many small ones.

      6. Final Output: The entire output must be a single JSON object.""";

  private final ReplicateClient replicateClient;
  private final ObjectMapper objectMapper;
  private final DotsOcrOutputParser parser;
  private final ExtractionProperties.Replicate settings;

  public DotsOcrLayoutProvider(
      ReplicateClient replicateClient,
      ObjectMapper objectMapper,
      ExtractionProperties properties) {
    this.replicateClient = replicateClient;
    this.objectMapper = objectMapper;
    this.parser = new DotsOcrOutputParser(objectMapper);
    this.settings = properties.getReplicate();
  }

  @Override
  public ExtractionMethod method() {
    return ExtractionMethod.DOTS_OCR;
  }

  @Override
  @CircuitBreaker(name = "dotsOcr")
  public ProviderLayout analyze(LayoutRequest request) {
    ObjectNode input = objectMapper.createObjectNode();
    input.put("image", request.dataUrl());
    input.put("prompt", LAYOUT_PROMPT);

    log.debug("Calling dots.ocr for {} ({} KB)", request.fileName(), request.content().length / 1024);
    JsonNode output =
        replicateClient.runPrediction(settings.getDotsOcrModel(), input, settings.getTimeout());
    ProviderLayout layout = parser.parse(output);
    log.info("dots.ocr returned {} blocks for {}", layout.blocks().size(), request.fileName());
    return layout;
  }
}
