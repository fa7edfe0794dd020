package com.flamingo.ai.docextract.service.extraction.layout;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.docextract.config.ExtractionProperties;
import com.flamingo.ai.docextract.exception.ProviderCallException;
import com.flamingo.ai.docextract.service.extraction.DocumentFetcher;
import com.flamingo.ai.docextract.service.extraction.model.PageImage;
import com.flamingo.ai.docextract.service.extraction.model.SourceDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Real-ESRGAN on Replicate. The upscaled image is downloaded again and replaces the page image. */
@Service
@Slf4j
public class RealEsrganUpscaler implements ImageUpscaler {

  static final String PROVIDER = "real-esrgan";

  private final ReplicateClient replicateClient;
  private final DocumentFetcher documentFetcher;
  private final ObjectMapper objectMapper;
  private final ExtractionProperties.Replicate settings;

  public RealEsrganUpscaler(
      ReplicateClient replicateClient,
      DocumentFetcher documentFetcher,
      ObjectMapper objectMapper,
      ExtractionProperties properties) {
    this.replicateClient = replicateClient;
    this.documentFetcher = documentFetcher;
    this.objectMapper = objectMapper;
    this.settings = properties.getReplicate();
  }

  @Override
  public PageImage upscale(PageImage page, int scale) {
    ObjectNode input = objectMapper.createObjectNode();
    input.put("image", page.dataUrl());
    input.put("scale", scale);

    JsonNode output =
        replicateClient.runPrediction(settings.getRealEsrganModel(), input, settings.getTimeout());
    String imageUrl = imageUrl(output);
    if (imageUrl == null) {
      throw new ProviderCallException(PROVIDER, "Real-ESRGAN output did not include an image URL");
    }

    SourceDocument upscaled = documentFetcher.download(imageUrl, page.mimeType());
    log.info(
        "Upscaled page {} x{} ({} KB -> {} KB)",
        page.pageNumber(),
        scale,
        page.image().length / 1024,
        upscaled.content().length / 1024);
    return page.upscaled(upscaled.content(), upscaled.mimeType(), scale);
  }

  /** The output is a URL string, an array containing one, or an object with an {@code image}. */
  static String imageUrl(JsonNode output) {
    if (output == null) {
      return null;
    }
    if (output.isTextual()) {
      return output.asText();
    }
    if (output.isArray()) {
      for (JsonNode value : output) {
        if (value.isTextual()) {
          return value.asText();
        }
      }
      return null;
    }
    JsonNode image = output.path("image");
    return image.isTextual() ? image.asText() : null;
  }
}
