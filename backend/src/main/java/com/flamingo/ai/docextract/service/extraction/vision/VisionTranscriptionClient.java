package com.flamingo.ai.docextract.service.extraction.vision;

import com.flamingo.ai.docextract.exception.ProviderCallException;
import com.flamingo.ai.docextract.service.extraction.model.BoundingBox;
import com.flamingo.ai.docextract.service.extraction.model.PageImage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Vision-language model calls: whole-page transcription and text extraction for one region of a
 * page. Every failure surfaces as a {@link ProviderCallException} flagged with its rate-limit
 * classification; no retries happen here.
 */
@Component
@Slf4j
public class VisionTranscriptionClient {

  static final String PROVIDER = "vision";

  private static final String FORMATTING_RULES =
      """
      - Use **bold** for emphasized or important text
      - Use headers (# ## ###) for titles and section headers
      - Use bullet points (-) or numbered lists where appropriate
      - Use tables (| col1 | col2 |) for tabular data
      """;

  private static final String PAGE_PROMPT =
      "Extract all text content from this document image and format it using Markdown syntax.\n\n"
          + "Formatting guidelines:\n"
          + FORMATTING_RULES
          + "- Use > blockquotes for quoted text or notes\n"
          + "- Preserve the structure, hierarchy and layout of the original document\n\n"
          + "Return ONLY the markdown-formatted text. No explanations, meta-commentary, or"
          + " descriptions of the image.";

  private static final String REGION_PROMPT_TEMPLATE =
      "Look at this document image. I need you to extract the text from a specific region.\n\n"
          + "The region is defined by these coordinates (in pixels from top-left):\n"
          + "- X (left): %d\n"
          + "- Y (top): %d\n"
          + "- Width: %d\n"
          + "- Height: %d\n\n"
          + "The OCR system detected this content in the region: \"%s\"\n\n"
          + "Please extract the text content from this region and format it using Markdown"
          + " syntax:\n"
          + FORMATTING_RULES
          + "- Preserve the structure and hierarchy of the content\n\n"
          + "If the OCR text looks correct, you can use it as a base. If you see errors or can"
          + " extract it more accurately, provide the corrected text.\n\n"
          + "Return ONLY the markdown-formatted text, nothing else. No explanations or"
          + " meta-commentary.";

  private final ChatModel chatModel;

  public VisionTranscriptionClient(@Qualifier("visionChatModel") ChatModel chatModel) {
    this.chatModel = chatModel;
  }

  /** Transcribes a full page to markdown. */
  public String transcribePage(PageImage page) {
    return call(page, PAGE_PROMPT);
  }

  /**
   * Extracts the text of one region of a page, seeded with the text the layout provider detected.
   */
  public String transcribeRegion(PageImage page, BoundingBox region, String ocrText) {
    return call(page, regionPrompt(region, ocrText));
  }

  static String regionPrompt(BoundingBox region, String ocrText) {
    String seed = ocrText == null || ocrText.isEmpty() ? "No text detected" : ocrText;
    return String.format(
        REGION_PROMPT_TEMPLATE,
        Math.round(region.x()),
        Math.round(region.y()),
        Math.round(region.width()),
        Math.round(region.height()),
        seed);
  }

  private String call(PageImage page, String prompt) {
    UserMessage message =
        UserMessage.from(
            TextContent.from(prompt), ImageContent.from(page.base64(), page.mimeType()));
    ChatResponse response;
    try {
      response = chatModel.chat(message);
    } catch (RuntimeException e) {
      log.debug("Vision call failed for page {}: {}", page.pageNumber(), e.getMessage());
      throw new ProviderCallException(PROVIDER, "Vision model call failed: " + e.getMessage(), e);
    }
    if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
      throw new ProviderCallException(PROVIDER, "Vision model returned no text");
    }
    return response.aiMessage().text().trim();
  }
}
