package com.flamingo.ai.docextract.service.extraction.quality;

import com.flamingo.ai.docextract.config.ExtractionProperties;
import com.flamingo.ai.docextract.service.extraction.model.ProviderBlock;
import com.flamingo.ai.docextract.service.extraction.model.ProviderLayout;
import com.flamingo.ai.docextract.service.extraction.model.QualityStats;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Judges whether a layout provider response is too sparse to trust. Stateless; the thresholds come
 * from {@link ExtractionProperties.Quality}.
 */
@Component
public class OcrQualityAssessor {

  private final ExtractionProperties.Quality thresholds;

  public OcrQualityAssessor(ExtractionProperties properties) {
    this.thresholds = properties.getQuality();
  }

  public QualityStats assess(ProviderLayout layout) {
    return assess(layout.blocks(), layout.markdown());
  }

  /**
   * Computes statistics and the low-quality verdict. Low quality when any rule holds: no blocks and
   * short markdown; too little text overall; too many empty blocks; a low average combined with a
   * moderate share of empty blocks.
   */
  public QualityStats assess(List<ProviderBlock> blocks, String markdown) {
    int blockCount = blocks.size();
    int totalTextLength = 0;
    int emptyBlocks = 0;
    for (ProviderBlock block : blocks) {
      String text = block.content() == null ? "" : block.content().trim();
      if (text.isEmpty()) {
        emptyBlocks++;
      } else {
        totalTextLength += text.length();
      }
    }
    int markdownLength = markdown == null ? 0 : markdown.trim().length();
    double avgCharsPerBlock = blockCount == 0 ? 0 : (double) totalTextLength / blockCount;
    double emptyBlockRatio = blockCount == 0 ? 1 : (double) emptyBlocks / blockCount;

    boolean lowQuality;
    if (blockCount == 0) {
      lowQuality = markdownLength < thresholds.getMinTextChars();
    } else {
      lowQuality =
          totalTextLength + markdownLength < thresholds.getMinTextChars()
              || emptyBlockRatio > thresholds.getMaxEmptyBlockRatio()
              || (avgCharsPerBlock < thresholds.getMinAvgBlockChars()
                  && emptyBlockRatio > thresholds.getSparseEmptyBlockRatio());
    }

    return new QualityStats(
        blockCount,
        totalTextLength,
        emptyBlocks,
        avgCharsPerBlock,
        emptyBlockRatio,
        markdownLength,
        lowQuality);
  }
}
