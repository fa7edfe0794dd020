package com.flamingo.ai.docextract.service.extraction.model;

/**
 * Statistics over a layout provider response.
 *
 * @param blockCount number of blocks
 * @param totalTextLength characters of non-empty trimmed block text
 * @param emptyBlocks blocks whose trimmed text is empty
 * @param avgCharsPerBlock {@code totalTextLength / blockCount}, 0 without blocks
 * @param emptyBlockRatio {@code emptyBlocks / blockCount}, 1 without blocks
 * @param markdownLength trimmed markdown length
 * @param lowQuality the verdict
 */
public record QualityStats(
    int blockCount,
    int totalTextLength,
    int emptyBlocks,
    double avgCharsPerBlock,
    double emptyBlockRatio,
    int markdownLength,
    boolean lowQuality) {}
