package io.scpidoc.parser.api;

/**
 * Counters of one extraction pass.
 *
 * @param blocks blocks consumed
 * @param blankBlocks blocks without text
 * @param headers blocks classified as command headers (finalized records before merging)
 * @param sectionLabels blocks classified as section labels
 * @param droppedBlocks content blocks seen before the first header
 * @param notes note lines collected
 * @param mergedDuplicates header blocks merged into an earlier record of the same mnemonic
 */
public record ExtractionStats(
    int blocks,
    int blankBlocks,
    int headers,
    int sectionLabels,
    int droppedBlocks,
    int notes,
    int mergedDuplicates) {}
