package io.scpidoc.parser.api;

import io.scpidoc.parser.impl.ManualExtractorImpl;
import java.util.List;
import java.util.Objects;

/**
 * Main entry point for extracting command definitions from a rendered programmer manual.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * CommandIndex index = CommandIndex.builder()
 *     .add("Acquisition", "ACQuire:STATE")
 *     .add("Vertical", "CH<x>:SCAle")
 *     .build();
 * ExtractionResult result =
 *     ManualExtractor.extract(blocks, index, ExtractorOptions.forHeaderFont("Arial Narrow"));
 *
 * result.group("Vertical").forEach(cmd -> System.out.println(cmd.mnemonic()));
 * result.flagged().forEach(cmd -> System.err.println("review: " + cmd.mnemonic()));
 * }</pre>
 *
 * <p>Extraction is a single synchronous pass over an in-memory block list. Document content never
 * makes it fail; doubtful records are kept and flagged instead (see {@link RecordFlag}).
 */
public final class ManualExtractor {

  private ManualExtractor() {}

  /**
   * Extracts commands with default options.
   *
   * @param blocks the manual's paragraphs in document order
   * @param index known commands and their groups
   * @return grouped commands
   * @throws NullPointerException if blocks or index is null
   */
  public static ExtractionResult extract(List<DocumentBlock> blocks, CommandIndex index) {
    return extract(blocks, index, ExtractorOptions.DEFAULT, null);
  }

  /**
   * Extracts commands with custom options.
   *
   * @param blocks the manual's paragraphs in document order
   * @param index known commands and their groups
   * @param options extractor options
   * @return grouped commands
   * @throws NullPointerException if blocks, index or options is null
   */
  public static ExtractionResult extract(
      List<DocumentBlock> blocks, CommandIndex index, ExtractorOptions options) {
    return extract(blocks, index, options, null);
  }

  /**
   * Extracts commands with custom options and progress reporting.
   *
   * @param blocks the manual's paragraphs in document order
   * @param index known commands and their groups
   * @param options extractor options
   * @param progressCallback optional callback for progress updates (0.0 to 1.0)
   * @return grouped commands
   * @throws NullPointerException if blocks, index or options is null
   */
  public static ExtractionResult extract(
      List<DocumentBlock> blocks,
      CommandIndex index,
      ExtractorOptions options,
      ProgressCallback progressCallback) {
    Objects.requireNonNull(blocks, "blocks must not be null");
    Objects.requireNonNull(index, "index must not be null");
    Objects.requireNonNull(options, "options must not be null");
    return ManualExtractorImpl.extract(blocks, index, options, progressCallback);
  }

  /**
   * Runs only the first phase: classification and the section state machine. Records come back
   * merged and in order of first header, without any post-processing.
   *
   * @param blocks the manual's paragraphs in document order
   * @param index known commands and their groups
   * @param options extractor options
   * @return finalized records
   * @throws NullPointerException if any argument is null
   */
  public static List<CommandRecord> collect(
      List<DocumentBlock> blocks, CommandIndex index, ExtractorOptions options) {
    Objects.requireNonNull(blocks, "blocks must not be null");
    Objects.requireNonNull(index, "index must not be null");
    Objects.requireNonNull(options, "options must not be null");
    return ManualExtractorImpl.collect(blocks, index, options);
  }

  /** Extractor configuration options. */
  public record ExtractorOptions(
      String headerStyleName,
      String headerFontFamily,
      boolean headerRequiresBold,
      String sectionStyleName,
      String fallbackGroup,
      boolean filterSyntax,
      boolean filterExamples,
      int maxEnumOptions) {

    /** Default enumeration size cap. */
    public static final int DEFAULT_MAX_ENUM_OPTIONS = 50;

    /** Group used when nothing else resolves. */
    public static final String DEFAULT_FALLBACK_GROUP = "Miscellaneous";

    /** Any bold block whose first token is a known command is a header. */
    public static final ExtractorOptions DEFAULT =
        new ExtractorOptions(
            null, null, true, null, DEFAULT_FALLBACK_GROUP, true, true, DEFAULT_MAX_ENUM_OPTIONS);

    /** Keeps every syntax and example line as extracted. */
    public static final ExtractorOptions UNFILTERED =
        builder().filterSyntax(false).filterExamples(false).build();

    public ExtractorOptions {
      Objects.requireNonNull(fallbackGroup, "fallbackGroup must not be null");
      if (fallbackGroup.isBlank()) {
        throw new IllegalArgumentException("fallbackGroup must not be blank");
      }
      if (maxEnumOptions < 1) {
        throw new IllegalArgumentException("maxEnumOptions must be positive: " + maxEnumOptions);
      }
      headerStyleName = blankToNull(headerStyleName);
      headerFontFamily = blankToNull(headerFontFamily);
      sectionStyleName = blankToNull(sectionStyleName);
    }

    /** Headers are bold runs in the given font family. */
    public static ExtractorOptions forHeaderFont(String fontFamily) {
      return builder().headerFontFamily(fontFamily).build();
    }

    /** Headers are paragraphs carrying the given style name. */
    public static ExtractorOptions forHeaderStyle(String styleName) {
      return builder().headerStyleName(styleName).build();
    }

    public static Builder builder() {
      return new Builder();
    }

    private static String blankToNull(String s) {
      return s == null || s.isBlank() ? null : s.trim();
    }

    public static class Builder {
      private String headerStyleName;
      private String headerFontFamily;
      private boolean headerRequiresBold = true;
      private String sectionStyleName;
      private String fallbackGroup = DEFAULT_FALLBACK_GROUP;
      private boolean filterSyntax = true;
      private boolean filterExamples = true;
      private int maxEnumOptions = DEFAULT_MAX_ENUM_OPTIONS;

      public Builder headerStyleName(String value) {
        this.headerStyleName = value;
        return this;
      }

      public Builder headerFontFamily(String value) {
        this.headerFontFamily = value;
        return this;
      }

      public Builder headerRequiresBold(boolean value) {
        this.headerRequiresBold = value;
        return this;
      }

      public Builder sectionStyleName(String value) {
        this.sectionStyleName = value;
        return this;
      }

      public Builder fallbackGroup(String value) {
        this.fallbackGroup = Objects.requireNonNull(value, "fallbackGroup must not be null");
        return this;
      }

      public Builder filterSyntax(boolean value) {
        this.filterSyntax = value;
        return this;
      }

      public Builder filterExamples(boolean value) {
        this.filterExamples = value;
        return this;
      }

      public Builder maxEnumOptions(int value) {
        this.maxEnumOptions = value;
        return this;
      }

      public ExtractorOptions build() {
        return new ExtractorOptions(
            headerStyleName,
            headerFontFamily,
            headerRequiresBold,
            sectionStyleName,
            fallbackGroup,
            filterSyntax,
            filterExamples,
            maxEnumOptions);
      }
    }
  }

  /** Callback interface for progress updates during extraction. */
  @FunctionalInterface
  public interface ProgressCallback {
    /**
     * Called periodically during extraction.
     *
     * @param progress progress value between 0.0 and 1.0
     * @param message optional message describing current phase
     */
    void onProgress(double progress, String message);
  }
}
