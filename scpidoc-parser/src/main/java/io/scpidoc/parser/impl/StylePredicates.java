package io.scpidoc.parser.impl;

import io.scpidoc.parser.api.DocumentBlock;
import io.scpidoc.parser.api.ManualExtractor.ExtractorOptions;
import io.scpidoc.parser.api.TextRun;
import java.util.Locale;
import java.util.Optional;

/** Style checks on document blocks. */
public final class StylePredicates {

  /**
   * The run covering most of the block's visible text. Ties go to the earlier run.
   *
   * @return the dominant run, or empty for a block without runs
   */
  public static Optional<TextRun> dominantRun(DocumentBlock block) {
    TextRun best = null;
    int bestLen = -1;
    for (TextRun run : block.runs()) {
      int len = visibleLength(run.text());
      if (len > bestLen) {
        best = run;
        bestLen = len;
      }
    }
    return Optional.ofNullable(best);
  }

  /** Bold when the dominant run is bold, or when it inherits a bold paragraph style. */
  public static boolean isBold(DocumentBlock block) {
    Optional<TextRun> run = dominantRun(block);
    if (run.isPresent() && run.get().bold() != null) {
      return run.get().bold();
    }
    return Boolean.TRUE.equals(block.paragraphBold());
  }

  public static boolean isItalic(DocumentBlock block) {
    return dominantRun(block).map(TextRun::isItalic).orElse(false);
  }

  public static boolean hasStyleName(DocumentBlock block, String styleName) {
    String actual = block.paragraphStyleName();
    return actual != null && styleName != null && actual.trim().equalsIgnoreCase(styleName.trim());
  }

  /** Whether the dominant run's font family contains {@code family}, ignoring case. */
  public static boolean usesFontFamily(DocumentBlock block, String family) {
    if (family == null) {
      return false;
    }
    String wanted = family.toLowerCase(Locale.ROOT);
    return dominantRun(block)
        .map(TextRun::fontFamily)
        .map(f -> f.toLowerCase(Locale.ROOT).contains(wanted))
        .orElse(false);
  }

  /**
   * Header style check. A configured paragraph style name is authoritative on its own; otherwise
   * the configured font family (if any) must match and, when required, the block must be bold.
   */
  public static boolean isHeaderStyled(DocumentBlock block, ExtractorOptions options) {
    if (options.headerStyleName() != null) {
      return hasStyleName(block, options.headerStyleName());
    }
    if (options.headerFontFamily() != null && !usesFontFamily(block, options.headerFontFamily())) {
      return false;
    }
    return !options.headerRequiresBold() || isBold(block);
  }

  /** Section label style: the configured style name, or bold text when none is configured. */
  public static boolean isSectionStyled(DocumentBlock block, ExtractorOptions options) {
    if (options.sectionStyleName() != null) {
      return hasStyleName(block, options.sectionStyleName());
    }
    return isBold(block);
  }

  private static int visibleLength(String text) {
    int n = 0;
    for (int i = 0; i < text.length(); i++) {
      if (!Character.isWhitespace(text.charAt(i))) {
        n++;
      }
    }
    return n;
  }

  private StylePredicates() {}
}
