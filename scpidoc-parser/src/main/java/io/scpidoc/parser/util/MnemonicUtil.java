package io.scpidoc.parser.util;

import io.scpidoc.parser.internal.IndexedFamily;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for SCPI mnemonic spellings.
 *
 * <p>Manuals spell the same command in several ways: mixed case long form ({@code
 * CH<x>:SCAle}), literal index ({@code CH1:SCAle}), alternate placeholder ({@code Ch<n>:scale})
 * and with or without the query suffix. {@link #normalize(String)} collapses all of them to one
 * comparison key.
 *
 * <h2>Examples</h2>
 *
 * <pre>{@code
 * MnemonicUtil.normalize("CH3:SCAle?");   // "CH<X>:SCALE"
 * MnemonicUtil.normalize("ch<n>:scale");  // "CH<X>:SCALE"
 * MnemonicUtil.shortName("CH<x>:SCAle?"); // "SCAle"
 * }</pre>
 */
public final class MnemonicUtil {

  /** Canonical placeholder used in normalized keys. */
  public static final String PLACEHOLDER = "<X>";

  private static final Pattern ANY_PLACEHOLDER = Pattern.compile("<[XN]>");
  private static final Pattern LITERAL_INDEX = Pattern.compile("(^|[:*])([A-Z]+)(\\d+)");
  private static final Pattern TRAILING_INDEX = Pattern.compile("\\d+$");
  private static final Pattern EDGE_PUNCTUATION =
      Pattern.compile("^[\\s,;.()\"'\\[\\]]+|[\\s,;.()\"'\\[\\]]+$");

  /**
   * Builds the comparison key for a mnemonic or a token shaped like one.
   *
   * @param token raw token, may be {@code null}
   * @return upper-cased key without query suffix and with every indexed spelling replaced by
   *     {@value #PLACEHOLDER}, or {@code null} for {@code null} input
   */
  public static String normalize(String token) {
    if (token == null) {
      return null;
    }
    String upper = stripQuery(token.trim()).toUpperCase(Locale.ROOT);
    upper = ANY_PLACEHOLDER.matcher(upper).replaceAll(PLACEHOLDER);
    Matcher m = LITERAL_INDEX.matcher(upper);
    StringBuilder sb = new StringBuilder(upper.length());
    while (m.find()) {
      String replacement = m.group();
      if (IndexedFamily.forPrefix(m.group(2)).isPresent()) {
        replacement = m.group(1) + m.group(2) + PLACEHOLDER;
      }
      m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  /** Removes one trailing {@code ?}, if present. */
  public static String stripQuery(String mnemonic) {
    if (mnemonic != null && mnemonic.endsWith("?")) {
      return mnemonic.substring(0, mnemonic.length() - 1);
    }
    return mnemonic;
  }

  public static boolean isQuery(String mnemonic) {
    return mnemonic != null && mnemonic.trim().endsWith("?");
  }

  /**
   * Returns the header text used to find the command inside a syntax line: everything up to the
   * first whitespace, without the query suffix.
   */
  public static String headerBase(String mnemonic) {
    String trimmed = mnemonic.trim();
    int space = indexOfWhitespace(trimmed);
    if (space >= 0) {
      trimmed = trimmed.substring(0, space);
    }
    return trimmed.replace("?", "");
  }

  /** First colon-delimited segment, upper-cased and without query suffix. */
  public static String firstSegment(String mnemonic) {
    String base = headerBase(mnemonic).toUpperCase(Locale.ROOT);
    int colon = base.indexOf(':', base.startsWith(":") ? 1 : 0);
    return colon > 0 ? base.substring(0, colon) : base;
  }

  /**
   * First segment without leading colon, placeholders and literal index, e.g. {@code CH} for
   * {@code CH<x>:SCAle}. Syntax and example lines of a command start with this stem.
   */
  public static String stem(String mnemonic) {
    String segment = firstSegment(mnemonic);
    if (segment.startsWith(":")) {
      segment = segment.substring(1);
    }
    return TRAILING_INDEX.matcher(ANY_PLACEHOLDER.matcher(segment).replaceAll("")).replaceAll("");
  }

  /** Last segment without query suffix or placeholders, e.g. {@code SCAle}. */
  public static String shortName(String mnemonic) {
    String base = headerBase(mnemonic);
    int colon = base.lastIndexOf(':');
    String last = colon >= 0 ? base.substring(colon + 1) : base;
    return last.replace("<x>", "").replace("<n>", "").replace("<X>", "").replace("<N>", "");
  }

  /** Strips punctuation that manuals put around mnemonics in running text. */
  public static String cleanToken(String token) {
    if (token == null) {
      return "";
    }
    return EDGE_PUNCTUATION.matcher(token).replaceAll("");
  }

  /** Returns {@code true} when {@code prefix} is a colon-delimited prefix of {@code key}. */
  public static boolean isSegmentPrefix(String prefix, String key) {
    return key.length() > prefix.length()
        && key.startsWith(prefix)
        && key.charAt(prefix.length()) == ':';
  }

  static int indexOfWhitespace(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (Character.isWhitespace(s.charAt(i))) {
        return i;
      }
    }
    return -1;
  }

  private MnemonicUtil() {
    // Utility class
  }
}
