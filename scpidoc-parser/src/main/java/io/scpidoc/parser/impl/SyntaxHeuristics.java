package io.scpidoc.parser.impl;

import io.scpidoc.parser.internal.IndexedFamily;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Named text predicates used throughout extraction. Manuals have no formal grammar, so each rule
 * here is a heuristic; keeping them separate lets every rule be tested on its own.
 */
public final class SyntaxHeuristics {

  private static final Pattern COMMAND_SHAPE =
      Pattern.compile("^:?[A-Z][A-Z0-9_]*(<[XN]>)?[A-Z0-9_]*:[A-Z0-9_:<>?]+$", Pattern.CASE_INSENSITIVE);
  private static final Pattern COMMON_COMMAND = Pattern.compile("^\\*[A-Z]{2,}\\??$", Pattern.CASE_INSENSITIVE);
  private static final Pattern NOTE_PREFIX = Pattern.compile("^note\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern BRACE_GROUP = Pattern.compile("\\{([^}]*)\\}");
  private static final Pattern ANGLE_TOKEN = Pattern.compile("<([^<>]+)>");
  private static final Pattern INDEXED_PLACEHOLDER =
      Pattern.compile("([A-Za-z]+)<([xXnN])>");
  private static final Pattern TRAILING_BARE_PLACEHOLDER =
      Pattern.compile("\\s([A-Za-z]+<[xXnN]>)\\s*$");
  private static final Pattern TRAILING_QUERY =
      Pattern.compile("\\s(\\S*:\\S*\\?|\\*[A-Za-z]+\\?)\\s*$");
  private static final Pattern NUMERIC_LITERAL =
      Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");
  private static final Pattern QUERY_ONLY =
      Pattern.compile("\\bquery[ -]only\\b|\\bquery form only\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern NO_QUERY_FORM =
      Pattern.compile("\\bno query form\\b", Pattern.CASE_INSENSITIVE);

  private static final Set<String> BOOLEAN_TOKENS = Set.of("ON", "OFF", "TRUE", "FALSE", "0", "1");
  private static final List<String> PROSE_OPENERS =
      List.of(
          "this ", "the ", "a ", "an ", "note", "see ", "use ", "for ", "when ", "if ", "to ",
          "in ", "on ", "it ", "you ", "requires");

  /** Whether a token is shaped like a SCPI command ({@code ACQuire:STATE}, {@code *IDN?}). */
  public static boolean looksLikeCommand(String token) {
    if (token == null || token.length() < 3) {
      return false;
    }
    return COMMAND_SHAPE.matcher(token).matches() || COMMON_COMMAND.matcher(token).matches();
  }

  /** Whether a line is a note annotation ("Note:", "NOTE ..."). */
  public static boolean isNoteLine(String text) {
    return text != null && NOTE_PREFIX.matcher(text.trim()).find();
  }

  /**
   * Whether text carries an argument: a brace group, a value placeholder such as {@code <NR3>}, or
   * a bare placeholder of an indexed family such as the {@code CH<x>} in {@code DATa:SOUrce
   * CH<x>}.
   */
  public static boolean hasArgumentMarker(String text) {
    if (text == null) {
      return false;
    }
    if (BRACE_GROUP.matcher(text).find()) {
      return true;
    }
    Matcher m = ANGLE_TOKEN.matcher(text);
    while (m.find()) {
      if (isValuePlaceholder(m.group())) {
        return true;
      }
    }
    return trailingBarePlaceholder(text).isPresent();
  }

  /**
   * Whether a token is a value placeholder ({@code <NR1>}, {@code <QString>}, {@code <Block>}),
   * as opposed to an index placeholder ({@code <x>}).
   */
  public static boolean isValuePlaceholder(String token) {
    if (token == null) {
      return false;
    }
    String t = token.trim();
    if (!t.startsWith("<") || !t.endsWith(">") || t.length() < 3) {
      return false;
    }
    String inner = t.substring(1, t.length() - 1).trim();
    return !inner.isEmpty() && !inner.equalsIgnoreCase("x") && !inner.equalsIgnoreCase("n");
  }

  /** Integer placeholder: {@code <NR1>}. */
  public static boolean isIntegerPlaceholder(String text) {
    return text != null && text.toUpperCase(Locale.ROOT).contains("<NR1>");
  }

  /** Float placeholder: {@code <NR2>}, {@code <NR3>} or {@code <NRf>}. */
  public static boolean isFloatPlaceholder(String text) {
    if (text == null) {
      return false;
    }
    String u = text.toUpperCase(Locale.ROOT);
    return u.contains("<NR2>") || u.contains("<NR3>") || u.contains("<NRF>");
  }

  /** Quoted string placeholder: {@code <QString>}. */
  public static boolean isStringPlaceholder(String text) {
    return text != null && text.toUpperCase(Locale.ROOT).contains("<QSTRING>");
  }

  /**
   * Parses a token of the form {@code PREFIX<x>} whose prefix is a known indexed family.
   *
   * @return the family, or empty when the token is anything else
   */
  public static Optional<IndexedFamily> indexedFamilyOf(String token) {
    if (token == null) {
      return Optional.empty();
    }
    Matcher m = INDEXED_PLACEHOLDER.matcher(token.trim());
    if (!m.matches()) {
      return Optional.empty();
    }
    return IndexedFamily.forPrefix(m.group(1));
  }

  /** Every {@code PREFIX<x>} occurrence in the text, as {@code [prefix, placeholder]} matches. */
  public static Matcher indexedPlaceholders(String text) {
    return INDEXED_PLACEHOLDER.matcher(text);
  }

  /** All brace groups of a syntax string; group 1 of each match is the inner text. */
  public static Matcher braceGroups(String text) {
    return BRACE_GROUP.matcher(text);
  }

  /**
   * The unbraced placeholder a set form ends with, if its prefix is a known indexed family.
   * {@code WAVEView<x>} names no family and gives empty.
   */
  public static Optional<String> trailingBarePlaceholder(String setForm) {
    if (setForm == null) {
      return Optional.empty();
    }
    Matcher m = TRAILING_BARE_PLACEHOLDER.matcher(setForm);
    if (m.find() && indexedFamilyOf(m.group(1)).isPresent()) {
      return Optional.of(m.group(1));
    }
    return Optional.empty();
  }

  /**
   * Finds a trailing query-shaped token: a colon-delimited token (or common command) ending in
   * {@code ?} at the end of the line, preceded by whitespace.
   *
   * @return matcher positioned on the token (group 1), or empty
   */
  public static Optional<Matcher> trailingQuery(String line) {
    Matcher m = TRAILING_QUERY.matcher(line);
    return m.find() ? Optional.of(m) : Optional.empty();
  }

  public static boolean isNumericLiteral(String token) {
    return token != null && NUMERIC_LITERAL.matcher(token).matches();
  }

  public static boolean isQuotedString(String token) {
    if (token == null || token.length() < 2) {
      return false;
    }
    char first = token.charAt(0);
    return (first == '"' || first == '\'') && token.charAt(token.length() - 1) == first;
  }

  public static boolean isBooleanLike(String token) {
    return token != null && BOOLEAN_TOKENS.contains(token.toUpperCase(Locale.ROOT));
  }

  /** Whether an option set is the boolean-like pair ({@code ON|OFF}, optionally with 1/0). */
  public static boolean isBooleanPair(List<String> options) {
    Set<String> upper = new HashSet<>();
    for (String o : options) {
      upper.add(o.toUpperCase(Locale.ROOT));
    }
    if (upper.equals(Set.of("TRUE", "FALSE")) || upper.equals(Set.of("1", "0"))) {
      return true;
    }
    return upper.contains("ON")
        && upper.contains("OFF")
        && Set.of("ON", "OFF", "1", "0").containsAll(upper);
  }

  /** Whether a description states that the command only has a query form. */
  public static boolean declaresQueryOnly(String description) {
    return description != null && QUERY_ONLY.matcher(description).find();
  }

  /** Whether a description states that the command has no query form. */
  public static boolean declaresNoQueryForm(String description) {
    return description != null && NO_QUERY_FORM.matcher(description).find();
  }

  /** A line that holds only an option list, printed below the command it belongs to. */
  public static boolean isOptionsOnlyLine(String line) {
    String t = line.trim();
    return t.startsWith("{") && t.contains("|");
  }

  /** Whether a line opens like running prose rather than a command. */
  public static boolean startsWithProse(String line) {
    String lower = line.trim().toLowerCase(Locale.ROOT);
    for (String opener : PROSE_OPENERS) {
      if (lower.startsWith(opener)) {
        return true;
      }
    }
    return false;
  }

  /** Whether a word starts with a lowercase letter, the usual start of description text. */
  public static boolean startsLowercase(String word) {
    return word != null && !word.isEmpty() && Character.isLowerCase(word.charAt(0));
  }

  private SyntaxHeuristics() {}
}
