package io.scpidoc.parser.impl;

import io.scpidoc.parser.util.MnemonicUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans the raw syntax lines of a command.
 *
 * <p>Manuals often print the option list of a set form on its own line, and the syntax section
 * picks up stray prose. Lines that do not start with the command's stem are dropped; an options
 * line is glued back onto the set form above it.
 */
public final class SyntaxLineFilter {

  private static final Pattern ARGUMENT_OPTIONS =
      Pattern.compile("\\{[A-Z][A-Za-z0-9]*(?:\\|[A-Z][A-Za-z0-9]*)+\\}");

  /**
   * Filters and repairs syntax lines.
   *
   * @param mnemonic canonical mnemonic
   * @param lines raw syntax lines
   * @param argumentsText the entry's arguments text, may be {@code null}
   * @return the surviving lines in order
   */
  public static List<String> filter(String mnemonic, List<String> lines, String argumentsText) {
    String stem = MnemonicUtil.stem(mnemonic);
    List<String> valid = new ArrayList<>();
    for (String raw : lines) {
      String line = raw.trim();
      if (line.isEmpty()) {
        continue;
      }
      if (SyntaxHeuristics.isOptionsOnlyLine(line) && !valid.isEmpty()) {
        int last = valid.size() - 1;
        String previous = valid.get(last);
        if (!previous.contains("?") && !previous.contains("{")) {
          valid.set(last, previous + " " + line);
        } else {
          valid.add(line);
        }
      } else if (startsWithStem(line, stem)) {
        valid.add(line);
      }
    }
    return withArgumentOptions(valid, argumentsText);
  }

  /** Drops blank lines only. */
  public static List<String> nonBlank(List<String> lines) {
    List<String> kept = new ArrayList<>();
    for (String line : lines) {
      if (!line.isBlank()) {
        kept.add(line.trim());
      }
    }
    return kept;
  }

  /**
   * When no syntax line lists options but the arguments text does ({@code {NORMal|AVErage}}), the
   * options are appended to every set line.
   */
  static List<String> withArgumentOptions(List<String> lines, String argumentsText) {
    if (argumentsText == null || lines.isEmpty()) {
      return lines;
    }
    for (String line : lines) {
      if (line.contains("{") && line.contains("|")) {
        return lines;
      }
    }
    Matcher m = ARGUMENT_OPTIONS.matcher(argumentsText);
    if (!m.find()) {
      return lines;
    }
    String options = m.group();
    List<String> enhanced = new ArrayList<>(lines.size());
    for (String line : lines) {
      enhanced.add(line.contains("?") || line.contains("{") ? line : line + " " + options);
    }
    return enhanced;
  }

  static boolean startsWithStem(String line, String stem) {
    String first = line.trim();
    int space = first.indexOf(' ');
    if (space > 0) {
      first = first.substring(0, space);
    }
    first = first.toUpperCase(Locale.ROOT);
    if (first.startsWith(":")) {
      first = first.substring(1);
    }
    return !stem.isEmpty() && first.startsWith(stem);
  }

  private SyntaxLineFilter() {}
}
