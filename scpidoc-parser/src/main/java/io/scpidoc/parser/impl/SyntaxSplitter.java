package io.scpidoc.parser.impl;

import io.scpidoc.parser.api.SyntaxForms;
import io.scpidoc.parser.util.MnemonicUtil;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Separates set and query syntax.
 *
 * <p>Manuals print both forms on one line as often as on two: {@code ACQuire:STATE {ON|OFF}
 * ACQuire:STATE?}. A line with a {@code ?} is split at the second occurrence of the header text,
 * else before a trailing query token when the text ahead of it carries an argument, else it is
 * taken whole. The first set form and the first query form found win.
 */
public final class SyntaxSplitter {

  /**
   * Outcome of a split.
   *
   * @param forms the set and query forms
   * @param synthesized whether any form was derived from the mnemonic rather than found
   */
  public record Split(SyntaxForms forms, boolean synthesized) {}

  public static SyntaxForms split(String mnemonic, List<String> lines, String description) {
    return analyze(mnemonic, lines, description).forms();
  }

  public static Split analyze(String mnemonic, List<String> lines, String description) {
    String header = MnemonicUtil.headerBase(mnemonic);
    String setForm = null;
    String queryForm = null;
    boolean anyLine = false;
    boolean anyArgument = false;

    for (String raw : lines) {
      String line = raw.trim();
      if (line.isEmpty()) {
        continue;
      }
      anyLine = true;
      anyArgument |= SyntaxHeuristics.hasArgumentMarker(line);
      if (!line.contains("?")) {
        setForm = firstOf(setForm, line);
        continue;
      }
      String[] parts = splitCombined(line, header);
      if (parts != null) {
        setForm = firstOf(setForm, parts[0]);
        queryForm = firstOf(queryForm, parts[1]);
      } else if (SyntaxHeuristics.hasArgumentMarker(line)) {
        setForm = firstOf(setForm, line);
      } else {
        queryForm = firstOf(queryForm, line);
      }
    }

    String bare = MnemonicUtil.stripQuery(mnemonic.trim());
    if (!anyLine) {
      if (MnemonicUtil.isQuery(mnemonic)) {
        return new Split(new SyntaxForms(null, mnemonic.trim()), true);
      }
      return new Split(new SyntaxForms(bare, bare + "?"), true);
    }

    boolean synthesized = false;
    if (queryForm == null && !SyntaxHeuristics.declaresNoQueryForm(description)) {
      queryForm = bare + "?";
      synthesized = true;
    }
    boolean queryOnly =
        MnemonicUtil.isQuery(mnemonic)
            || SyntaxHeuristics.declaresQueryOnly(description)
            || !anyArgument;
    if (setForm == null && !queryOnly) {
      setForm = bare;
      synthesized = true;
    }
    return new Split(new SyntaxForms(setForm, queryForm), synthesized);
  }

  /**
   * Splits a line carrying both forms.
   *
   * @return {@code [set, query]}, or {@code null} when the line is not a combined line
   */
  static String[] splitCombined(String line, String header) {
    if (!header.isEmpty()) {
      String lowerLine = line.toLowerCase(Locale.ROOT);
      String lowerHeader = header.toLowerCase(Locale.ROOT);
      int first = lowerLine.indexOf(lowerHeader);
      int second = first < 0 ? -1 : lowerLine.indexOf(lowerHeader, first + lowerHeader.length());
      if (second > 0) {
        String set = line.substring(0, second).trim();
        String query = line.substring(second).trim();
        if (!set.isEmpty() && !query.isEmpty()) {
          return new String[] {set, query};
        }
      }
    }
    Optional<Matcher> trailing = SyntaxHeuristics.trailingQuery(line);
    if (trailing.isPresent()) {
      Matcher m = trailing.get();
      String set = line.substring(0, m.start()).trim();
      if (!set.isEmpty() && SyntaxHeuristics.hasArgumentMarker(set)) {
        return new String[] {set, m.group(1)};
      }
    }
    return null;
  }

  private static String firstOf(String current, String candidate) {
    return current != null || candidate.isEmpty() ? current : candidate;
  }

  private SyntaxSplitter() {}
}
