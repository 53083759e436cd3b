package io.scpidoc.parser.impl;

import io.scpidoc.parser.util.MnemonicUtil;
import java.util.ArrayList;
import java.util.List;

/** Keeps the example lines that are actual command invocations. */
public final class ExampleFilter {

  /**
   * Filters example lines. A kept line starts with an uppercase letter or {@code *}, does not open
   * like prose, starts with the mnemonic's stem and, for hierarchical mnemonics, contains a colon.
   *
   * @param mnemonic canonical mnemonic
   * @param lines raw example lines
   * @return the surviving lines, trimmed
   */
  public static List<String> filter(String mnemonic, List<String> lines) {
    String stem = MnemonicUtil.stem(mnemonic);
    boolean hierarchical = mnemonic.indexOf(':', 1) > 0;
    List<String> valid = new ArrayList<>();
    for (String raw : lines) {
      String line = raw.trim();
      if (line.isEmpty()) {
        continue;
      }
      char first = line.charAt(0);
      if (!Character.isUpperCase(first) && first != '*' && first != ':') {
        continue;
      }
      if (SyntaxHeuristics.startsWithProse(line)) {
        continue;
      }
      if (!SyntaxLineFilter.startsWithStem(line, stem)) {
        continue;
      }
      if (hierarchical && line.indexOf(':') < 0) {
        continue;
      }
      valid.add(line);
    }
    return valid;
  }

  private ExampleFilter() {}
}
