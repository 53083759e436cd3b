package io.scpidoc.parser.impl;

import io.scpidoc.parser.api.CommandRecord;
import java.util.ArrayList;
import java.util.List;

/**
 * Merges two records of the same mnemonic. The earlier record keeps its non-empty text fields and
 * takes the ones it lacks from the later record; list fields are unioned in order without
 * duplicates.
 *
 * <p>The merge is idempotent, and commutative for records whose non-empty text fields are
 * disjoint (list contents are then equal as sets).
 */
public final class RecordMerger {

  public static CommandRecord merge(CommandRecord earlier, CommandRecord later) {
    if (!earlier.mnemonic().equals(later.mnemonic())) {
      throw new IllegalArgumentException(
          "Cannot merge " + earlier.mnemonic() + " with " + later.mnemonic());
    }
    return new CommandRecord(
        earlier.mnemonic(),
        pick(earlier.group(), later.group()),
        pick(earlier.documentGroup(), later.documentGroup()),
        pick(earlier.description(), later.description()),
        pick(earlier.conditions(), later.conditions()),
        pick(earlier.arguments(), later.arguments()),
        pick(earlier.returns(), later.returns()),
        union(earlier.syntaxLines(), later.syntaxLines()),
        union(earlier.examples(), later.examples()),
        union(earlier.related(), later.related()),
        union(earlier.notes(), later.notes()));
  }

  private static String pick(String first, String second) {
    return first != null && !first.isBlank() ? first : second;
  }

  private static List<String> union(List<String> first, List<String> second) {
    List<String> out = new ArrayList<>(first);
    for (String s : second) {
      if (!out.contains(s)) {
        out.add(s);
      }
    }
    return out;
  }

  private RecordMerger() {}
}
