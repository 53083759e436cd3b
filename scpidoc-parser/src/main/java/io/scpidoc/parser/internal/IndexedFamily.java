package io.scpidoc.parser.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Mnemonic segments that stand for a numbered instrument resource, such as {@code CH<x>} for an
 * analog channel. Each family knows the parameter name it maps to and its valid index range.
 *
 * <p>Families are matched on the upper-cased prefix, either in long form ({@code HISTOGRAM}) or in
 * the SCPI short form ({@code HIST}).
 */
public enum IndexedFamily {
  CHANNEL("CH", "CH", "channel", 1, 8),
  MATH("MATH", "MATH", "math", 1, 4),
  REF("REF", "REF", "ref", 1, 4),
  BUS("BUS", "BUS", "bus", 1, 8),
  BUS_SHORT("B", "B", "bus", 1, 8),
  MEAS("MEAS", "MEAS", "meas", 1, 8),
  SEARCH("SEARCH", "SEARCH", "search", 1, 8),
  PLOT("PLOT", "PLOT", "plot", 1, 4),
  POWER("POWER", "POW", "power", 1, 8),
  HISTOGRAM("HISTOGRAM", "HIST", "histogram", 1, 4),
  CURSOR("CURSOR", "CURS", "cursor", 1, 2),
  CALLOUT("CALLOUT", "CALLOUT", "callout", 1, 8),
  MASK("MASK", "MASK", "mask", 1, 4);

  private final String longForm;
  private final String shortForm;
  private final String parameterName;
  private final int min;
  private final int max;

  IndexedFamily(String longForm, String shortForm, String parameterName, int min, int max) {
    this.longForm = longForm;
    this.shortForm = shortForm;
    this.parameterName = parameterName;
    this.min = min;
    this.max = max;
  }

  public String parameterName() {
    return parameterName;
  }

  public int min() {
    return min;
  }

  public int max() {
    return max;
  }

  /**
   * Finds the family for a mnemonic prefix such as {@code CH}, {@code POWer} or {@code HIST}.
   *
   * @param prefix the letters preceding the placeholder or the literal index
   * @return the family, or empty when the prefix is not an indexed resource
   */
  public static Optional<IndexedFamily> forPrefix(String prefix) {
    if (prefix == null || prefix.isEmpty()) {
      return Optional.empty();
    }
    String upper = prefix.toUpperCase(Locale.ROOT);
    for (IndexedFamily family : values()) {
      if (family.longForm.equals(upper) || family.shortForm.equals(upper)) {
        return Optional.of(family);
      }
    }
    return Optional.empty();
  }

  /**
   * Expands the family into its literal members, keeping the prefix spelling of the caller.
   *
   * <p>Example: {@code expand("B")} on {@link #BUS_SHORT} gives {@code B1 .. B8}.
   */
  public List<String> expand(String spelledPrefix) {
    List<String> members = new ArrayList<>(max - min + 1);
    for (int i = min; i <= max; i++) {
      members.add(spelledPrefix + i);
    }
    return members;
  }
}
