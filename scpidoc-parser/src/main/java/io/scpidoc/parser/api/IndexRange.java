package io.scpidoc.parser.api;

/** Inclusive bounds of an indexed resource, e.g. channels 1 to 8. */
public record IndexRange(int min, int max) {
  public IndexRange {
    if (min > max) {
      throw new IllegalArgumentException("min > max: " + min + " > " + max);
    }
  }
}
