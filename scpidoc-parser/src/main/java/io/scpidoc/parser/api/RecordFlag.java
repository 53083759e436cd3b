package io.scpidoc.parser.api;

/** Review markers attached to extracted commands. None of them drops the command. */
public enum RecordFlag {
  /** Neither a description nor both a group and syntax were found. */
  LOW_CONFIDENCE,
  /** The mnemonic had more than one header; the entries were merged. */
  MERGED_DUPLICATE,
  /** The group did not come from the Command Index. */
  GROUP_NOT_INDEXED,
  /** The group is the configured fallback. */
  GROUP_UNRESOLVED,
  /** A set or query form was not documented and was synthesized from the mnemonic. */
  SYNTAX_SYNTHESIZED;

  /** Flags that warrant a human look, as opposed to informational ones. */
  public boolean needsReview() {
    return this == LOW_CONFIDENCE || this == GROUP_UNRESOLVED;
  }
}
