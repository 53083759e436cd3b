package io.scpidoc.parser.api;

/** Where the group of an extracted command came from, most to least authoritative. */
public enum GroupSource {
  /** The Command Index, by exact or prefix match. */
  INDEX,
  /** The entry's own "Group" section. */
  DOCUMENT,
  /** The mnemonic prefix table. */
  PREFIX,
  /** The configured fallback group. */
  FALLBACK
}
