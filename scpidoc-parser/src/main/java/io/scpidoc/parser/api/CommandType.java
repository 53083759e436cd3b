package io.scpidoc.parser.api;

/** Which syntax forms a command documents. */
public enum CommandType {
  SET,
  QUERY,
  BOTH;

  static CommandType of(boolean hasSet, boolean hasQuery) {
    if (hasSet && hasQuery) {
      return BOTH;
    }
    return hasQuery ? QUERY : SET;
  }
}
