package io.scpidoc.parser.api;

/** Value kind of an inferred command parameter. */
public enum ParameterKind {
  INTEGER,
  FLOAT,
  STRING,
  ENUMERATION
}
