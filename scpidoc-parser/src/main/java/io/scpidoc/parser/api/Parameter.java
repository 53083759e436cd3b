package io.scpidoc.parser.api;

import java.util.List;
import java.util.Objects;

/**
 * A typed command parameter derived from syntax grammar and examples.
 *
 * @param name parameter name ({@code channel}, {@code state}, {@code value}, ...)
 * @param kind value kind
 * @param required whether the command needs the value
 * @param defaultValue default inferred from an example or the first option, may be {@code null}.
 *     An {@link Integer}, {@link Double} or {@link String} depending on {@code kind}
 * @param options literal options of an enumeration, empty otherwise
 * @param range index bounds of a path parameter, may be {@code null}
 * @param description short human readable summary, may be {@code null}
 */
public record Parameter(
    String name,
    ParameterKind kind,
    boolean required,
    Object defaultValue,
    List<String> options,
    IndexRange range,
    String description) {

  public Parameter {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(kind, "kind must not be null");
    options = options == null ? List.of() : List.copyOf(options);
  }

  public static Parameter indexed(String name, int min, int max, String description) {
    return new Parameter(
        name, ParameterKind.INTEGER, true, null, List.of(), new IndexRange(min, max), description);
  }

  public static Parameter enumeration(String name, List<String> options, String description) {
    return new Parameter(name, ParameterKind.ENUMERATION, true, null, options, null, description);
  }

  public static Parameter value(String name, ParameterKind kind, String description) {
    return new Parameter(name, kind, true, null, List.of(), null, description);
  }

  public Parameter withDefault(Object value) {
    return new Parameter(name, kind, required, value, options, range, description);
  }

  /** Path parameters select the addressed resource inside the mnemonic, e.g. the x of CH<x>. */
  public boolean isPathParameter() {
    return range != null;
  }
}
