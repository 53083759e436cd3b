package io.scpidoc.parser.api;

/**
 * A usage example split into the literal SCPI snippet and its explanation.
 *
 * @param scpi the command text as sent to the instrument
 * @param description the natural language explanation, empty when none was found
 */
public record Example(String scpi, String description) {
  public Example {
    scpi = scpi == null ? "" : scpi;
    description = description == null ? "" : description;
  }
}
