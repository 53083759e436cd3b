package io.scpidoc.parser.api;

import java.util.List;
import java.util.Objects;

/**
 * A command entry as assembled from the manual, before syntax and parameter inference.
 *
 * <p>Scalar text fields are {@code null} when the manual has no such section. {@code group} is the
 * Command Index mapping and is never replaced by {@code documentGroup}, the text of the entry's own
 * "Group" section.
 */
public record CommandRecord(
    String mnemonic,
    String group,
    String documentGroup,
    String description,
    String conditions,
    String arguments,
    String returns,
    List<String> syntaxLines,
    List<String> examples,
    List<String> related,
    List<String> notes) {

  public CommandRecord {
    Objects.requireNonNull(mnemonic, "mnemonic must not be null");
    syntaxLines = List.copyOf(syntaxLines);
    examples = List.copyOf(examples);
    related = List.copyOf(related);
    notes = List.copyOf(notes);
  }

  public boolean hasDescription() {
    return description != null && !description.isBlank();
  }

  /** Whether any group, mapped or document-derived, is known. */
  public boolean hasGroup() {
    return group != null || (documentGroup != null && !documentGroup.isBlank());
  }

  public boolean hasSyntax() {
    return !syntaxLines.isEmpty();
  }

  /**
   * A record is low confidence when it has neither a description nor both a group and syntax.
   * Such records are kept but flagged for review.
   */
  public boolean isLowConfidence() {
    return !hasDescription() && !(hasGroup() && hasSyntax());
  }
}
