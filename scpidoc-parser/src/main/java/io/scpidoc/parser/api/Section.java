package io.scpidoc.parser.api;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Labeled subsections of a command entry. {@link #DESCRIPTION} has no label: it is the text that
 * directly follows a command header.
 */
public enum Section {
  DESCRIPTION(false),
  GROUP(false, "Group"),
  SYNTAX(true, "Syntax"),
  ARGUMENTS(false, "Arguments"),
  EXAMPLES(true, "Examples"),
  RELATED(true, "Related Commands", "Related"),
  RETURNS(false, "Returns"),
  CONDITIONS(false, "Conditions");

  private final boolean listValued;
  private final List<String> labels;

  Section(boolean listValued, String... labels) {
    this.listValued = listValued;
    this.labels = List.of(labels);
  }

  /** Whether flushed lines are appended ({@code true}) or joined into one text field. */
  public boolean isListValued() {
    return listValued;
  }

  /** Labels in match order; longer labels come first so "Related Commands" wins over "Related". */
  public List<String> labels() {
    return labels;
  }

  /**
   * Looks up a section by its exact label, ignoring case and surrounding whitespace.
   *
   * @param label candidate label text
   * @return the section, or empty when the text is not a label
   */
  public static Optional<Section> forLabel(String label) {
    if (label == null) {
      return Optional.empty();
    }
    String wanted = label.trim().toLowerCase(Locale.ROOT);
    for (Section s : values()) {
      for (String l : s.labels) {
        if (l.toLowerCase(Locale.ROOT).equals(wanted)) {
          return Optional.of(s);
        }
      }
    }
    return Optional.empty();
  }
}
