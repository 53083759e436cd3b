package io.scpidoc.parser.impl;

import io.scpidoc.parser.api.CommandIndex;
import io.scpidoc.parser.api.CommandRecord;
import io.scpidoc.parser.api.Section;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** The open, still mutable command record of the section state machine. */
public final class RecordBuilder {

  private final String mnemonic;
  private final String group;
  private String documentGroup;
  private String description;
  private String conditions;
  private String arguments;
  private String returns;
  private final List<String> syntaxLines = new ArrayList<>();
  private final List<String> examples = new ArrayList<>();
  private final List<String> related = new ArrayList<>();
  private final List<String> notes = new ArrayList<>();

  public RecordBuilder(String mnemonic, String group) {
    this.mnemonic = Objects.requireNonNull(mnemonic, "mnemonic must not be null");
    this.group = group;
  }

  public String mnemonic() {
    return mnemonic;
  }

  /**
   * Writes buffered lines into the field of {@code section}. List fields are appended to; text
   * fields keep their first non-empty value.
   */
  public void flush(Section section, List<String> lines, CommandIndex index) {
    if (lines.isEmpty()) {
      return;
    }
    switch (section) {
      case DESCRIPTION -> description = firstNonEmpty(description, joinText(lines));
      case GROUP -> documentGroup = firstNonEmpty(documentGroup, joinText(lines));
      case ARGUMENTS -> arguments = firstNonEmpty(arguments, joinText(lines));
      case CONDITIONS -> conditions = firstNonEmpty(conditions, joinText(lines));
      case RETURNS -> returns = firstNonEmpty(returns, joinText(lines));
      case SYNTAX -> lines.forEach(l -> addLine(syntaxLines, l));
      case EXAMPLES -> lines.forEach(l -> addLine(examples, l));
      case RELATED -> lines.forEach(l -> addRelated(l, index));
    }
  }

  public void addNote(String line) {
    notes.add(line.trim());
  }

  public CommandRecord build() {
    return new CommandRecord(
        mnemonic,
        group,
        documentGroup,
        description,
        conditions,
        arguments,
        returns,
        syntaxLines,
        examples,
        related,
        notes);
  }

  private void addRelated(String line, CommandIndex index) {
    for (String token : line.split("[\\s,]+")) {
      Optional<String> canonical = index.lookup(token);
      if (canonical.isPresent() && !canonical.get().equals(mnemonic)) {
        addLine(related, canonical.get());
      }
    }
  }

  private static void addLine(List<String> target, String line) {
    String t = line.trim();
    if (!t.isEmpty() && !target.contains(t)) {
      target.add(t);
    }
  }

  /** Joins lines with single spaces and collapses runs of whitespace. */
  static String joinText(List<String> lines) {
    String joined = String.join(" ", lines).trim().replaceAll("\\s+", " ");
    return joined.isEmpty() ? null : joined;
  }

  private static String firstNonEmpty(String current, String candidate) {
    return current != null ? current : candidate;
  }
}
