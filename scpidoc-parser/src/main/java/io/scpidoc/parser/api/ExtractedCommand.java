package io.scpidoc.parser.api;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A fully processed command: the assembled record plus everything inferred from it.
 *
 * @param record the merged command record
 * @param name short name, the last mnemonic segment without placeholders
 * @param group resolved group name
 * @param groupSource where {@code group} came from
 * @param shortDescription description cut to one line
 * @param syntax syntax lines that survived filtering
 * @param forms set and query syntax
 * @param parameters inferred parameters, path parameters first
 * @param examples split usage examples
 * @param flags review markers
 */
public record ExtractedCommand(
    CommandRecord record,
    String name,
    String group,
    GroupSource groupSource,
    String shortDescription,
    List<String> syntax,
    SyntaxForms forms,
    List<Parameter> parameters,
    List<Example> examples,
    Set<RecordFlag> flags) {

  public ExtractedCommand {
    Objects.requireNonNull(record, "record must not be null");
    Objects.requireNonNull(group, "group must not be null");
    syntax = List.copyOf(syntax);
    parameters = List.copyOf(parameters);
    examples = List.copyOf(examples);
    flags =
        flags.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(flags));
  }

  public String mnemonic() {
    return record.mnemonic();
  }

  public CommandType commandType() {
    return forms.commandType();
  }

  /** First example snippet, or {@code null} without examples. */
  public String example() {
    return examples.isEmpty() ? null : examples.get(0).scpi();
  }

  public boolean hasFlag(RecordFlag flag) {
    return flags.contains(flag);
  }

  /** Whether any flag asks for human review. */
  public boolean needsReview() {
    for (RecordFlag f : flags) {
      if (f.needsReview()) {
        return true;
      }
    }
    return false;
  }
}
