package io.scpidoc.parser.api;

import io.scpidoc.parser.impl.MapCommandIndex;
import io.scpidoc.parser.impl.PatternCommandIndex;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The master command dictionary: canonical mnemonics and the group each one belongs to.
 *
 * <p>Lookups are spelling tolerant. {@code CH1:SCAle}, {@code ch<n>:scale?} and {@code
 * CH<x>:SCAle} all resolve to the canonical spelling stored in the index.
 *
 * <pre>{@code
 * CommandIndex index =
 *     CommandIndex.builder()
 *         .add("Vertical", "CH<x>:SCAle")
 *         .add("Miscellaneous", "*IDN?")
 *         .build();
 * index.lookup("CH1:SCAle");     // Optional["CH<x>:SCAle"]
 * index.groupOf("CH2:SCAle:RATio"); // Optional["Vertical"] via prefix match
 * }</pre>
 */
public interface CommandIndex {

  /**
   * Resolves a raw token to the canonical mnemonic it matches.
   *
   * @param token raw token as found in the manual
   * @return canonical mnemonic, or empty when the token is not a known command
   */
  Optional<String> lookup(String token);

  /**
   * Returns the group of a command. Exact matches win; otherwise a canonical command that is a
   * colon-delimited prefix of the token (or that the token is a prefix of) lends its group.
   *
   * @param token canonical mnemonic or raw token
   * @return group name, or empty when no mapping exists
   */
  Optional<String> groupOf(String token);

  /** Group names in registration order. */
  List<String> groups();

  /** Optional free-text description of a group. */
  Optional<String> groupDescription(String group);

  /** Number of canonical commands. */
  int size();

  default boolean contains(String token) {
    return lookup(token).isPresent();
  }

  /**
   * Index used when no group mapping is available: every token shaped like a SCPI command is its
   * own canonical mnemonic and no group is known.
   */
  static CommandIndex patternBased() {
    return PatternCommandIndex.INSTANCE;
  }

  /**
   * Creates an index from a group to mnemonics mapping.
   *
   * @param commandsByGroup group name to the canonical mnemonics of that group
   * @return a new index
   */
  static CommandIndex of(Map<String, ? extends List<String>> commandsByGroup) {
    Objects.requireNonNull(commandsByGroup, "commandsByGroup must not be null");
    Builder builder = builder();
    commandsByGroup.forEach((group, commands) -> commands.forEach(c -> builder.add(group, c)));
    return builder.build();
  }

  static Builder builder() {
    return new Builder();
  }

  final class Builder {
    private final Map<String, String> groupByCommand = new LinkedHashMap<>();
    private final Map<String, String> descriptions = new LinkedHashMap<>();

    private Builder() {}

    /** Registers a command. The first registration of a mnemonic keeps its group. */
    public Builder add(String group, String mnemonic) {
      Objects.requireNonNull(group, "group must not be null");
      Objects.requireNonNull(mnemonic, "mnemonic must not be null");
      if (!mnemonic.isBlank()) {
        groupByCommand.putIfAbsent(mnemonic.trim(), group);
      }
      descriptions.putIfAbsent(group, null);
      return this;
    }

    public Builder describe(String group, String description) {
      Objects.requireNonNull(group, "group must not be null");
      descriptions.put(group, description);
      return this;
    }

    public CommandIndex build() {
      return new MapCommandIndex(groupByCommand, descriptions);
    }
  }
}
