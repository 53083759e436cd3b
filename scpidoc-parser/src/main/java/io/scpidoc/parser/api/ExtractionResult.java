package io.scpidoc.parser.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Commands grouped by canonical group name, in order of first appearance in the manual.
 */
public final class ExtractionResult {

  private final Map<String, List<ExtractedCommand>> groups;
  private final ExtractionStats stats;
  private final int totalCommands;

  public ExtractionResult(Map<String, List<ExtractedCommand>> groups, ExtractionStats stats) {
    Map<String, List<ExtractedCommand>> copy = new LinkedHashMap<>();
    int total = 0;
    for (Map.Entry<String, List<ExtractedCommand>> e : groups.entrySet()) {
      copy.put(e.getKey(), List.copyOf(e.getValue()));
      total += e.getValue().size();
    }
    this.groups = Collections.unmodifiableMap(copy);
    this.stats = stats;
    this.totalCommands = total;
  }

  public Map<String, List<ExtractedCommand>> groups() {
    return groups;
  }

  public List<ExtractedCommand> group(String name) {
    return groups.getOrDefault(name, List.of());
  }

  public Stream<ExtractedCommand> commands() {
    return groups.values().stream().flatMap(List::stream);
  }

  public Optional<ExtractedCommand> find(String mnemonic) {
    return commands().filter(c -> c.mnemonic().equals(mnemonic)).findFirst();
  }

  /** Commands carrying a flag that asks for review. */
  public List<ExtractedCommand> flagged() {
    return commands()
        .filter(ExtractedCommand::needsReview)
        .collect(Collectors.toCollection(ArrayList::new));
  }

  public int totalCommands() {
    return totalCommands;
  }

  public int totalGroups() {
    return groups.size();
  }

  public ExtractionStats stats() {
    return stats;
  }

  @Override
  public String toString() {
    return "ExtractionResult{commands=" + totalCommands + ", groups=" + groups.size() + "}";
  }
}
