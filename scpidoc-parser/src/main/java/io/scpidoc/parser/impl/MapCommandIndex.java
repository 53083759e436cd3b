package io.scpidoc.parser.impl;

import io.scpidoc.parser.api.CommandIndex;
import io.scpidoc.parser.util.MnemonicUtil;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link CommandIndex} backed by a precomputed mnemonic to group table. Keys are stored in
 * normalized form so lookups tolerate case, query suffix and placeholder spelling.
 */
public final class MapCommandIndex implements CommandIndex {

  private static final class Entry {
    final String canonical;
    final String group;

    Entry(String canonical, String group) {
      this.canonical = canonical;
      this.group = group;
    }
  }

  private final Map<String, Entry> byKey = new LinkedHashMap<>();
  private final Map<String, String> descriptions;
  private final List<String> groups;

  public MapCommandIndex(Map<String, String> groupByCommand, Map<String, String> descriptions) {
    groupByCommand.forEach(
        (command, group) ->
            byKey.putIfAbsent(MnemonicUtil.normalize(command), new Entry(command, group)));
    this.descriptions = new LinkedHashMap<>(descriptions);
    List<String> names = new ArrayList<>(descriptions.keySet());
    for (Entry e : byKey.values()) {
      if (!names.contains(e.group)) {
        names.add(e.group);
      }
    }
    this.groups = Collections.unmodifiableList(names);
  }

  @Override
  public Optional<String> lookup(String token) {
    Entry e = entryFor(token);
    return e == null ? Optional.empty() : Optional.of(e.canonical);
  }

  @Override
  public Optional<String> groupOf(String token) {
    String key = keyOf(token);
    if (key.isEmpty()) {
      return Optional.empty();
    }
    Entry exact = byKey.get(key);
    if (exact != null) {
      return Optional.of(exact.group);
    }
    // parent commands, longest first
    int colon = key.lastIndexOf(':');
    while (colon > 0) {
      Entry parent = byKey.get(key.substring(0, colon));
      if (parent != null) {
        return Optional.of(parent.group);
      }
      colon = key.lastIndexOf(':', colon - 1);
    }
    for (Map.Entry<String, Entry> e : byKey.entrySet()) {
      if (MnemonicUtil.isSegmentPrefix(key, e.getKey())) {
        return Optional.of(e.getValue().group);
      }
    }
    return Optional.empty();
  }

  @Override
  public List<String> groups() {
    return groups;
  }

  @Override
  public Optional<String> groupDescription(String group) {
    return Optional.ofNullable(descriptions.get(group));
  }

  @Override
  public int size() {
    return byKey.size();
  }

  private Entry entryFor(String token) {
    String key = keyOf(token);
    return key.isEmpty() ? null : byKey.get(key);
  }

  private static String keyOf(String token) {
    String cleaned = MnemonicUtil.cleanToken(token);
    return cleaned.isEmpty() ? "" : MnemonicUtil.normalize(cleaned);
  }
}
