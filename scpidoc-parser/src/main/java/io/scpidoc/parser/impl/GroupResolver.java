package io.scpidoc.parser.impl;

import io.scpidoc.parser.api.CommandRecord;
import io.scpidoc.parser.api.GroupSource;
import io.scpidoc.parser.internal.GroupPrefixTable;
import io.scpidoc.parser.util.MnemonicUtil;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the group of a record through a fixed chain: the Command Index mapping, the entry's
 * own "Group" section, the mnemonic prefix table, the fallback group.
 */
public final class GroupResolver {

  /** A resolved group and where it came from. */
  public record Resolution(String group, GroupSource source) {}

  private final String fallbackGroup;

  public GroupResolver(String fallbackGroup) {
    this.fallbackGroup = Objects.requireNonNull(fallbackGroup, "fallbackGroup must not be null");
  }

  public Resolution resolve(CommandRecord record) {
    if (record.group() != null && !record.group().isBlank()) {
      return new Resolution(record.group(), GroupSource.INDEX);
    }
    String documentGroup = documentGroup(record.documentGroup());
    if (documentGroup != null) {
      return new Resolution(documentGroup, GroupSource.DOCUMENT);
    }
    Optional<String> byPrefix =
        GroupPrefixTable.groupFor(MnemonicUtil.stem(record.mnemonic()), record.mnemonic());
    if (byPrefix.isPresent()) {
      return new Resolution(byPrefix.get(), GroupSource.PREFIX);
    }
    return new Resolution(fallbackGroup, GroupSource.FALLBACK);
  }

  /** Group section text without trailing punctuation; {@code null} when nothing is left. */
  static String documentGroup(String text) {
    if (text == null) {
      return null;
    }
    String cleaned = text.trim().replaceAll("[\\s.;:]+$", "");
    return cleaned.isEmpty() ? null : cleaned;
  }
}
