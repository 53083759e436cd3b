package io.scpidoc.parser.impl;

import io.scpidoc.parser.api.CommandIndex;
import io.scpidoc.parser.util.MnemonicUtil;
import java.util.List;
import java.util.Optional;

/**
 * Index for manuals without a group mapping: a token is a command when it is shaped like one, and
 * it is its own canonical spelling.
 */
public final class PatternCommandIndex implements CommandIndex {

  public static final PatternCommandIndex INSTANCE = new PatternCommandIndex();

  private PatternCommandIndex() {}

  @Override
  public Optional<String> lookup(String token) {
    String cleaned = MnemonicUtil.cleanToken(token);
    return SyntaxHeuristics.looksLikeCommand(cleaned) ? Optional.of(cleaned) : Optional.empty();
  }

  @Override
  public Optional<String> groupOf(String token) {
    return Optional.empty();
  }

  @Override
  public List<String> groups() {
    return List.of();
  }

  @Override
  public Optional<String> groupDescription(String group) {
    return Optional.empty();
  }

  @Override
  public int size() {
    return 0;
  }
}
