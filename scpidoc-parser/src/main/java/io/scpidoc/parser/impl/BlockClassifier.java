package io.scpidoc.parser.impl;

import io.scpidoc.parser.api.BlockRole;
import io.scpidoc.parser.api.CommandIndex;
import io.scpidoc.parser.api.DocumentBlock;
import io.scpidoc.parser.api.ManualExtractor.ExtractorOptions;
import io.scpidoc.parser.api.Section;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides the role of a single block: command header, section label or plain content.
 *
 * <p>A header needs both the header style and a first token known to the {@link CommandIndex}.
 * Style alone fires on prose that mentions a command in bold; the pattern alone fires on body text
 * shaped like a command.
 */
public final class BlockClassifier {

  private final CommandIndex index;
  private final ExtractorOptions options;

  public BlockClassifier(CommandIndex index, ExtractorOptions options) {
    this.index = Objects.requireNonNull(index, "index must not be null");
    this.options = Objects.requireNonNull(options, "options must not be null");
  }

  public BlockRole classify(DocumentBlock block) {
    String text = block.text().trim();
    if (text.isEmpty()) {
      return new BlockRole.Content("");
    }
    Optional<BlockRole.SectionLabel> label = sectionLabel(text, block);
    if (label.isPresent()) {
      return label.get();
    }
    if (StylePredicates.isHeaderStyled(block, options)) {
      Optional<String> mnemonic = index.lookup(firstToken(text));
      if (mnemonic.isPresent()) {
        return new BlockRole.Header(mnemonic.get());
      }
    }
    return new BlockRole.Content(text);
  }

  private Optional<BlockRole.SectionLabel> sectionLabel(String text, DocumentBlock block) {
    String lower = text.toLowerCase(Locale.ROOT);
    for (Section section : Section.values()) {
      for (String label : section.labels()) {
        if (!lower.startsWith(label.toLowerCase(Locale.ROOT))) {
          continue;
        }
        String rest = text.substring(label.length());
        if (rest.isEmpty()) {
          return Optional.of(new BlockRole.SectionLabel(section, ""));
        }
        if (!rest.startsWith(":") && !Character.isWhitespace(rest.charAt(0))) {
          continue;
        }
        String trailing = rest.trim();
        if (trailing.startsWith(":")) {
          return Optional.of(new BlockRole.SectionLabel(section, trailing.substring(1).trim()));
        }
        // "Group Acquisition" without colon: only trust it on a styled label line
        if (StylePredicates.isSectionStyled(block, options)) {
          return Optional.of(new BlockRole.SectionLabel(section, trailing));
        }
      }
    }
    return Optional.empty();
  }

  static String firstToken(String text) {
    String trimmed = text.trim();
    for (int i = 0; i < trimmed.length(); i++) {
      if (Character.isWhitespace(trimmed.charAt(i))) {
        return trimmed.substring(0, i);
      }
    }
    return trimmed;
  }
}
