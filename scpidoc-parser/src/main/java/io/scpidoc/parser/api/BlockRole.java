package io.scpidoc.parser.api;

import java.util.Objects;

/** Role of a single block in the command stream, as decided by the block classifier. */
public sealed interface BlockRole permits BlockRole.Header, BlockRole.SectionLabel, BlockRole.Content {

  /** A command header that opens a new record. */
  record Header(String mnemonic) implements BlockRole {
    public Header {
      Objects.requireNonNull(mnemonic, "mnemonic must not be null");
    }
  }

  /**
   * A section label line. Text that followed the label on the same block (e.g. the
   * "Acquisition" in "Group: Acquisition") is carried as {@code trailingText}, empty otherwise.
   */
  record SectionLabel(Section section, String trailingText) implements BlockRole {
    public SectionLabel {
      Objects.requireNonNull(section, "section must not be null");
      trailingText = trailingText == null ? "" : trailingText;
    }
  }

  /** Any other text. */
  record Content(String text) implements BlockRole {
    public Content {
      text = text == null ? "" : text;
    }
  }
}
