package io.scpidoc.parser.api;

import java.util.List;

/**
 * One paragraph of the rendered manual, as supplied by the document loader.
 *
 * @param text paragraph text; derived from the runs when {@code null}
 * @param runs styled runs in reading order
 * @param paragraphStyleName name of the paragraph style (e.g. {@code "Heading 4"}), may be {@code
 *     null}
 * @param paragraphBold whether the paragraph style itself is bold, may be {@code null}
 */
public record DocumentBlock(
    String text, List<TextRun> runs, String paragraphStyleName, Boolean paragraphBold) {

  public DocumentBlock {
    runs = runs == null ? List.of() : List.copyOf(runs);
    if (text == null) {
      StringBuilder sb = new StringBuilder();
      for (TextRun run : runs) {
        sb.append(run.text());
      }
      text = sb.toString();
    }
  }

  /** A block with a single unstyled run. */
  public static DocumentBlock of(String text) {
    return new DocumentBlock(text, List.of(TextRun.plain(text)), null, null);
  }

  /** A block whose single run uses the given font family and weight. */
  public static DocumentBlock styled(String text, String fontFamily, boolean bold) {
    return new DocumentBlock(text, List.of(TextRun.styled(text, fontFamily, bold)), null, null);
  }

  /** A block carrying a named paragraph style. */
  public static DocumentBlock withStyle(String text, String paragraphStyleName) {
    return new DocumentBlock(text, List.of(TextRun.plain(text)), paragraphStyleName, null);
  }

  public boolean isBlank() {
    return text.isBlank();
  }
}
