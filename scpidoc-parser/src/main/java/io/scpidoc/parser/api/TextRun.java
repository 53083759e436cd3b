package io.scpidoc.parser.api;

/**
 * A run of uniformly styled text inside a {@link DocumentBlock}.
 *
 * @param text the run text
 * @param fontFamily font family name, or {@code null} when the run inherits it
 * @param bold explicit bold flag, or {@code null} when inherited
 * @param italic explicit italic flag, or {@code null} when inherited
 */
public record TextRun(String text, String fontFamily, Boolean bold, Boolean italic) {

  public TextRun {
    text = text == null ? "" : text;
  }

  public static TextRun plain(String text) {
    return new TextRun(text, null, null, null);
  }

  public static TextRun styled(String text, String fontFamily, boolean bold) {
    return new TextRun(text, fontFamily, bold, null);
  }

  public boolean isBold() {
    return Boolean.TRUE.equals(bold);
  }

  public boolean isItalic() {
    return Boolean.TRUE.equals(italic);
  }
}
