package io.scpidoc.parser.impl;

import io.scpidoc.parser.api.Example;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits an example line such as {@code CH1:SCAle 1.0E+0 sets the scale to 1 volt} into the SCPI
 * snippet and the explanation that follows it.
 *
 * <p>The explanation starts at the first description verb. A verb written in all caps is an
 * argument value, not prose. A response documented as {@code might return TRUE} belongs to the
 * snippet.
 */
public final class ExampleSplitter {

  private static final Pattern VERB =
      Pattern.compile(
          "(?<=\\s)(sets|queries|returns|indicates|indicating|specifies|turns|enables|disables|might)(?=\\s|$)",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern MIGHT_RETURN =
      Pattern.compile("^might\\s+return\\s+\\S+", Pattern.CASE_INSENSITIVE);
  private static final Pattern LOWERCASE_WORD = Pattern.compile("\\s+(?=\\p{Ll})");

  public static Example split(String line) {
    String text = line.trim();
    Matcher verb = VERB.matcher(text);
    while (verb.find()) {
      String word = verb.group(1);
      if (word.equals(word.toUpperCase(Locale.ROOT))) {
        continue;
      }
      if (word.equalsIgnoreCase("might")) {
        Matcher response = MIGHT_RETURN.matcher(text.substring(verb.start()));
        if (response.find()) {
          int end = verb.start() + response.end();
          return new Example(text.substring(0, end).trim(), text.substring(end).trim());
        }
      }
      return new Example(text.substring(0, verb.start()).trim(), text.substring(verb.start()));
    }
    Matcher lower = LOWERCASE_WORD.matcher(text);
    if (lower.find()) {
      return new Example(text.substring(0, lower.start()), text.substring(lower.end()));
    }
    return new Example(text, "");
  }

  /** The SCPI snippet of an example line. */
  public static String snippet(String line) {
    return split(line).scpi();
  }

  private ExampleSplitter() {}
}
