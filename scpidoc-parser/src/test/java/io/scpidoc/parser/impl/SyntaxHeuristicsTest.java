package io.scpidoc.parser.impl;

import static org.assertj.core.api.Assertions.assertThat;

import io.scpidoc.parser.internal.IndexedFamily;
import java.util.List;
import java.util.regex.Matcher;
import org.junit.jupiter.api.Test;

class SyntaxHeuristicsTest {

  @Test
  void looksLikeCommand() {
    assertThat(SyntaxHeuristics.looksLikeCommand("ACQuire:STATE")).isTrue();
    assertThat(SyntaxHeuristics.looksLikeCommand(":ACQuire:STATE?")).isTrue();
    assertThat(SyntaxHeuristics.looksLikeCommand("CH<x>:SCAle")).isTrue();
    assertThat(SyntaxHeuristics.looksLikeCommand("*IDN?")).isTrue();
    assertThat(SyntaxHeuristics.looksLikeCommand("Sets")).isFalse();
    assertThat(SyntaxHeuristics.looksLikeCommand("ratio:")).isFalse();
    assertThat(SyntaxHeuristics.looksLikeCommand("12:30")).isFalse();
    assertThat(SyntaxHeuristics.looksLikeCommand(null)).isFalse();
  }

  @Test
  void noteLines() {
    assertThat(SyntaxHeuristics.isNoteLine("Note: the value is rounded")).isTrue();
    assertThat(SyntaxHeuristics.isNoteLine("  NOTE this is an alias")).isTrue();
    assertThat(SyntaxHeuristics.isNoteLine("Notebook mode")).isFalse();
    assertThat(SyntaxHeuristics.isNoteLine("See note below")).isFalse();
  }

  @Test
  void argumentMarkers() {
    assertThat(SyntaxHeuristics.hasArgumentMarker("ACQuire:STATE {ON|OFF}")).isTrue();
    assertThat(SyntaxHeuristics.hasArgumentMarker("CH<x>:SCAle <NR3>")).isTrue();
    assertThat(SyntaxHeuristics.hasArgumentMarker("DATa:SOUrce CH<x>")).isTrue();
    assertThat(SyntaxHeuristics.hasArgumentMarker("CH<x>:SCAle?")).isFalse();
    assertThat(SyntaxHeuristics.hasArgumentMarker("*RST")).isFalse();
  }

  @Test
  void placeholders() {
    assertThat(SyntaxHeuristics.isValuePlaceholder("<NR1>")).isTrue();
    assertThat(SyntaxHeuristics.isValuePlaceholder("<QString>")).isTrue();
    assertThat(SyntaxHeuristics.isValuePlaceholder("<x>")).isFalse();
    assertThat(SyntaxHeuristics.isValuePlaceholder("NR1")).isFalse();
    assertThat(SyntaxHeuristics.isIntegerPlaceholder("X <nr1>")).isTrue();
    assertThat(SyntaxHeuristics.isFloatPlaceholder("X <NRf>")).isTrue();
    assertThat(SyntaxHeuristics.isStringPlaceholder("X <QString>")).isTrue();
  }

  @Test
  void indexedFamilies() {
    assertThat(SyntaxHeuristics.indexedFamilyOf("CH<x>")).contains(IndexedFamily.CHANNEL);
    assertThat(SyntaxHeuristics.indexedFamilyOf("B<n>")).contains(IndexedFamily.BUS_SHORT);
    assertThat(SyntaxHeuristics.indexedFamilyOf("CH1")).isEmpty();
    assertThat(SyntaxHeuristics.indexedFamilyOf("FOO<x>")).isEmpty();
    assertThat(SyntaxHeuristics.trailingBarePlaceholder("DATa:SOUrce CH<x>")).contains("CH<x>");
    assertThat(SyntaxHeuristics.trailingBarePlaceholder("DATa:SOUrce {CH<x>|MATH<x>}")).isEmpty();
  }

  @Test
  void trailingPlaceholderNeedsKnownFamily() {
    assertThat(SyntaxHeuristics.trailingBarePlaceholder("DISplay:SELect:VIEW WAVEView<x>")).isEmpty();
    assertThat(SyntaxHeuristics.hasArgumentMarker("DISplay:SELect:VIEW WAVEView<x>")).isFalse();
    assertThat(SyntaxHeuristics.hasArgumentMarker("DATa:SOUrce MATH<x>")).isTrue();
  }

  @Test
  void trailingQueryToken() {
    Matcher m =
        SyntaxHeuristics.trailingQuery("ACQuire:STATE {ON|OFF} ACQuire:STATE?").orElseThrow();
    assertThat(m.group(1)).isEqualTo("ACQuire:STATE?");
    assertThat(SyntaxHeuristics.trailingQuery("ACQuire:STATE?")).isEmpty();
  }

  @Test
  void literalShapes() {
    assertThat(SyntaxHeuristics.isNumericLiteral("1.0E+0")).isTrue();
    assertThat(SyntaxHeuristics.isNumericLiteral("-5")).isTrue();
    assertThat(SyntaxHeuristics.isNumericLiteral(".5")).isTrue();
    assertThat(SyntaxHeuristics.isNumericLiteral("ON")).isFalse();
    assertThat(SyntaxHeuristics.isQuotedString("\"Label\"")).isTrue();
    assertThat(SyntaxHeuristics.isQuotedString("\"")).isFalse();
    assertThat(SyntaxHeuristics.isBooleanLike("off")).isTrue();
  }

  @Test
  void booleanPairs() {
    assertThat(SyntaxHeuristics.isBooleanPair(List.of("ON", "OFF"))).isTrue();
    assertThat(SyntaxHeuristics.isBooleanPair(List.of("OFF", "ON", "1", "0"))).isTrue();
    assertThat(SyntaxHeuristics.isBooleanPair(List.of("TRUE", "FALSE"))).isTrue();
    assertThat(SyntaxHeuristics.isBooleanPair(List.of("ON", "OFF", "AUTO"))).isFalse();
    assertThat(SyntaxHeuristics.isBooleanPair(List.of("ON"))).isFalse();
  }

  @Test
  void descriptionCues() {
    assertThat(SyntaxHeuristics.declaresQueryOnly("This command is query only.")).isTrue();
    assertThat(SyntaxHeuristics.declaresQueryOnly("Query-only command.")).isTrue();
    assertThat(SyntaxHeuristics.declaresNoQueryForm("There is no query form.")).isTrue();
    assertThat(SyntaxHeuristics.declaresNoQueryForm(null)).isFalse();
  }

  @Test
  void lineShapes() {
    assertThat(SyntaxHeuristics.isOptionsOnlyLine(" {ON|OFF}")).isTrue();
    assertThat(SyntaxHeuristics.isOptionsOnlyLine("{<NR3>}")).isFalse();
    assertThat(SyntaxHeuristics.startsWithProse("The scale is set")).isTrue();
    assertThat(SyntaxHeuristics.startsWithProse("TRIGger:A:MODe AUTO")).isFalse();
    assertThat(SyntaxHeuristics.startsLowercase("sets")).isTrue();
    assertThat(SyntaxHeuristics.startsLowercase("ON")).isFalse();
  }
}
