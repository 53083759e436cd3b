package io.scpidoc.parser.impl;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class SyntaxLineFilterTest {

  @Test
  void mergesOptionsLineIntoSetForm() {
    List<String> lines =
        SyntaxLineFilter.filter(
            "ACQuire:MODe",
            List.of("ACQuire:MODe", "{SAMple|PEAKdetect|AVErage}", "ACQuire:MODe?"),
            null);
    assertThat(lines).containsExactly("ACQuire:MODe {SAMple|PEAKdetect|AVErage}", "ACQuire:MODe?");
  }

  @Test
  void optionsLineAfterQueryStaysSeparate() {
    List<String> lines =
        SyntaxLineFilter.filter("ACQuire:MODe", List.of("ACQuire:MODe?", "{SAMple|AVErage}"), null);
    assertThat(lines).containsExactly("ACQuire:MODe?", "{SAMple|AVErage}");
  }

  @Test
  void dropsLinesNotStartingWithStem() {
    List<String> lines =
        SyntaxLineFilter.filter(
            "ACQuire:STATE",
            List.of("This command starts acquisition", "", ":ACQuire:STATE {ON|OFF}", "Default ON"),
            null);
    assertThat(lines).containsExactly(":ACQuire:STATE {ON|OFF}");
  }

  @Test
  void literalIndexMatchesPlaceholderStem() {
    assertThat(SyntaxLineFilter.filter("CH<x>:SCAle", List.of("CH1:SCAle <NR3>"), null))
        .containsExactly("CH1:SCAle <NR3>");
  }

  @Test
  void optionsFromArgumentsText() {
    List<String> lines =
        SyntaxLineFilter.filter(
            "ACQuire:MODe",
            List.of("ACQuire:MODe", "ACQuire:MODe?"),
            "Arguments are {SAMple|AVErage}, where SAMple is the default.");
    assertThat(lines).containsExactly("ACQuire:MODe {SAMple|AVErage}", "ACQuire:MODe?");
  }

  @Test
  void argumentsTextIgnoredWhenSyntaxHasOptions() {
    List<String> lines =
        SyntaxLineFilter.filter(
            "ACQuire:STATE", List.of("ACQuire:STATE {ON|OFF}"), "{RUN|STOP} are aliases.");
    assertThat(lines).containsExactly("ACQuire:STATE {ON|OFF}");
  }

  @Test
  void nonBlankOnlyTrims() {
    assertThat(SyntaxLineFilter.nonBlank(List.of(" a ", " ", "b"))).containsExactly("a", "b");
  }
}
