package io.scpidoc.parser.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.scpidoc.parser.api.BlockRole;
import io.scpidoc.parser.api.CommandIndex;
import io.scpidoc.parser.api.CommandRecord;
import io.scpidoc.parser.api.Section;
import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import org.junit.jupiter.api.Test;

class SectionStateMachineTest {

  private static final CommandIndex INDEX =
      CommandIndex.builder()
          .add("Acquisition", "ACQuire:STATE")
          .add("Acquisition", "ACQuire:MODe")
          .add("Status and Error", "*IDN?")
          .add("Vertical", "CH<x>:SCAle")
          .build();

  private final SectionStateMachine machine = new SectionStateMachine(INDEX);

  private static BlockRole header(String mnemonic) {
    return new BlockRole.Header(mnemonic);
  }

  private static BlockRole label(Section section) {
    return new BlockRole.SectionLabel(section, "");
  }

  private static BlockRole content(String text) {
    return new BlockRole.Content(text);
  }

  private ExtractionState run(BlockRole... roles) {
    ExtractionState state = machine.initialState();
    for (BlockRole role : roles) {
      machine.step(state, role);
    }
    return machine.finish(state);
  }

  @Test
  void assemblesSections() {
    ExtractionState state =
        run(
            header("ACQuire:STATE"),
            content("Sets or queries"),
            content("the acquisition state."),
            label(Section.SYNTAX),
            content("ACQuire:STATE {ON|OFF}"),
            content("ACQuire:STATE?"),
            label(Section.ARGUMENTS),
            content("ON starts acquisition."),
            label(Section.EXAMPLES),
            content("ACQuire:STATE ON starts acquisition."));

    CommandRecord record = state.records().get("ACQuire:STATE");
    assertThat(record.description()).isEqualTo("Sets or queries the acquisition state.");
    assertThat(record.group()).isEqualTo("Acquisition");
    assertThat(record.syntaxLines()).containsExactly("ACQuire:STATE {ON|OFF}", "ACQuire:STATE?");
    assertThat(record.arguments()).isEqualTo("ON starts acquisition.");
    assertThat(record.examples()).containsExactly("ACQuire:STATE ON starts acquisition.");
  }

  @Test
  void headerFinalizesPreviousRecord() {
    ExtractionState state =
        run(
            header("ACQuire:STATE"),
            content("State."),
            header("ACQuire:MODe"),
            content("Mode."));
    assertThat(state.records()).containsOnlyKeys("ACQuire:STATE", "ACQuire:MODe");
    assertThat(state.records().get("ACQuire:STATE").description()).isEqualTo("State.");
    assertThat(state.records().get("ACQuire:MODe").description()).isEqualTo("Mode.");
  }

  @Test
  void contentBeforeFirstHeaderIsDropped() {
    ExtractionState state = run(content("Table of Contents"), label(Section.SYNTAX), content("x"));
    assertThat(state.records()).isEmpty();
    assertThat(state.stats().droppedBlocks()).isEqualTo(3);
    assertThat(state.openRecord()).isEmpty();
  }

  @Test
  void repeatedHeaderMerges() {
    ExtractionState state =
        run(
            header("*IDN?"),
            content("Returns the identification string."),
            header("ACQuire:STATE"),
            content("Unrelated."),
            header("*IDN?"),
            label(Section.SYNTAX),
            content("*IDN?"));
    CommandRecord idn = state.records().get("*IDN?");
    assertThat(idn.description()).isEqualTo("Returns the identification string.");
    assertThat(idn.syntaxLines()).containsExactly("*IDN?");
    assertThat(state.records()).hasSize(2);
    assertThat(state.duplicated()).containsExactly("*IDN?");
    assertThat(state.stats().mergedDuplicates()).isEqualTo(1);
    assertThat(state.finalizedCount()).isEqualTo(3);
  }

  @Test
  void notesBypassSections() {
    ExtractionState state =
        run(
            header("ACQuire:STATE"),
            label(Section.SYNTAX),
            content("ACQuire:STATE {ON|OFF}"),
            content("NOTE: Only available with option X."),
            content("ACQuire:STATE?"));
    CommandRecord record = state.records().get("ACQuire:STATE");
    assertThat(record.notes()).containsExactly("NOTE: Only available with option X.");
    assertThat(record.syntaxLines()).containsExactly("ACQuire:STATE {ON|OFF}", "ACQuire:STATE?");
  }

  @Test
  void firstNonEmptyTextWins() {
    ExtractionState state =
        run(
            header("ACQuire:STATE"),
            label(Section.ARGUMENTS),
            content("First."),
            label(Section.SYNTAX),
            content("ACQuire:STATE ON"),
            label(Section.ARGUMENTS),
            content("Second."));
    assertThat(state.records().get("ACQuire:STATE").arguments()).isEqualTo("First.");
  }

  @Test
  void trailingTextOpensSection() {
    ExtractionState state =
        run(
            header("ACQuire:STATE"),
            new BlockRole.SectionLabel(Section.GROUP, "Acquisition"),
            new BlockRole.SectionLabel(Section.RELATED, "ACQuire:MODe, CH1:SCAle, FOO:BAR"));
    CommandRecord record = state.records().get("ACQuire:STATE");
    assertThat(record.documentGroup()).isEqualTo("Acquisition");
    assertThat(record.related()).containsExactly("ACQuire:MODe", "CH<x>:SCAle");
  }

  @Test
  void relatedSkipsSelfReference() {
    ExtractionState state =
        run(header("ACQuire:STATE"), label(Section.RELATED), content("ACQuire:STATE ACQuire:MODe"));
    assertThat(state.records().get("ACQuire:STATE").related()).containsExactly("ACQuire:MODe");
  }

  @Test
  void blankContentIsIgnored() {
    ExtractionState state = run(header("ACQuire:STATE"), content(""), content("Text."));
    assertThat(state.records().get("ACQuire:STATE").description()).isEqualTo("Text.");
    assertThat(state.stats().blankBlocks()).isEqualTo(1);
  }

  @Test
  void finishedStateRejectsSteps() {
    ExtractionState state = run(header("ACQuire:STATE"));
    assertThat(state.isFinished()).isTrue();
    assertThatThrownBy(() -> machine.step(state, content("late")))
        .isInstanceOf(IllegalStateException.class);
  }

  @Property
  void finalizedRecordsEqualHeaderCount(@ForAll("roleStreams") List<BlockRole> roles) {
    ExtractionState state = run(roles.toArray(new BlockRole[0]));
    int headers = (int) roles.stream().filter(r -> r instanceof BlockRole.Header).count();
    assertThat(state.finalizedCount()).isEqualTo(headers);
    assertThat(state.stats().headers()).isEqualTo(headers);
    assertThat(state.records().size() + state.stats().mergedDuplicates()).isEqualTo(headers);
  }

  @Provide
  Arbitrary<List<BlockRole>> roleStreams() {
    Arbitrary<BlockRole> headers =
        Arbitraries.of("ACQuire:STATE", "ACQuire:MODe", "*IDN?", "CH<x>:SCAle")
            .map(BlockRole.Header::new);
    Arbitrary<BlockRole> labels =
        Arbitraries.of(Section.values()).map(s -> new BlockRole.SectionLabel(s, ""));
    Arbitrary<BlockRole> contents =
        Arbitraries.of("text", "", "Note: careful", "ACQuire:MODe").map(BlockRole.Content::new);
    return Arbitraries.oneOf(headers, labels, contents).list().ofMaxSize(40);
  }
}
