package io.scpidoc.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.scpidoc.parser.api.DocumentBlock;
import io.scpidoc.parser.api.TextRun;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import org.junit.jupiter.api.Test;

class BlockDumpReaderTest {

  @Test
  void readsFixture() throws IOException {
    List<DocumentBlock> blocks = BlockDumpReader.read(Fixtures.resource(Fixtures.BLOCKS));

    assertThat(blocks).hasSize(23);
    DocumentBlock header = blocks.get(1);
    assertThat(header.text()).isEqualTo("ACQuire:STATE");
    TextRun run = header.runs().get(0);
    assertThat(run.fontFamily()).isEqualTo("Arial Narrow");
    assertThat(run.isBold()).isTrue();
    assertThat(run.italic()).isNull();

    assertThat(blocks.get(2).text()).isEqualTo("Sets or queries acquisition state.");
    assertThat(blocks.get(3).paragraphBold()).isTrue();
    assertThat(blocks.get(8).isBlank()).isTrue();
  }

  @Test
  void readsParagraphStyle() throws IOException {
    List<DocumentBlock> blocks =
        BlockDumpReader.read(
            new StringReader("[{\"text\": \"*RST\", \"style\": \"Heading 4\"}]"), "inline");

    assertThat(blocks).hasSize(1);
    assertThat(blocks.get(0).paragraphStyleName()).isEqualTo("Heading 4");
    assertThat(blocks.get(0).runs()).isEmpty();
  }

  @Test
  void malformedJsonNamesSource() {
    assertThatThrownBy(() -> BlockDumpReader.read(new StringReader("[{\"text\": "), "broken.json"))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("broken.json");
  }

  @Test
  void rejectsNonArrayRoot() {
    assertThatThrownBy(() -> BlockDumpReader.read(new StringReader("{}"), "object.json"))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("must be a JSON array");
    assertThatThrownBy(() -> BlockDumpReader.read(new StringReader("[1]"), "numbers.json"))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("Block 0");
  }

  @Test
  void rejectsWrongFieldShapes() {
    assertThatThrownBy(
            () ->
                BlockDumpReader.read(
                    new StringReader("[{\"text\": \"a\"}, {\"text\": {\"x\": 1}}]"), "shape.json"))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("Block 1 of shape.json")
        .hasMessageContaining("text");
    assertThatThrownBy(
            () ->
                BlockDumpReader.read(
                    new StringReader("[{\"runs\": [{\"text\": \"a\", \"bold\": [true]}]}]"),
                    "runs.json"))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("Block 0 of runs.json")
        .hasMessageContaining("bold");
  }
}
