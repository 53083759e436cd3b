package io.scpidoc.parser.impl;

import static org.assertj.core.api.Assertions.assertThat;

import io.scpidoc.parser.api.CommandRecord;
import io.scpidoc.parser.api.GroupSource;
import java.util.List;
import org.junit.jupiter.api.Test;

class GroupResolverTest {

  private final GroupResolver resolver = new GroupResolver("Miscellaneous");

  private static CommandRecord record(String mnemonic, String group, String documentGroup) {
    return new CommandRecord(
        mnemonic, group, documentGroup, null, null, null, null, List.of(), List.of(), List.of(),
        List.of());
  }

  @Test
  void indexGroupWins() {
    assertThat(resolver.resolve(record("TRIGger:A:MODe", "Trigger", "Other")))
        .isEqualTo(new GroupResolver.Resolution("Trigger", GroupSource.INDEX));
  }

  @Test
  void documentGroupIsNext() {
    assertThat(resolver.resolve(record("TRIGger:A:MODe", null, " Trigger control. ")))
        .isEqualTo(new GroupResolver.Resolution("Trigger control", GroupSource.DOCUMENT));
  }

  @Test
  void prefixTableIsNext() {
    assertThat(resolver.resolve(record("TRIGger:A:MODe", null, " ")))
        .isEqualTo(new GroupResolver.Resolution("Trigger", GroupSource.PREFIX));
    assertThat(resolver.resolve(record("*IDN?", null, null)).group()).isEqualTo("Miscellaneous");
    assertThat(resolver.resolve(record("*IDN?", null, null)).source()).isEqualTo(GroupSource.PREFIX);
  }

  @Test
  void fallbackIsLast() {
    assertThat(resolver.resolve(record("FOO:BAR", null, null)))
        .isEqualTo(new GroupResolver.Resolution("Miscellaneous", GroupSource.FALLBACK));
    assertThat(new GroupResolver("Uncategorized").resolve(record("*RST", null, null)).group())
        .isEqualTo("Uncategorized");
  }
}
