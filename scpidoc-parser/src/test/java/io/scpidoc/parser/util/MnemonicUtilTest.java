package io.scpidoc.parser.util;

import static org.junit.jupiter.api.Assertions.*;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

public class MnemonicUtilTest {

  @Test
  void normalize_collapsesIndexSpellings() {
    assertEquals("CH<X>:SCALE", MnemonicUtil.normalize("CH3:SCAle?"));
    assertEquals("CH<X>:SCALE", MnemonicUtil.normalize("ch<n>:scale"));
    assertEquals("CH<X>:SCALE", MnemonicUtil.normalize("CH<x>:SCAle"));
  }

  @Test
  void normalize_keepsDigitsOfUnknownPrefixes() {
    assertEquals("CURSOR:VBARS:POSITION1", MnemonicUtil.normalize("CURSor:VBArs:POSITION1"));
  }

  @Test
  void normalize_handlesNestedFamilies() {
    assertEquals(
        "SEARCH:SEARCH<X>:TRIGGER:A:LOGIC:WHEN",
        MnemonicUtil.normalize("SEARCH:SEARCH1:TRIGger:A:LOGIc:WHEn"));
    assertEquals("BUS:B<X>:CAN:BITRATE", MnemonicUtil.normalize("BUS:B2:CAN:BITRate"));
  }

  @Test
  void normalize_commonCommand() {
    assertEquals("*IDN", MnemonicUtil.normalize("*IDN?"));
    assertNull(MnemonicUtil.normalize(null));
  }

  @Test
  void shortName_dropsQueryAndPlaceholders() {
    assertEquals("SCAle", MnemonicUtil.shortName("CH<x>:SCAle?"));
    assertEquals("*IDN", MnemonicUtil.shortName("*IDN?"));
    assertEquals("MEAS", MnemonicUtil.shortName("MEASUrement:MEAS<x>"));
  }

  @Test
  void headerBase_stopsAtWhitespace() {
    assertEquals("ACQuire:STATE", MnemonicUtil.headerBase("ACQuire:STATE {ON|OFF}"));
    assertEquals("ACQuire:STATE", MnemonicUtil.headerBase("ACQuire:STATE?"));
  }

  @Test
  void stem_isFirstSegmentWithoutIndex() {
    assertEquals("CH", MnemonicUtil.stem("CH<x>:SCAle"));
    assertEquals("ACQUIRE", MnemonicUtil.stem(":ACQuire:STATE"));
    assertEquals("*IDN", MnemonicUtil.stem("*IDN?"));
    assertEquals("MEASUREMENT", MnemonicUtil.stem("MEASUrement:MEAS<x>:TYPe"));
  }

  @Test
  void cleanToken_stripsSurroundingPunctuation() {
    assertEquals("ACQuire:MODe", MnemonicUtil.cleanToken("(ACQuire:MODe),"));
    assertEquals("", MnemonicUtil.cleanToken(null));
  }

  @Test
  void isSegmentPrefix_requiresColonBoundary() {
    assertTrue(MnemonicUtil.isSegmentPrefix("CH<X>", "CH<X>:SCALE"));
    assertFalse(MnemonicUtil.isSegmentPrefix("CH<X>:SC", "CH<X>:SCALE"));
    assertFalse(MnemonicUtil.isSegmentPrefix("CH<X>:SCALE", "CH<X>:SCALE"));
  }

  @Property
  void literalAndPlaceholderSpellingsNormalizeAlike(
      @ForAll("familyPrefixes") String prefix,
      @ForAll @IntRange(min = 1, max = 8) int index,
      @ForAll("segments") String suffix) {
    String literal = MnemonicUtil.normalize(prefix + index + ":" + suffix);
    assertEquals(literal, MnemonicUtil.normalize(prefix + "<x>:" + suffix));
    assertEquals(literal, MnemonicUtil.normalize(prefix.toLowerCase() + "<n>:" + suffix + "?"));
  }

  @Property
  void normalizeIsIdempotent(
      @ForAll("familyPrefixes") String prefix,
      @ForAll @IntRange(min = 1, max = 8) int index,
      @ForAll("segments") String suffix) {
    String once = MnemonicUtil.normalize(prefix + index + ":" + suffix + "?");
    assertEquals(once, MnemonicUtil.normalize(once));
  }

  @Provide
  Arbitrary<String> familyPrefixes() {
    return Arbitraries.of("CH", "MATH", "REF", "MEAS", "B", "BUS", "SEARCH", "PLOT", "POWer");
  }

  @Provide
  Arbitrary<String> segments() {
    return Arbitraries.strings().withCharRange('A', 'Z').ofMinLength(1).ofMaxLength(8);
  }
}
