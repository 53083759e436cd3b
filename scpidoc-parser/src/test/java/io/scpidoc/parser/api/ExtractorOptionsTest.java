package io.scpidoc.parser.api;

import static org.junit.jupiter.api.Assertions.*;

import io.scpidoc.parser.api.ManualExtractor.ExtractorOptions;
import org.junit.jupiter.api.Test;

public class ExtractorOptionsTest {

  @Test
  void defaults() {
    ExtractorOptions options = ExtractorOptions.DEFAULT;
    assertNull(options.headerStyleName());
    assertNull(options.headerFontFamily());
    assertTrue(options.headerRequiresBold());
    assertEquals("Miscellaneous", options.fallbackGroup());
    assertEquals(50, options.maxEnumOptions());
    assertTrue(options.filterSyntax());
    assertEquals(ExtractorOptions.DEFAULT, ExtractorOptions.builder().build());
  }

  @Test
  void blankNamesAreUnset() {
    ExtractorOptions options =
        ExtractorOptions.builder().headerFontFamily("  ").sectionStyleName(" Label ").build();
    assertNull(options.headerFontFamily());
    assertEquals("Label", options.sectionStyleName());
  }

  @Test
  void presets() {
    assertEquals("Arial Narrow", ExtractorOptions.forHeaderFont("Arial Narrow").headerFontFamily());
    assertEquals("Heading 4", ExtractorOptions.forHeaderStyle("Heading 4").headerStyleName());
    assertFalse(ExtractorOptions.UNFILTERED.filterExamples());
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(
        IllegalArgumentException.class, () -> ExtractorOptions.builder().maxEnumOptions(0).build());
    assertThrows(
        IllegalArgumentException.class, () -> ExtractorOptions.builder().fallbackGroup(" ").build());
    assertThrows(NullPointerException.class, () -> ExtractorOptions.builder().fallbackGroup(null));
  }
}
