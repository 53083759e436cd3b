package io.scpidoc.parser.internal;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Conventional command groups of oscilloscope programmer manuals, keyed by mnemonic prefix. Used
 * only when neither the Command Index nor the manual names a group.
 */
public final class GroupPrefixTable {

  private static final Map<String, String> GROUPS = new LinkedHashMap<>();

  static {
    put("Acquisition", "ACQ", "ACQUIRE");
    put("Trigger", "TRIG", "TRIGGER");
    put("Vertical", "CH", "CHANNEL", "AUX", "AUXIN");
    put("Horizontal", "HOR", "HORIZONTAL");
    put("Display control", "DIS", "DISPLAY");
    put("Measurement", "MEAS", "MEASUREMENT");
    put("Math", "MATH");
    put("Cursor", "CURS", "CURSOR");
    put("Bus", "BUS");
    put("Save and Recall", "SAV", "SAVE", "REC", "RECALL");
    put("Save On", "SAVEON");
    put("Waveform Transfer", "WAV", "WAVEFORM", "DAT", "DATA");
    put("Calibration", "CAL");
    put("Diagnostics", "DIA", "DIAG", "DIAGNOSTICS", "TES", "TEST");
    put("Error Detector", "ERR", "ERROR", "ERRORDETECTOR");
    put("E-mail", "EMA", "EMAIL");
    put("Histogram", "HIS", "HISTOGRAM");
    put("Limit Test", "LIM", "LIMIT");
    put("Mask", "MAS", "MASK");
    put("Search and Mark", "SEA", "SEARCH", "MARK");
    put("Zoom", "ZOO", "ZOOM");
    put("File system", "FIL", "FILE");
    put("Hard copy", "HAR", "HARD");
    put("Low Speed Serial Trigger", "LOW", "LOWS");
    put(
        "Miscellaneous",
        "SYST", "SYSTEM", "APP", "APPLICATION", "AUXOUT", "ROS", "ROSC", "IDN", "USB", "USBTMC",
        "FPA", "FPANEL", "SET", "SETUP", "VIS", "VISUAL");
  }

  private static void put(String group, String... prefixes) {
    for (String prefix : prefixes) {
      GROUPS.putIfAbsent(prefix, group);
    }
  }

  /**
   * Finds the conventional group for a mnemonic.
   *
   * @param stem upper-cased first segment without placeholders, e.g. {@code CH} or {@code SELECT}
   * @param mnemonic the full mnemonic, consulted for the digital channel selection commands
   * @return the group, or empty when no prefix matches
   */
  public static Optional<String> groupFor(String stem, String mnemonic) {
    String prefix = stem.toUpperCase(Locale.ROOT);
    if (prefix.startsWith("*")) {
      prefix = prefix.substring(1);
    }
    if (prefix.isEmpty()) {
      return Optional.empty();
    }
    if (prefix.equals("SEL") || prefix.equals("SELECT")) {
      String upper = mnemonic.toUpperCase(Locale.ROOT);
      return Optional.of(upper.contains("DIG") || upper.contains("D<") ? "Digital" : "Search and Mark");
    }
    String exact = GROUPS.get(prefix);
    if (exact != null) {
      return Optional.of(exact);
    }
    for (Map.Entry<String, String> e : GROUPS.entrySet()) {
      if (prefix.startsWith(e.getKey())) {
        return Optional.of(e.getValue());
      }
    }
    return Optional.empty();
  }

  private GroupPrefixTable() {}
}
