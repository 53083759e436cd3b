package io.scpidoc.parser.impl;

import io.scpidoc.parser.api.CommandRecord;
import io.scpidoc.parser.api.ExtractionStats;
import io.scpidoc.parser.api.Section;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * State threaded through {@link SectionStateMachine#step}: the open record, the current section,
 * the buffered lines of that section and the records finalized so far.
 */
public final class ExtractionState {

  RecordBuilder current;
  Section section = Section.DESCRIPTION;
  final List<String> buffer = new ArrayList<>();
  final Map<String, CommandRecord> records = new LinkedHashMap<>();
  final Set<String> duplicated = new LinkedHashSet<>();

  int blocks;
  int blankBlocks;
  int headers;
  int sectionLabels;
  int droppedBlocks;
  int notes;
  int mergedDuplicates;
  int finalized;
  boolean finished;

  public Optional<RecordBuilder> openRecord() {
    return Optional.ofNullable(current);
  }

  public Section section() {
    return section;
  }

  public List<String> buffer() {
    return Collections.unmodifiableList(buffer);
  }

  /** Finalized records keyed by canonical mnemonic, in order of first header. */
  public Map<String, CommandRecord> records() {
    return Collections.unmodifiableMap(records);
  }

  /** Mnemonics that had more than one header. */
  public Set<String> duplicated() {
    return Collections.unmodifiableSet(duplicated);
  }

  /** Records finalized before merging; equals the number of header blocks once finished. */
  public int finalizedCount() {
    return finalized;
  }

  public boolean isFinished() {
    return finished;
  }

  public ExtractionStats stats() {
    return new ExtractionStats(
        blocks, blankBlocks, headers, sectionLabels, droppedBlocks, notes, mergedDuplicates);
  }
}
