package io.scpidoc.parser.impl;

import io.scpidoc.parser.api.BlockRole;
import io.scpidoc.parser.api.CommandIndex;
import io.scpidoc.parser.api.CommandRecord;
import io.scpidoc.parser.api.Section;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds classified blocks into command records.
 *
 * <p>Exactly one record is open at a time. A header finalizes the open record (merging it into an
 * earlier record of the same mnemonic) before opening the next one; section labels move buffered
 * lines into the field of the section they close.
 */
public final class SectionStateMachine {
  private static final Logger log = LoggerFactory.getLogger(SectionStateMachine.class);

  private final CommandIndex index;

  public SectionStateMachine(CommandIndex index) {
    this.index = Objects.requireNonNull(index, "index must not be null");
  }

  public ExtractionState initialState() {
    return new ExtractionState();
  }

  /**
   * Advances the state by one block.
   *
   * @param state current state, mutated in place
   * @param role role of the next block
   * @return the same state, for folding
   */
  public ExtractionState step(ExtractionState state, BlockRole role) {
    if (state.finished) {
      throw new IllegalStateException("Extraction already finished");
    }
    state.blocks++;
    if (role instanceof BlockRole.Header header) {
      onHeader(state, header.mnemonic());
    } else if (role instanceof BlockRole.SectionLabel label) {
      onSection(state, label);
    } else if (role instanceof BlockRole.Content content) {
      onContent(state, content.text());
    }
    return state;
  }

  /** Flushes the buffer and finalizes the last open record. */
  public ExtractionState finish(ExtractionState state) {
    if (!state.finished) {
      finalizeCurrent(state);
      state.finished = true;
    }
    return state;
  }

  private void onHeader(ExtractionState state, String mnemonic) {
    state.headers++;
    finalizeCurrent(state);
    state.current = new RecordBuilder(mnemonic, index.groupOf(mnemonic).orElse(null));
    state.section = Section.DESCRIPTION;
  }

  private void onSection(ExtractionState state, BlockRole.SectionLabel label) {
    state.sectionLabels++;
    if (state.current == null) {
      state.droppedBlocks++;
      return;
    }
    flushBuffer(state);
    state.section = label.section();
    if (!label.trailingText().isEmpty()) {
      state.buffer.add(label.trailingText());
    }
  }

  private void onContent(ExtractionState state, String text) {
    if (text.isBlank()) {
      state.blankBlocks++;
      return;
    }
    if (state.current == null) {
      // front matter, table of contents
      state.droppedBlocks++;
      log.debug("Dropping content before first header: {}", text);
      return;
    }
    if (SyntaxHeuristics.isNoteLine(text)) {
      state.notes++;
      state.current.addNote(text);
      return;
    }
    state.buffer.add(text);
  }

  private void flushBuffer(ExtractionState state) {
    if (state.current != null) {
      state.current.flush(state.section, state.buffer, index);
    }
    state.buffer.clear();
  }

  private void finalizeCurrent(ExtractionState state) {
    flushBuffer(state);
    if (state.current == null) {
      return;
    }
    CommandRecord record = state.current.build();
    state.finalized++;
    CommandRecord existing = state.records.get(record.mnemonic());
    if (existing == null) {
      state.records.put(record.mnemonic(), record);
    } else {
      state.records.put(record.mnemonic(), RecordMerger.merge(existing, record));
      state.duplicated.add(record.mnemonic());
      state.mergedDuplicates++;
      log.debug("Merged repeated header {}", record.mnemonic());
    }
    state.current = null;
    state.section = Section.DESCRIPTION;
  }
}
