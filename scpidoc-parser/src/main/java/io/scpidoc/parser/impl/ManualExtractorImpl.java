package io.scpidoc.parser.impl;

import io.scpidoc.parser.api.BlockRole;
import io.scpidoc.parser.api.CommandIndex;
import io.scpidoc.parser.api.CommandRecord;
import io.scpidoc.parser.api.DocumentBlock;
import io.scpidoc.parser.api.Example;
import io.scpidoc.parser.api.ExtractedCommand;
import io.scpidoc.parser.api.ExtractionResult;
import io.scpidoc.parser.api.GroupSource;
import io.scpidoc.parser.api.ManualExtractor;
import io.scpidoc.parser.api.ManualExtractor.ExtractorOptions;
import io.scpidoc.parser.api.Parameter;
import io.scpidoc.parser.api.RecordFlag;
import io.scpidoc.parser.util.MnemonicUtil;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The extraction pipeline: classify, fold, then post-process every record into an {@link
 * ExtractedCommand} and group the results.
 */
public final class ManualExtractorImpl {

  private static final Logger log = LoggerFactory.getLogger(ManualExtractorImpl.class);

  static final int SHORT_DESCRIPTION_LENGTH = 100;

  /** Progress share of the first phase. */
  private static final double FOLD_SHARE = 0.7;

  private final ExtractorOptions options;
  private final BlockClassifier classifier;
  private final SectionStateMachine stateMachine;
  private final ParameterInference inference;
  private final GroupResolver groupResolver;

  private ManualExtractorImpl(CommandIndex index, ExtractorOptions options) {
    this.options = options;
    this.classifier = new BlockClassifier(index, options);
    this.stateMachine = new SectionStateMachine(index);
    this.inference = new ParameterInference(options.maxEnumOptions());
    this.groupResolver = new GroupResolver(options.fallbackGroup());
  }

  /**
   * Runs the full pipeline.
   *
   * @param blocks the manual's paragraphs in document order
   * @param index known commands
   * @param options extractor options
   * @param progressCallback optional progress callback
   * @return grouped commands
   */
  public static ExtractionResult extract(
      List<DocumentBlock> blocks,
      CommandIndex index,
      ExtractorOptions options,
      ManualExtractor.ProgressCallback progressCallback) {
    return new ManualExtractorImpl(index, options).run(blocks, progressCallback);
  }

  /** Runs classification and the state machine only. */
  public static List<CommandRecord> collect(
      List<DocumentBlock> blocks, CommandIndex index, ExtractorOptions options) {
    ExtractionState state = new ManualExtractorImpl(index, options).fold(blocks, null);
    return new ArrayList<>(state.records().values());
  }

  private ExtractionResult run(
      List<DocumentBlock> blocks, ManualExtractor.ProgressCallback progressCallback) {
    ExtractionState state = fold(blocks, progressCallback);

    Map<String, List<ExtractedCommand>> groups = new LinkedHashMap<>();
    int processed = 0;
    int total = state.records().size();
    for (CommandRecord record : state.records().values()) {
      ExtractedCommand command = process(record, state.duplicated().contains(record.mnemonic()));
      if (command.hasFlag(RecordFlag.LOW_CONFIDENCE)) {
        log.warn(
            "Low confidence record {}: no description and no group with syntax",
            record.mnemonic());
      }
      groups.computeIfAbsent(command.group(), g -> new ArrayList<>()).add(command);
      processed++;
      if (progressCallback != null && processed % 100 == 0) {
        progressCallback.onProgress(
            FOLD_SHARE + (1.0 - FOLD_SHARE) * processed / total, "Inferring parameters");
      }
    }
    if (progressCallback != null) {
      progressCallback.onProgress(1.0, "Complete");
    }

    ExtractionResult result = new ExtractionResult(groups, state.stats());
    log.info(
        "Extracted {} commands in {} groups from {} blocks ({} headers, {} merged, {} flagged)",
        result.totalCommands(),
        result.totalGroups(),
        state.stats().blocks(),
        state.stats().headers(),
        state.stats().mergedDuplicates(),
        result.flagged().size());
    return result;
  }

  private ExtractionState fold(
      List<DocumentBlock> blocks, ManualExtractor.ProgressCallback progressCallback) {
    ExtractionState state = stateMachine.initialState();
    int size = blocks.size();
    int step = Math.max(1, size / 20);
    if (progressCallback != null) {
      progressCallback.onProgress(0.0, "Classifying blocks");
    }
    for (int i = 0; i < size; i++) {
      BlockRole role = classifier.classify(blocks.get(i));
      stateMachine.step(state, role);
      if (progressCallback != null && (i + 1) % step == 0) {
        progressCallback.onProgress(FOLD_SHARE * (i + 1) / size, "Classifying blocks");
      }
    }
    return stateMachine.finish(state);
  }

  ExtractedCommand process(CommandRecord record, boolean duplicated) {
    String mnemonic = record.mnemonic();
    Set<RecordFlag> flags = EnumSet.noneOf(RecordFlag.class);

    List<String> syntax =
        options.filterSyntax()
            ? SyntaxLineFilter.filter(mnemonic, record.syntaxLines(), record.arguments())
            : SyntaxLineFilter.nonBlank(record.syntaxLines());
    List<String> exampleLines =
        options.filterExamples()
            ? ExampleFilter.filter(mnemonic, record.examples())
            : SyntaxLineFilter.nonBlank(record.examples());

    SyntaxSplitter.Split split = SyntaxSplitter.analyze(mnemonic, syntax, record.description());
    List<Parameter> parameters =
        inference.infer(mnemonic, split.forms(), exampleLines, record.arguments());

    List<Example> examples = new ArrayList<>(exampleLines.size());
    for (String line : exampleLines) {
      examples.add(ExampleSplitter.split(line));
    }

    GroupResolver.Resolution group = groupResolver.resolve(record);

    if (record.isLowConfidence()) {
      flags.add(RecordFlag.LOW_CONFIDENCE);
    }
    if (duplicated) {
      flags.add(RecordFlag.MERGED_DUPLICATE);
    }
    if (group.source() != GroupSource.INDEX) {
      flags.add(RecordFlag.GROUP_NOT_INDEXED);
    }
    if (group.source() == GroupSource.FALLBACK) {
      flags.add(RecordFlag.GROUP_UNRESOLVED);
    }
    if (split.synthesized()) {
      flags.add(RecordFlag.SYNTAX_SYNTHESIZED);
    }

    return new ExtractedCommand(
        record,
        MnemonicUtil.shortName(mnemonic),
        group.group(),
        group.source(),
        shortDescription(record.description()),
        syntax,
        split.forms(),
        parameters,
        examples,
        flags);
  }

  static String shortDescription(String description) {
    if (description == null) {
      return "";
    }
    return description.length() > SHORT_DESCRIPTION_LENGTH
        ? description.substring(0, SHORT_DESCRIPTION_LENGTH) + "..."
        : description;
  }
}
