package io.scpidoc.cli;

import com.google.gson.JsonObject;
import io.scpidoc.parser.api.CommandIndex;
import io.scpidoc.parser.api.DocumentBlock;
import io.scpidoc.parser.api.ExtractedCommand;
import io.scpidoc.parser.api.ExtractionResult;
import io.scpidoc.parser.api.ManualExtractor;
import io.scpidoc.parser.api.ManualExtractor.ExtractorOptions;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(
    name = "scpidoc-extract",
    description = "Extracts a SCPI command library from a programmer manual block dump",
    version = "0.1.0",
    mixinStandardHelpOptions = true)
public class Main implements Callable<Integer> {
  private static final Logger log = LoggerFactory.getLogger(Main.class);

  static final String HEADER_FONT_PROPERTY = "scpidoc.header.font";
  static final String HEADER_FONT_ENV = "SCPIDOC_HEADER_FONT";

  @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

  @CommandLine.Option(
      names = {"-b", "--blocks"},
      required = true,
      description = "Block dump of the manual (JSON array of paragraphs)")
  private Path blocksFile;

  @CommandLine.Option(
      names = {"-i", "--index"},
      description = "Group mapping (JSON); without it any command-shaped header is accepted")
  private Path indexFile;

  @CommandLine.Option(
      names = {"-o", "--output"},
      description = "Output file; JSON goes to stdout when omitted")
  private Path outputFile;

  @CommandLine.Option(
      names = "--manual",
      defaultValue = "Programmer Manual",
      description = "Manual title written to the output (default: ${DEFAULT-VALUE})")
  private String manual;

  @CommandLine.Option(names = "--header-style", description = "Paragraph style of command headers")
  private String headerStyle;

  @CommandLine.Option(names = "--header-font", description = "Font family of command headers")
  private String headerFont;

  @CommandLine.Option(names = "--no-bold", description = "Do not require bold command headers")
  private boolean noBold;

  @CommandLine.Option(names = "--section-style", description = "Paragraph style of section labels")
  private String sectionStyle;

  @CommandLine.Option(
      names = "--fallback-group",
      defaultValue = ExtractorOptions.DEFAULT_FALLBACK_GROUP,
      description = "Group for commands nothing else places (default: ${DEFAULT-VALUE})")
  private String fallbackGroup;

  @CommandLine.Option(
      names = "--max-enum-options",
      defaultValue = "50",
      description = "Cap on expanded enumeration options (default: ${DEFAULT-VALUE})")
  private int maxEnumOptions;

  @CommandLine.Option(
      names = "--no-filter",
      description = "Keep every syntax and example line, even ones not starting with the command")
  private boolean noFilter;

  @CommandLine.Option(
      names = "--report-flagged",
      description = "Print commands flagged for review to stderr")
  private boolean reportFlagged;

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() {
    PrintWriter err = spec.commandLine().getErr();
    ExtractorOptions options;
    try {
      options = options();
    } catch (IllegalArgumentException e) {
      err.println("Error: " + e.getMessage());
      return CommandLine.ExitCode.USAGE;
    }

    try {
      List<DocumentBlock> blocks = BlockDumpReader.read(blocksFile);
      CommandIndex index =
          indexFile == null ? CommandIndex.patternBased() : CommandIndexLoader.load(indexFile);
      ExtractionResult result =
          ManualExtractor.extract(
              blocks,
              index,
              options,
              (progress, message) ->
                  log.debug("{} ({}%)", message, Math.round(progress * 100)));

      CommandJsonWriter writer = new CommandJsonWriter();
      JsonObject document = writer.toJson(result, index, manual);
      if (outputFile == null) {
        writer.write(document, spec.commandLine().getOut());
      } else {
        writer.write(document, outputFile);
        log.info("Wrote {} commands to {}", result.totalCommands(), outputFile);
      }

      if (reportFlagged) {
        for (ExtractedCommand command : result.flagged()) {
          err.println("FLAGGED " + command.mnemonic() + " " + command.flags());
        }
      }
      return CommandLine.ExitCode.OK;
    } catch (IOException e) {
      log.debug("Extraction failed", e);
      err.println("Error: " + e.getMessage());
      return CommandLine.ExitCode.SOFTWARE;
    }
  }

  ExtractorOptions options() {
    return ExtractorOptions.builder()
        .headerStyleName(headerStyle)
        .headerFontFamily(resolveHeaderFont(headerFont))
        .headerRequiresBold(!noBold)
        .sectionStyleName(sectionStyle)
        .fallbackGroup(fallbackGroup)
        .filterSyntax(!noFilter)
        .filterExamples(!noFilter)
        .maxEnumOptions(maxEnumOptions)
        .build();
  }

  /**
   * Picks the header font family. An explicit {@code --header-font} is used as given; without it
   * the font comes from, in order:
   *
   * <ol>
   *   <li>the {@value #HEADER_FONT_PROPERTY} system property
   *   <li>the {@value #HEADER_FONT_ENV} environment variable
   * </ol>
   *
   * @return the font family, or {@code null} when none is configured
   */
  static String resolveHeaderFont(String option) {
    if (option != null && !option.isBlank()) {
      return option;
    }

    String sysProp = System.getProperty(HEADER_FONT_PROPERTY);
    if (sysProp != null && !sysProp.isBlank()) {
      return sysProp;
    }

    String envVar = System.getenv(HEADER_FONT_ENV);
    if (envVar != null && !envVar.isBlank()) {
      return envVar;
    }
    return null;
  }
}
