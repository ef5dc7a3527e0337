package ca.gc.cra.replay.api;

import ca.gc.cra.replay.application.pipeline.ConvertSummary;
import ca.gc.cra.replay.config.CompositionRoot;
import ca.gc.cra.replay.config.ConvertConfig;
import ca.gc.cra.replay.config.PublisherConfig;
import ca.gc.cra.replay.domain.replay.TimelineSegment;
import ca.gc.cra.replay.logging.LoggingConfigurator;
import ca.gc.cra.replay.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code convert} command: binary log in, interchange CSV out.
 *
 * @since 0.1.0
 */
public final class ConvertCli {
  private static final Logger log = LoggerFactory.getLogger(ConvertCli.class);
  private static final String SUMMARY_USAGE =
      "usage: convert in=LOG [out=CSV] [config=PATH] [--dry-run] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      Binary log converter

      Usage:
        convert in=LOG [out=CSV] [options]

      Options:
        in=PATH             Binary log to decode (required)
        out=PATH            CSV to write (default: input name with .csv)
        config=PATH         YAML file; its common and convert sections are merged
        --allow-overwrite   Replace an existing output file
        --dry-run           Validate paths and print the plan without decoding
        --verbose           Enable DEBUG logging
        --help              Show this message
      """;

  private ConvertCli() {}

  /**
   * Runs the command.
   *
   * @param args command arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for convert");
    }
    boolean dryRun = input.hasFlag("--dry-run");
    boolean allowOverwrite = input.hasFlag("--allow-overwrite");

    ConvertConfig config;
    Path in;
    Path out;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArray());
      config = ConvertConfig.fromMap(ConfigCliUtils.effectiveConfig("convert", kv, log));
      in = Paths.requireReadableFile(config.input());
      out = Paths.validateOutputFile(config.output(), allowOverwrite, !dryRun);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid convert arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    if (dryRun) {
      CliPrinter.printLines(
          "Convert dry-run: no file will be written.",
          " Input            : " + in,
          " Output           : " + out,
          " Allow overwrite  : " + allowOverwrite,
          " Re-run without --dry-run to convert.");
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot(PublisherConfig.defaults(), config.telemetry())) {
      ConvertSummary summary = root.converter().convert(in, out);
      printSummary(in, summary);
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Conversion I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Conversion configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in convert", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printSummary(Path in, ConvertSummary summary) {
    CliPrinter.printLines(
        "Converted " + in + " -> " + summary.output(),
        " Samples          : " + summary.samples(),
        " Control records  : " + summary.controlRecords(),
        " Dropped records  : " + summary.droppedRecords(),
        " Malformed values : " + summary.malformedValues(),
        " Duration         : " + String.format(Locale.ROOT, "%.3f s", summary.durationSeconds()),
        " Segments         : " + summary.segments().size());
    for (TimelineSegment segment : summary.segments()) {
      CliPrinter.println(String.format(Locale.ROOT, "   %9.3f - %9.3f  %s",
          segment.startSeconds(), segment.endSeconds(), segment.state().label()));
    }
  }
}
