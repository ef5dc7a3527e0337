package ca.gc.cra.replay.api;

import ca.gc.cra.replay.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code replay} command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: replay <publish|convert> [options]";
  private static final String HELP_TEXT = """
      Telemetry log replay

      Usage:
        replay <command> [options]

      Commands:
        publish     Serve the control protocol on stdin/stdout and replay loaded logs to a sink
        convert     Decode a binary log into an interchange CSV

      Global flags:
        --help      Show this message (or <command> --help for command options)
        --verbose   Enable DEBUG logging before dispatching
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a command without terminating the JVM.
   *
   * @param args dispatcher arguments; the first one names the command
   * @return exit code of the command
   */
  static ExitCode run(String[] args) {
    if (args == null || args.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = args[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(args, 1, args.length);
    return switch (command) {
      case "publish" -> PublisherCli.run(delegateArgs);
      case "convert" -> ConvertCli.run(delegateArgs);
      case "--help", "-h", "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      case "--verbose", "-v" -> {
        LoggingConfigurator.enableVerboseLogging();
        yield run(delegateArgs);
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
