package ca.gc.cra.replay.api;

import ca.gc.cra.replay.api.control.ControlChannel;
import ca.gc.cra.replay.config.CompositionRoot;
import ca.gc.cra.replay.config.PublisherConfig;
import ca.gc.cra.replay.logging.LoggingConfigurator;
import java.io.BufferedReader;
import java.io.FileDescriptor;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code publish} command: runs the timing loop and serves the control protocol on
 * stdin/stdout until {@code QUIT} or end of input.
 *
 * @since 0.1.0
 */
public final class PublisherCli {
  private static final Logger log = LoggerFactory.getLogger(PublisherCli.class);
  private static final String SUMMARY_USAGE =
      "usage: publish [config=PATH] [sink=KAFKA|LOG|NONE] [server=HOST:PORT] [kafkaTopic=TOPIC] "
          + "[periodMillis=N] [maxTimestampSeconds=S] [metricsExporter=otlp|none] [--dry-run]";
  private static final String HELP_TEXT = """
      Replay publisher

      Usage:
        publish [options]

      Options:
        config=PATH               YAML file; its common and publish sections are merged
        sink=KAFKA|LOG|NONE       Sink behind SET_SERVER (default KAFKA)
        server=HOST:PORT          Connect the sink at startup instead of waiting for SET_SERVER
        kafkaTopic=TOPIC          Topic for the Kafka sink ([A-Za-z0-9._-], default replay.values)
        kafkaMaxBlockMs=N         Producer max.block.ms, 0-60000 (default 10)
        periodMillis=N            Frame width in milliseconds, 1-1000 (default 20)
        maxTimestampSeconds=S     Samples after S seconds are ignored (default 1000)
        metricsExporter=otlp|none OpenTelemetry metrics exporter (default otlp)
        otelEndpoint=URL          OTLP endpoint override
        --dry-run                 Print the resolved configuration and exit
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Control protocol (one command per line on stdin, one response per line on stdout):
        SET_SERVER host port | LOAD_CSV path | LOAD_LOG path | SEEK seconds
        PLAY | PAUSE | STOP | PUBLISH_ON | PUBLISH_OFF | QUIT
      """;

  private PublisherCli() {}

  /**
   * Runs the command on the process streams.
   *
   * @param args command arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    BufferedReader stdin = new BufferedReader(
        new InputStreamReader(new FileInputStream(FileDescriptor.in), StandardCharsets.UTF_8));
    return run(args, stdin, CliPrinter.writer());
  }

  /**
   * Runs the command on the given streams.
   *
   * @param args command arguments
   * @param in control requests
   * @param out control responses
   * @return exit code
   */
  static ExitCode run(String[] args, BufferedReader in, Writer out) {
    Objects.requireNonNull(in, "in");
    Objects.requireNonNull(out, "out");
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for publish");
    }

    PublisherConfig config;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArray());
      config = PublisherConfig.fromMap(ConfigCliUtils.effectiveConfig("publish", kv, log));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid publish configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    if (input.hasFlag("--dry-run")) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot(config, config.telemetry())) {
      root.connectConfiguredServer();
      root.timingLoop().start();
      ControlChannel channel =
          new ControlChannel(root.scheduler(), root.loader(), root.sinkConnector(), root.metrics());
      log.info("Publisher ready: sink={} period={}ms", config.sinkType(), config.periodMillis());
      boolean quit = channel.serve(in, out);
      log.info("Publisher stopping ({})", quit ? "QUIT" : "end of input");
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Control stream failure", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Publisher configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in publisher", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(PublisherConfig config) {
    CliPrinter.printLines(
        "Publish dry-run: nothing will be served.",
        " Sink             : " + config.sinkType(),
        " Kafka topic      : " + config.kafkaTopic(),
        " Kafka max block  : " + config.kafkaMaxBlockMs() + " ms",
        " Startup server   : " + config.server().map(Object::toString).orElse("<none>"),
        " Frame period     : " + config.periodMillis() + " ms",
        " Replay window    : 0 - " + config.maxTimestampSeconds() + " s",
        " Metrics exporter : " + config.telemetry().metricsExporter(),
        " Re-run without --dry-run to start the publisher.");
  }
}
