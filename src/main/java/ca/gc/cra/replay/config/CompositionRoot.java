package ca.gc.cra.replay.config;

import ca.gc.cra.replay.adapter.kafka.KafkaSinkConnector;
import ca.gc.cra.replay.application.pipeline.ConvertUseCase;
import ca.gc.cra.replay.application.pipeline.LogLoadUseCase;
import ca.gc.cra.replay.application.playback.PlaybackScheduler;
import ca.gc.cra.replay.application.playback.TimingLoop;
import ca.gc.cra.replay.application.port.ClockPort;
import ca.gc.cra.replay.application.port.InterchangeFilePort;
import ca.gc.cra.replay.application.port.KeyValueSink;
import ca.gc.cra.replay.application.port.MetricsPort;
import ca.gc.cra.replay.application.port.SinkConnector;
import ca.gc.cra.replay.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.replay.infrastructure.interchange.CsvInterchangeFile;
import ca.gc.cra.replay.infrastructure.metrics.MetricsSettings;
import ca.gc.cra.replay.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.replay.infrastructure.sink.DiscardingKeyValueSink;
import ca.gc.cra.replay.infrastructure.sink.LoggingSinkConnector;
import ca.gc.cra.replay.infrastructure.time.SystemClockAdapter;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Per-process context object that wires the replay components.
 * <p><strong>Why:</strong> Keeps every collaborator explicit; nothing in the process is a global singleton.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning load, playback, sink and control stages.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Translate {@link PublisherConfig} and {@link TelemetryConfig} into concrete adapters.</li>
 *   <li>Own the scheduler, timing loop and metrics adapter, and close them in reverse order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Build and close on one thread; components are created once and cached.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);

  private final PublisherConfig config;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final AutoCloseable metricsResource;
  private final InterchangeFilePort interchange = new CsvInterchangeFile();

  private LogLoadUseCase loader;
  private PlaybackScheduler scheduler;
  private TimingLoop timingLoop;

  /**
   * Creates a root exporting metrics as configured.
   *
   * @param config publisher settings
   * @param telemetry metrics settings
   */
  public CompositionRoot(PublisherConfig config, TelemetryConfig telemetry) {
    this(config, new SystemClockAdapter(), new OpenTelemetryMetricsAdapter(metricsSettings(telemetry)));
  }

  /**
   * Creates a root with explicit clock and metrics, used by tests.
   *
   * @param config publisher settings
   * @param clock monotonic clock
   * @param metrics metrics sink; closed with the root when it is {@link AutoCloseable}
   */
  public CompositionRoot(PublisherConfig config, ClockPort clock, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.metricsResource = metrics instanceof AutoCloseable closeable ? closeable : null;
  }

  /**
   * Maps telemetry options onto exporter settings.
   *
   * @param telemetry validated options
   * @return exporter settings
   */
  public static MetricsSettings metricsSettings(TelemetryConfig telemetry) {
    return new MetricsSettings(
        telemetry.metricsExporter(), telemetry.otelEndpoint(), telemetry.otelResourceAttributes(), EXPORT_INTERVAL);
  }

  /**
   * Returns the metrics port shared by all components.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Returns the interchange CSV adapter.
   *
   * @return interchange port
   */
  public InterchangeFilePort interchange() {
    return interchange;
  }

  /**
   * Returns the loader, creating it on first use.
   *
   * @return loader bound to the configured period and window
   */
  public LogLoadUseCase loader() {
    if (loader == null) {
      loader = new LogLoadUseCase(interchange, metrics, config.periodMicros(), config.maxTimestampSeconds());
    }
    return loader;
  }

  /**
   * Returns a converter sharing this root's loader.
   *
   * @return converter
   */
  public ConvertUseCase converter() {
    return new ConvertUseCase(loader(), interchange);
  }

  /**
   * Returns the scheduler, creating it on first use.
   *
   * @return scheduler
   */
  public PlaybackScheduler scheduler() {
    if (scheduler == null) {
      scheduler = new PlaybackScheduler(clock, metrics, config.periodMicros(), config.maxTimestampSeconds());
    }
    return scheduler;
  }

  /**
   * Returns the connector matching {@link PublisherConfig#sinkType()}.
   *
   * @return sink connector
   */
  public SinkConnector sinkConnector() {
    return switch (config.sinkType()) {
      case KAFKA -> new KafkaSinkConnector(config.kafkaTopic(), config.kafkaMaxBlockMs(), metrics);
      case LOG -> new LoggingSinkConnector(metrics);
      case NONE -> DiscardingKeyValueSink.connector(metrics);
    };
  }

  /**
   * Returns the timing loop, creating it on first use. The loop is not started.
   *
   * @return timing loop
   */
  public TimingLoop timingLoop() {
    if (timingLoop == null) {
      timingLoop = new TimingLoop(scheduler(), clock, metrics,
          ExecutorFactories.newServiceThreadFactory("replay-timing", null));
    }
    return timingLoop;
  }

  /**
   * Connects the startup server, when one is configured.
   *
   * @return the connected sink, or empty when no server is configured
   * @throws IllegalArgumentException when the connection cannot be set up
   */
  public Optional<KeyValueSink> connectConfiguredServer() {
    if (config.server().isEmpty()) {
      return Optional.empty();
    }
    var target = config.server().get();
    KeyValueSink sink = sinkConnector().connect(target.host(), target.port());
    scheduler().setSink(sink);
    log.info("Connected startup sink {}", sink.describe());
    return Optional.of(sink);
  }

  @Override
  public void close() {
    if (timingLoop != null) {
      timingLoop.close();
    }
    if (scheduler != null) {
      scheduler.close();
    }
    if (metricsResource != null) {
      try {
        metricsResource.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics exporter", ex);
      }
    }
  }
}
