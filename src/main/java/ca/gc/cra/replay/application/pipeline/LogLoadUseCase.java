package ca.gc.cra.replay.application.pipeline;

import ca.gc.cra.replay.application.port.InterchangeFilePort;
import ca.gc.cra.replay.application.port.MetricsPort;
import ca.gc.cra.replay.domain.log.LogCodec;
import ca.gc.cra.replay.domain.log.LogProjection;
import ca.gc.cra.replay.domain.log.LogProjector;
import ca.gc.cra.replay.domain.replay.FrameCoalescer;
import ca.gc.cra.replay.domain.replay.FrameTimeline;
import ca.gc.cra.replay.domain.replay.Sample;
import ca.gc.cra.replay.domain.replay.TimelineSegment;
import ca.gc.cra.replay.domain.replay.TimelineSegmenter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads an interchange CSV or a binary log into a {@link LoadedLog}.
 * <p><strong>Role:</strong> Batch pipeline invoked by the control channel before a timeline swap.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Decode and project binary logs, or read interchange rows.</li>
 *   <li>Keep samples inside {@code [0, maxTimestampSeconds]} and stable-sort them by timestamp.</li>
 *   <li>Coalesce frames and derive robot state segments.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from collaborators; safe to call from one control thread.</p>
 * <p><strong>Observability:</strong> Counters {@code load.samples}, {@code load.records.control},
 * {@code load.records.dropped}, {@code load.values.malformed}.</p>
 *
 * @since 0.1.0
 */
public final class LogLoadUseCase {
  private static final Logger log = LoggerFactory.getLogger(LogLoadUseCase.class);

  private final InterchangeFilePort interchange;
  private final MetricsPort metrics;
  private final FrameCoalescer coalescer;
  private final TimelineSegmenter segmenter = new TimelineSegmenter();
  private final LogProjector projector = new LogProjector();
  private final double maxTimestampSeconds;

  /**
   * Creates the use case.
   *
   * @param interchange interchange file reader
   * @param metrics metrics sink
   * @param periodMicros frame width
   * @param maxTimestampSeconds inclusive upper bound of kept samples
   */
  public LogLoadUseCase(
      InterchangeFilePort interchange, MetricsPort metrics, long periodMicros, double maxTimestampSeconds) {
    this.interchange = Objects.requireNonNull(interchange, "interchange");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.coalescer = new FrameCoalescer(periodMicros);
    this.maxTimestampSeconds = maxTimestampSeconds;
  }

  /**
   * Loads an interchange CSV.
   *
   * @param path file to read
   * @return computed timeline and segments
   * @throws IOException when the file cannot be read
   */
  public LoadedLog loadCsv(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    List<Sample> rows = interchange.read(path);
    LoadedLog loaded = normalize(rows);
    log.info("Loaded interchange file {}: {} rows, {} kept, {} frames, {}s",
        path, rows.size(), loaded.sampleCount(), loaded.timeline().frameCount(), loaded.durationSeconds());
    return loaded;
  }

  /**
   * Decodes a binary log directly.
   *
   * @param path log file
   * @return computed timeline and segments
   * @throws IOException when the file cannot be read
   */
  public LoadedLog loadLog(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    LogProjection projection = decode(path);
    LoadedLog loaded = normalize(projection.samples());
    log.info("Loaded binary log {}: {} samples kept, {} frames, {}s",
        path, loaded.sampleCount(), loaded.timeline().frameCount(), loaded.durationSeconds());
    return loaded;
  }

  /**
   * Decodes and projects a binary log without coalescing.
   *
   * @param path log file
   * @return samples in record order with counters
   * @throws IOException when the file cannot be read
   */
  public LogProjection decode(Path path) throws IOException {
    LogCodec codec = LogCodec.fromFile(path);
    if (!codec.hasValidPrologue()) {
      log.warn("{} does not start with the WPILOG magic; decoding anyway", path);
    }
    LogProjection projection = projector.project(codec.records());
    metrics.observe("load.records.control", projection.controlRecords());
    metrics.observe("load.records.dropped", projection.droppedRecords());
    metrics.observe("load.values.malformed", projection.malformedValues());
    if (projection.malformedValues() > 0) {
      log.debug("{} values in {} could not be decoded", projection.malformedValues(), path);
    }
    return projection;
  }

  /**
   * Filters to the replay window, stable-sorts, coalesces and segments.
   *
   * @param samples samples in any order
   * @return computed result
   */
  public LoadedLog normalize(List<Sample> samples) {
    List<Sample> kept = new ArrayList<>(samples.size());
    for (Sample sample : samples) {
      double t = sample.timestampSeconds();
      if (t >= 0.0 && t <= maxTimestampSeconds) {
        kept.add(sample);
      }
    }
    kept.sort(Sample.BY_TIMESTAMP);
    FrameTimeline timeline = coalescer.coalesce(kept);
    List<TimelineSegment> segments = segmenter.segment(kept);
    double duration = kept.isEmpty() ? 0.0 : kept.get(kept.size() - 1).timestampSeconds();
    metrics.observe("load.samples", kept.size());
    return new LoadedLog(timeline, segments, kept.size(), duration);
  }
}
