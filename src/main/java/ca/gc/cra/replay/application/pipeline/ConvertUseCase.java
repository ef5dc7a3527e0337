package ca.gc.cra.replay.application.pipeline;

import ca.gc.cra.replay.application.port.InterchangeFilePort;
import ca.gc.cra.replay.domain.log.LogProjection;
import ca.gc.cra.replay.domain.replay.Sample;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a binary log into an interchange CSV.
 *
 * <p>Every projected sample is written in record order. Window filtering and sorting happen when the
 * file is loaded, so the CSV stays a faithful copy of the log.</p>
 *
 * @since 0.1.0
 */
public final class ConvertUseCase {
  private static final Logger log = LoggerFactory.getLogger(ConvertUseCase.class);

  private final LogLoadUseCase loader;
  private final InterchangeFilePort interchange;

  /**
   * Creates the converter.
   *
   * @param loader decoder used for projection and segmentation
   * @param interchange CSV writer
   */
  public ConvertUseCase(LogLoadUseCase loader, InterchangeFilePort interchange) {
    this.loader = Objects.requireNonNull(loader, "loader");
    this.interchange = Objects.requireNonNull(interchange, "interchange");
  }

  /**
   * Decodes {@code input} and writes {@code output}.
   *
   * @param input binary log
   * @param output CSV destination; replaced if present
   * @return counts, duration and segments
   * @throws IOException when reading or writing fails
   */
  public ConvertSummary convert(Path input, Path output) throws IOException {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(output, "output");
    LogProjection projection = loader.decode(input);
    List<Sample> samples = projection.samples();
    interchange.write(output, samples);

    List<Sample> sorted = new ArrayList<>(samples);
    sorted.sort(Sample.BY_TIMESTAMP);
    double duration = sorted.isEmpty() ? 0.0 : sorted.get(sorted.size() - 1).timestampSeconds();
    LoadedLog loaded = loader.normalize(sorted);
    log.info("Converted {} -> {} ({} samples)", input, output, samples.size());
    return new ConvertSummary(
        output,
        samples.size(),
        projection.controlRecords(),
        projection.droppedRecords(),
        projection.malformedValues(),
        duration,
        loaded.segments());
  }
}
