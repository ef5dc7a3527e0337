package ca.gc.cra.replay.application.port;

import ca.gc.cra.replay.domain.replay.Sample;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Port to the tabular interchange file that carries decoded samples between the converter and the
 * publisher.
 *
 * @since 0.1.0
 */
public interface InterchangeFilePort {
  /**
   * Reads every well-formed row of an interchange file.
   *
   * @param path file to read
   * @return samples in file order; rows with an unparsable timestamp or too few columns are skipped
   * @throws IOException when the file cannot be read
   */
  List<Sample> read(Path path) throws IOException;

  /**
   * Writes samples with a header row, replacing any existing file.
   *
   * @param path destination
   * @param samples samples to write, in order
   * @throws IOException when the file cannot be written
   */
  void write(Path path, List<Sample> samples) throws IOException;
}
