package ca.gc.cra.replay.domain.log;

import ca.gc.cra.replay.domain.replay.Sample;
import java.util.List;
import java.util.Objects;

/**
 * Result of projecting a record stream into samples.
 *
 * @param samples samples in record order
 * @param controlRecords control records seen (recognized or not)
 * @param droppedRecords data records referencing an unknown or retired entry
 * @param malformedValues data records whose payload did not fit the entry type
 * @since 0.1.0
 */
public record LogProjection(
    List<Sample> samples, long controlRecords, long droppedRecords, long malformedValues) {
  /**
   * Copies the sample list.
   */
  public LogProjection {
    samples = List.copyOf(Objects.requireNonNull(samples, "samples"));
  }
}
