package ca.gc.cra.replay.application.pipeline;

import ca.gc.cra.replay.domain.replay.TimelineSegment;
import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one {@link ConvertUseCase#convert} run.
 *
 * @param output file written
 * @param samples rows written
 * @param controlRecords control records seen
 * @param droppedRecords data records without a live entry
 * @param malformedValues values written empty because their payload did not decode
 * @param durationSeconds largest sample timestamp
 * @param segments robot state segments
 * @since 0.1.0
 */
public record ConvertSummary(
    Path output,
    int samples,
    long controlRecords,
    long droppedRecords,
    long malformedValues,
    double durationSeconds,
    List<TimelineSegment> segments) {
  /**
   * Copies the segment list.
   */
  public ConvertSummary {
    segments = List.copyOf(segments);
  }
}
