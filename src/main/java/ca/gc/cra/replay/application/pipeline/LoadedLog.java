package ca.gc.cra.replay.application.pipeline;

import ca.gc.cra.replay.domain.replay.FrameTimeline;
import ca.gc.cra.replay.domain.replay.TimelineSegment;
import java.util.List;
import java.util.Objects;

/**
 * Fully computed result of loading a log, ready to be swapped into the scheduler.
 *
 * @param timeline coalesced frames
 * @param segments robot state segments
 * @param sampleCount samples kept after window filtering
 * @param durationSeconds timestamp of the last kept sample, or zero when there are none
 * @since 0.1.0
 */
public record LoadedLog(
    FrameTimeline timeline, List<TimelineSegment> segments, int sampleCount, double durationSeconds) {
  /**
   * Validates and copies.
   */
  public LoadedLog {
    Objects.requireNonNull(timeline, "timeline");
    segments = List.copyOf(Objects.requireNonNull(segments, "segments"));
  }
}
