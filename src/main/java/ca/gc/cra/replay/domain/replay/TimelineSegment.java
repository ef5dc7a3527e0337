package ca.gc.cra.replay.domain.replay;

import java.util.Objects;

/**
 * Contiguous interval during which the robot stayed in one state.
 *
 * @param startSeconds inclusive start
 * @param endSeconds exclusive end
 * @param state robot state for the interval
 * @since 0.1.0
 */
public record TimelineSegment(double startSeconds, double endSeconds, RobotState state) {
  /**
   * Validates the interval.
   */
  public TimelineSegment {
    Objects.requireNonNull(state, "state");
    if (endSeconds < startSeconds) {
      throw new IllegalArgumentException("segment end precedes start");
    }
  }

  /**
   * Returns the segment length.
   *
   * @return end minus start, in seconds
   */
  public double durationSeconds() {
    return endSeconds - startSeconds;
  }
}
