package ca.gc.cra.replay.domain.replay;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Derives robot state segments from the driver-station boolean samples of a log.
 *
 * <p>The robot starts disabled at time zero. Each sample for {@link #ENABLED_KEY}, {@link #AUTONOMOUS_KEY}
 * or {@link #ESTOP_KEY} updates its flag; a state change closes the running segment. Zero-length segments
 * are folded into the state that follows them. The last segment ends at the final sample timestamp.</p>
 *
 * @since 0.1.0
 */
public final class TimelineSegmenter {
  public static final String ENABLED_KEY = "DS:enabled";
  public static final String AUTONOMOUS_KEY = "DS:autonomous";
  public static final String ESTOP_KEY = "DS:estop";

  /**
   * Computes the segments.
   *
   * @param samples samples sorted by timestamp
   * @return segments in time order; empty when there are no samples
   */
  public List<TimelineSegment> segment(List<Sample> samples) {
    Objects.requireNonNull(samples, "samples");
    List<TimelineSegment> segments = new ArrayList<>();
    if (samples.isEmpty()) {
      return segments;
    }
    boolean enabled = false;
    boolean autonomous = false;
    boolean estop = false;
    RobotState current = RobotState.DISABLED;
    double start = 0.0;
    double duration = 0.0;
    for (Sample sample : samples) {
      duration = Math.max(duration, sample.timestampSeconds());
      switch (sample.key()) {
        case ENABLED_KEY -> enabled = SinkValues.parseBoolean(sample.value());
        case AUTONOMOUS_KEY -> autonomous = SinkValues.parseBoolean(sample.value());
        case ESTOP_KEY -> estop = SinkValues.parseBoolean(sample.value());
        default -> {
          continue;
        }
      }
      RobotState next = RobotState.of(enabled, autonomous, estop);
      if (next == current) {
        continue;
      }
      double at = sample.timestampSeconds();
      if (at > start) {
        append(segments, new TimelineSegment(start, at, current));
        start = at;
      }
      current = next;
    }
    if (duration > start || segments.isEmpty()) {
      append(segments, new TimelineSegment(start, Math.max(start, duration), current));
    }
    return segments;
  }

  private static void append(List<TimelineSegment> segments, TimelineSegment segment) {
    if (!segments.isEmpty()) {
      TimelineSegment last = segments.get(segments.size() - 1);
      if (last.state() == segment.state() && last.endSeconds() == segment.startSeconds()) {
        segments.set(segments.size() - 1,
            new TimelineSegment(last.startSeconds(), segment.endSeconds(), last.state()));
        return;
      }
    }
    segments.add(segment);
  }
}
