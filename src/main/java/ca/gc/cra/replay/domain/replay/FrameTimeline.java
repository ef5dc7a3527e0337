package ca.gc.cra.replay.domain.replay;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable sequence of frames at a fixed period.
 * <p><strong>Role:</strong> Handed from the load pipeline to the playback scheduler by reference swap.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across the control and timing threads.</p>
 *
 * @since 0.1.0
 */
public final class FrameTimeline {
  private final List<Frame> frames;
  private final long periodMicros;

  /**
   * Creates a timeline.
   *
   * @param frames frames in slot order; copied
   * @param periodMicros slot width in microseconds; must be positive
   */
  public FrameTimeline(List<Frame> frames, long periodMicros) {
    if (periodMicros <= 0) {
      throw new IllegalArgumentException("periodMicros must be positive");
    }
    this.frames = List.copyOf(Objects.requireNonNull(frames, "frames"));
    this.periodMicros = periodMicros;
  }

  /**
   * Creates a timeline with no frames.
   *
   * @param periodMicros slot width in microseconds
   * @return empty timeline
   */
  public static FrameTimeline empty(long periodMicros) {
    return new FrameTimeline(List.of(), periodMicros);
  }

  /**
   * Returns the frame for slot {@code index}.
   *
   * @param index slot index
   * @return frame at that slot
   * @throws IndexOutOfBoundsException when {@code index} is outside {@code [0, frameCount)}
   */
  public Frame frame(int index) {
    return frames.get(index);
  }

  /**
   * Returns the number of slots.
   *
   * @return frame count
   */
  public int frameCount() {
    return frames.size();
  }

  /**
   * Indicates whether the timeline holds no frames.
   *
   * @return {@code true} when there is nothing to play
   */
  public boolean isEmpty() {
    return frames.isEmpty();
  }

  /**
   * Returns the slot width.
   *
   * @return period in microseconds
   */
  public long periodMicros() {
    return periodMicros;
  }

  /**
   * Returns the slot width in nanoseconds.
   *
   * @return period in nanoseconds
   */
  public long periodNanos() {
    return periodMicros * 1_000L;
  }

  /**
   * Returns the covered duration.
   *
   * @return frame count times period, in seconds
   */
  public double durationSeconds() {
    return frames.size() * (periodMicros / 1_000_000.0);
  }

  @Override
  public String toString() {
    return "FrameTimeline{frames=" + frames.size() + ", periodMicros=" + periodMicros + '}';
  }
}
