package ca.gc.cra.replay.domain.replay;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Buckets samples into fixed-width frames; within a slot the last sample per key wins.
 *
 * <p>Slots are computed on integer microseconds so decimal timestamps land in the slot their decimal
 * value names (for example {@code 0.02} falls in slot 1 at a 20 ms period).</p>
 *
 * @since 0.1.0
 */
public final class FrameCoalescer {
  /** Default slot width: 20 ms. */
  public static final long DEFAULT_PERIOD_MICROS = 20_000L;

  private final long periodMicros;

  /**
   * Creates a coalescer.
   *
   * @param periodMicros slot width in microseconds; must be positive
   */
  public FrameCoalescer(long periodMicros) {
    if (periodMicros <= 0) {
      throw new IllegalArgumentException("periodMicros must be positive");
    }
    this.periodMicros = periodMicros;
  }

  /**
   * Builds the frame timeline for a sample list.
   *
   * @param samples samples in playback order (timestamps must be non-negative)
   * @return timeline with {@code floor(lastTimestamp / period) + 1} frames, or an empty timeline
   */
  public FrameTimeline coalesce(List<Sample> samples) {
    Objects.requireNonNull(samples, "samples");
    if (samples.isEmpty()) {
      return FrameTimeline.empty(periodMicros);
    }
    long lastSlot = 0;
    for (Sample sample : samples) {
      lastSlot = Math.max(lastSlot, slotOf(sample.timestampSeconds()));
    }
    if (lastSlot >= Integer.MAX_VALUE) {
      throw new IllegalArgumentException("timeline too long: " + lastSlot + " slots");
    }
    int frameCount = (int) lastSlot + 1;
    List<Map<String, SampleValue>> slots = new ArrayList<>(frameCount);
    for (int i = 0; i < frameCount; i++) {
      slots.add(null);
    }
    for (Sample sample : samples) {
      int slot = (int) slotOf(sample.timestampSeconds());
      Map<String, SampleValue> values = slots.get(slot);
      if (values == null) {
        values = new LinkedHashMap<>();
        slots.set(slot, values);
      }
      values.put(sample.key(), sample.toSampleValue());
    }
    List<Frame> frames = new ArrayList<>(frameCount);
    for (Map<String, SampleValue> values : slots) {
      frames.add(values == null ? Frame.EMPTY : Frame.of(values));
    }
    return new FrameTimeline(frames, periodMicros);
  }

  /**
   * Returns the slot a timestamp falls into.
   *
   * @param timestampSeconds non-negative timestamp
   * @return slot index
   */
  public long slotOf(double timestampSeconds) {
    if (!(timestampSeconds >= 0)) {
      throw new IllegalArgumentException("timestamp must be >= 0 (was " + timestampSeconds + ")");
    }
    return Math.round(timestampSeconds * 1_000_000.0) / periodMicros;
  }

  /**
   * Returns the configured slot width.
   *
   * @return period in microseconds
   */
  public long periodMicros() {
    return periodMicros;
  }
}
