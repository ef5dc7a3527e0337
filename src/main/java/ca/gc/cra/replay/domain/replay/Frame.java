package ca.gc.cra.replay.domain.replay;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable key to value mapping for one fixed-width time slot.
 *
 * @since 0.1.0
 */
public final class Frame {
  /** Shared frame for slots with no samples. */
  public static final Frame EMPTY = new Frame(Map.of());

  private final Map<String, SampleValue> values;

  private Frame(Map<String, SampleValue> values) {
    this.values = values;
  }

  /**
   * Creates a frame from a key/value map, preserving iteration order.
   *
   * @param values values keyed by entry name
   * @return frame holding a copy of {@code values}
   */
  public static Frame of(Map<String, SampleValue> values) {
    Objects.requireNonNull(values, "values");
    if (values.isEmpty()) {
      return EMPTY;
    }
    return new Frame(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
  }

  /**
   * Returns the value held for {@code key}.
   *
   * @param key entry name
   * @return value or {@code null} when the key has no sample in this slot
   */
  public SampleValue get(String key) {
    return values.get(key);
  }

  /**
   * Returns an unmodifiable view of all values.
   *
   * @return values keyed by entry name, in first-write order
   */
  public Map<String, SampleValue> values() {
    return values;
  }

  /**
   * Computes the keys whose value is new or changed relative to {@code previous}.
   *
   * <p>Keys present in {@code previous} but absent here are not reported.</p>
   *
   * @param previous the previously emitted frame; {@code null} is treated as {@link #EMPTY}
   * @return changed values in this frame's iteration order
   */
  public Map<String, SampleValue> changesSince(Frame previous) {
    Frame baseline = previous == null ? EMPTY : previous;
    if (baseline == this) {
      return Map.of();
    }
    Map<String, SampleValue> changed = new LinkedHashMap<>();
    for (Map.Entry<String, SampleValue> entry : values.entrySet()) {
      if (!entry.getValue().equals(baseline.values.get(entry.getKey()))) {
        changed.put(entry.getKey(), entry.getValue());
      }
    }
    return changed;
  }

  /**
   * Returns the number of keys in this frame.
   *
   * @return key count
   */
  public int size() {
    return values.size();
  }

  /**
   * Indicates whether the slot had no samples.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return values.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Frame that && values.equals(that.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "Frame" + values;
  }
}
