package ca.gc.cra.replay.application.port;

/**
 * <strong>What:</strong> Port supplying monotonic time to the playback scheduler and timing loop.
 * <p><strong>Why:</strong> Replay pacing must not jump when the wall clock is adjusted, and tests need to
 * drive time explicitly.</p>
 * <p><strong>Role:</strong> Domain port consumed by application use cases.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; the control and timing threads
 * both read the clock.</p>
 *
 * @implNote Default implementation delegates to {@link System#nanoTime()}.
 * @since 0.1.0
 * @see ca.gc.cra.replay.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current monotonic time.
   *
   * @return nanoseconds from an arbitrary fixed origin; only differences are meaningful
   */
  long nanoTime();

  /** Default {@link ClockPort} using {@link System#nanoTime()}. */
  ClockPort SYSTEM = System::nanoTime;
}
