package ca.gc.cra.replay.infrastructure.time;

import ca.gc.cra.replay.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#nanoTime()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /**
   * Creates a system clock adapter.
   */
  public SystemClockAdapter() {}

  /**
   * Returns the JVM monotonic time.
   *
   * @return nanoseconds from an arbitrary origin
   */
  @Override
  public long nanoTime() {
    return System.nanoTime();
  }
}
