package ca.gc.cra.replay.application.playback;

import ca.gc.cra.replay.application.port.ClockPort;
import ca.gc.cra.replay.application.port.MetricsPort;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.locks.LockSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Dedicated thread that ticks the {@link PlaybackScheduler} once per period.
 * <p><strong>Why:</strong> Keeps replay aligned with the monotonic clock independently of control traffic.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Sleep until an explicit deadline, parking first and spinning for the final stretch.</li>
 *   <li>Advance the deadline on a fixed grid, skipping whole periods after a stall.</li>
 *   <li>Stop promptly once {@link #close()} is called.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #start()} and {@link #close()} may be called from any thread; the
 * loop body runs on its own thread only.</p>
 * <p><strong>Observability:</strong> {@code replay.tick.missed} records skipped periods;
 * {@code replay.tick.error} counts unexpected tick failures.</p>
 *
 * @since 0.1.0
 */
public final class TimingLoop implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TimingLoop.class);
  private static final long SPIN_WINDOW_NANOS = 1_000_000L;
  private static final Duration JOIN_TIMEOUT = Duration.ofSeconds(2);

  private final PlaybackScheduler scheduler;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final long periodNanos;
  private final ThreadFactory threadFactory;

  private volatile boolean cancelled;
  private Thread thread;

  /**
   * Creates a loop; call {@link #start()} to begin ticking.
   *
   * @param scheduler scheduler to drive
   * @param clock monotonic clock shared with the scheduler
   * @param metrics metrics sink
   * @param threadFactory factory for the loop thread
   */
  public TimingLoop(
      PlaybackScheduler scheduler, ClockPort clock, MetricsPort metrics, ThreadFactory threadFactory) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
    this.periodNanos = scheduler.periodMicros() * 1_000L;
  }

  /** Starts the loop thread. */
  public synchronized void start() {
    if (thread != null) {
      throw new IllegalStateException("timing loop already started");
    }
    thread = threadFactory.newThread(this::run);
    thread.start();
    log.info("Timing loop started with period {} us", periodNanos / 1_000L);
  }

  /**
   * Computes the deadline after {@code previous} given the time the last tick ran.
   *
   * <p>Normally the deadline advances by one period. When the loop has fallen more than one period behind,
   * the missed periods are skipped so that the next deadline is the first grid point after {@code now}.</p>
   *
   * @param previous deadline of the tick that just ran
   * @param now time the tick ran
   * @param period period in nanoseconds
   * @return next deadline
   */
  static long nextDeadline(long previous, long now, long period) {
    long next = previous + period;
    long behind = now - next;
    if (behind > period) {
      next += (behind / period + 1) * period;
    }
    return next;
  }

  /**
   * Indicates whether the loop thread is alive.
   *
   * @return {@code true} while running
   */
  public synchronized boolean isRunning() {
    return thread != null && thread.isAlive();
  }

  /** Cancels the loop and waits briefly for the thread to exit. */
  @Override
  public void close() {
    cancelled = true;
    Thread running;
    synchronized (this) {
      running = thread;
    }
    if (running == null || running == Thread.currentThread()) {
      return;
    }
    running.interrupt();
    try {
      running.join(JOIN_TIMEOUT.toMillis());
      if (running.isAlive()) {
        log.warn("Timing loop did not stop within {}", JOIN_TIMEOUT);
      } else {
        log.info("Timing loop stopped");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for timing loop to stop");
    }
  }

  private void run() {
    long deadline = clock.nanoTime();
    while (!cancelled) {
      if (!sleepUntil(deadline)) {
        break;
      }
      long now = clock.nanoTime();
      try {
        scheduler.tick(now);
      } catch (RuntimeException ex) {
        metrics.increment("replay.tick.error");
        log.error("Playback tick failed", ex);
      }
      long next = nextDeadline(deadline, now, periodNanos);
      long skipped = (next - deadline) / periodNanos - 1;
      if (skipped > 0) {
        metrics.observe("replay.tick.missed", skipped);
        log.debug("Timing loop fell behind; skipped {} periods", skipped);
      }
      deadline = next;
    }
  }

  private boolean sleepUntil(long deadline) {
    while (!cancelled) {
      long remaining = deadline - clock.nanoTime();
      if (remaining <= 0) {
        return true;
      }
      if (remaining > SPIN_WINDOW_NANOS) {
        LockSupport.parkNanos(remaining - SPIN_WINDOW_NANOS);
      } else {
        Thread.onSpinWait();
      }
    }
    return false;
  }
}
