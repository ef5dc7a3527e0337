package ca.gc.cra.replay.infrastructure.sink;

import ca.gc.cra.replay.application.port.KeyValueSink;
import ca.gc.cra.replay.application.port.MetricsPort;
import ca.gc.cra.replay.domain.replay.SampleValue;
import ca.gc.cra.replay.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link KeyValueSink} decorator that hands writes to a bounded queue drained by one
 * dedicated sink thread.
 * <p><strong>Role:</strong> Sits between the timing thread and a sink whose {@code put} may block, such as a
 * Kafka producer waiting for metadata from an absent broker.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return from {@link #put} without touching the delegate.</li>
 *   <li>Drop and count writes when the queue is full.</li>
 *   <li>Preserve per-key order; a single thread drains the queue.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #put} may be called from any thread; {@link #close()} is
 * idempotent.</p>
 * <p><strong>Observability:</strong> {@code sink.queue.dropped} and {@code sink.queue.error} counters.</p>
 *
 * @since 0.1.0
 */
public final class QueueingKeyValueSink implements KeyValueSink {
  private static final Logger log = LoggerFactory.getLogger(QueueingKeyValueSink.class);
  private static final long POLL_MILLIS = 50L;

  /** Default number of writes held while the delegate catches up. */
  public static final int DEFAULT_CAPACITY = 4_096;

  private final KeyValueSink delegate;
  private final MetricsPort metrics;
  private final BlockingQueue<Update> queue;
  private final Duration closeTimeout;
  private final Thread drainer;
  private volatile boolean running = true;

  private record Update(String key, SampleValue value) {}

  /**
   * Creates the decorator and starts its drain thread.
   *
   * @param delegate sink that performs the actual writes
   * @param capacity maximum queued writes; must be positive
   * @param closeTimeout how long {@link #close()} waits for the drain thread
   * @param metrics metrics sink
   */
  public QueueingKeyValueSink(KeyValueSink delegate, int capacity, Duration closeTimeout, MetricsPort metrics) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.closeTimeout = Objects.requireNonNull(closeTimeout, "closeTimeout");
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.drainer = ExecutorFactories.newServiceThreadFactory("replay-sink", null).newThread(this::drain);
    this.drainer.start();
  }

  /**
   * Queues a write for the drain thread.
   *
   * @param key entry name
   * @param value value to write
   * @throws IllegalStateException after {@link #close()}
   */
  @Override
  public void put(String key, SampleValue value) {
    if (!running) {
      throw new IllegalStateException("sink closed: " + delegate.describe());
    }
    if (!queue.offer(new Update(key, value))) {
      metrics.increment("sink.queue.dropped");
      log.debug("Sink queue full; dropped update for key {}", key);
    }
  }

  @Override
  public String describe() {
    return delegate.describe();
  }

  /**
   * Number of writes waiting for the drain thread.
   *
   * @return queue depth
   */
  public int pending() {
    return queue.size();
  }

  /**
   * Stops the drain thread, discards writes still queued and closes the delegate.
   */
  @Override
  public void close() {
    if (!running) {
      return;
    }
    running = false;
    try {
      drainer.join(closeTimeout.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    if (drainer.isAlive()) {
      log.warn("Sink thread for {} still busy after {} ms; interrupting", delegate.describe(),
          closeTimeout.toMillis());
      drainer.interrupt();
    }
    int discarded = queue.size();
    queue.clear();
    if (discarded > 0) {
      log.info("Discarded {} queued updates for {}", discarded, delegate.describe());
    }
    delegate.close();
  }

  private void drain() {
    while (running) {
      Update update;
      try {
        update = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return;
      }
      if (update == null) {
        continue;
      }
      try {
        delegate.put(update.key(), update.value());
      } catch (RuntimeException ex) {
        metrics.increment("sink.queue.error");
        log.warn("Sink write failed for key {}: {}", update.key(), ex.getMessage());
        log.debug("Sink write failure detail", ex);
      }
    }
  }
}
