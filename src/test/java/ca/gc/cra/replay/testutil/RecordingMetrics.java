package ca.gc.cra.replay.testutil;

import ca.gc.cra.replay.application.port.MetricsPort;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics port that sums increments and observations per key.
 */
public final class RecordingMetrics implements MetricsPort {
  private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();
  private final Map<String, AtomicLong> observed = new ConcurrentHashMap<>();

  @Override
  public void increment(String key) {
    counters.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
  }

  @Override
  public void observe(String key, long value) {
    observed.computeIfAbsent(key, k -> new AtomicLong()).addAndGet(value);
  }

  public long count(String key) {
    AtomicLong value = counters.get(key);
    return value == null ? 0 : value.get();
  }

  public long observedTotal(String key) {
    AtomicLong value = observed.get(key);
    return value == null ? 0 : value.get();
  }

  public boolean wasObserved(String key) {
    return observed.containsKey(key);
  }
}
