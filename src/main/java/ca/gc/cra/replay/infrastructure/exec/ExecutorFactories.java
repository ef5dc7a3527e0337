package ca.gc.cra.replay.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the named threads the replay process runs.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds a thread factory for long-lived service threads such as the timing loop.
   *
   * <p>Threads are daemons at maximum priority so they never keep the JVM alive after the control channel
   * exits.</p>
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on each thread; {@code null} logs at ERROR
   * @return configured thread factory
   */
  public static ThreadFactory newServiceThreadFactory(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "replay" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler,
        (t, ex) -> log.error("Uncaught exception in {}", t.getName(), ex));
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(true);
      thread.setPriority(Thread.MAX_PRIORITY);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
