package ca.gc.cra.replay.application.playback;

import ca.gc.cra.replay.application.port.ClockPort;
import ca.gc.cra.replay.application.port.KeyValueSink;
import ca.gc.cra.replay.application.port.MetricsPort;
import ca.gc.cra.replay.domain.replay.Frame;
import ca.gc.cra.replay.domain.replay.FrameTimeline;
import ca.gc.cra.replay.domain.replay.SampleValue;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owns the replay position and the play/pause/seek/stop/publishing state machine.
 * <p><strong>Why:</strong> Turns a frame timeline into time-accurate sink writes while control commands arrive
 * on another thread.</p>
 * <p><strong>Role:</strong> Application service driven by {@link TimingLoop} (via {@link #tick(long)}) and by
 * the control channel (all other operations).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Map elapsed monotonic time to a target frame and advance to it.</li>
 *   <li>Write only the keys that changed since the previously emitted frame.</li>
 *   <li>Keep sink failures away from the timing loop.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One lock guards the index, flags, origin, and a position version bumped by
 * {@link #load}, {@link #seek} and {@link #stop}. Sink writes happen outside the lock; a tick's index write-back
 * is discarded only when the position was moved in the meantime. A pause during a tick keeps the frames the
 * tick already emitted. {@link #tick(long)} must only be called from one thread.</p>
 * <p><strong>Observability:</strong> Counters {@code replay.frames.advanced}, {@code replay.sink.put},
 * {@code replay.sink.error}.</p>
 *
 * @since 0.1.0
 */
public final class PlaybackScheduler implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PlaybackScheduler.class);

  private final ClockPort clock;
  private final MetricsPort metrics;
  private final long periodMicros;
  private final long periodNanos;
  private final double maxTimestampSeconds;

  private final AtomicReference<FrameTimeline> timeline;
  private final AtomicReference<KeyValueSink> sink = new AtomicReference<>();
  private final ReentrantLock lock = new ReentrantLock();

  // guarded by lock
  private long frameIndex;
  private boolean playing;
  private boolean publishing;
  private long originNanos;
  private long positionVersion;

  // confined to the ticking thread
  private FrameTimeline lastTicked;
  private Frame previousEmitted = Frame.EMPTY;

  /**
   * Creates a scheduler with an empty timeline.
   *
   * @param clock monotonic clock
   * @param metrics metrics sink
   * @param periodMicros frame width in microseconds
   * @param maxTimestampSeconds upper clamp for {@link #seek(double)}
   */
  public PlaybackScheduler(ClockPort clock, MetricsPort metrics, long periodMicros, double maxTimestampSeconds) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (periodMicros <= 0) {
      throw new IllegalArgumentException("periodMicros must be positive");
    }
    if (!(maxTimestampSeconds > 0) || Double.isInfinite(maxTimestampSeconds)) {
      throw new IllegalArgumentException("maxTimestampSeconds must be positive and finite");
    }
    this.periodMicros = periodMicros;
    this.periodNanos = periodMicros * 1_000L;
    this.maxTimestampSeconds = maxTimestampSeconds;
    this.timeline = new AtomicReference<>(FrameTimeline.empty(periodMicros));
    this.originNanos = clock.nanoTime();
  }

  /**
   * Replaces the timeline and resets to stopped at frame zero.
   *
   * @param frames fully built timeline with this scheduler's period
   */
  public void load(FrameTimeline frames) {
    Objects.requireNonNull(frames, "frames");
    if (frames.periodMicros() != periodMicros) {
      throw new IllegalArgumentException(
          "timeline period " + frames.periodMicros() + "us does not match scheduler period " + periodMicros + "us");
    }
    lock.lock();
    try {
      timeline.set(frames);
      frameIndex = 0;
      playing = false;
      originNanos = clock.nanoTime();
      positionVersion++;
    } finally {
      lock.unlock();
    }
    log.info("Loaded timeline with {} frames", frames.frameCount());
  }

  /**
   * Moves the position to {@code seconds}, clamped to the replay window. The playing flag is unchanged.
   *
   * @param seconds target log time
   * @throws IllegalArgumentException when {@code seconds} is NaN or infinite
   */
  public void seek(double seconds) {
    if (!Double.isFinite(seconds)) {
      throw new IllegalArgumentException("seek target must be finite (was " + seconds + ")");
    }
    double clamped = Math.max(0.0, Math.min(seconds, maxTimestampSeconds));
    long micros = Math.round(clamped * 1_000_000.0);
    lock.lock();
    try {
      frameIndex = micros / periodMicros;
      originNanos = clock.nanoTime() - micros * 1_000L;
      positionVersion++;
    } finally {
      lock.unlock();
    }
  }

  /** Starts or resumes playback from the current frame; no effect while already playing. */
  public void play() {
    lock.lock();
    try {
      if (!playing) {
        originNanos = clock.nanoTime() - frameIndex * periodNanos;
        playing = true;
      }
    } finally {
      lock.unlock();
    }
  }

  /** Freezes the position at the current frame. */
  public void pause() {
    lock.lock();
    try {
      playing = false;
    } finally {
      lock.unlock();
    }
  }

  /** Stops playback and rewinds to frame zero. */
  public void stop() {
    lock.lock();
    try {
      playing = false;
      frameIndex = 0;
      originNanos = clock.nanoTime();
      positionVersion++;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Enables or disables sink writes; advancing continues either way.
   *
   * @param enabled {@code true} to publish advanced frames
   */
  public void setPublishing(boolean enabled) {
    lock.lock();
    try {
      publishing = enabled;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Installs a new sink and closes the previous one.
   *
   * @param replacement new sink, or {@code null} to detach
   */
  public void setSink(KeyValueSink replacement) {
    KeyValueSink previous = sink.getAndSet(replacement);
    if (previous != null && previous != replacement) {
      log.info("Closing sink {}", previous.describe());
      previous.close();
    }
  }

  /**
   * Performs one timing loop iteration.
   *
   * @param now current monotonic time
   * @return number of frames advanced
   */
  public int tick(long now) {
    FrameTimeline frames;
    long index;
    long origin;
    boolean publish;
    long observedVersion;
    lock.lock();
    try {
      frames = timeline.get();
      if (!playing || frames.isEmpty()) {
        return 0;
      }
      index = frameIndex;
      origin = originNanos;
      publish = publishing;
      observedVersion = positionVersion;
    } finally {
      lock.unlock();
    }

    if (frames != lastTicked) {
      lastTicked = frames;
      previousEmitted = Frame.EMPTY;
    }

    long target = Math.min(Math.floorDiv(now - origin, periodNanos), frames.frameCount() - 1L);
    KeyValueSink activeSink = sink.get();
    int advanced = 0;
    while (index <= target) {
      Frame frame = frames.frame((int) index);
      if (publish) {
        emit(activeSink, frame);
        previousEmitted = frame;
      }
      index++;
      advanced++;
    }

    lock.lock();
    try {
      if (positionVersion == observedVersion) {
        if (originNanos != origin) {
          // play() re-anchored the origin on the pre-tick index while frames were being emitted
          originNanos -= (index - frameIndex) * periodNanos;
        }
        frameIndex = index;
        if (index >= frames.frameCount()) {
          playing = false;
          log.info("Reached end of timeline at frame {}", index);
        }
      }
    } finally {
      lock.unlock();
    }
    if (advanced > 0) {
      metrics.observe("replay.frames.advanced", advanced);
    }
    return advanced;
  }

  /**
   * Returns a consistent snapshot of the state.
   *
   * @return current state
   */
  public PlaybackState state() {
    lock.lock();
    try {
      return new PlaybackState(frameIndex, playing, publishing, originNanos, timeline.get().frameCount());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the frame width.
   *
   * @return period in microseconds
   */
  public long periodMicros() {
    return periodMicros;
  }

  /** Detaches and closes the sink. */
  @Override
  public void close() {
    setSink(null);
  }

  private void emit(KeyValueSink target, Frame frame) {
    if (target == null) {
      return;
    }
    for (Map.Entry<String, SampleValue> change : frame.changesSince(previousEmitted).entrySet()) {
      try {
        target.put(change.getKey(), change.getValue());
        metrics.increment("replay.sink.put");
      } catch (RuntimeException ex) {
        metrics.increment("replay.sink.error");
        log.warn("Sink write failed for key {}: {}", change.getKey(), ex.getMessage());
        log.debug("Sink write failure detail", ex);
      }
    }
  }
}
