package ca.gc.cra.replay.application.port;

import ca.gc.cra.replay.domain.replay.SampleValue;

/**
 * <strong>What:</strong> Port to the external key-value store that receives replayed values.
 * <p><strong>Role:</strong> Output side of playback; one instance per configured server.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Store the latest value for a key, encoded according to its value type.</li>
 *   <li>Release network resources on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #put} is called from the timing thread and {@link #close()} from the
 * control thread; implementations must tolerate that.</p>
 * <p><strong>Performance:</strong> {@link #put} is fire-and-forget and must not wait for acknowledgement.</p>
 *
 * @since 0.1.0
 */
public interface KeyValueSink extends AutoCloseable {
  /**
   * Publishes a value.
   *
   * @param key entry name
   * @param value typed value with metadata
   * @throws RuntimeException on local failures; the scheduler logs and skips the key
   */
  void put(String key, SampleValue value);

  /**
   * Describes the target for logs.
   *
   * @return human-readable target such as {@code host:port}
   */
  String describe();

  /**
   * Releases resources. Must not throw.
   */
  @Override
  void close();
}
