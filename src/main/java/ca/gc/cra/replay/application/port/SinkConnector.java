package ca.gc.cra.replay.application.port;

/**
 * Opens {@link KeyValueSink}s for a server address.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SinkConnector {
  /**
   * Connects to a server.
   *
   * @param host validated host name or address
   * @param port port in {@code 1..65535}
   * @return a new sink owned by the caller
   * @throws IllegalArgumentException when the target cannot be used
   */
  KeyValueSink connect(String host, int port);
}
