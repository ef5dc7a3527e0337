package ca.gc.cra.replay.api.control;

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.io.Writer;
import java.util.Objects;

/**
 * Front-end side of the control protocol: one request line out, one response line back.
 *
 * <p>Calls are serialized so concurrent callers never interleave requests and responses.</p>
 *
 * @since 0.1.0
 */
public final class ControlClient implements AutoCloseable {
  private final BufferedReader responses;
  private final Writer requests;

  /**
   * Creates a client over an established duplex stream.
   *
   * @param responses lines written by the replay process
   * @param requests stream read by the replay process
   */
  public ControlClient(BufferedReader responses, Writer requests) {
    this.responses = Objects.requireNonNull(responses, "responses");
    this.requests = Objects.requireNonNull(requests, "requests");
  }

  /**
   * Sends one command and waits for its response.
   *
   * @param command request without a line terminator
   * @return the response line
   * @throws IllegalArgumentException if {@code command} is blank or contains a line break
   * @throws EOFException when the process closed the stream without answering
   * @throws IOException when the stream fails
   */
  public synchronized ControlChannel.Reply send(String command) throws IOException {
    Objects.requireNonNull(command, "command");
    if (command.indexOf('\n') >= 0 || command.indexOf('\r') >= 0) {
      throw new IllegalArgumentException("command must be a single line");
    }
    if (command.isBlank()) {
      throw new IllegalArgumentException("command must not be blank");
    }
    requests.write(command);
    requests.write('\n');
    requests.flush();
    String line = responses.readLine();
    if (line == null) {
      throw new EOFException("control channel closed before responding to " + command);
    }
    try {
      return ControlChannel.Reply.valueOf(line.strip());
    } catch (IllegalArgumentException ex) {
      throw new IOException("unexpected control response: " + line, ex);
    }
  }

  /**
   * Ends the session.
   *
   * @return {@code true} when the process answered {@code BYE}
   * @throws IOException when the stream fails
   */
  public boolean quit() throws IOException {
    return send(ControlCommand.QUIT.name()) == ControlChannel.Reply.BYE;
  }

  /**
   * Closes both streams without sending anything; the process sees end of input.
   *
   * @throws IOException when closing fails
   */
  @Override
  public synchronized void close() throws IOException {
    try {
      requests.close();
    } finally {
      responses.close();
    }
  }
}
