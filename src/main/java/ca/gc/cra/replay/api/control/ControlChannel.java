package ca.gc.cra.replay.api.control;

import ca.gc.cra.replay.application.pipeline.LoadedLog;
import ca.gc.cra.replay.application.pipeline.LogLoadUseCase;
import ca.gc.cra.replay.application.playback.PlaybackScheduler;
import ca.gc.cra.replay.application.port.KeyValueSink;
import ca.gc.cra.replay.application.port.MetricsPort;
import ca.gc.cra.replay.application.port.SinkConnector;
import ca.gc.cra.replay.logging.Logs;
import ca.gc.cra.replay.validation.Net;
import ca.gc.cra.replay.validation.Numbers;
import ca.gc.cra.replay.validation.Paths;
import ca.gc.cra.replay.validation.Strings;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Line-based request/response protocol that drives playback.
 * <p><strong>Why:</strong> Lets a front end control an independent replay process over a duplex stream.</p>
 * <p><strong>Role:</strong> Inbound adapter; translates commands into scheduler and loader calls.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Answer every request line with exactly one of {@code OK}, {@code ERR} or {@code BYE}, in order.</li>
 *   <li>Keep the channel usable after any handler failure.</li>
 *   <li>Swap in a new timeline only after it is fully computed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Confined to the control thread; commands execute one at a time.</p>
 * <p><strong>Observability:</strong> Counters {@code control.command.<verb>} and {@code control.command.error};
 * rejected requests are logged at DEBUG, handler failures at WARN.</p>
 *
 * @since 0.1.0
 */
public final class ControlChannel {
  private static final Logger log = LoggerFactory.getLogger(ControlChannel.class);

  /** Longest request line accepted, in characters. */
  public static final int MAX_LINE_LENGTH = 8_192;

  /** Wire responses. */
  public enum Reply {
    OK,
    ERR,
    BYE
  }

  private final PlaybackScheduler scheduler;
  private final LogLoadUseCase loader;
  private final SinkConnector connector;
  private final MetricsPort metrics;

  /**
   * Creates a channel.
   *
   * @param scheduler playback state machine
   * @param loader loads CSV and binary logs
   * @param connector opens sinks for {@code SET_SERVER}
   * @param metrics metrics sink
   */
  public ControlChannel(
      PlaybackScheduler scheduler, LogLoadUseCase loader, SinkConnector connector, MetricsPort metrics) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.loader = Objects.requireNonNull(loader, "loader");
    this.connector = Objects.requireNonNull(connector, "connector");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Serves requests until {@code QUIT} or end of input.
   *
   * <p>Blank lines are skipped without a response. Lines longer than {@link #MAX_LINE_LENGTH} are discarded
   * up to their terminator and answered {@code ERR}.</p>
   *
   * @param in request lines
   * @param out response lines; flushed after each response
   * @return {@code true} when the session ended with {@code QUIT}, {@code false} on end of input
   * @throws IOException when the response stream fails
   */
  public boolean serve(BufferedReader in, Writer out) throws IOException {
    Objects.requireNonNull(in, "in");
    Objects.requireNonNull(out, "out");
    BoundedLineReader lines = new BoundedLineReader(in, MAX_LINE_LENGTH);
    String line;
    while ((line = lines.readLine()) != null) {
      Reply reply;
      if (lines.overflowed()) {
        reply = reject("request line longer than " + MAX_LINE_LENGTH + " characters");
      } else if (line.isBlank()) {
        continue;
      } else {
        reply = handle(line);
      }
      out.write(reply.name());
      out.write('\n');
      out.flush();
      if (reply == Reply.BYE) {
        log.info("Control channel closed by QUIT");
        return true;
      }
    }
    log.info("Control channel reached end of input");
    return false;
  }

  /**
   * Executes one request line.
   *
   * @param line request without its terminator
   * @return response
   */
  public Reply handle(String line) {
    if (line == null || line.length() > MAX_LINE_LENGTH) {
      return reject("request line missing or longer than " + MAX_LINE_LENGTH + " characters");
    }
    String request = line.strip();
    if (request.isEmpty()) {
      return reject("blank request");
    }
    int space = indexOfWhitespace(request);
    String verb = space < 0 ? request : request.substring(0, space);
    String rest = space < 0 ? "" : request.substring(space).strip();
    Optional<ControlCommand> command = ControlCommand.lookup(verb);
    if (command.isEmpty()) {
      return reject("unknown verb " + Logs.printable(Logs.truncate(verb, 64)));
    }
    try {
      Reply reply = execute(command.get(), rest);
      if (reply == Reply.ERR) {
        metrics.increment("control.command.error");
      } else {
        metrics.increment(command.get().metricKey());
      }
      return reply;
    } catch (IllegalArgumentException ex) {
      metrics.increment("control.command.error");
      log.warn("{} rejected: {}", verb, ex.getMessage());
      return Reply.ERR;
    } catch (IOException | UncheckedIOException ex) {
      metrics.increment("control.command.error");
      log.warn("{} failed: {}", verb, ex.getMessage());
      return Reply.ERR;
    } catch (RuntimeException ex) {
      metrics.increment("control.command.error");
      log.warn("{} failed unexpectedly", verb, ex);
      return Reply.ERR;
    }
  }

  private Reply execute(ControlCommand command, String rest) throws IOException {
    String[] args = command.takesPath() ? pathArgument(rest) : splitArguments(rest);
    if (args.length != command.arity()) {
      throw new IllegalArgumentException("expected " + command.arity() + " argument(s), got " + args.length);
    }
    switch (command) {
      case SET_SERVER -> setServer(args[0], args[1]);
      case LOAD_CSV -> swapIn(loader.loadCsv(readable(args[0])));
      case LOAD_LOG -> swapIn(loader.loadLog(readable(args[0])));
      case SEEK -> scheduler.seek(Numbers.parseFinite("seek", args[0]));
      case PLAY -> scheduler.play();
      case PAUSE -> scheduler.pause();
      case STOP -> scheduler.stop();
      case PUBLISH_ON -> scheduler.setPublishing(true);
      case PUBLISH_OFF -> scheduler.setPublishing(false);
      case QUIT -> {
        return Reply.BYE;
      }
      default -> throw new IllegalStateException("unhandled command " + command);
    }
    return Reply.OK;
  }

  private void setServer(String host, String port) {
    Net.HostPort target = Net.validate(host, port);
    KeyValueSink sink = connector.connect(target.host(), target.port());
    scheduler.setSink(sink);
    log.info("Sink connected to {}", sink.describe());
  }

  private void swapIn(LoadedLog loaded) {
    scheduler.load(loaded.timeline());
    log.info("Timeline ready: {} frames, {} segments", loaded.timeline().frameCount(), loaded.segments().size());
  }

  private static Path readable(String raw) {
    return Paths.requireReadableFile(Paths.parse("path", raw));
  }

  private Reply reject(String reason) {
    metrics.increment("control.command.error");
    log.debug("Rejected request: {}", reason);
    return Reply.ERR;
  }

  private static String[] pathArgument(String rest) {
    if (rest.isEmpty()) {
      return new String[0];
    }
    String path = Strings.stripQuotes(rest);
    return path.isEmpty() ? new String[0] : new String[] {path};
  }

  private static String[] splitArguments(String rest) {
    return rest.isEmpty() ? new String[0] : rest.split("\\s+");
  }

  private static int indexOfWhitespace(String value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isWhitespace(value.charAt(i))) {
        return i;
      }
    }
    return -1;
  }
}
