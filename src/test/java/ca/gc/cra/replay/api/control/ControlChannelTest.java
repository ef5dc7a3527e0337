package ca.gc.cra.replay.api.control;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.replay.api.control.ControlChannel.Reply;
import ca.gc.cra.replay.application.pipeline.LogLoadUseCase;
import ca.gc.cra.replay.application.playback.PlaybackScheduler;
import ca.gc.cra.replay.application.playback.PlaybackState;
import ca.gc.cra.replay.application.port.SinkConnector;
import ca.gc.cra.replay.infrastructure.interchange.CsvInterchangeFile;
import ca.gc.cra.replay.testutil.ControllableClock;
import ca.gc.cra.replay.testutil.RecordingMetrics;
import ca.gc.cra.replay.testutil.RecordingSink;
import ca.gc.cra.replay.testutil.WpiLogFixtures;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ControlChannelTest {
  private static final long PERIOD_MICROS = 20_000L;

  @TempDir
  Path dir;

  private ControllableClock clock;
  private RecordingMetrics metrics;
  private PlaybackScheduler scheduler;
  private List<String> connections;
  private RecordingSink sink;
  private ControlChannel channel;

  @BeforeEach
  void setUp() {
    clock = new ControllableClock();
    metrics = new RecordingMetrics();
    scheduler = new PlaybackScheduler(clock, metrics, PERIOD_MICROS, 1_000.0);
    connections = new ArrayList<>();
    sink = new RecordingSink();
    SinkConnector connector = (host, port) -> {
      connections.add(host + ":" + port);
      return sink;
    };
    LogLoadUseCase loader = new LogLoadUseCase(new CsvInterchangeFile(), metrics, PERIOD_MICROS, 1_000.0);
    channel = new ControlChannel(scheduler, loader, connector, metrics);
  }

  @Test
  void setServerConnectsValidatedEndpoint() {
    assertEquals(Reply.OK, channel.handle("SET_SERVER 127.0.0.1 5810"));
    assertEquals(Reply.OK, channel.handle("SET_SERVER [::1] 5811"));

    assertEquals(List.of("127.0.0.1:5810", "::1:5811"), connections);
    assertEquals(2L, metrics.count("control.command.set_server"));
  }

  @Test
  void setServerRejectsBadArguments() {
    assertEquals(Reply.ERR, channel.handle("SET_SERVER 127.0.0.1"));
    assertEquals(Reply.ERR, channel.handle("SET_SERVER 127.0.0.1 70000"));
    assertEquals(Reply.ERR, channel.handle("SET_SERVER bad_host! 5810"));

    assertTrue(connections.isEmpty());
    assertEquals(3L, metrics.count("control.command.error"));
  }

  @Test
  void loadCsvSwapsTimelineAndResetsPosition() throws IOException {
    Path csv = writeCsv(dir.resolve("match log.csv"));
    channel.handle("SEEK 0.5");

    assertEquals(Reply.OK, channel.handle("LOAD_CSV \"" + csv + "\""));

    PlaybackState state = scheduler.state();
    assertEquals(0L, state.frameIndex());
    assertFalse(state.playing());
    assertEquals(3, state.frameCount());
  }

  @Test
  void loadCsvAcceptsUnquotedPathWithSpaces() throws IOException {
    Path csv = writeCsv(dir.resolve("with space.csv"));

    assertEquals(Reply.OK, channel.handle("LOAD_CSV " + csv));
    assertEquals(3, scheduler.state().frameCount());
  }

  @Test
  void loadLogDecodesBinaryLog() throws IOException {
    Path log = dir.resolve("match.wpilog");
    WpiLogFixtures.log()
        .start(1, "/ds/enabled", "boolean", "", 0)
        .bool(1, true, 0)
        .bool(1, false, 60_000)
        .writeTo(log);

    assertEquals(Reply.OK, channel.handle("LOAD_LOG " + log));
    assertEquals(4, scheduler.state().frameCount());
  }

  @Test
  void missingFileFailsWithoutReplacingTimeline() throws IOException {
    channel.handle("LOAD_CSV " + writeCsv(dir.resolve("good.csv")));

    assertEquals(Reply.ERR, channel.handle("LOAD_CSV " + dir.resolve("missing.csv")));
    assertEquals(Reply.ERR, channel.handle("LOAD_LOG"));
    assertEquals(3, scheduler.state().frameCount());
  }

  @Test
  void playbackCommandsDriveScheduler() throws IOException {
    channel.handle("LOAD_CSV " + writeCsv(dir.resolve("drive.csv")));
    channel.handle("SET_SERVER localhost 5810");

    assertEquals(Reply.OK, channel.handle("PUBLISH_ON"));
    assertEquals(Reply.OK, channel.handle("PLAY"));
    scheduler.tick(clock.advanceMillis(0));
    assertEquals(List.of("/drive/speed"), sink.keys());

    assertEquals(Reply.OK, channel.handle("PAUSE"));
    assertFalse(scheduler.state().playing());
    assertEquals(Reply.OK, channel.handle("SEEK 0.04"));
    assertEquals(2L, scheduler.state().frameIndex());
    assertEquals(Reply.OK, channel.handle("STOP"));
    assertEquals(0L, scheduler.state().frameIndex());
    assertEquals(Reply.OK, channel.handle("PUBLISH_OFF"));
    assertFalse(scheduler.state().publishing());
  }

  @Test
  void seekRejectsNonNumbers() {
    assertEquals(Reply.ERR, channel.handle("SEEK soon"));
    assertEquals(Reply.ERR, channel.handle("SEEK NaN"));
    assertEquals(Reply.ERR, channel.handle("SEEK"));
    assertEquals(Reply.ERR, channel.handle("PLAY now"));
  }

  @Test
  void unknownOrMalformedRequestsAreErrors() {
    assertEquals(Reply.ERR, channel.handle("play"));
    assertEquals(Reply.ERR, channel.handle("REWIND"));
    assertEquals(Reply.ERR, channel.handle("   "));
    assertEquals(Reply.ERR, channel.handle(null));
    assertEquals(Reply.ERR, channel.handle("SEEK " + "1".repeat(ControlChannel.MAX_LINE_LENGTH)));
    assertEquals(5L, metrics.count("control.command.error"));
  }

  @Test
  void failingConnectorKeepsChannelUsable() {
    ControlChannel failing = new ControlChannel(
        scheduler,
        new LogLoadUseCase(new CsvInterchangeFile(), metrics, PERIOD_MICROS, 1_000.0),
        (host, port) -> {
          throw new IllegalStateException("broker down");
        },
        metrics);

    assertEquals(Reply.ERR, failing.handle("SET_SERVER 10.0.0.2 5810"));
    assertEquals(Reply.OK, failing.handle("PLAY"));
  }

  @Test
  void serveAnswersEachLineAndStopsAtQuit() throws IOException {
    StringWriter out = new StringWriter();
    BufferedReader in = new BufferedReader(new StringReader("PLAY\nBOGUS\nQUIT\nPAUSE\n"));

    boolean quit = channel.serve(in, out);

    assertTrue(quit);
    assertEquals("OK\nERR\nBYE\n", out.toString());
    assertTrue(scheduler.state().playing());
  }

  @Test
  void serveReturnsFalseAtEndOfInput() throws IOException {
    StringWriter out = new StringWriter();

    boolean quit = channel.serve(new BufferedReader(new StringReader("STOP\r\n")), out);

    assertFalse(quit);
    assertEquals("OK\n", out.toString());
  }

  @Test
  void serveSkipsBlankLinesWithoutAnswering() throws IOException {
    StringWriter out = new StringWriter();

    boolean quit = channel.serve(new BufferedReader(new StringReader("\n   \r\nPLAY\n\nQUIT\n")), out);

    assertTrue(quit);
    assertEquals("OK\nBYE\n", out.toString());
    assertEquals(0L, metrics.count("control.command.error"));
  }

  @Test
  void serveDiscardsOverlongLineAndKeepsReading() throws IOException {
    StringWriter out = new StringWriter();
    String overlong = "SEEK " + "9".repeat(ControlChannel.MAX_LINE_LENGTH * 64);

    boolean quit = channel.serve(new BufferedReader(new StringReader(overlong + "\nPLAY\nQUIT\n")), out);

    assertTrue(quit);
    assertEquals("ERR\nOK\nBYE\n", out.toString());
    assertTrue(scheduler.state().playing());
    assertEquals(0L, scheduler.state().frameIndex());
  }

  @Test
  void serveAcceptsLineAtTheLengthLimit() throws IOException {
    StringWriter out = new StringWriter();
    String padded = "PLAY" + " ".repeat(ControlChannel.MAX_LINE_LENGTH - 4);

    channel.serve(new BufferedReader(new StringReader(padded + "\r\n")), out);

    assertEquals("OK\n", out.toString());
  }

  private static Path writeCsv(Path path) throws IOException {
    String csv = "timestamp,key,type,value,meta\n"
        + "0.000000,/drive/speed,double,1.0,\n"
        + "0.040000,/drive/speed,double,2.0,\n";
    Files.writeString(path, csv, StandardCharsets.UTF_8);
    return path;
  }
}
