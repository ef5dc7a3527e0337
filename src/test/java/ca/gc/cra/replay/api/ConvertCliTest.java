package ca.gc.cra.replay.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.replay.testutil.WpiLogFixtures;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ConvertCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ConvertCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingInputReturnsInvalidArgs() {
    ExitCode code = ConvertCli.run(new String[] {"out=" + tempDir.resolve("x.csv")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: convert"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("in is required")));
  }

  @Test
  void nonexistentInputReturnsInvalidArgs() {
    ExitCode code = ConvertCli.run(new String[] {"in=" + tempDir.resolve("nope.wpilog")});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void convertsLogToCsvAndPrintsSummary() throws Exception {
    Path log = sampleLog(tempDir.resolve("match.wpilog"));

    ExitCode code = ConvertCli.run(new String[] {"in=" + log, "metricsExporter=none"});

    assertEquals(ExitCode.SUCCESS, code);
    Path csv = tempDir.resolve("match.csv");
    List<String> lines = Files.readAllLines(csv);
    assertEquals("timestamp,key,type,value,meta", lines.get(0));
    assertEquals("0.000000,/ds/enabled,boolean,true,", lines.get(1));
    assertEquals("1.500000,/drive/speed,double,2.5,", lines.get(2));
    String summary = buffer.toString();
    assertTrue(summary.contains("Samples          : 2"));
    assertTrue(summary.contains("Duration         : 1.500 s"));
  }

  @Test
  void existingOutputNeedsAllowOverwrite() throws Exception {
    Path log = sampleLog(tempDir.resolve("match.wpilog"));
    Path out = Files.writeString(tempDir.resolve("taken.csv"), "keep");

    ExitCode refused = ConvertCli.run(new String[] {"in=" + log, "out=" + out, "metricsExporter=none"});
    assertEquals(ExitCode.INVALID_ARGS, refused);
    assertEquals("keep", Files.readString(out));

    ExitCode replaced = ConvertCli.run(
        new String[] {"in=" + log, "out=" + out, "metricsExporter=none", "--allow-overwrite"});
    assertEquals(ExitCode.SUCCESS, replaced);
    assertTrue(Files.readString(out).startsWith("timestamp,"));
  }

  @Test
  void dryRunDoesNotWrite() throws Exception {
    Path log = sampleLog(tempDir.resolve("match.wpilog"));
    Path out = tempDir.resolve("out.csv");

    ExitCode code = ConvertCli.run(new String[] {"in=" + log, "out=" + out, "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Convert dry-run"));
    assertTrue(buffer.toString().contains(out.toString()));
    assertFalse(Files.exists(out));
  }

  @Test
  void yamlSuppliesInputPath() throws Exception {
    Path log = sampleLog(tempDir.resolve("match.wpilog"));
    Path yaml = Files.writeString(tempDir.resolve("replay.yaml"),
        "common:\n  metricsExporter: none\nconvert:\n  in: " + log + "\n");

    ExitCode code = ConvertCli.run(new String[] {"config=" + yaml});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(Files.exists(tempDir.resolve("match.csv")));
  }

  private static Path sampleLog(Path path) throws Exception {
    return WpiLogFixtures.log()
        .start(1, "/ds/enabled", "boolean", "", 0)
        .start(2, "/drive/speed", "double", "", 0)
        .bool(1, true, 0)
        .dbl(2, 2.5, 1_500_000)
        .writeTo(path);
  }
}
