package ca.gc.cra.replay.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: replay"));
  }

  @Test
  void unknownCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"record"}));
    assertTrue(buffer.toString().contains("usage: replay"));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    String text = buffer.toString();
    assertTrue(text.contains("publish"));
    assertTrue(text.contains("convert"));
  }

  @Test
  void dispatchesToCommandHelp() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"Convert", "--help"}));
    assertTrue(buffer.toString().contains("Binary log converter"));
  }
}
