package ca.gc.cra.replay.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @Test
  void validatesInputsAndOutputs(@TempDir Path dir) throws Exception {
    Path existing = Files.writeString(dir.resolve("in.wpilog"), "x");

    assertEquals(existing.toRealPath(), Paths.requireReadableFile(existing));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile(dir));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile(dir.resolve("missing")));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateOutputFile(existing, false, true));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateOutputFile(dir, true, true));

    Path nested = Paths.validateOutputFile(dir.resolve("a/b/out.csv"), false, true);
    assertTrue(Files.isDirectory(nested.getParent()));
    assertThrows(IllegalArgumentException.class, () -> Paths.parse("in", "  "));
  }
}
