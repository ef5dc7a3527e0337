package ca.gc.cra.replay.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.replay.domain.replay.RobotState;
import ca.gc.cra.replay.infrastructure.interchange.CsvInterchangeFile;
import ca.gc.cra.replay.testutil.RecordingMetrics;
import ca.gc.cra.replay.testutil.WpiLogFixtures;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LogLoadUseCaseTest {
  @TempDir
  Path dir;

  private final RecordingMetrics metrics = new RecordingMetrics();
  private final LogLoadUseCase loader = new LogLoadUseCase(new CsvInterchangeFile(), metrics, 20_000L, 1_000.0);

  @Test
  void csvRowsAreFilteredAndStablySorted() throws IOException {
    Path csv = dir.resolve("match.csv");
    Files.writeString(csv, String.join("\n",
        "timestamp,key,type,value,meta",
        "0.040000,k,int64,3,",
        "0.010000,k,int64,1,",
        "0.010000,k,int64,2,",
        "-1.000000,k,int64,9,",
        "1000.500000,k,int64,9,",
        "NaN,k,int64,9,",
        "0.500000,DS:enabled,boolean,true,"), StandardCharsets.UTF_8);

    LoadedLog loaded = loader.loadCsv(csv);

    assertEquals(4, loaded.sampleCount());
    assertEquals(26, loaded.timeline().frameCount());
    assertEquals("2", loaded.timeline().frame(0).get("k").value());
    assertEquals("3", loaded.timeline().frame(2).get("k").value());
    assertEquals(0.5, loaded.durationSeconds());
    assertEquals(RobotState.DISABLED, loaded.segments().get(0).state());
    assertEquals(4, metrics.observedTotal("load.samples"));
  }

  @Test
  void binaryLogLoadsDirectly() throws IOException {
    Path log = WpiLogFixtures.log()
        .start(1, "DS:enabled", "boolean", "", 0)
        .bool(1, true, 2_000_000)
        .start(2, "odd", "double", "", 0)
        .record(2, 2_500_000, new byte[] {1})
        .int64(9, 5, 3_000_000)
        .writeTo(dir.resolve("match.wpilog"));

    LoadedLog loaded = loader.loadLog(log);

    assertEquals(2, loaded.sampleCount());
    assertEquals(126, loaded.timeline().frameCount());
    assertEquals("", loaded.timeline().frame(125).get("odd").value());
    assertEquals(2, loaded.segments().size());
    assertEquals(RobotState.TELEOP, loaded.segments().get(1).state());
    assertEquals(2, metrics.observedTotal("load.records.control"));
    assertEquals(1, metrics.observedTotal("load.records.dropped"));
    assertEquals(1, metrics.observedTotal("load.values.malformed"));
  }

  @Test
  void missingFileFails() {
    assertThrows(NoSuchFileException.class, () -> loader.loadCsv(dir.resolve("absent.csv")));
  }
}
