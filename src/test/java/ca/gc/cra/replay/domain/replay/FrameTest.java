package ca.gc.cra.replay.domain.replay;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class FrameTest {

  @Test
  void changesSinceReportsNewAndChangedKeysOnly() {
    SampleValue one = new SampleValue("int64", "1", "");
    SampleValue two = new SampleValue("int64", "2", "");
    Frame previous = Frame.of(Map.of("a", one, "b", one, "gone", one));
    Frame current = Frame.of(Map.of("a", one, "b", two, "c", one));

    assertEquals(Map.of("b", two, "c", one), current.changesSince(previous));
  }

  @Test
  void metadataChangeCountsAsChange() {
    Frame previous = Frame.of(Map.of("a", new SampleValue("string", "x", "m1")));
    Frame current = Frame.of(Map.of("a", new SampleValue("string", "x", "m2")));

    assertEquals(1, current.changesSince(previous).size());
    assertTrue(current.changesSince(current).isEmpty());
  }
}
