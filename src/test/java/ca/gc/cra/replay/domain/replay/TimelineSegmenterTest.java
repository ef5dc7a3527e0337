package ca.gc.cra.replay.domain.replay;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class TimelineSegmenterTest {
  private final TimelineSegmenter segmenter = new TimelineSegmenter();

  @Test
  void derivesMatchPhases() {
    List<TimelineSegment> segments = segmenter.segment(List.of(
        flag(1.0, TimelineSegmenter.ENABLED_KEY, "true"),
        flag(1.0, TimelineSegmenter.AUTONOMOUS_KEY, "true"),
        flag(16.0, TimelineSegmenter.AUTONOMOUS_KEY, "false"),
        new Sample(30.0, "drive/speed", "double", "0.0", "")));

    assertEquals(List.of(
        new TimelineSegment(0.0, 1.0, RobotState.DISABLED),
        new TimelineSegment(1.0, 16.0, RobotState.AUTONOMOUS),
        new TimelineSegment(16.0, 30.0, RobotState.TELEOP)), segments);
  }

  @Test
  void estopOverridesEverything() {
    List<TimelineSegment> segments = segmenter.segment(List.of(
        flag(2.0, TimelineSegmenter.ENABLED_KEY, "true"),
        flag(5.0, TimelineSegmenter.ESTOP_KEY, "true"),
        flag(6.0, TimelineSegmenter.ENABLED_KEY, "false"),
        flag(8.0, TimelineSegmenter.ESTOP_KEY, "false")));

    assertEquals(List.of(
        new TimelineSegment(0.0, 2.0, RobotState.DISABLED),
        new TimelineSegment(2.0, 5.0, RobotState.TELEOP),
        new TimelineSegment(5.0, 8.0, RobotState.ESTOP)), segments);
  }

  @Test
  void noStateSamplesGiveOneDisabledSegment() {
    assertEquals(
        List.of(new TimelineSegment(0.0, 3.0, RobotState.DISABLED)),
        segmenter.segment(List.of(new Sample(3.0, "x", "int64", "1", ""))));
    assertTrue(segmenter.segment(List.of()).isEmpty());
  }

  private static Sample flag(double t, String key, String value) {
    return new Sample(t, key, "boolean", value, "");
  }
}
