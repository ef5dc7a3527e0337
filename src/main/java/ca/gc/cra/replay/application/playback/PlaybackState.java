package ca.gc.cra.replay.application.playback;

/**
 * Point-in-time view of the scheduler state.
 *
 * @param frameIndex next frame to emit
 * @param playing whether the timing loop advances frames
 * @param publishing whether advanced frames are written to the sink
 * @param originNanos monotonic instant that corresponds to log time zero while playing
 * @param frameCount number of frames in the loaded timeline
 * @since 0.1.0
 */
public record PlaybackState(
    long frameIndex, boolean playing, boolean publishing, long originNanos, int frameCount) {

  /**
   * Names the state machine position.
   *
   * @return {@code playing}, {@code stopped} (paused at frame zero), or {@code paused}
   */
  public String phase() {
    if (playing) {
      return "playing";
    }
    return frameIndex == 0 ? "stopped" : "paused";
  }
}
