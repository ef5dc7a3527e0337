package ca.gc.cra.replay.domain.replay;

/**
 * Match phase derived from the driver-station flags.
 *
 * @since 0.1.0
 */
public enum RobotState {
  DISABLED("disabled"),
  TELEOP("teleop"),
  AUTONOMOUS("autonomous"),
  ESTOP("estop");

  private final String label;

  RobotState(String label) {
    this.label = label;
  }

  /**
   * Returns the lowercase label used in summaries.
   *
   * @return label
   */
  public String label() {
    return label;
  }

  /**
   * Derives the state from the three flags; estop beats disabled, which beats autonomous.
   *
   * @param enabled robot enabled flag
   * @param autonomous autonomous mode flag
   * @param estop emergency stop flag
   * @return derived state
   */
  public static RobotState of(boolean enabled, boolean autonomous, boolean estop) {
    if (estop) {
      return ESTOP;
    }
    if (!enabled) {
      return DISABLED;
    }
    return autonomous ? AUTONOMOUS : TELEOP;
  }
}
