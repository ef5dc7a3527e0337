package ca.gc.cra.replay.api.control;

import java.util.Locale;
import java.util.Optional;

/**
 * Verbs understood by {@link ControlChannel}.
 *
 * <p>Verbs are case-sensitive. {@link #takesPath()} verbs consume the remainder of the line as one argument;
 * the others take exactly {@link #arity()} whitespace-separated arguments.</p>
 *
 * @since 0.1.0
 */
public enum ControlCommand {
  SET_SERVER(2, false),
  LOAD_CSV(1, true),
  LOAD_LOG(1, true),
  SEEK(1, false),
  PLAY(0, false),
  PAUSE(0, false),
  STOP(0, false),
  PUBLISH_ON(0, false),
  PUBLISH_OFF(0, false),
  QUIT(0, false);

  private final int arity;
  private final boolean takesPath;

  ControlCommand(int arity, boolean takesPath) {
    this.arity = arity;
    this.takesPath = takesPath;
  }

  /**
   * Number of arguments the verb requires.
   *
   * @return argument count
   */
  public int arity() {
    return arity;
  }

  /**
   * Whether the single argument is the rest of the line.
   *
   * @return {@code true} for path-taking verbs
   */
  public boolean takesPath() {
    return takesPath;
  }

  /**
   * Metric key counting executions of this verb.
   *
   * @return key such as {@code control.command.seek}
   */
  public String metricKey() {
    return "control.command." + name().toLowerCase(Locale.ROOT);
  }

  /**
   * Finds a verb by its exact wire spelling.
   *
   * @param verb first token of a request line
   * @return the command, or empty for unknown or wrongly cased verbs
   */
  public static Optional<ControlCommand> lookup(String verb) {
    for (ControlCommand command : values()) {
      if (command.name().equals(verb)) {
        return Optional.of(command);
      }
    }
    return Optional.empty();
  }
}
