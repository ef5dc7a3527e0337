/**
 * Command-line entry points: the {@code replay} dispatcher and its {@code publish} and {@code convert} commands.
 * <p>Arguments are {@code key=value} pairs plus flags; configuration layers defaults, YAML and CLI values.
 * Commands return an {@link ca.gc.cra.replay.api.ExitCode} instead of exiting so tests can call them.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.replay.api;
