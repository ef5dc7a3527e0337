/**
 * Line-based control protocol: the serving {@link ca.gc.cra.replay.api.control.ControlChannel} and the
 * requesting {@link ca.gc.cra.replay.api.control.ControlClient}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.replay.api.control;
