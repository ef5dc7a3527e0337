/**
 * <strong>Purpose:</strong> Input validation for CLI arguments, YAML values, and control commands.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Security:</strong> Rejects control characters and malformed endpoints before any resource is
 * opened.
 *
 * @since 0.1.0
 */
package ca.gc.cra.replay.validation;
