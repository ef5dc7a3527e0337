/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and keep payloads readable.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; all output goes to stderr.
 *
 * @since 0.1.0
 */
package ca.gc.cra.replay.logging;
