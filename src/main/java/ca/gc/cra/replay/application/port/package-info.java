/**
 * Ports connecting the replay use cases to clocks, metrics, sinks, and interchange files.
 * <p><strong>Role:</strong> Hexagonal boundary; adapters live under {@code infrastructure} and {@code adapter}.</p>
 * <p><strong>Concurrency:</strong> Implementations document their own guarantees; clocks and metrics must be
 * thread-safe.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.replay.application.port;
