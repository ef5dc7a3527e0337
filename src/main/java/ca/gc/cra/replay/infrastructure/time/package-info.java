/**
 * Time-related infrastructure adapters implementing clock ports.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 */
package ca.gc.cra.replay.infrastructure.time;
