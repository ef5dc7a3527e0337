/**
 * <strong>Purpose:</strong> Binary telemetry log decoding: framing, entry lifecycle, and value decoding.
 * <p><strong>Pipeline role:</strong> First stage of loading (bytes -> records -> samples).
 * <p><strong>Concurrency:</strong> Codec and records are immutable; {@link ca.gc.cra.replay.domain.log.EntryRegistry}
 * is confined to one decode pass.
 * <p><strong>Performance:</strong> Single forward pass over an in-memory buffer.
 *
 * @since 0.1.0
 */
package ca.gc.cra.replay.domain.log;
