/**
 * <strong>Purpose:</strong> Replay model: samples, frames, the frame coalescer, and robot state segments.
 * <p><strong>Pipeline role:</strong> Sits between log projection and the playback scheduler.
 * <p><strong>Concurrency:</strong> Value types are immutable; builders are single-threaded.
 *
 * @since 0.1.0
 */
package ca.gc.cra.replay.domain.replay;
