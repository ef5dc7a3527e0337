/**
 * <strong>Purpose:</strong> Sink-side helpers: logging sink, JSON document encoding, and raw type tags.
 * <p><strong>Concurrency:</strong> Stateless helpers; sinks tolerate put and close from different threads.
 */
package ca.gc.cra.replay.infrastructure.sink;
