/**
 * Kafka adapters publishing replayed values.
 * <p><strong>Concurrency:</strong> Producers are thread-safe; sends are asynchronous.</p>
 */
package ca.gc.cra.replay.adapter.kafka;
