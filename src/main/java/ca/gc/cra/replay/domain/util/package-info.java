/**
 * <strong>Purpose:</strong> Byte-level helpers shared by the binary log decoders.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 *
 * @since 0.1.0
 */
package ca.gc.cra.replay.domain.util;
