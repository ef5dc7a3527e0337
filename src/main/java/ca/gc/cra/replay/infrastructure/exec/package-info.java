/**
 * Thread construction helpers for the timing loop and other long-lived service threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.replay.infrastructure.exec;
