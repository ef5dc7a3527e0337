/**
 * <strong>Purpose:</strong> Real-time playback: the scheduler state machine and the timing loop that drives it.
 * <p><strong>Concurrency:</strong> Control operations and the timing thread share one lock inside
 * {@link ca.gc.cra.replay.application.playback.PlaybackScheduler}; sink writes run outside it.
 * <p><strong>Observability:</strong> Publishes {@code replay.*} metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.replay.application.playback;
