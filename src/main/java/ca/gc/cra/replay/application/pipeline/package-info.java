/**
 * Batch pipelines that turn log files into replayable timelines.
 * <p>Loading runs on the caller's thread and returns a fully built {@link ca.gc.cra.replay.application.pipeline.LoadedLog};
 * nothing is published to the scheduler until the caller swaps it in.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.replay.application.pipeline;
