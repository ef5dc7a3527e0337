/**
 * Configuration layering (defaults, YAML, CLI) and the composition root.
 * <p>{@link ca.gc.cra.replay.config.ConfigMerger} produces a flat map that the typed records
 * {@link ca.gc.cra.replay.config.PublisherConfig} and {@link ca.gc.cra.replay.config.ConvertConfig} validate.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.replay.config;
