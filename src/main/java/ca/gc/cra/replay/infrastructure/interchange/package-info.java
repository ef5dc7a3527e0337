/**
 * Interchange file adapters: the CSV form of decoded samples shared by {@code convert} and the publisher.
 */
package ca.gc.cra.replay.infrastructure.interchange;
