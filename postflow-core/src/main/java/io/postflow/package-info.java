/**
 * Scheduled multi-platform publishing engine.
 *
 * <p>{@link io.postflow.Postflow} wires the dispatcher from a {@link io.postflow.PostflowConfig};
 * the subpackages hold the pieces it is made of.
 */
package io.postflow;
