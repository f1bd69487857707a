/**
 * Platform publisher contract, the outcome type publishers report, and the registry that
 * maps each {@link io.postflow.Platform} to its publisher.
 */
package io.postflow.platform;
