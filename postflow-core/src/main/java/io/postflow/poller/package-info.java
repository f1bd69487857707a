/**
 * Tick loop that materializes due schedules, reclaims expired leases and claims work.
 */
package io.postflow.poller;
