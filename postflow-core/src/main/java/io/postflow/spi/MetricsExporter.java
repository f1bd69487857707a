package io.postflow.spi;

import io.postflow.Platform;
import io.postflow.model.ErrorKind;

/**
 * Observability hook for exporting dispatcher counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of schedules found due and materialized into publications.
     */
    void incrementSchedulesDue(int count);

    void incrementPublicationsCreated(int count);

    /**
     * Increments the count of claims won by this dispatcher.
     */
    void incrementClaimed();

    /**
     * Increments the count of claims lost to another dispatcher.
     */
    void incrementClaimConflict();

    void incrementLeasesReclaimed(int count);

    /**
     * Increments the count of calls made to a platform publisher.
     */
    void incrementAttempt(Platform platform);

    void incrementPublished(Platform platform);

    void incrementRetried(Platform platform, ErrorKind kind);

    void incrementFailed(Platform platform, ErrorKind kind);

    void incrementTokenRefresh(Platform platform);

    void incrementTokenRefreshFailure(Platform platform);

    default void incrementEventsEmitted() {
    }

    default void incrementEventDeliveryFailure() {
    }

    /**
     * Records the number of attempts currently executing on this dispatcher.
     */
    void recordInFlight(int inFlight);

    /**
     * Records the wall time of one attempt, from start to settle.
     */
    default void recordAttemptDurationMs(Platform platform, long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementSchedulesDue(int count) {
        }

        @Override
        public void incrementPublicationsCreated(int count) {
        }

        @Override
        public void incrementClaimed() {
        }

        @Override
        public void incrementClaimConflict() {
        }

        @Override
        public void incrementLeasesReclaimed(int count) {
        }

        @Override
        public void incrementAttempt(Platform platform) {
        }

        @Override
        public void incrementPublished(Platform platform) {
        }

        @Override
        public void incrementRetried(Platform platform, ErrorKind kind) {
        }

        @Override
        public void incrementFailed(Platform platform, ErrorKind kind) {
        }

        @Override
        public void incrementTokenRefresh(Platform platform) {
        }

        @Override
        public void incrementTokenRefreshFailure(Platform platform) {
        }

        @Override
        public void recordInFlight(int inFlight) {
        }
    }
}
