package io.postflow.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.postflow.Platform;
import io.postflow.model.ErrorKind;
import io.postflow.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code postflow.schedules.due}, {@code postflow.publications.created}</li>
 *   <li>{@code postflow.claims.won}, {@code postflow.claims.conflict}, {@code postflow.leases.reclaimed}</li>
 *   <li>{@code postflow.attempts}, {@code postflow.published} tagged {@code platform}</li>
 *   <li>{@code postflow.retried}, {@code postflow.failed} tagged {@code platform} and {@code kind}</li>
 *   <li>{@code postflow.token.refresh}, {@code postflow.token.refresh.failure} tagged {@code platform}</li>
 *   <li>{@code postflow.events.emitted}, {@code postflow.events.delivery.failure}</li>
 * </ul>
 *
 * <h3>Gauges and summaries</h3>
 * <ul>
 *   <li>{@code postflow.attempts.in.flight}: attempts executing on this dispatcher</li>
 *   <li>{@code postflow.attempt.duration.ms}: wall time of one attempt, tagged {@code platform}</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final String prefix;
    private final Counter schedulesDue;
    private final Counter publicationsCreated;
    private final Counter claimed;
    private final Counter claimConflict;
    private final Counter leasesReclaimed;
    private final Counter eventsEmitted;
    private final Counter eventDeliveryFailure;
    private final Gauge inFlightGauge;
    private final AtomicInteger inFlight = new AtomicInteger();

    /** Tagged meters are created on first use; remembered so {@link #close()} can remove them. */
    private final Set<Meter> taggedMeters = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "postflow");
    }

    /**
     * @param namePrefix prefix for all meter names (e.g. {@code "social.postflow"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.prefix = namePrefix;
        this.schedulesDue = Counter.builder(namePrefix + ".schedules.due")
                .description("Schedules found due and materialized")
                .register(registry);
        this.publicationsCreated = Counter.builder(namePrefix + ".publications.created")
                .description("Publication rows inserted")
                .register(registry);
        this.claimed = Counter.builder(namePrefix + ".claims.won")
                .description("Publications claimed by this dispatcher")
                .register(registry);
        this.claimConflict = Counter.builder(namePrefix + ".claims.conflict")
                .description("Claims lost to another dispatcher")
                .register(registry);
        this.leasesReclaimed = Counter.builder(namePrefix + ".leases.reclaimed")
                .description("Expired leases returned to pending")
                .register(registry);
        this.eventsEmitted = Counter.builder(namePrefix + ".events.emitted")
                .description("Publication events delivered to the notification sink")
                .register(registry);
        this.eventDeliveryFailure = Counter.builder(namePrefix + ".events.delivery.failure")
                .description("Publication events that could not be delivered")
                .register(registry);
        this.inFlightGauge = Gauge.builder(namePrefix + ".attempts.in.flight", inFlight, AtomicInteger::get)
                .description("Attempts currently executing")
                .register(registry);
    }

    @Override
    public void incrementSchedulesDue(int count) {
        if (closed) return;
        schedulesDue.increment(count);
    }

    @Override
    public void incrementPublicationsCreated(int count) {
        if (closed) return;
        publicationsCreated.increment(count);
    }

    @Override
    public void incrementClaimed() {
        if (closed) return;
        claimed.increment();
    }

    @Override
    public void incrementClaimConflict() {
        if (closed) return;
        claimConflict.increment();
    }

    @Override
    public void incrementLeasesReclaimed(int count) {
        if (closed) return;
        leasesReclaimed.increment(count);
    }

    @Override
    public void incrementAttempt(Platform platform) {
        if (closed) return;
        counter("attempts", "Calls made to platform publishers", platformTags(platform)).increment();
    }

    @Override
    public void incrementPublished(Platform platform) {
        if (closed) return;
        counter("published", "Publications published", platformTags(platform)).increment();
    }

    @Override
    public void incrementRetried(Platform platform, ErrorKind kind) {
        if (closed) return;
        counter("retried", "Failed attempts scheduled for retry", kindTags(platform, kind)).increment();
    }

    @Override
    public void incrementFailed(Platform platform, ErrorKind kind) {
        if (closed) return;
        counter("failed", "Publications failed permanently", kindTags(platform, kind)).increment();
    }

    @Override
    public void incrementTokenRefresh(Platform platform) {
        if (closed) return;
        counter("token.refresh", "Access tokens refreshed", platformTags(platform)).increment();
    }

    @Override
    public void incrementTokenRefreshFailure(Platform platform) {
        if (closed) return;
        counter("token.refresh.failure", "Token refreshes that failed", platformTags(platform)).increment();
    }

    @Override
    public void incrementEventsEmitted() {
        if (closed) return;
        eventsEmitted.increment();
    }

    @Override
    public void incrementEventDeliveryFailure() {
        if (closed) return;
        eventDeliveryFailure.increment();
    }

    @Override
    public void recordInFlight(int inFlight) {
        if (closed) return;
        this.inFlight.set(inFlight);
    }

    @Override
    public void recordAttemptDurationMs(Platform platform, long durationMs) {
        if (closed) return;
        DistributionSummary summary = DistributionSummary.builder(prefix + ".attempt.duration.ms")
                .description("Attempt wall time in milliseconds")
                .baseUnit("milliseconds")
                .tags(platformTags(platform))
                .register(registry);
        taggedMeters.add(summary);
        summary.record(durationMs);
    }

    private Counter counter(String name, String description, Tags tags) {
        // register() returns the existing meter for the same name and tags
        Counter counter = Counter.builder(prefix + "." + name)
                .description(description)
                .tags(tags)
                .register(registry);
        taggedMeters.add(counter);
        return counter;
    }

    private static Tags platformTags(Platform platform) {
        return Tags.of("platform", platform == null ? "unknown" : platform.tag());
    }

    private static Tags kindTags(Platform platform, ErrorKind kind) {
        return platformTags(platform).and("kind", kind == null ? "unknown" : kind.name().toLowerCase(Locale.ROOT));
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     */
    @Override
    public void close() {
        closed = true;
        List<Meter> meters = new ArrayList<>(List.of(schedulesDue, publicationsCreated, claimed, claimConflict,
                leasesReclaimed, eventsEmitted, eventDeliveryFailure, inFlightGauge));
        meters.addAll(taggedMeters);
        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
