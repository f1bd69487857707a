package io.postflow.poller;

import io.postflow.Platform;
import io.postflow.PostflowConfig;
import io.postflow.event.EventEmitter;
import io.postflow.event.PublicationEvent;
import io.postflow.model.Publication;
import io.postflow.model.Schedule;
import io.postflow.spi.ConnectionProvider;
import io.postflow.spi.MetricsExporter;
import io.postflow.spi.PublicationStore;
import io.postflow.spi.ScheduleStore;
import io.postflow.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled database scanner that turns due schedules into publications and claims
 * publications for the {@link DispatchHandler}.
 *
 * <p>Each {@link #tick()}:
 * <ol>
 *   <li>creates the missing {@code pending} publications of every due schedule, one
 *       transaction per schedule;</li>
 *   <li>returns {@code publishing} rows with an expired lease to {@code pending};</li>
 *   <li>claims claimable rows with a conditional update, up to the handler's free capacity
 *       and skipping platforms at their concurrency cap, and hands each won claim over;</li>
 *   <li>emits again the terminal events that no sink has acknowledged within the
 *       redelivery delay, when an {@link EventEmitter} is configured.</li>
 * </ol>
 *
 * <p>Any number of pollers may share one database: a claim is won by exactly one of them
 * and the losers skip the row.
 *
 * <p>This class is thread-safe. The {@link #start()} and {@link #close()} methods are
 * synchronized to prevent concurrent lifecycle transitions.
 */
public final class DispatchPoller implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(DispatchPoller.class.getName());

    private final ConnectionProvider connectionProvider;
    private final ScheduleStore scheduleStore;
    private final PublicationStore publicationStore;
    private final DispatchHandler handler;
    private final EventEmitter emitter;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final int batchSize;
    private final long intervalMs;
    private final Duration leaseDuration;
    private final Duration eventRedeliveryDelay;
    private final String ownerId;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean closed;

    private DispatchPoller(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.scheduleStore = Objects.requireNonNull(builder.scheduleStore, "scheduleStore");
        this.publicationStore = Objects.requireNonNull(builder.publicationStore, "publicationStore");
        this.handler = Objects.requireNonNull(builder.handler, "handler");
        PostflowConfig config = Objects.requireNonNull(builder.config, "config");
        this.emitter = builder.emitter;

        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.batchSize = config.batchSize();
        this.intervalMs = config.tickInterval().toMillis();
        this.leaseDuration = config.leaseDuration();
        this.eventRedeliveryDelay = config.eventRedeliveryDelay();
        this.ownerId = config.workerId();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the scheduled tick loop. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("DispatchPoller has been closed");
        }
        if (pollTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("postflow-poller-"));
        pollTask = scheduler.scheduleWithFixedDelay(this::tick, 0L, intervalMs, TimeUnit.MILLISECONDS);
        logger.log(Level.INFO, "Dispatch poller {0} started, interval={1}ms", new Object[]{ownerId, intervalMs});
    }

    /**
     * Executes a single tick. Called automatically by the scheduler, but may also be invoked
     * directly for testing.
     */
    public void tick() {
        if (closed) {
            return;
        }
        try {
            Instant now = clock.instant();
            materializeDue(now);
            reclaimExpired(now);
            claimAndDispatch(now);
            redeliverEvents(now);
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Tick failed", t);
        }
    }

    private void materializeDue(Instant now) {
        List<Schedule> due;
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            due = scheduleStore.findDue(conn, now, batchSize);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to fetch due schedules", e);
            return;
        }
        if (due.isEmpty()) {
            return;
        }
        metrics.incrementSchedulesDue(due.size());
        for (Schedule schedule : due) {
            materialize(schedule, now);
        }
    }

    private void materialize(Schedule schedule, Instant now) {
        try (Connection conn = connectionProvider.getConnection()) {
            if (schedule.platforms().isEmpty()) {
                // Nothing to publish: complete right away instead of matching findDue forever
                conn.setAutoCommit(true);
                scheduleStore.refreshCompletion(conn, schedule.id(), 0, now);
                return;
            }
            // All-or-nothing, so a schedule never ends up with only some of its publications
            conn.setAutoCommit(false);
            int created = 0;
            try {
                for (Platform platform : schedule.platforms()) {
                    created += publicationStore.insertIfAbsent(conn, schedule.id(), platform, now);
                }
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
            if (created > 0) {
                metrics.incrementPublicationsCreated(created);
                logger.log(Level.FINE, "Created {0} publications for scheduleId={1}",
                    new Object[]{created, schedule.id()});
            }
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to create publications for scheduleId=" + schedule.id(), e);
        }
    }

    private void reclaimExpired(Instant now) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            int reclaimed = publicationStore.reclaimExpired(conn, now);
            if (reclaimed > 0) {
                metrics.incrementLeasesReclaimed(reclaimed);
                logger.log(Level.INFO, "Reclaimed {0} publications with expired leases", reclaimed);
            }
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to reclaim expired leases", e);
        }
    }

    private void claimAndDispatch(Instant now) {
        if (handler.availableCapacity() <= 0) {
            return;
        }
        List<Publication> candidates;
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            candidates = publicationStore.findClaimable(conn, now, batchSize);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to fetch claimable publications", e);
            return;
        }

        for (Publication candidate : candidates) {
            if (handler.availableCapacity() <= 0) {
                break;
            }
            if (!handler.hasCapacity(candidate.platform())) {
                continue;
            }
            Instant leaseExpiresAt = now.plus(leaseDuration);
            if (!claim(candidate, now, leaseExpiresAt)) {
                continue;
            }
            Publication claimed = candidate.claimedBy(ownerId, leaseExpiresAt);
            if (!handler.handle(claimed)) {
                release(claimed);
            }
        }
    }

    private boolean claim(Publication candidate, Instant now, Instant leaseExpiresAt) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            if (publicationStore.claim(conn, candidate.id(), ownerId, now, leaseExpiresAt) == 1) {
                metrics.incrementClaimed();
                return true;
            }
            metrics.incrementClaimConflict();
            logger.log(Level.FINE, "Claim conflict on publicationId={0}", candidate.id());
            return false;
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to claim publicationId=" + candidate.id(), e);
            return false;
        }
    }

    private void release(Publication claimed) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            publicationStore.releaseClaim(conn, claimed.id(), ownerId, clock.instant());
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to release claim on publicationId=" + claimed.id()
                + "; it will be reclaimed when the lease expires", e);
        }
    }

    private void redeliverEvents(Instant now) {
        if (emitter == null) {
            return;
        }
        Instant pendingBefore = now.minus(eventRedeliveryDelay);
        List<Publication> owed;
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            owed = publicationStore.findUnacknowledgedEvents(conn, pendingBefore, batchSize);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to fetch unacknowledged events", e);
            return;
        }
        int redelivered = 0;
        for (Publication row : owed) {
            if (claimRedelivery(row, pendingBefore, now) && emitter.emit(PublicationEvent.fromSettled(row))) {
                redelivered++;
            }
        }
        if (redelivered > 0) {
            logger.log(Level.INFO, "Redelivering {0} unacknowledged publication events", redelivered);
        }
    }

    private boolean claimRedelivery(Publication row, Instant pendingBefore, Instant now) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return publicationStore.claimEventRedelivery(conn, row.id(), pendingBefore, now) == 1;
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to claim event redelivery for publicationId=" + row.id(), e);
            return false;
        }
    }

    /**
     * Cancels the tick schedule and shuts down the scheduler thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Builder for {@link DispatchPoller}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private ScheduleStore scheduleStore;
        private PublicationStore publicationStore;
        private DispatchHandler handler;
        private EventEmitter emitter;
        private PostflowConfig config;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder scheduleStore(ScheduleStore scheduleStore) {
            this.scheduleStore = scheduleStore;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder publicationStore(PublicationStore publicationStore) {
            this.publicationStore = publicationStore;
            return this;
        }

        /**
         * Sets the handler that receives claimed publications (typically a
         * {@link io.postflow.dispatch.DispatcherPollerHandler}).
         *
         * <p><b>Required.</b>
         */
        public Builder handler(DispatchHandler handler) {
            this.handler = handler;
            return this;
        }

        /**
         * Emitter used to redeliver unacknowledged terminal events. Optional; without one no
         * redelivery happens.
         */
        public Builder emitter(EventEmitter emitter) {
            this.emitter = emitter;
            return this;
        }

        /**
         * Supplies tick interval, batch size, lease duration, event redelivery delay and the
         * lease owner id.
         *
         * <p><b>Required.</b>
         */
        public Builder config(PostflowConfig config) {
            this.config = config;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public DispatchPoller build() {
            return new DispatchPoller(this);
        }
    }
}
