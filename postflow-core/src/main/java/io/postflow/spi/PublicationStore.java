package io.postflow.spi;

import io.postflow.Platform;
import io.postflow.model.ErrorKind;
import io.postflow.model.Publication;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for the publication ledger.
 *
 * <p>Every write is conditional and returns the number of rows it changed. A result of
 * {@code 0} means another dispatcher won the row (or the lease lapsed) and is a normal
 * outcome, not an error. All methods receive an explicit {@link Connection} so the caller
 * controls transaction boundaries. Implementations live in the {@code postflow-jdbc} module.
 */
public interface PublicationStore {

    /**
     * Creates a {@code pending} publication for {@code (scheduleId, platform)} unless one exists.
     *
     * @return 1 if a row was created, 0 if it already existed
     */
    int insertIfAbsent(Connection conn, String scheduleId, Platform platform, Instant now);

    /**
     * Lists pending publications whose retry time has arrived, whose lease is absent or
     * expired, and whose schedule is still active; oldest {@code next_retry_at} first.
     */
    List<Publication> findClaimable(Connection conn, Instant now, int limit);

    /**
     * Moves a claimable row to {@code publishing} under {@code owner}'s lease.
     *
     * @return 1 if the claim was won, 0 if another dispatcher got there first
     */
    int claim(Connection conn, String publicationId, String owner, Instant now, Instant leaseExpiresAt);

    /**
     * Extends the lease held by {@code owner}. Returns 0 if the lease is no longer held.
     */
    int renewLease(Connection conn, String publicationId, String owner, Instant now, Instant leaseExpiresAt);

    /**
     * {@code publishing -> published}, conditioned on the lease owner. An already recorded
     * remote post id is kept. The same update marks the row's completion event as owed
     * (pending since {@code publishedAt}) until {@link #acknowledgeEvent} clears it.
     *
     * @param attempts number of platform attempts made under this lease
     */
    int markPublished(Connection conn, String publicationId, String owner, String remotePostId,
        int attempts, Instant publishedAt);

    /**
     * Records the remote post id only when none is stored yet, regardless of status or lease.
     */
    int recordRemotePostId(Connection conn, String publicationId, String remotePostId, Instant now);

    /**
     * {@code publishing -> pending} with a new retry time, conditioned on the lease owner.
     */
    int markRetry(Connection conn, String publicationId, String owner, Instant nextRetryAt,
        int attempts, ErrorKind errorKind, String error, Instant now);

    /**
     * {@code publishing -> failed}, conditioned on the lease owner. Marks the completion
     * event as owed, like {@link #markPublished}.
     */
    int markFailed(Connection conn, String publicationId, String owner, int attempts,
        ErrorKind errorKind, String error, Instant now);

    /**
     * Returns a claimed row to {@code pending} without consuming an attempt.
     */
    int releaseClaim(Connection conn, String publicationId, String owner, Instant now);

    /**
     * Returns every {@code publishing} row whose lease has expired to {@code pending}.
     *
     * @return the number of rows reclaimed
     */
    int reclaimExpired(Connection conn, Instant now);

    /**
     * Lists terminal rows whose completion event has been owed since {@code pendingBefore}
     * or earlier, oldest first.
     */
    List<Publication> findUnacknowledgedEvents(Connection conn, Instant pendingBefore, int limit);

    /**
     * Claims one redelivery of an owed event by moving its pending time to {@code now}.
     * Only matches while the event is still owed since {@code pendingBefore} or earlier.
     *
     * @return 1 if this caller should redeliver, 0 if it was acknowledged or claimed elsewhere
     */
    int claimEventRedelivery(Connection conn, String publicationId, Instant pendingBefore, Instant now);

    /**
     * Clears the owed-event marker once a sink has accepted the event.
     */
    int acknowledgeEvent(Connection conn, String publicationId);

    Optional<Publication> findById(Connection conn, String publicationId);

    List<Publication> findBySchedule(Connection conn, String scheduleId);
}
