package io.postflow.model;

import io.postflow.Platform;

import java.time.Instant;
import java.util.Objects;

/**
 * Ledger row tracking the delivery of one {@link Schedule} to one {@link Platform}.
 *
 * <p>At most one row exists per {@code (scheduleId, platform)}. Once {@code remotePostId}
 * is set it never changes, and a row carrying one is never sent to the platform again.
 *
 * @param leaseOwner     dispatcher holding the claim, or {@code null}
 * @param leaseExpiresAt when the claim lapses, or {@code null}
 * @param lastErrorKind  classification of the most recent failed attempt, or {@code null}
 */
public record Publication(
    String id,
    String scheduleId,
    Platform platform,
    PublicationStatus status,
    int attemptCount,
    Instant nextRetryAt,
    String leaseOwner,
    Instant leaseExpiresAt,
    ErrorKind lastErrorKind,
    String errorMessage,
    String remotePostId,
    Instant publishedAt,
    Instant createdAt,
    Instant updatedAt
) {
  public Publication {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(scheduleId, "scheduleId");
    Objects.requireNonNull(platform, "platform");
    Objects.requireNonNull(status, "status");
    if (attemptCount < 0) {
      throw new IllegalArgumentException("attemptCount must be >= 0");
    }
  }

  /**
   * Returns a copy carrying the lease just won by {@code owner}.
   */
  public Publication claimedBy(String owner, Instant leaseExpiresAt) {
    return new Publication(id, scheduleId, platform, PublicationStatus.PUBLISHING, attemptCount,
        nextRetryAt, owner, leaseExpiresAt, lastErrorKind, errorMessage, remotePostId, publishedAt,
        createdAt, updatedAt);
  }
}
