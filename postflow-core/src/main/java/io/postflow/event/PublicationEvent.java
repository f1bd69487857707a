package io.postflow.event;

import io.postflow.Platform;
import io.postflow.model.ErrorKind;
import io.postflow.model.Publication;
import io.postflow.model.PublicationStatus;

import java.time.Instant;
import java.util.Objects;

/**
 * Emitted once a publication reaches a terminal status.
 *
 * @param remotePostId set for {@link Outcome#PUBLISHED}
 * @param errorKind    set for {@link Outcome#FAILED}
 * @param errorMessage set for {@link Outcome#FAILED}
 */
public record PublicationEvent(
    String scheduleId,
    String publicationId,
    Platform platform,
    Outcome outcome,
    String remotePostId,
    ErrorKind errorKind,
    String errorMessage,
    int attemptCount,
    Instant occurredAt
) {
    public enum Outcome {
        PUBLISHED,
        FAILED
    }

    public PublicationEvent {
        Objects.requireNonNull(scheduleId, "scheduleId");
        Objects.requireNonNull(publicationId, "publicationId");
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(occurredAt, "occurredAt");
    }

    public static PublicationEvent published(String scheduleId, String publicationId, Platform platform,
                                             String remotePostId, int attemptCount, Instant occurredAt) {
        return new PublicationEvent(scheduleId, publicationId, platform, Outcome.PUBLISHED,
            remotePostId, null, null, attemptCount, occurredAt);
    }

    public static PublicationEvent failed(String scheduleId, String publicationId, Platform platform,
                                          ErrorKind errorKind, String errorMessage, int attemptCount,
                                          Instant occurredAt) {
        return new PublicationEvent(scheduleId, publicationId, platform, Outcome.FAILED,
            null, errorKind, errorMessage, attemptCount, occurredAt);
    }

    /**
     * Rebuilds the event a terminal ledger row stands for, for redelivery.
     *
     * @throws IllegalArgumentException if the row is not {@code published} or {@code failed}
     */
    public static PublicationEvent fromSettled(Publication row) {
        if (row.status() == PublicationStatus.PUBLISHED) {
            Instant at = row.publishedAt() != null ? row.publishedAt() : row.updatedAt();
            return published(row.scheduleId(), row.id(), row.platform(), row.remotePostId(),
                row.attemptCount(), at);
        }
        if (row.status() == PublicationStatus.FAILED) {
            return failed(row.scheduleId(), row.id(), row.platform(), row.lastErrorKind(), row.errorMessage(),
                row.attemptCount(), row.updatedAt());
        }
        throw new IllegalArgumentException("Publication " + row.id() + " is not settled: " + row.status());
    }
}
