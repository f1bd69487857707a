package io.postflow.platform;

import io.postflow.model.ErrorKind;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of one call to a {@link PlatformPublisher}. Publishers never throw; every HTTP
 * status, transport error and timeout is mapped onto one of these variants.
 *
 * <ul>
 *   <li>{@link Success} carries the id the platform assigned to the post.</li>
 *   <li>{@link RateLimited} asks the caller to wait at least {@code retryAfter}.</li>
 *   <li>{@link AuthError} means the token was rejected; a refresh may help.</li>
 *   <li>{@link TransientError} is worth retrying with backoff.</li>
 *   <li>{@link PermanentError} will never succeed as-is.</li>
 * </ul>
 */
public sealed interface PublishOutcome permits PublishOutcome.Success, PublishOutcome.Failure {

    static Success success(String remotePostId) {
        return new Success(remotePostId);
    }

    static RateLimited rateLimited(Duration retryAfter) {
        return new RateLimited(retryAfter, null);
    }

    static AuthError authError(String message) {
        return new AuthError(message);
    }

    static TransientError transientError(String message) {
        return new TransientError(message);
    }

    static PermanentError permanentError(String reason) {
        return new PermanentError(reason);
    }

    /**
     * The post now exists on the platform.
     */
    record Success(String remotePostId) implements PublishOutcome {
        public Success {
            Objects.requireNonNull(remotePostId, "remotePostId");
            if (remotePostId.isBlank()) {
                throw new IllegalArgumentException("remotePostId must not be blank");
            }
        }
    }

    /**
     * Any unsuccessful outcome.
     */
    sealed interface Failure extends PublishOutcome
        permits RateLimited, AuthError, TransientError, PermanentError {

        ErrorKind kind();

        String message();
    }

    record RateLimited(Duration retryAfter, String message) implements Failure {
        public RateLimited {
            Objects.requireNonNull(retryAfter, "retryAfter");
            if (retryAfter.isNegative()) {
                throw new IllegalArgumentException("retryAfter must not be negative");
            }
            if (message == null) {
                message = "Rate limited, retry after " + retryAfter.toSeconds() + "s";
            }
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.RATE_LIMITED;
        }
    }

    record AuthError(String message) implements Failure {
        @Override
        public ErrorKind kind() {
            return ErrorKind.AUTH;
        }
    }

    record TransientError(String message) implements Failure {
        @Override
        public ErrorKind kind() {
            return ErrorKind.TRANSIENT;
        }
    }

    record PermanentError(String message) implements Failure {
        @Override
        public ErrorKind kind() {
            return ErrorKind.PERMANENT;
        }
    }
}
