package io.postflow.retry;

import io.postflow.model.ErrorKind;
import io.postflow.platform.PublishOutcome;

import java.time.Instant;
import java.util.Objects;

/**
 * Retry rules applied in order:
 *
 * <ol>
 *   <li>{@code attemptCount >= maxAttempts}: fail.</li>
 *   <li>{@link PublishOutcome.PermanentError}: fail.</li>
 *   <li>{@link PublishOutcome.RateLimited}: retry at {@code now + retryAfter}.</li>
 *   <li>{@link PublishOutcome.TransientError}: retry at {@code now + backoff(attemptCount)}.</li>
 *   <li>{@link PublishOutcome.AuthError}: refresh the token and retry, unless the previous
 *       attempt was also an auth error, in which case fail.</li>
 * </ol>
 */
public final class DefaultRetryPolicy implements RetryPolicy {
  private final int maxAttempts;
  private final ExponentialBackoff backoff;

  public DefaultRetryPolicy(int maxAttempts, ExponentialBackoff backoff) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
    }
    this.maxAttempts = maxAttempts;
    this.backoff = Objects.requireNonNull(backoff, "backoff");
  }

  @Override
  public RetryDecision decide(PublishOutcome.Failure failure, int attemptCount,
      ErrorKind previousErrorKind, Instant now) {
    Objects.requireNonNull(failure, "failure");
    Objects.requireNonNull(now, "now");

    if (attemptCount >= maxAttempts) {
      return new RetryDecision.Fail("Giving up after " + attemptCount + " attempts: "
          + failure.message());
    }
    if (failure instanceof PublishOutcome.PermanentError) {
      return new RetryDecision.Fail(failure.message());
    }
    if (failure instanceof PublishOutcome.RateLimited rateLimited) {
      return new RetryDecision.RetryAt(now.plus(rateLimited.retryAfter()));
    }
    if (failure instanceof PublishOutcome.TransientError) {
      return new RetryDecision.RetryAt(now.plus(backoff.delay(attemptCount)));
    }
    if (previousErrorKind == ErrorKind.AUTH) {
      return new RetryDecision.Fail("Authentication failed after token refresh: " + failure.message());
    }
    return new RetryDecision.RefreshTokenThenRetry();
  }

  public int maxAttempts() {
    return maxAttempts;
  }
}
