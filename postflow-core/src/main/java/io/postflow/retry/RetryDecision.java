package io.postflow.retry;

import java.time.Instant;
import java.util.Objects;

/**
 * What to do with a publication after a failed attempt.
 */
public sealed interface RetryDecision
    permits RetryDecision.RetryAt, RetryDecision.RefreshTokenThenRetry, RetryDecision.Fail {

  /**
   * Return the publication to {@code pending} until {@code nextAttemptAt}.
   */
  record RetryAt(Instant nextAttemptAt) implements RetryDecision {
    public RetryAt {
      Objects.requireNonNull(nextAttemptAt, "nextAttemptAt");
    }
  }

  /**
   * Force a token refresh and retry once, immediately.
   */
  record RefreshTokenThenRetry() implements RetryDecision {
  }

  /**
   * Give up; the publication becomes {@code failed}.
   */
  record Fail(String reason) implements RetryDecision {
    public Fail {
      Objects.requireNonNull(reason, "reason");
    }
  }
}
