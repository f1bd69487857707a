package io.postflow.retry;

import io.postflow.model.ErrorKind;
import io.postflow.platform.PublishOutcome;

import java.time.Instant;

/**
 * Maps a failed attempt to the next step. Implementations must be pure: the same
 * arguments always yield the same kind of decision, and nothing is read or written.
 *
 * @see DefaultRetryPolicy
 */
public interface RetryPolicy {

  /**
   * @param failure           outcome of the attempt that just failed
   * @param attemptCount      attempts made so far, including this one
   * @param previousErrorKind classification of the attempt before this one, or {@code null}
   * @param now               current time
   */
  RetryDecision decide(PublishOutcome.Failure failure, int attemptCount, ErrorKind previousErrorKind,
      Instant now);
}
