package io.postflow.retry;

import io.postflow.model.ErrorKind;
import io.postflow.platform.PublishOutcome;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DefaultRetryPolicyTest {
  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private final DefaultRetryPolicy policy = new DefaultRetryPolicy(5,
      new ExponentialBackoff(Duration.ofSeconds(30), 2.0, Duration.ofMinutes(5)));

  @Test
  void rateLimitedRetriesAfterPlatformDelay() {
    RetryDecision decision = policy.decide(PublishOutcome.rateLimited(Duration.ofSeconds(900)), 1, null, NOW);

    RetryDecision.RetryAt retryAt = assertInstanceOf(RetryDecision.RetryAt.class, decision);
    assertEquals(NOW.plusSeconds(900), retryAt.nextAttemptAt());
  }

  @Test
  void transientRetriesWithBackoff() {
    RetryDecision decision = policy.decide(PublishOutcome.transientError("503"), 1, null, NOW);

    RetryDecision.RetryAt retryAt = assertInstanceOf(RetryDecision.RetryAt.class, decision);
    long delayMs = Duration.between(NOW, retryAt.nextAttemptAt()).toMillis();
    assertTrue(delayMs >= 30_000 && delayMs <= 60_000, "got " + delayMs);
  }

  @Test
  void permanentFailsImmediately() {
    RetryDecision decision = policy.decide(PublishOutcome.permanentError("duplicate content"), 1, null, NOW);

    RetryDecision.Fail fail = assertInstanceOf(RetryDecision.Fail.class, decision);
    assertEquals("duplicate content", fail.reason());
  }

  @Test
  void firstAuthErrorAsksForRefresh() {
    RetryDecision decision = policy.decide(PublishOutcome.authError("401"), 1, null, NOW);

    assertInstanceOf(RetryDecision.RefreshTokenThenRetry.class, decision);
  }

  @Test
  void authErrorAfterAuthErrorFails() {
    RetryDecision decision = policy.decide(PublishOutcome.authError("401"), 2, ErrorKind.AUTH, NOW);

    assertInstanceOf(RetryDecision.Fail.class, decision);
  }

  @Test
  void authErrorAfterOtherErrorStillRefreshes() {
    RetryDecision decision = policy.decide(PublishOutcome.authError("401"), 2, ErrorKind.TRANSIENT, NOW);

    assertInstanceOf(RetryDecision.RefreshTokenThenRetry.class, decision);
  }

  @Test
  void attemptLimitWinsOverEveryOtherRule() {
    assertInstanceOf(RetryDecision.Fail.class,
        policy.decide(PublishOutcome.rateLimited(Duration.ofSeconds(1)), 5, null, NOW));
    assertInstanceOf(RetryDecision.Fail.class,
        policy.decide(PublishOutcome.transientError("timeout"), 5, null, NOW));
    assertInstanceOf(RetryDecision.Fail.class,
        policy.decide(PublishOutcome.authError("401"), 7, null, NOW));
  }

  @Test
  void rejectsMaxAttemptsBelowOne() {
    assertThrows(IllegalArgumentException.class, () -> new DefaultRetryPolicy(0,
        new ExponentialBackoff(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(2))));
  }
}
