package io.postflow.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffTest {

  private final ExponentialBackoff backoff =
      new ExponentialBackoff(Duration.ofSeconds(30), 2.0, Duration.ofMinutes(5));

  @Test
  void cappedDelayGrowsGeometrically() {
    assertEquals(60_000, backoff.cappedDelayMs(1));
    assertEquals(120_000, backoff.cappedDelayMs(2));
    assertEquals(240_000, backoff.cappedDelayMs(3));
    assertEquals(300_000, backoff.cappedDelayMs(4));
  }

  @Test
  void cappedDelayIsMonotonicAndBounded() {
    long previous = 0;
    for (int n = 0; n < 200; n++) {
      long delay = backoff.cappedDelayMs(n);
      assertTrue(delay >= previous, "delay decreased at n=" + n);
      assertTrue(delay <= 300_000, "delay above max at n=" + n);
      previous = delay;
    }
  }

  @Test
  void hugeAttemptCountDoesNotOverflow() {
    assertEquals(300_000, backoff.cappedDelayMs(Integer.MAX_VALUE));
    Duration delay = backoff.delay(Integer.MAX_VALUE);
    assertFalse(delay.isNegative());
    assertTrue(delay.toMillis() <= 300_000);
  }

  @Test
  void jitterStaysWithinHalfToFullDelay() {
    for (int i = 0; i < 500; i++) {
      long delay = backoff.delay(2).toMillis();
      assertTrue(delay >= 60_000 && delay <= 120_000, "Expected delay in [60000, 120000], got: " + delay);
    }
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class,
        () -> new ExponentialBackoff(Duration.ZERO, 2.0, Duration.ofSeconds(1)));
    assertThrows(IllegalArgumentException.class,
        () -> new ExponentialBackoff(Duration.ofSeconds(1), 0.5, Duration.ofSeconds(10)));
    assertThrows(IllegalArgumentException.class,
        () -> new ExponentialBackoff(Duration.ofSeconds(10), 2.0, Duration.ofSeconds(1)));
    assertThrows(NullPointerException.class,
        () -> new ExponentialBackoff(null, 2.0, Duration.ofSeconds(1)));
  }
}
