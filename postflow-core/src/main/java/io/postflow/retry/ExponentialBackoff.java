package io.postflow.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter.
 *
 * <p>Delay formula: {@code min(base * multiplier^n, max)}, scaled by a random factor in
 * [0.5, 1.0]. The un-jittered delay is non-decreasing in {@code n} and never exceeds
 * {@code max}.
 */
public final class ExponentialBackoff {
  private final long baseMs;
  private final double multiplier;
  private final long maxMs;

  public ExponentialBackoff(Duration base, double multiplier, Duration max) {
    Objects.requireNonNull(base, "base");
    Objects.requireNonNull(max, "max");
    if (base.isZero() || base.isNegative()) {
      throw new IllegalArgumentException("base must be > 0, got: " + base);
    }
    if (max.compareTo(base) < 0) {
      throw new IllegalArgumentException("max must be >= base, got: " + max);
    }
    if (Double.isNaN(multiplier) || multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be >= 1.0, got: " + multiplier);
    }
    this.baseMs = base.toMillis();
    this.multiplier = multiplier;
    this.maxMs = max.toMillis();
  }

  /**
   * Returns {@code min(base * multiplier^n, max)} in milliseconds.
   */
  public long cappedDelayMs(int n) {
    if (n <= 0) {
      return baseMs;
    }
    double raw = baseMs * Math.pow(multiplier, n);
    // pow overflows to Infinity long before n gets near Integer.MAX_VALUE
    if (Double.isInfinite(raw) || raw >= maxMs) {
      return maxMs;
    }
    return (long) raw;
  }

  /**
   * Returns the jittered delay for attempt {@code n}.
   */
  public Duration delay(int n) {
    long capped = cappedDelayMs(n);
    double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.0);
    long withJitter = (long) (capped * jitter);
    return Duration.ofMillis(Math.min(maxMs, Math.max(0L, withJitter)));
  }

  public Duration max() {
    return Duration.ofMillis(maxMs);
  }
}
