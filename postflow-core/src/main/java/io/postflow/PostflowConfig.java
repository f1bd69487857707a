package io.postflow;

import io.postflow.util.Durations;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable set of dispatcher tunables, passed to each component at construction.
 *
 * <p>Built with {@link #builder()}; {@link Builder#build()} rejects inconsistent values, in
 * particular a lease shorter than {@value #CALLS_PER_LEASE} external calls: the credential
 * lookup, a token refresh and the publish call can all run between two lease renewals.
 */
public final class PostflowConfig {
  static final int CALLS_PER_LEASE = 3;

  private final Duration tickInterval;
  private final int batchSize;
  private final Duration leaseDuration;
  private final Duration callTimeout;
  private final int workerCount;
  private final Map<Platform, Integer> platformConcurrency;
  private final int maxAttempts;
  private final Duration backoffBase;
  private final double backoffMultiplier;
  private final Duration backoffMax;
  private final Duration tokenSafetyMargin;
  private final int eventDeliveryAttempts;
  private final int eventQueueCapacity;
  private final Duration eventRedeliveryDelay;
  private final Duration drainTimeout;
  private final String workerId;

  private PostflowConfig(Builder builder) {
    this.tickInterval = Durations.requirePositive(builder.tickInterval, "tickInterval");
    this.batchSize = Durations.requireAtLeastOne(builder.batchSize, "batchSize");
    this.leaseDuration = Durations.requirePositive(builder.leaseDuration, "leaseDuration");
    this.callTimeout = Durations.requirePositive(builder.callTimeout, "callTimeout");
    this.workerCount = Durations.requireAtLeastOne(builder.workerCount, "workerCount");
    this.maxAttempts = Durations.requireAtLeastOne(builder.maxAttempts, "maxAttempts");
    this.backoffBase = Durations.requirePositive(builder.backoffBase, "backoffBase");
    this.backoffMax = Durations.requirePositive(builder.backoffMax, "backoffMax");
    this.tokenSafetyMargin = Objects.requireNonNull(builder.tokenSafetyMargin, "tokenSafetyMargin");
    this.eventDeliveryAttempts = Durations.requireAtLeastOne(builder.eventDeliveryAttempts, "eventDeliveryAttempts");
    this.eventQueueCapacity = Durations.requireAtLeastOne(builder.eventQueueCapacity, "eventQueueCapacity");
    this.eventRedeliveryDelay = Durations.requirePositive(builder.eventRedeliveryDelay, "eventRedeliveryDelay");
    this.drainTimeout = Objects.requireNonNull(builder.drainTimeout, "drainTimeout");
    this.workerId = builder.workerId != null
        ? builder.workerId : "dispatcher-" + UUID.randomUUID().toString().substring(0, 8);

    if (builder.backoffMultiplier < 1.0) {
      throw new IllegalArgumentException("backoffMultiplier must be >= 1.0, got: " + builder.backoffMultiplier);
    }
    this.backoffMultiplier = builder.backoffMultiplier;
    if (backoffMax.compareTo(backoffBase) < 0) {
      throw new IllegalArgumentException("backoffMax must be >= backoffBase");
    }
    if (tokenSafetyMargin.isNegative() || drainTimeout.isNegative()) {
      throw new IllegalArgumentException("tokenSafetyMargin and drainTimeout must be >= 0");
    }
    if (leaseDuration.compareTo(callTimeout.multipliedBy(CALLS_PER_LEASE)) <= 0) {
      throw new IllegalArgumentException("leaseDuration (" + leaseDuration + ") must be longer than "
          + CALLS_PER_LEASE + " x callTimeout (" + callTimeout + ")");
    }
    if (workerId.isBlank()) {
      throw new IllegalArgumentException("workerId must not be blank");
    }

    Map<Platform, Integer> caps = new EnumMap<>(Platform.class);
    for (Map.Entry<Platform, Integer> entry : builder.platformConcurrency.entrySet()) {
      int cap = Durations.requireAtLeastOne(entry.getValue(), "platformConcurrency[" + entry.getKey().tag() + "]");
      caps.put(entry.getKey(), cap);
    }
    this.platformConcurrency = Collections.unmodifiableMap(caps);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static PostflowConfig defaults() {
    return builder().build();
  }

  public Duration tickInterval() {
    return tickInterval;
  }

  public int batchSize() {
    return batchSize;
  }

  public Duration leaseDuration() {
    return leaseDuration;
  }

  public Duration callTimeout() {
    return callTimeout;
  }

  public int workerCount() {
    return workerCount;
  }

  /**
   * Per-platform caps on concurrent attempts. Platforms without an entry are limited only
   * by {@link #workerCount()}.
   */
  public Map<Platform, Integer> platformConcurrency() {
    return platformConcurrency;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public Duration backoffBase() {
    return backoffBase;
  }

  public double backoffMultiplier() {
    return backoffMultiplier;
  }

  public Duration backoffMax() {
    return backoffMax;
  }

  public Duration tokenSafetyMargin() {
    return tokenSafetyMargin;
  }

  public int eventDeliveryAttempts() {
    return eventDeliveryAttempts;
  }

  public int eventQueueCapacity() {
    return eventQueueCapacity;
  }

  /**
   * How long a terminal event may stay unacknowledged before the poller emits it again.
   */
  public Duration eventRedeliveryDelay() {
    return eventRedeliveryDelay;
  }

  public Duration drainTimeout() {
    return drainTimeout;
  }

  /**
   * Lease owner written into claimed rows. Must be unique per running dispatcher.
   */
  public String workerId() {
    return workerId;
  }

  @Override
  public String toString() {
    return "PostflowConfig{tickInterval=" + tickInterval + ", batchSize=" + batchSize
        + ", leaseDuration=" + leaseDuration + ", callTimeout=" + callTimeout
        + ", workerCount=" + workerCount + ", platformConcurrency=" + platformConcurrency
        + ", maxAttempts=" + maxAttempts + ", backoff=" + backoffBase + "*" + backoffMultiplier
        + "^n<=" + backoffMax + ", workerId=" + workerId + "}";
  }

  /** Builder for {@link PostflowConfig}. */
  public static final class Builder {
    private Duration tickInterval = Duration.ofSeconds(5);
    private int batchSize = 50;
    private Duration leaseDuration = Duration.ofMinutes(5);
    private Duration callTimeout = Duration.ofSeconds(30);
    private int workerCount = 4;
    private final Map<Platform, Integer> platformConcurrency = new EnumMap<>(Platform.class);
    private int maxAttempts = 5;
    private Duration backoffBase = Duration.ofSeconds(30);
    private double backoffMultiplier = 2.0;
    private Duration backoffMax = Duration.ofMinutes(5);
    private Duration tokenSafetyMargin = Duration.ofMinutes(5);
    private int eventDeliveryAttempts = 3;
    private int eventQueueCapacity = 1000;
    private Duration eventRedeliveryDelay = Duration.ofMinutes(1);
    private Duration drainTimeout = Duration.ofSeconds(5);
    private String workerId;

    private Builder() {
    }

    /** How often the poller ticks. Defaults to 5 seconds. */
    public Builder tickInterval(Duration tickInterval) {
      this.tickInterval = tickInterval;
      return this;
    }

    /** Maximum rows read per query in one tick. Defaults to 50. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** How long a claim stays exclusive. Defaults to 5 minutes. */
    public Builder leaseDuration(Duration leaseDuration) {
      this.leaseDuration = leaseDuration;
      return this;
    }

    /** Timeout for each external call. Defaults to 30 seconds. */
    public Builder callTimeout(Duration callTimeout) {
      this.callTimeout = callTimeout;
      return this;
    }

    /** Number of attempt worker threads. Defaults to 4. */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /** Caps concurrent attempts against {@code platform}. */
    public Builder platformConcurrency(Platform platform, int maxConcurrent) {
      this.platformConcurrency.put(Objects.requireNonNull(platform, "platform"), maxConcurrent);
      return this;
    }

    /** Attempts before a publication fails for good. Defaults to 5. */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /** Defaults to 30 seconds. */
    public Builder backoffBase(Duration backoffBase) {
      this.backoffBase = backoffBase;
      return this;
    }

    /** Defaults to 2.0. */
    public Builder backoffMultiplier(double backoffMultiplier) {
      this.backoffMultiplier = backoffMultiplier;
      return this;
    }

    /** Defaults to 5 minutes. */
    public Builder backoffMax(Duration backoffMax) {
      this.backoffMax = backoffMax;
      return this;
    }

    /** Tokens expiring within this margin are refreshed before use. Defaults to 5 minutes. */
    public Builder tokenSafetyMargin(Duration tokenSafetyMargin) {
      this.tokenSafetyMargin = tokenSafetyMargin;
      return this;
    }

    public Builder eventDeliveryAttempts(int eventDeliveryAttempts) {
      this.eventDeliveryAttempts = eventDeliveryAttempts;
      return this;
    }

    public Builder eventQueueCapacity(int eventQueueCapacity) {
      this.eventQueueCapacity = eventQueueCapacity;
      return this;
    }

    /** Defaults to 1 minute. */
    public Builder eventRedeliveryDelay(Duration eventRedeliveryDelay) {
      this.eventRedeliveryDelay = eventRedeliveryDelay;
      return this;
    }

    /** How long {@code close()} waits for in-flight attempts and queued events. Defaults to 5 seconds. */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    /** Lease owner id. Defaults to {@code dispatcher-<random>}. */
    public Builder workerId(String workerId) {
      this.workerId = workerId;
      return this;
    }

    public PostflowConfig build() {
      return new PostflowConfig(this);
    }
  }
}
