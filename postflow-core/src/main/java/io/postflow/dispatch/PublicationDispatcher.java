package io.postflow.dispatch;

import io.postflow.Platform;
import io.postflow.PostflowConfig;
import io.postflow.event.EventEmitter;
import io.postflow.model.Publication;
import io.postflow.model.PublicationStatus;
import io.postflow.platform.PublisherRegistry;
import io.postflow.retry.DefaultRetryPolicy;
import io.postflow.retry.ExponentialBackoff;
import io.postflow.retry.RetryPolicy;
import io.postflow.spi.ConnectionProvider;
import io.postflow.spi.ConnectionStore;
import io.postflow.spi.MediaStore;
import io.postflow.spi.MetricsExporter;
import io.postflow.spi.PostStore;
import io.postflow.spi.PublicationStore;
import io.postflow.spi.ScheduleStore;
import io.postflow.util.DaemonThreadFactory;
import io.postflow.vault.CredentialVault;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded worker pool that executes claimed publications.
 *
 * <p>Capacity is {@code workerCount} attempts at a time, further limited per platform by
 * {@link PostflowConfig#platformConcurrency()}. {@link #submit} never queues beyond that
 * capacity: a claim that cannot start immediately is refused so the caller can release it.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} for graceful shutdown with the configured drain timeout.
 *
 * @see DispatcherPollerHandler
 */
public final class PublicationDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PublicationDispatcher.class.getName());

  private final ExecutorService workers;
  private final Semaphore slots;
  private final Map<Platform, Semaphore> platformSlots = new EnumMap<>(Platform.class);
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final AtomicInteger inFlight = new AtomicInteger();
  private final Object idleMonitor = new Object();

  private final AttemptExecutor executor;
  private final MetricsExporter metrics;
  private final String workerId;
  private final long drainTimeoutMs;

  private PublicationDispatcher(Builder builder) {
    Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    Objects.requireNonNull(builder.publicationStore, "publicationStore");
    Objects.requireNonNull(builder.scheduleStore, "scheduleStore");
    Objects.requireNonNull(builder.connectionStore, "connectionStore");
    Objects.requireNonNull(builder.publisherRegistry, "publisherRegistry");
    Objects.requireNonNull(builder.vault, "vault");
    Objects.requireNonNull(builder.postStore, "postStore");
    Objects.requireNonNull(builder.mediaStore, "mediaStore");
    PostflowConfig config = Objects.requireNonNull(builder.config, "config");

    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    RetryPolicy retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy
        : new DefaultRetryPolicy(config.maxAttempts(),
            new ExponentialBackoff(config.backoffBase(), config.backoffMultiplier(), config.backoffMax()));
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.executor = new AttemptExecutor(builder, retryPolicy, metrics, clock);
    this.workerId = config.workerId();
    this.drainTimeoutMs = config.drainTimeout().toMillis();

    this.slots = new Semaphore(config.workerCount());
    config.platformConcurrency().forEach((platform, cap) -> platformSlots.put(platform, new Semaphore(cap)));
    this.workers = Executors.newFixedThreadPool(config.workerCount(),
        new DaemonThreadFactory("postflow-worker-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Number of attempts that could start right now.
   */
  public int availableCapacity() {
    return accepting.get() ? slots.availablePermits() : 0;
  }

  /**
   * Whether the per-platform cap for {@code platform} leaves room for another attempt.
   */
  public boolean hasCapacity(Platform platform) {
    Semaphore cap = platformSlots.get(platform);
    return cap == null || cap.availablePermits() > 0;
  }

  /**
   * Starts executing {@code claimed} on a worker thread.
   *
   * @param claimed a publication in {@code publishing} whose lease is held by this dispatcher
   * @return {@code false} if no worker (or no per-platform slot) is free, or the dispatcher
   *     is closing; the claim should then be released
   */
  public boolean submit(Publication claimed) {
    Objects.requireNonNull(claimed, "claimed");
    if (claimed.status() != PublicationStatus.PUBLISHING || !workerId.equals(claimed.leaseOwner())) {
      throw new IllegalArgumentException("Publication " + claimed.id() + " is not claimed by " + workerId);
    }
    if (!accepting.get() || !slots.tryAcquire()) {
      return false;
    }
    Semaphore cap = platformSlots.get(claimed.platform());
    if (cap != null && !cap.tryAcquire()) {
      slots.release();
      return false;
    }
    metrics.recordInFlight(inFlight.incrementAndGet());
    try {
      workers.execute(() -> runAttempt(claimed, cap));
      return true;
    } catch (RejectedExecutionException e) {
      release(cap);
      return false;
    }
  }

  private void runAttempt(Publication claimed, Semaphore cap) {
    try {
      executor.execute(claimed);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Worker error for publicationId=" + claimed.id(), t);
    } finally {
      release(cap);
    }
  }

  private void release(Semaphore cap) {
    if (cap != null) {
      cap.release();
    }
    slots.release();
    int remaining = inFlight.decrementAndGet();
    metrics.recordInFlight(remaining);
    if (remaining == 0) {
      synchronized (idleMonitor) {
        idleMonitor.notifyAll();
      }
    }
  }

  /**
   * Blocks until no attempt is executing or {@code timeout} elapses.
   *
   * @return {@code true} if idle
   */
  public boolean awaitIdle(Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    synchronized (idleMonitor) {
      while (inFlight.get() > 0) {
        long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        if (remainingMs <= 0) {
          return false;
        }
        idleMonitor.wait(remainingMs);
      }
    }
    return true;
  }

  public int inFlight() {
    return inFlight.get();
  }

  /**
   * Stops accepting claims and waits up to the drain timeout for running attempts.
   * Attempts still running afterwards are interrupted; their leases expire and the rows
   * are reclaimed by a later tick.
   */
  @Override
  public void close() {
    accepting.set(false);
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; interrupting " + inFlight.get() + " attempts");
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link PublicationDispatcher}. */
  public static final class Builder {
    ConnectionProvider connectionProvider;
    PublicationStore publicationStore;
    ScheduleStore scheduleStore;
    ConnectionStore connectionStore;
    PublisherRegistry publisherRegistry;
    CredentialVault vault;
    RetryPolicy retryPolicy;
    PostStore postStore;
    MediaStore mediaStore;
    EventEmitter emitter;
    PostflowConfig config;
    MetricsExporter metrics;
    Clock clock;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the ledger store used for conditional status writes.
     *
     * <p><b>Required.</b>
     */
    public Builder publicationStore(PublicationStore publicationStore) {
      this.publicationStore = publicationStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder scheduleStore(ScheduleStore scheduleStore) {
      this.scheduleStore = scheduleStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder connectionStore(ConnectionStore connectionStore) {
      this.connectionStore = connectionStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder publisherRegistry(PublisherRegistry publisherRegistry) {
      this.publisherRegistry = publisherRegistry;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder vault(CredentialVault vault) {
      this.vault = vault;
      return this;
    }

    /**
     * Optional. Defaults to {@link DefaultRetryPolicy} built from the config's max attempts
     * and backoff settings.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder postStore(PostStore postStore) {
      this.postStore = postStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder mediaStore(MediaStore mediaStore) {
      this.mediaStore = mediaStore;
      return this;
    }

    /**
     * Sets the emitter notified of terminal transitions.
     *
     * <p>Optional. Without one no events are emitted.
     */
    public Builder emitter(EventEmitter emitter) {
      this.emitter = emitter;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder config(PostflowConfig config) {
      this.config = config;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public PublicationDispatcher build() {
      return new PublicationDispatcher(this);
    }
  }
}
