package io.postflow;

import io.postflow.dispatch.DispatcherPollerHandler;
import io.postflow.dispatch.PublicationDispatcher;
import io.postflow.event.EventEmitter;
import io.postflow.event.LedgerEventAcknowledger;
import io.postflow.platform.PublisherRegistry;
import io.postflow.poller.DispatchPoller;
import io.postflow.retry.RetryPolicy;
import io.postflow.spi.ConnectionProvider;
import io.postflow.spi.ConnectionStore;
import io.postflow.spi.MediaStore;
import io.postflow.spi.MetricsExporter;
import io.postflow.spi.NotificationSink;
import io.postflow.spi.PostStore;
import io.postflow.spi.PublicationStore;
import io.postflow.spi.ScheduleStore;
import io.postflow.spi.TokenCipher;
import io.postflow.spi.TokenRefresher;
import io.postflow.vault.CredentialVault;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a {@link CredentialVault}, {@link EventEmitter},
 * {@link PublicationDispatcher} and {@link DispatchPoller} into a single
 * {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Postflow postflow = Postflow.builder()
 *     .config(PostflowConfig.builder().workerCount(8).build())
 *     .connectionProvider(connectionProvider)
 *     .scheduleStore(stores.scheduleStore())
 *     .publicationStore(stores.publicationStore())
 *     .connectionStore(stores.connectionStore())
 *     .publisherRegistry(registry)
 *     .tokenCipher(cipher)
 *     .tokenRefresher(refresher)
 *     .postStore(postStore)
 *     .mediaStore(mediaStore)
 *     .notificationSink(sink)
 *     .build()) {
 *   postflow.start();
 *   // ...
 * }
 * }</pre>
 */
public final class Postflow implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Postflow.class.getName());

  private final PostflowConfig config;
  private final CredentialVault vault;
  private final EventEmitter emitter;
  private final PublicationDispatcher dispatcher;
  private final DispatchPoller poller;
  private final MetricsExporter metrics;

  private Postflow(PostflowConfig config, CredentialVault vault, EventEmitter emitter,
      PublicationDispatcher dispatcher, DispatchPoller poller, MetricsExporter metrics) {
    this.config = config;
    this.vault = vault;
    this.emitter = emitter;
    this.dispatcher = dispatcher;
    this.poller = poller;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the tick loop at the configured interval.
   */
  public void start() {
    poller.start();
    logger.info("Postflow dispatcher started: " + config);
  }

  /**
   * Runs one tick on the calling thread. Attempts still run on worker threads; see
   * {@link #awaitIdle(Duration)}.
   */
  public void tick() {
    poller.tick();
  }

  /**
   * Waits until no attempt is executing.
   *
   * @return {@code true} if idle before the timeout
   */
  public boolean awaitIdle(Duration timeout) throws InterruptedException {
    return dispatcher.awaitIdle(timeout);
  }

  public CredentialVault vault() {
    return vault;
  }

  public PublicationDispatcher dispatcher() {
    return dispatcher;
  }

  public PostflowConfig config() {
    return config;
  }

  /**
   * Shuts down components in order: poller, dispatcher, emitter.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      poller.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      dispatcher.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    try {
      emitter.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Postflow}. */
  public static final class Builder {
    private PostflowConfig config;
    private ConnectionProvider connectionProvider;
    private ScheduleStore scheduleStore;
    private PublicationStore publicationStore;
    private ConnectionStore connectionStore;
    private PublisherRegistry publisherRegistry;
    private TokenCipher tokenCipher;
    private TokenRefresher tokenRefresher;
    private PostStore postStore;
    private MediaStore mediaStore;
    private NotificationSink notificationSink;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private Clock clock;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /** Optional. Defaults to {@link PostflowConfig#defaults()}. */
    public Builder config(PostflowConfig config) {
      this.config = config;
      return this;
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder scheduleStore(ScheduleStore scheduleStore) {
      this.scheduleStore = scheduleStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder publicationStore(PublicationStore publicationStore) {
      this.publicationStore = publicationStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder connectionStore(ConnectionStore connectionStore) {
      this.connectionStore = connectionStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder publisherRegistry(PublisherRegistry publisherRegistry) {
      this.publisherRegistry = publisherRegistry;
      return this;
    }

    /** <b>Required.</b> */
    public Builder tokenCipher(TokenCipher tokenCipher) {
      this.tokenCipher = tokenCipher;
      return this;
    }

    /** <b>Required.</b> */
    public Builder tokenRefresher(TokenRefresher tokenRefresher) {
      this.tokenRefresher = tokenRefresher;
      return this;
    }

    /** <b>Required.</b> */
    public Builder postStore(PostStore postStore) {
      this.postStore = postStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder mediaStore(MediaStore mediaStore) {
      this.mediaStore = mediaStore;
      return this;
    }

    /** Optional. Defaults to {@link NotificationSink#NOOP}. */
    public Builder notificationSink(NotificationSink notificationSink) {
      this.notificationSink = notificationSink;
      return this;
    }

    /** Optional. Defaults to a {@link io.postflow.retry.DefaultRetryPolicy} built from the config. */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to the UTC system clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Postflow build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      PostflowConfig cfg = config != null ? config : PostflowConfig.defaults();
      MetricsExporter m = metrics != null ? metrics : MetricsExporter.NOOP;
      Clock c = clock != null ? clock : Clock.systemUTC();

      CredentialVault vault = CredentialVault.builder()
          .connectionProvider(connectionProvider)
          .connectionStore(connectionStore)
          .cipher(tokenCipher)
          .refresher(tokenRefresher)
          .safetyMargin(cfg.tokenSafetyMargin())
          .ownerId(cfg.workerId())
          .refreshLease(cfg.callTimeout().multipliedBy(2))
          .clock(c)
          .metrics(m)
          .build();

      EventEmitter emitter = EventEmitter.builder()
          .sink(notificationSink != null ? notificationSink : NotificationSink.NOOP)
          .deliveryAttempts(cfg.eventDeliveryAttempts())
          .queueCapacity(cfg.eventQueueCapacity())
          .drainTimeoutMs(cfg.drainTimeout().toMillis())
          .acknowledger(new LedgerEventAcknowledger(connectionProvider, publicationStore))
          .metrics(m)
          .build();

      PublicationDispatcher dispatcher;
      try {
        dispatcher = PublicationDispatcher.builder()
            .connectionProvider(connectionProvider)
            .publicationStore(publicationStore)
            .scheduleStore(scheduleStore)
            .connectionStore(connectionStore)
            .publisherRegistry(publisherRegistry)
            .vault(vault)
            .retryPolicy(retryPolicy)
            .postStore(postStore)
            .mediaStore(mediaStore)
            .emitter(emitter)
            .config(cfg)
            .metrics(m)
            .clock(c)
            .build();
      } catch (RuntimeException e) {
        emitter.close();
        throw e;
      }

      DispatchPoller poller;
      try {
        poller = DispatchPoller.builder()
            .connectionProvider(connectionProvider)
            .scheduleStore(scheduleStore)
            .publicationStore(publicationStore)
            .handler(new DispatcherPollerHandler(dispatcher))
            .emitter(emitter)
            .config(cfg)
            .metrics(m)
            .clock(c)
            .build();
      } catch (RuntimeException e) {
        dispatcher.close();
        emitter.close();
        throw e;
      }
      return new Postflow(cfg, vault, emitter, dispatcher, poller, m);
    }
  }
}
