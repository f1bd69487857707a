package io.postflow.event;

import io.postflow.spi.MetricsExporter;
import io.postflow.spi.NotificationSink;
import io.postflow.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivers {@link PublicationEvent}s to a {@link NotificationSink} on a dedicated daemon
 * thread so that emitting never blocks an attempt worker.
 *
 * <p>A failing sink is retried up to {@code deliveryAttempts} times, doubling the delay from
 * {@code retryDelayMs} each time. Each accepted event is passed to the {@link EventAcknowledger}.
 * An event that is never acknowledged (the sink kept failing, the queue was full, or the
 * process died first) stays owed in the ledger and the dispatch poller emits it again.
 */
public final class EventEmitter implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventEmitter.class.getName());

  private final NotificationSink sink;
  private final int deliveryAttempts;
  private final long retryDelayMs;
  private final long drainTimeoutMs;
  private final MetricsExporter metrics;
  private final EventAcknowledger acknowledger;
  private final ThreadPoolExecutor executor;

  private EventEmitter(Builder builder) {
    this.sink = Objects.requireNonNull(builder.sink, "sink");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.acknowledger = builder.acknowledger != null ? builder.acknowledger : EventAcknowledger.NOOP;
    if (builder.deliveryAttempts < 1) {
      throw new IllegalArgumentException("deliveryAttempts must be >= 1");
    }
    if (builder.queueCapacity < 1) {
      throw new IllegalArgumentException("queueCapacity must be >= 1");
    }
    if (builder.retryDelayMs < 0 || builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("retryDelayMs and drainTimeoutMs must be >= 0");
    }
    this.deliveryAttempts = builder.deliveryAttempts;
    this.retryDelayMs = builder.retryDelayMs;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(builder.queueCapacity), new DaemonThreadFactory("postflow-events-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Queues {@code event} for delivery.
   *
   * @return {@code false} if the queue is full or closed; the event is left for redelivery
   */
  public boolean emit(PublicationEvent event) {
    Objects.requireNonNull(event, "event");
    try {
      executor.execute(() -> deliver(event));
      metrics.incrementEventsEmitted();
      return true;
    } catch (RejectedExecutionException e) {
      metrics.incrementEventDeliveryFailure();
      logger.log(Level.WARNING, "Emitter queue full or closed; " + event.outcome()
          + " event for publicationId=" + event.publicationId() + " left for redelivery");
      return false;
    }
  }

  private void deliver(PublicationEvent event) {
    long delayMs = retryDelayMs;
    for (int attempt = 1; attempt <= deliveryAttempts; attempt++) {
      try {
        sink.onPublicationEvent(event);
        acknowledge(event);
        return;
      } catch (Exception e) {
        if (attempt == deliveryAttempts) {
          metrics.incrementEventDeliveryFailure();
          logger.log(Level.WARNING, "Notification sink still failing after " + attempt + " attempts; "
              + event.outcome() + " event for publicationId=" + event.publicationId()
              + " left for redelivery", e);
          return;
        }
        logger.log(Level.WARNING, "Notification sink failed for publicationId="
            + event.publicationId() + " (attempt " + attempt + "), retrying in " + delayMs + "ms", e);
      }
      try {
        Thread.sleep(delayMs);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        logger.log(Level.WARNING, "Interrupted while retrying event for publicationId="
            + event.publicationId());
        return;
      }
      delayMs = Math.min(delayMs * 2, 60_000L);
    }
  }

  private void acknowledge(PublicationEvent event) {
    try {
      acknowledger.acknowledge(event);
    } catch (Exception e) {
      logger.log(Level.WARNING, "Failed to acknowledge event for publicationId=" + event.publicationId()
          + "; it will be delivered again", e);
    }
  }

  /**
   * Stops accepting events and waits up to the drain timeout for queued ones to be delivered.
   */
  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Event drain timeout exceeded; "
            + executor.getQueue().size() + " events not delivered");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link EventEmitter}. */
  public static final class Builder {
    private NotificationSink sink;
    private int deliveryAttempts = 3;
    private long retryDelayMs = 200;
    private int queueCapacity = 1000;
    private long drainTimeoutMs = 5000;
    private MetricsExporter metrics;
    private EventAcknowledger acknowledger;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder sink(NotificationSink sink) {
      this.sink = sink;
      return this;
    }

    /**
     * Optional. Defaults to {@code 3}. Must be &ge; 1.
     */
    public Builder deliveryAttempts(int deliveryAttempts) {
      this.deliveryAttempts = deliveryAttempts;
      return this;
    }

    /**
     * Delay before the first redelivery. Optional. Defaults to {@code 200} ms.
     */
    public Builder retryDelayMs(long retryDelayMs) {
      this.retryDelayMs = retryDelayMs;
      return this;
    }

    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Called after the sink accepts an event. Optional. Defaults to {@link EventAcknowledger#NOOP}.
     */
    public Builder acknowledger(EventAcknowledger acknowledger) {
      this.acknowledger = acknowledger;
      return this;
    }

    public EventEmitter build() {
      return new EventEmitter(this);
    }
  }
}
