package io.postflow.dispatch;

import io.postflow.Platform;
import io.postflow.event.EventEmitter;
import io.postflow.event.PublicationEvent;
import io.postflow.model.AccessToken;
import io.postflow.model.ErrorKind;
import io.postflow.model.PlatformConnection;
import io.postflow.model.PostContent;
import io.postflow.model.Publication;
import io.postflow.model.PublishContent;
import io.postflow.model.Schedule;
import io.postflow.platform.PlatformPublisher;
import io.postflow.platform.PublishOutcome;
import io.postflow.platform.PublisherRegistry;
import io.postflow.retry.RetryDecision;
import io.postflow.retry.RetryPolicy;
import io.postflow.spi.ConnectionProvider;
import io.postflow.spi.ConnectionStore;
import io.postflow.spi.MediaStore;
import io.postflow.spi.MetricsExporter;
import io.postflow.spi.PostStore;
import io.postflow.spi.PublicationStore;
import io.postflow.spi.ScheduleStore;
import io.postflow.vault.CredentialException;
import io.postflow.vault.CredentialVault;

import java.net.URI;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one claimed publication to a settled state on the calling thread.
 *
 * <p>Every ledger write is conditioned on the lease owner. A write that changes no row
 * means the lease was lost: the attempt stops, emits nothing, and (after a successful
 * platform call) only records the remote post id so the post is never sent twice.
 */
final class AttemptExecutor {
  private static final Logger logger = Logger.getLogger(AttemptExecutor.class.getName());

  private static final int STORE_FAILED = -1;

  private final ConnectionProvider connectionProvider;
  private final PublicationStore publicationStore;
  private final ScheduleStore scheduleStore;
  private final ConnectionStore connectionStore;
  private final PublisherRegistry publisherRegistry;
  private final CredentialVault vault;
  private final RetryPolicy retryPolicy;
  private final PostStore postStore;
  private final MediaStore mediaStore;
  private final EventEmitter emitter;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final Duration leaseDuration;

  AttemptExecutor(PublicationDispatcher.Builder builder, RetryPolicy retryPolicy, MetricsExporter metrics,
      Clock clock) {
    this.connectionProvider = builder.connectionProvider;
    this.publicationStore = builder.publicationStore;
    this.scheduleStore = builder.scheduleStore;
    this.connectionStore = builder.connectionStore;
    this.publisherRegistry = builder.publisherRegistry;
    this.vault = builder.vault;
    this.postStore = builder.postStore;
    this.mediaStore = builder.mediaStore;
    this.emitter = builder.emitter;
    this.leaseDuration = builder.config.leaseDuration();
    this.retryPolicy = retryPolicy;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * Executes the claimed publication. Never throws.
   */
  void execute(Publication claimed) {
    long start = System.nanoTime();
    try {
      if (claimed.remotePostId() != null) {
        // Already on the platform; only the ledger is behind
        settlePublished(claimed, claimed.remotePostId(), 0);
        return;
      }
      run(claimed);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Attempt aborted for publicationId=" + claimed.id()
          + "; lease will expire and the row will be reclaimed", e);
    } finally {
      metrics.recordAttemptDurationMs(claimed.platform(), (System.nanoTime() - start) / 1_000_000L);
    }
  }

  private void run(Publication publication) {
    Target target = resolveTarget(publication);
    ErrorKind previousError = publication.lastErrorKind();
    PublishOutcome outcome = target.failure != null ? target.failure : publishOnce(publication, target, false);
    int attempts = 1;

    while (true) {
      if (outcome == null) {
        logger.log(Level.WARNING, "Lease lost before calling the platform for publicationId={0}",
            publication.id());
        return;
      }
      if (outcome instanceof PublishOutcome.Success success) {
        settlePublished(publication, success.remotePostId(), attempts);
        return;
      }
      PublishOutcome.Failure failure = (PublishOutcome.Failure) outcome;
      RetryDecision decision = retryPolicy.decide(failure, publication.attemptCount() + attempts,
          previousError, clock.instant());

      if (decision instanceof RetryDecision.RetryAt retryAt) {
        settleRetry(publication, retryAt.nextAttemptAt(), attempts, failure);
        return;
      }
      if (decision instanceof RetryDecision.Fail fail) {
        settleFailed(publication, attempts, failure.kind(), fail.reason());
        return;
      }

      // RefreshTokenThenRetry: one immediate retry inside a renewed lease
      previousError = failure.kind();
      if (!renewLease(publication)) {
        logger.log(Level.WARNING, "Lease lost before token refresh for publicationId={0}", publication.id());
        return;
      }
      outcome = target.connection == null ? failure : publishOnce(publication, target, true);
      attempts++;
    }
  }

  private Target resolveTarget(Publication publication) {
    Platform platform = publication.platform();
    PlatformPublisher publisher = publisherRegistry.publisherFor(platform);
    if (publisher == null) {
      return Target.failed(PublishOutcome.permanentError("No publisher registered for " + platform.tag()));
    }

    Optional<Schedule> schedule;
    try {
      schedule = read(conn -> scheduleStore.findById(conn, publication.scheduleId()));
    } catch (SQLException | RuntimeException e) {
      return Target.failed(PublishOutcome.transientError("Schedule lookup failed: " + e.getMessage()));
    }
    if (schedule.isEmpty()) {
      return Target.failed(PublishOutcome.permanentError("Schedule " + publication.scheduleId() + " not found"));
    }

    PublishContent content;
    try {
      Optional<PostContent> post = postStore.getContent(schedule.get().postId());
      if (post.isEmpty()) {
        return Target.failed(PublishOutcome.permanentError("Post " + schedule.get().postId() + " not found"));
      }
      content = resolveMedia(post.get());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Content lookup failed for publicationId=" + publication.id(), e);
      return Target.failed(PublishOutcome.transientError("Content lookup failed: " + e.getMessage()));
    }

    Optional<PlatformConnection> connection;
    try {
      connection = read(conn -> connectionStore.findActive(conn, schedule.get().userId(), platform));
    } catch (SQLException | RuntimeException e) {
      return Target.failed(PublishOutcome.transientError("Connection lookup failed: " + e.getMessage()));
    }
    if (connection.isEmpty()) {
      return Target.failed(PublishOutcome.permanentError("No active " + platform.tag()
          + " connection for user " + schedule.get().userId()));
    }
    return new Target(publisher, content, connection.get(), null);
  }

  private PublishContent resolveMedia(PostContent post) {
    List<URI> urls = new ArrayList<>(post.mediaRefs().size());
    for (String ref : post.mediaRefs()) {
      urls.add(mediaStore.resolveUrl(ref));
    }
    return new PublishContent(post.text(), urls, post.linkPreview());
  }

  /**
   * Obtains a token and calls the publisher under a freshly renewed lease.
   *
   * @return the outcome, or {@code null} if the lease was lost before the platform call
   */
  private PublishOutcome publishOnce(Publication publication, Target target, boolean forceRefresh) {
    String connectionId = target.connection.id();
    AccessToken token;
    try {
      token = forceRefresh ? vault.forceRefresh(connectionId) : vault.getValidToken(connectionId);
    } catch (CredentialException e) {
      return PublishOutcome.authError(e.getMessage());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Credential lookup failed for connection " + connectionId, e);
      return PublishOutcome.transientError("Credential lookup failed: " + e.getMessage());
    }
    if (!renewLease(publication)) {
      return null;
    }

    metrics.incrementAttempt(publication.platform());
    try {
      PublishOutcome outcome = target.publisher.publish(target.content, token);
      if (outcome == null) {
        return PublishOutcome.transientError("Publisher returned no outcome");
      }
      return outcome;
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Publisher for " + publication.platform().tag()
          + " threw instead of returning an outcome", e);
      return PublishOutcome.transientError(e.toString());
    }
  }

  private void settlePublished(Publication publication, String remotePostId, int attempts) {
    Instant now = clock.instant();
    int updated = withConnection("mark published", publication.id(),
        conn -> publicationStore.markPublished(conn, publication.id(), publication.leaseOwner(),
            remotePostId, attempts, now));
    if (updated != 1) {
      logger.log(Level.WARNING, "Lease lost after publishing publicationId={0}; recording remotePostId only",
          publication.id());
      withConnection("record remote post id", publication.id(),
          conn -> publicationStore.recordRemotePostId(conn, publication.id(), remotePostId, now));
      return;
    }
    metrics.incrementPublished(publication.platform());
    emit(PublicationEvent.published(publication.scheduleId(), publication.id(), publication.platform(),
        remotePostId, publication.attemptCount() + attempts, now));
    refreshCompletion(publication.scheduleId(), now);
  }

  private void settleRetry(Publication publication, Instant nextRetryAt, int attempts,
      PublishOutcome.Failure failure) {
    Instant now = clock.instant();
    int updated = withConnection("mark retry", publication.id(),
        conn -> publicationStore.markRetry(conn, publication.id(), publication.leaseOwner(), nextRetryAt,
            attempts, failure.kind(), failure.message(), now));
    if (updated == 1) {
      metrics.incrementRetried(publication.platform(), failure.kind());
      logger.log(Level.FINE, "Retry of publicationId={0} scheduled at {1} after {2}",
          new Object[]{publication.id(), nextRetryAt, failure.kind()});
    } else {
      logger.log(Level.WARNING, "Lease lost before scheduling retry of publicationId={0}", publication.id());
    }
  }

  private void settleFailed(Publication publication, int attempts, ErrorKind kind, String reason) {
    Instant now = clock.instant();
    int updated = withConnection("mark failed", publication.id(),
        conn -> publicationStore.markFailed(conn, publication.id(), publication.leaseOwner(), attempts,
            kind, reason, now));
    if (updated != 1) {
      logger.log(Level.WARNING, "Lease lost before failing publicationId={0}", publication.id());
      return;
    }
    metrics.incrementFailed(publication.platform(), kind);
    logger.log(Level.INFO, "Publication {0} to {1} failed ({2}): {3}",
        new Object[]{publication.id(), publication.platform().tag(), kind, reason});
    emit(PublicationEvent.failed(publication.scheduleId(), publication.id(), publication.platform(),
        kind, reason, publication.attemptCount() + attempts, now));
    refreshCompletion(publication.scheduleId(), now);
  }

  private boolean renewLease(Publication publication) {
    Instant now = clock.instant();
    return withConnection("renew lease", publication.id(),
        conn -> publicationStore.renewLease(conn, publication.id(), publication.leaseOwner(), now,
            now.plus(leaseDuration))) == 1;
  }

  private void refreshCompletion(String scheduleId, Instant now) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      Optional<Schedule> schedule = scheduleStore.findById(conn, scheduleId);
      if (schedule.isPresent()) {
        scheduleStore.refreshCompletion(conn, scheduleId, schedule.get().platforms().size(), now);
      }
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to refresh completion for scheduleId=" + scheduleId, e);
    }
  }

  private void emit(PublicationEvent event) {
    if (emitter != null) {
      emitter.emit(event);
    }
  }

  private <T> T read(SqlQuery<T> query) throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return query.execute(conn);
    }
  }

  private int withConnection(String action, String publicationId, SqlUpdate op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return op.execute(conn);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to " + action + " for publicationId=" + publicationId, e);
      return STORE_FAILED;
    }
  }

  @FunctionalInterface
  private interface SqlUpdate {
    int execute(Connection conn) throws SQLException;
  }

  @FunctionalInterface
  private interface SqlQuery<T> {
    T execute(Connection conn) throws SQLException;
  }

  /** Everything needed to call the publisher, or the outcome that prevents it. */
  private static final class Target {
    final PlatformPublisher publisher;
    final PublishContent content;
    final PlatformConnection connection;
    final PublishOutcome.Failure failure;

    Target(PlatformPublisher publisher, PublishContent content, PlatformConnection connection,
        PublishOutcome.Failure failure) {
      this.publisher = publisher;
      this.content = content;
      this.connection = connection;
      this.failure = failure;
    }

    static Target failed(PublishOutcome.Failure failure) {
      return new Target(null, null, null, failure);
    }
  }
}
