package io.postflow.dispatch;

import io.postflow.Platform;
import io.postflow.PostflowConfig;
import io.postflow.event.EventEmitter;
import io.postflow.event.PublicationEvent;
import io.postflow.model.ErrorKind;
import io.postflow.model.Publication;
import io.postflow.model.PublicationStatus;
import io.postflow.model.Schedule;
import io.postflow.platform.DefaultPublisherRegistry;
import io.postflow.platform.PublishOutcome;
import io.postflow.retry.DefaultRetryPolicy;
import io.postflow.retry.ExponentialBackoff;
import io.postflow.spi.MetricsExporter;
import io.postflow.spi.TokenRefresher;
import io.postflow.support.Fixtures;
import io.postflow.support.InMemoryStores;
import io.postflow.support.MutableClock;
import io.postflow.support.PrefixCipher;
import io.postflow.support.RecordingSink;
import io.postflow.support.ScriptedPublisher;
import io.postflow.support.StubConnections;
import io.postflow.support.StubRefresher;
import io.postflow.vault.CredentialVault;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AttemptExecutorTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String OWNER = "w1";

    private final InMemoryStores stores = new InMemoryStores();
    private final MutableClock clock = new MutableClock(NOW);
    private final RecordingSink sink = new RecordingSink();
    private final StubRefresher refresher = new StubRefresher();
    private final ScriptedPublisher twitter = new ScriptedPublisher(Platform.TWITTER);
    private EventEmitter emitter;
    private AttemptExecutor executor;

    @BeforeEach
    void setUp() {
        stores.insertSchedule(Fixtures.schedule("s1", NOW, Platform.TWITTER));
        stores.insertConnection(Fixtures.connection("c1", Platform.TWITTER, "token-0", "refresh-0", null, NOW));
        emitter = EventEmitter.builder().sink(sink).retryDelayMs(1).build();
        executor = newExecutor(Fixtures.postStore());
    }

    @AfterEach
    void tearDown() {
        emitter.close();
    }

    private AttemptExecutor newExecutor(io.postflow.spi.PostStore postStore) {
        return newExecutor(postStore, refresher);
    }

    private AttemptExecutor newExecutor(io.postflow.spi.PostStore postStore, TokenRefresher tokenRefresher) {
        PostflowConfig config = PostflowConfig.builder().workerId(OWNER).build();
        CredentialVault vault = CredentialVault.builder()
            .connectionProvider(StubConnections.provider())
            .connectionStore(stores.connectionStore())
            .cipher(new PrefixCipher())
            .refresher(tokenRefresher)
            .clock(clock)
            .build();
        PublicationDispatcher.Builder builder = PublicationDispatcher.builder()
            .connectionProvider(StubConnections.provider())
            .publicationStore(stores.publicationStore())
            .scheduleStore(stores.scheduleStore())
            .connectionStore(stores.connectionStore())
            .publisherRegistry(new DefaultPublisherRegistry().register(twitter))
            .vault(vault)
            .postStore(postStore)
            .mediaStore(Fixtures.mediaStore())
            .emitter(emitter)
            .config(config);
        DefaultRetryPolicy policy = new DefaultRetryPolicy(config.maxAttempts(),
            new ExponentialBackoff(config.backoffBase(), config.backoffMultiplier(), config.backoffMax()));
        return new AttemptExecutor(builder, policy, MetricsExporter.NOOP, clock);
    }

    private Publication claimed(int attemptCount, ErrorKind lastErrorKind, String remotePostId) {
        Publication publication = new Publication("p1", "s1", Platform.TWITTER, PublicationStatus.PUBLISHING,
            attemptCount, NOW, OWNER, NOW.plus(Duration.ofMinutes(5)), lastErrorKind, null, remotePostId, null,
            NOW, NOW);
        stores.put(publication);
        return publication;
    }

    private List<PublicationEvent> eventsAfterDrain() {
        emitter.close();
        return sink.events();
    }

    @Test
    void successMarksPublishedEmitsEventAndCompletesSchedule() throws Exception {
        executor.execute(claimed(0, null, null));

        Publication row = stores.publication("p1");
        assertEquals(PublicationStatus.PUBLISHED, row.status());
        assertEquals("twitter-post-1", row.remotePostId());
        assertEquals(1, row.attemptCount());
        assertNull(row.leaseOwner());
        assertEquals(NOW, row.publishedAt());
        assertTrue(stores.schedule("s1").completed());

        PublicationEvent event = sink.awaitEvents(1, Duration.ofSeconds(5)).get(0);
        assertEquals(PublicationEvent.Outcome.PUBLISHED, event.outcome());
        assertEquals("twitter-post-1", event.remotePostId());
        assertEquals(1, event.attemptCount());
    }

    @Test
    void publisherReceivesResolvedContentAndDecryptedToken() {
        executor.execute(claimed(0, null, null));

        assertEquals("token-0", twitter.tokens().get(0).value());
        assertEquals("Hello from postflow", twitter.contents().get(0).text());
        assertEquals(List.of(URI.create("https://cdn.example.com/img-1")), twitter.contents().get(0).mediaUrls());
    }

    @Test
    void rateLimitedReschedulesAtPlatformDelay() {
        twitter.then(PublishOutcome.rateLimited(Duration.ofSeconds(900)));

        executor.execute(claimed(0, null, null));

        Publication row = stores.publication("p1");
        assertEquals(PublicationStatus.PENDING, row.status());
        assertEquals(NOW.plusSeconds(900), row.nextRetryAt());
        assertEquals(ErrorKind.RATE_LIMITED, row.lastErrorKind());
        assertEquals(1, row.attemptCount());
        assertNull(row.leaseOwner());
        assertTrue(eventsAfterDrain().isEmpty());
    }

    @Test
    void transientErrorReschedulesWithBackoff() {
        twitter.then(PublishOutcome.transientError("HTTP 503"));

        executor.execute(claimed(0, null, null));

        Publication row = stores.publication("p1");
        assertEquals(PublicationStatus.PENDING, row.status());
        assertEquals(ErrorKind.TRANSIENT, row.lastErrorKind());
        long delayMs = Duration.between(NOW, row.nextRetryAt()).toMillis();
        assertTrue(delayMs >= 30_000 && delayMs <= 60_000, "got " + delayMs);
        assertEquals("HTTP 503", row.errorMessage());
    }

    @Test
    void permanentErrorFailsAndEmits() throws Exception {
        twitter.then(PublishOutcome.permanentError("Status is a duplicate"));

        executor.execute(claimed(0, null, null));

        Publication row = stores.publication("p1");
        assertEquals(PublicationStatus.FAILED, row.status());
        assertEquals(ErrorKind.PERMANENT, row.lastErrorKind());
        assertTrue(stores.schedule("s1").completed());
        PublicationEvent event = sink.awaitEvents(1, Duration.ofSeconds(5)).get(0);
        assertEquals(PublicationEvent.Outcome.FAILED, event.outcome());
        assertEquals(ErrorKind.PERMANENT, event.errorKind());
    }

    @Test
    void authErrorRefreshesOnceAndRetriesInsideTheLease() {
        twitter.then(PublishOutcome.authError("401")).then(PublishOutcome.success("tw-42"));

        executor.execute(claimed(0, null, null));

        Publication row = stores.publication("p1");
        assertEquals(PublicationStatus.PUBLISHED, row.status());
        assertEquals("tw-42", row.remotePostId());
        assertEquals(2, row.attemptCount());
        assertEquals(1, refresher.calls.get());
        // before the first call, before the refresh, before the retried call
        assertEquals(3, stores.renewLeaseCount.get());
        assertEquals("access-1", twitter.tokens().get(1).value());
    }

    @Test
    void leaseLostDuringSlowTokenRefreshSkipsThePlatformCall() {
        stores.insertConnection(Fixtures.connection("c1", Platform.TWITTER, "token-0", "refresh-0", NOW, NOW));
        AttemptExecutor slowRefresh = newExecutor(Fixtures.postStore(), (platform, refreshToken) -> {
            // The lease lapsed while the refresh endpoint was slow and another dispatcher took the row
            Publication current = stores.publication("p1");
            stores.put(new Publication(current.id(), current.scheduleId(), current.platform(),
                PublicationStatus.PUBLISHING, current.attemptCount(), current.nextRetryAt(), "w2",
                NOW.plus(Duration.ofMinutes(10)), null, null, null, null, current.createdAt(), NOW));
            return new TokenRefresher.RefreshedTokens("access-slow", null, NOW.plus(Duration.ofHours(2)));
        });

        slowRefresh.execute(claimed(0, null, null));

        assertEquals(0, twitter.calls());
        Publication row = stores.publication("p1");
        assertEquals(PublicationStatus.PUBLISHING, row.status());
        assertEquals("w2", row.leaseOwner());
        assertEquals(0, row.attemptCount());
        assertTrue(eventsAfterDrain().isEmpty());
    }

    @Test
    void secondConsecutiveAuthErrorFailsWithoutAnotherRefresh() throws Exception {
        twitter.then(PublishOutcome.authError("401")).then(PublishOutcome.authError("401 again"));

        executor.execute(claimed(0, null, null));

        Publication row = stores.publication("p1");
        assertEquals(PublicationStatus.FAILED, row.status());
        assertEquals(ErrorKind.AUTH, row.lastErrorKind());
        assertEquals(2, row.attemptCount());
        assertEquals(2, twitter.calls());
        assertEquals(1, refresher.calls.get());
        PublicationEvent event = sink.awaitEvents(1, Duration.ofSeconds(5)).get(0);
        assertEquals(ErrorKind.AUTH, event.errorKind());
    }

    @Test
    void failedRefreshCountsAsSecondAuthError() {
        refresher.failWith(new IllegalStateException("invalid_grant"));
        twitter.then(PublishOutcome.authError("401"));

        executor.execute(claimed(0, null, null));

        assertEquals(PublicationStatus.FAILED, stores.publication("p1").status());
        assertEquals(ErrorKind.AUTH, stores.publication("p1").lastErrorKind());
        assertEquals(1, twitter.calls());
    }

    @Test
    void existingRemotePostIdSettlesWithoutPublishing() throws Exception {
        executor.execute(claimed(1, ErrorKind.TRANSIENT, "tw-already"));

        assertEquals(0, twitter.calls());
        Publication row = stores.publication("p1");
        assertEquals(PublicationStatus.PUBLISHED, row.status());
        assertEquals("tw-already", row.remotePostId());
        assertEquals("tw-already", sink.awaitEvents(1, Duration.ofSeconds(5)).get(0).remotePostId());
    }

    @Test
    void lostLeaseAfterSuccessRecordsRemoteIdOnly() {
        twitter.then(() -> {
            // Another dispatcher reclaimed the row while the call was in flight
            Publication current = stores.publication("p1");
            stores.put(new Publication(current.id(), current.scheduleId(), current.platform(),
                PublicationStatus.PUBLISHING, current.attemptCount(), current.nextRetryAt(), "w2",
                NOW.plus(Duration.ofMinutes(10)), null, null, null, null, current.createdAt(), NOW));
            return PublishOutcome.success("tw-77");
        });

        executor.execute(claimed(0, null, null));

        Publication row = stores.publication("p1");
        assertEquals(PublicationStatus.PUBLISHING, row.status());
        assertEquals("w2", row.leaseOwner());
        assertEquals("tw-77", row.remotePostId());
        assertTrue(eventsAfterDrain().isEmpty());
    }

    @Test
    void missingPostFailsPermanently() {
        executor = newExecutor(postId -> java.util.Optional.empty());

        executor.execute(claimed(0, null, null));

        assertEquals(PublicationStatus.FAILED, stores.publication("p1").status());
        assertEquals(ErrorKind.PERMANENT, stores.publication("p1").lastErrorKind());
        assertEquals(0, twitter.calls());
    }

    @Test
    void contentStoreFailureIsTransient() {
        executor = newExecutor(postId -> {
            throw new IllegalStateException("content service down");
        });

        executor.execute(claimed(0, null, null));

        assertEquals(PublicationStatus.PENDING, stores.publication("p1").status());
        assertEquals(ErrorKind.TRANSIENT, stores.publication("p1").lastErrorKind());
    }

    @Test
    void missingConnectionFailsPermanently() {
        stores.connectionStore().deactivate(null, "c1", NOW);

        executor.execute(claimed(0, null, null));

        assertEquals(PublicationStatus.FAILED, stores.publication("p1").status());
        assertTrue(stores.publication("p1").errorMessage().contains("No active twitter connection"));
    }

    @Test
    void unregisteredPlatformFailsPermanently() {
        stores.insertSchedule(Schedule.create("s2", Fixtures.POST, Fixtures.USER, NOW, Set.of(Platform.INSTAGRAM), NOW));
        Publication publication = new Publication("p2", "s2", Platform.INSTAGRAM, PublicationStatus.PUBLISHING, 0,
            NOW, OWNER, NOW.plusSeconds(300), null, null, null, null, NOW, NOW);
        stores.put(publication);

        executor.execute(publication);

        assertEquals(PublicationStatus.FAILED, stores.publication("p2").status());
    }

    @Test
    void throwingPublisherIsTreatedAsTransient() {
        twitter.then(() -> {
            throw new IllegalStateException("boom");
        });

        executor.execute(claimed(0, null, null));

        assertEquals(PublicationStatus.PENDING, stores.publication("p1").status());
        assertEquals(ErrorKind.TRANSIENT, stores.publication("p1").lastErrorKind());
    }

    @Test
    void attemptLimitTurnsTransientIntoFailure() {
        twitter.then(PublishOutcome.transientError("HTTP 502"));

        executor.execute(claimed(4, ErrorKind.TRANSIENT, null));

        Publication row = stores.publication("p1");
        assertEquals(PublicationStatus.FAILED, row.status());
        assertEquals(5, row.attemptCount());
    }
}
