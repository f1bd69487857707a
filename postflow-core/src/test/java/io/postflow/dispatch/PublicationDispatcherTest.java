package io.postflow.dispatch;

import io.postflow.Platform;
import io.postflow.PostflowConfig;
import io.postflow.model.Publication;
import io.postflow.model.PublicationStatus;
import io.postflow.platform.DefaultPublisherRegistry;
import io.postflow.platform.PublishOutcome;
import io.postflow.support.Fixtures;
import io.postflow.support.InMemoryStores;
import io.postflow.support.MutableClock;
import io.postflow.support.PrefixCipher;
import io.postflow.support.ScriptedPublisher;
import io.postflow.support.StubConnections;
import io.postflow.support.StubRefresher;
import io.postflow.vault.CredentialVault;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class PublicationDispatcherTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final InMemoryStores stores = new InMemoryStores();
    private final MutableClock clock = new MutableClock(NOW);
    private final CountDownLatch gate = new CountDownLatch(1);
    private final ScriptedPublisher twitter = new ScriptedPublisher(Platform.TWITTER);
    private final ScriptedPublisher linkedin = new ScriptedPublisher(Platform.LINKEDIN);
    private PublicationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        stores.insertSchedule(Fixtures.schedule("s1", NOW, Platform.TWITTER, Platform.LINKEDIN));
        stores.insertSchedule(Fixtures.schedule("s2", NOW, Platform.TWITTER, Platform.LINKEDIN));
        stores.insertConnection(Fixtures.connection("c1", Platform.TWITTER, "tw", null, null, NOW));
        stores.insertConnection(Fixtures.connection("c2", Platform.LINKEDIN, "li", null, null, NOW));
        twitter.then(blocked("tw-1")).then(blocked("tw-2"));
        linkedin.then(blocked("li-1")).then(blocked("li-2"));

        PostflowConfig config = PostflowConfig.builder()
            .workerId("w1")
            .workerCount(2)
            .platformConcurrency(Platform.TWITTER, 1)
            .drainTimeout(Duration.ofSeconds(5))
            .build();
        dispatcher = PublicationDispatcher.builder()
            .connectionProvider(StubConnections.provider())
            .publicationStore(stores.publicationStore())
            .scheduleStore(stores.scheduleStore())
            .connectionStore(stores.connectionStore())
            .publisherRegistry(new DefaultPublisherRegistry().register(twitter).register(linkedin))
            .vault(CredentialVault.builder()
                .connectionProvider(StubConnections.provider())
                .connectionStore(stores.connectionStore())
                .cipher(new PrefixCipher())
                .refresher(new StubRefresher())
                .clock(clock)
                .build())
            .postStore(Fixtures.postStore())
            .mediaStore(Fixtures.mediaStore())
            .config(config)
            .clock(clock)
            .build();
    }

    @AfterEach
    void tearDown() {
        gate.countDown();
        dispatcher.close();
    }

    private Supplier<PublishOutcome> blocked(String remotePostId) {
        return () -> {
            try {
                if (!gate.await(10, TimeUnit.SECONDS)) {
                    return PublishOutcome.transientError("gate timeout");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return PublishOutcome.transientError("interrupted");
            }
            return PublishOutcome.success(remotePostId);
        };
    }

    private Publication claimed(String id, String scheduleId, Platform platform) {
        Publication publication = new Publication(id, scheduleId, platform, PublicationStatus.PUBLISHING, 0, NOW,
            "w1", NOW.plus(Duration.ofMinutes(5)), null, null, null, null, NOW, NOW);
        stores.put(publication);
        return publication;
    }

    @Test
    void refusesWorkBeyondGlobalAndPlatformCapacity() throws Exception {
        assertEquals(2, dispatcher.availableCapacity());

        assertTrue(dispatcher.submit(claimed("p1", "s1", Platform.TWITTER)));
        assertFalse(dispatcher.hasCapacity(Platform.TWITTER));
        assertTrue(dispatcher.hasCapacity(Platform.LINKEDIN));
        assertFalse(dispatcher.submit(claimed("p2", "s2", Platform.TWITTER)));

        assertTrue(dispatcher.submit(claimed("p3", "s1", Platform.LINKEDIN)));
        assertEquals(0, dispatcher.availableCapacity());
        assertFalse(dispatcher.submit(claimed("p4", "s2", Platform.LINKEDIN)));
        assertEquals(2, dispatcher.inFlight());

        gate.countDown();
        assertTrue(dispatcher.awaitIdle(Duration.ofSeconds(5)));

        assertEquals(PublicationStatus.PUBLISHED, stores.publication("p1").status());
        assertEquals(PublicationStatus.PUBLISHED, stores.publication("p3").status());
        assertEquals(PublicationStatus.PUBLISHING, stores.publication("p2").status());
        assertEquals(2, dispatcher.availableCapacity());
        assertTrue(dispatcher.hasCapacity(Platform.TWITTER));
        assertTrue(stores.schedule("s1").completed());
    }

    @Test
    void rejectsPublicationNotClaimedByThisWorker() {
        Publication foreign = new Publication("p9", "s1", Platform.TWITTER, PublicationStatus.PUBLISHING, 0, NOW,
            "w2", NOW.plusSeconds(300), null, null, null, null, NOW, NOW);
        Publication pending = new Publication("p8", "s1", Platform.TWITTER, PublicationStatus.PENDING, 0, NOW,
            null, null, null, null, null, null, NOW, NOW);

        assertThrows(IllegalArgumentException.class, () -> dispatcher.submit(foreign));
        assertThrows(IllegalArgumentException.class, () -> dispatcher.submit(pending));
    }

    @Test
    void closedDispatcherRefusesWork() {
        gate.countDown();
        dispatcher.close();

        assertEquals(0, dispatcher.availableCapacity());
        assertFalse(dispatcher.submit(claimed("p1", "s1", Platform.TWITTER)));
    }

    @Test
    void closeDrainsRunningAttempts() {
        assertTrue(dispatcher.submit(claimed("p3", "s1", Platform.LINKEDIN)));
        gate.countDown();

        dispatcher.close();

        assertEquals(0, dispatcher.inFlight());
        assertEquals(PublicationStatus.PUBLISHED, stores.publication("p3").status());
        assertEquals("li-1", stores.publication("p3").remotePostId());
    }
}
