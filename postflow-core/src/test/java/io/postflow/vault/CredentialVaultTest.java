package io.postflow.vault;

import io.postflow.Platform;
import io.postflow.model.AccessToken;
import io.postflow.model.PlatformConnection;
import io.postflow.support.Fixtures;
import io.postflow.support.InMemoryStores;
import io.postflow.support.MutableClock;
import io.postflow.support.PrefixCipher;
import io.postflow.support.StubConnections;
import io.postflow.support.StubRefresher;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CredentialVaultTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final InMemoryStores stores = new InMemoryStores();
    private final MutableClock clock = new MutableClock(NOW);
    private final StubRefresher refresher = new StubRefresher().expiresAt(NOW.plus(Duration.ofHours(2)));

    private CredentialVault vault() {
        return vault("node-a");
    }

    private CredentialVault vault(String ownerId) {
        return CredentialVault.builder()
            .connectionProvider(StubConnections.provider())
            .connectionStore(stores.connectionStore())
            .cipher(new PrefixCipher())
            .refresher(refresher)
            .safetyMargin(Duration.ofMinutes(5))
            .ownerId(ownerId)
            .clock(clock)
            .build();
    }

    @Test
    void returnsStoredTokenWhenOutsideSafetyMargin() {
        stores.insertConnection(Fixtures.connection("c1", Platform.TWITTER, "stored", "r0",
            NOW.plus(Duration.ofHours(1)), NOW));

        AccessToken token = vault().getValidToken("c1");

        assertEquals("stored", token.value());
        assertEquals("twitter-account", token.platformAccountId());
        assertEquals(0, refresher.calls.get());
    }

    @Test
    void nonExpiringTokenIsNeverRefreshed() {
        stores.insertConnection(Fixtures.connection("c1", Platform.FACEBOOK, "page-token", null, null, NOW));

        assertEquals("page-token", vault().getValidToken("c1").value());
        assertEquals(0, refresher.calls.get());
    }

    @Test
    void refreshesInsideSafetyMarginAndPersistsEncryptedTokens() {
        stores.insertConnection(Fixtures.connection("c1", Platform.LINKEDIN, "old", "r0",
            NOW.plus(Duration.ofMinutes(4)), NOW));

        AccessToken token = vault().getValidToken("c1");

        assertEquals("access-1", token.value());
        PlatformConnection stored = stores.connection("c1");
        assertEquals("enc:access-1", stored.accessTokenCiphertext());
        assertEquals("enc:refresh-1", stored.refreshTokenCiphertext());
        assertEquals(NOW.plus(Duration.ofHours(2)), stored.expiresAt());
    }

    @Test
    void keepsOldRefreshTokenWhenPlatformDoesNotRotateIt() {
        stores.insertConnection(Fixtures.connection("c1", Platform.TWITTER, "old", "r0", NOW, NOW));
        CredentialVault vault = CredentialVault.builder()
            .connectionProvider(StubConnections.provider())
            .connectionStore(stores.connectionStore())
            .cipher(new PrefixCipher())
            .refresher((platform, refreshToken) ->
                new io.postflow.spi.TokenRefresher.RefreshedTokens("fresh", null, null))
            .clock(clock)
            .build();

        vault.getValidToken("c1");

        assertEquals("enc:r0", stores.connection("c1").refreshTokenCiphertext());
        assertNull(stores.connection("c1").expiresAt());
    }

    @Test
    void expiredTokenWithoutRefreshTokenIsExpired() {
        stores.insertConnection(Fixtures.connection("c1", Platform.TWITTER, "old", null, NOW.minusSeconds(1), NOW));

        assertThrows(TokenExpiredException.class, () -> vault().getValidToken("c1"));
    }

    @Test
    void unknownOrInactiveConnectionIsExpired() {
        stores.insertConnection(Fixtures.connection("c1", Platform.TWITTER, "t", "r", null, NOW));
        stores.connectionStore().deactivate(null, "c1", NOW);

        CredentialVault vault = vault();
        assertThrows(TokenExpiredException.class, () -> vault.getValidToken("c1"));
        assertThrows(TokenExpiredException.class, () -> vault.getValidToken("missing"));
    }

    @Test
    void refresherFailureSurfacesAsRefreshException() {
        stores.insertConnection(Fixtures.connection("c1", Platform.TWITTER, "old", "r0", NOW, NOW));
        refresher.failWith(new IllegalStateException("invalid_grant"));

        TokenRefreshException e = assertThrows(TokenRefreshException.class, () -> vault().getValidToken("c1"));
        assertFalse(e.getMessage().contains("r0"));
    }

    @Test
    void forceRefreshIgnoresStoredExpiry() {
        stores.insertConnection(Fixtures.connection("c1", Platform.TWITTER, "stored", "r0",
            NOW.plus(Duration.ofDays(30)), NOW));

        assertEquals("access-1", vault().forceRefresh("c1").value());
        assertEquals(1, refresher.calls.get());
    }

    @Test
    void concurrentCallersShareOneRefresh() throws Exception {
        stores.insertConnection(Fixtures.connection("c1", Platform.TWITTER, "old", "r0", NOW, NOW));
        refresher.delayMs(200);
        CredentialVault vault = vault();

        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AccessToken>> futures = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            Callable<AccessToken> call = () -> {
                start.await();
                return vault.getValidToken("c1");
            };
            futures.add(pool.submit(call));
        }
        start.countDown();

        for (Future<AccessToken> future : futures) {
            assertEquals("access-1", future.get(5, TimeUnit.SECONDS).value());
        }
        pool.shutdown();
        assertEquals(1, refresher.calls.get());
    }

    @Test
    void vaultsSharingOneStoreRefreshOnce() throws Exception {
        stores.insertConnection(Fixtures.connection("c1", Platform.TWITTER, "old", "r0", NOW, NOW));
        refresher.delayMs(200);
        CredentialVault nodeA = vault("node-a");
        CredentialVault nodeB = vault("node-b");

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        Future<AccessToken> a = pool.submit(() -> {
            start.await();
            return nodeA.getValidToken("c1");
        });
        Future<AccessToken> b = pool.submit(() -> {
            start.await();
            return nodeB.getValidToken("c1");
        });
        start.countDown();

        assertEquals("access-1", a.get(5, TimeUnit.SECONDS).value());
        assertEquals("access-1", b.get(5, TimeUnit.SECONDS).value());
        pool.shutdown();
        assertEquals(1, refresher.calls.get());
        assertEquals("enc:refresh-1", stores.connection("c1").refreshTokenCiphertext());
    }

    @Test
    void waitsForRefreshLeaseHeldByAnotherNode() throws Exception {
        stores.insertConnection(Fixtures.connection("c1", Platform.LINKEDIN, "old", "r0", NOW, NOW));
        assertEquals(1, stores.connectionStore().claimRefresh(null, "c1", "node-b", NOW, NOW.plusSeconds(60)));
        CredentialVault vault = vault("node-a");

        ExecutorService pool = Executors.newSingleThreadExecutor();
        Future<AccessToken> waiting = pool.submit(() -> vault.getValidToken("c1"));
        Thread.sleep(150);
        assertFalse(waiting.isDone());
        assertEquals(1, stores.connectionStore().updateTokens(null, "c1", "enc:r0", "enc:from-node-b",
            "enc:r1", NOW.plus(Duration.ofHours(2)), NOW));

        assertEquals("from-node-b", waiting.get(5, TimeUnit.SECONDS).value());
        pool.shutdown();
        assertEquals(0, refresher.calls.get());
    }

    @Test
    void givesUpWhenAnotherNodeNeverFinishesItsRefresh() {
        stores.insertConnection(Fixtures.connection("c1", Platform.TWITTER, "old", "r0", NOW, NOW));
        stores.connectionStore().claimRefresh(null, "c1", "node-b", NOW, NOW.plusSeconds(60));
        CredentialVault vault = CredentialVault.builder()
            .connectionProvider(StubConnections.provider())
            .connectionStore(stores.connectionStore())
            .cipher(new PrefixCipher())
            .refresher(refresher)
            .refreshLease(Duration.ofMillis(200))
            .ownerId("node-a")
            .clock(clock)
            .build();

        assertThrows(TokenRefreshException.class, () -> vault.getValidToken("c1"));
        assertEquals(0, refresher.calls.get());
    }

    @Test
    void refreshLeaseLapsedMidRefreshKeepsTheNewerTokens() {
        stores.insertConnection(Fixtures.connection("c1", Platform.TWITTER, "old", "r0", NOW, NOW));
        CredentialVault vault = CredentialVault.builder()
            .connectionProvider(StubConnections.provider())
            .connectionStore(stores.connectionStore())
            .cipher(new PrefixCipher())
            .refresher((platform, refreshToken) -> {
                // Another node took over after our lease lapsed and stored its tokens first
                stores.connectionStore().updateTokens(null, "c1", "enc:r0", "enc:newer", "enc:r-newer",
                    NOW.plus(Duration.ofHours(2)), NOW);
                return new io.postflow.spi.TokenRefresher.RefreshedTokens("late", "r-late", null);
            })
            .clock(clock)
            .build();

        assertEquals("newer", vault.getValidToken("c1").value());
        assertEquals("enc:r-newer", stores.connection("c1").refreshTokenCiphertext());
    }

    @Test
    void callerAfterCompletedRefreshReusesFreshToken() {
        stores.insertConnection(Fixtures.connection("c1", Platform.TWITTER, "old", "r0", NOW, NOW));
        CredentialVault vault = vault();

        vault.getValidToken("c1");
        AccessToken second = vault.getValidToken("c1");

        assertEquals("access-1", second.value());
        assertEquals(1, refresher.calls.get());
    }

    @Test
    void tokenToStringHidesValue() {
        AccessToken token = new AccessToken("c1", Platform.TWITTER, "acct", "secret-value", null);

        assertFalse(token.toString().contains("secret-value"));
    }
}
