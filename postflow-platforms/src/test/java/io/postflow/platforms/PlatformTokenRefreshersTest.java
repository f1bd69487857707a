package io.postflow.platforms;

import io.postflow.Platform;
import io.postflow.spi.TokenRefresher;
import io.postflow.vault.TokenRefreshException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlatformTokenRefreshersTest {

    @Test
    void routesByPlatform() {
        List<String> calls = new ArrayList<>();
        TokenRefresher meta = (platform, token) -> {
            calls.add(platform.tag() + ":" + token);
            return new TokenRefresher.RefreshedTokens("meta-" + token, null, null);
        };
        PlatformTokenRefreshers refreshers = new PlatformTokenRefreshers()
            .register(Platform.FACEBOOK, meta)
            .register(Platform.INSTAGRAM, meta);

        assertEquals("meta-a", refreshers.refresh(Platform.FACEBOOK, "a").accessToken());
        assertEquals("meta-b", refreshers.refresh(Platform.INSTAGRAM, "b").accessToken());
        assertEquals(List.of("facebook:a", "instagram:b"), calls);
        assertTrue(refreshers.supports(Platform.FACEBOOK));
        assertFalse(refreshers.supports(Platform.TWITTER));
    }

    @Test
    void unregisteredPlatformFailsAsRefreshError() {
        PlatformTokenRefreshers refreshers = new PlatformTokenRefreshers();

        assertThrows(TokenRefreshException.class, () -> refreshers.refresh(Platform.LINKEDIN, "x"));
    }

    @Test
    void duplicateRegistrationIsRejected() {
        TokenRefresher refresher = (platform, token) -> new TokenRefresher.RefreshedTokens("a", null, null);
        PlatformTokenRefreshers refreshers = new PlatformTokenRefreshers().register(Platform.TWITTER, refresher);

        assertThrows(IllegalStateException.class, () -> refreshers.register(Platform.TWITTER, refresher));
    }
}
