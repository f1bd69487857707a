package io.postflow.platforms;

import io.postflow.Platform;
import io.postflow.spi.TokenRefresher;
import io.postflow.vault.TokenRefreshException;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Routes each refresh to the refresher registered for the connection's platform.
 *
 * <pre>{@code
 * TokenRefresher refresher = new PlatformTokenRefreshers()
 *     .register(Platform.TWITTER, OAuth2TokenRefresher.twitter(id, secret, timeout))
 *     .register(Platform.FACEBOOK, meta)
 *     .register(Platform.INSTAGRAM, meta);
 * }</pre>
 */
public final class PlatformTokenRefreshers implements TokenRefresher {
  private final Map<Platform, TokenRefresher> refreshers = new EnumMap<>(Platform.class);

  /**
   * @throws IllegalStateException if a refresher is already registered for {@code platform}
   */
  public synchronized PlatformTokenRefreshers register(Platform platform, TokenRefresher refresher) {
    Objects.requireNonNull(platform, "platform");
    Objects.requireNonNull(refresher, "refresher");
    if (refreshers.containsKey(platform)) {
      throw new IllegalStateException("Token refresher already registered for " + platform.tag());
    }
    refreshers.put(platform, refresher);
    return this;
  }

  public synchronized boolean supports(Platform platform) {
    return refreshers.containsKey(platform);
  }

  @Override
  public RefreshedTokens refresh(Platform platform, String refreshToken) {
    TokenRefresher refresher;
    synchronized (this) {
      refresher = refreshers.get(platform);
    }
    if (refresher == null) {
      throw new TokenRefreshException("No token refresher registered for "
          + (platform == null ? "null" : platform.tag()), null);
    }
    return refresher.refresh(platform, refreshToken);
  }
}
