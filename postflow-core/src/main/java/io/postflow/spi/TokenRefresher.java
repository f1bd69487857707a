package io.postflow.spi;

import io.postflow.Platform;

import java.time.Instant;
import java.util.Objects;

/**
 * Exchanges a refresh token for a new access token at the platform's token endpoint.
 */
public interface TokenRefresher {

    /**
     * @param platform     platform the token belongs to
     * @param refreshToken the decrypted refresh token
     * @return the new tokens
     * @throws RuntimeException when the platform rejects the refresh or cannot be reached
     */
    RefreshedTokens refresh(Platform platform, String refreshToken);

    /**
     * Result of a refresh.
     *
     * @param refreshToken rotated refresh token, or {@code null} if the platform kept the old one
     * @param expiresAt    expiry of the new access token, or {@code null} if it does not expire
     */
    record RefreshedTokens(String accessToken, String refreshToken, Instant expiresAt) {
        public RefreshedTokens {
            Objects.requireNonNull(accessToken, "accessToken");
        }

        @Override
        public String toString() {
            return "RefreshedTokens[accessToken=****, refreshToken="
                + (refreshToken == null ? "null" : "****") + ", expiresAt=" + expiresAt + "]";
        }
    }
}
