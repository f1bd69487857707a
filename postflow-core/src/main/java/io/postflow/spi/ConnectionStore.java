package io.postflow.spi;

import io.postflow.Platform;
import io.postflow.model.PlatformConnection;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

/**
 * Persistence contract for platform connections. Token columns hold ciphertext.
 */
public interface ConnectionStore {

    Optional<PlatformConnection> findById(Connection conn, String connectionId);

    /**
     * Returns the most recently updated active connection of {@code userId} on {@code platform}.
     */
    Optional<PlatformConnection> findActive(Connection conn, String userId, Platform platform);

    /**
     * Takes the refresh lease on a connection unless another owner holds one that has not
     * yet expired. Dispatchers sharing a database use it so that only one of them calls the
     * platform's refresh endpoint at a time.
     *
     * @return 1 if the lease was taken, 0 if it is held elsewhere
     */
    int claimRefresh(Connection conn, String connectionId, String owner, Instant now, Instant leaseUntil);

    /**
     * Gives up the refresh lease if {@code owner} still holds it.
     */
    int releaseRefresh(Connection conn, String connectionId, String owner);

    /**
     * Replaces the stored tokens, provided the stored refresh token is still
     * {@code expectedRefreshTokenCiphertext}, and clears the refresh lease. A {@code null}
     * new refresh token keeps the stored one.
     *
     * @return 1 if written, 0 if the tokens were already replaced by another refresh
     */
    int updateTokens(Connection conn, String connectionId, String expectedRefreshTokenCiphertext,
        String accessTokenCiphertext, String refreshTokenCiphertext, Instant expiresAt, Instant now);

    void insert(Connection conn, PlatformConnection connection);

    int deactivate(Connection conn, String connectionId, Instant now);
}
