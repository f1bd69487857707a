package io.postflow.vault;

import io.postflow.model.AccessToken;
import io.postflow.model.PlatformConnection;
import io.postflow.spi.ConnectionProvider;
import io.postflow.spi.ConnectionStore;
import io.postflow.spi.MetricsExporter;
import io.postflow.spi.TokenCipher;
import io.postflow.spi.TokenRefresher;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hands out valid access tokens for platform connections, refreshing them when needed.
 *
 * <p>A stored token is returned as-is when it does not expire or expires after
 * {@code now + safetyMargin}. Otherwise it is refreshed through the {@link TokenRefresher}
 * and the new tokens are encrypted and written back before being returned.
 *
 * <p>Refreshes are single-flight per connection within this process: concurrent callers
 * wait on the one in-flight refresh and all receive its result (or its failure). A caller
 * arriving after that refresh finished re-reads the connection and refreshes again only if
 * the token is still inside the safety margin.
 *
 * <p>Across processes sharing the database, the refresh is guarded by a lease on the
 * connection row ({@link ConnectionStore#claimRefresh}). A vault that finds the lease held
 * elsewhere polls the row until the new tokens appear. The write-back is conditioned on
 * the refresh token that was read, so a refresh that outlives its lease cannot overwrite
 * newer tokens.
 *
 * <p>Failures are reported as {@link CredentialException} subclasses. Raw token values never
 * appear in log records or exception messages.
 */
public final class CredentialVault {
    private static final Logger logger = Logger.getLogger(CredentialVault.class.getName());
    private static final long REFRESH_WAIT_MS = 50;

    private final ConnectionProvider connectionProvider;
    private final ConnectionStore connectionStore;
    private final TokenCipher cipher;
    private final TokenRefresher refresher;
    private final Duration safetyMargin;
    private final Duration refreshLease;
    private final String ownerId;
    private final Clock clock;
    private final MetricsExporter metrics;
    private final ConcurrentMap<String, CompletableFuture<AccessToken>> inFlight = new ConcurrentHashMap<>();

    private CredentialVault(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.connectionStore = Objects.requireNonNull(builder.connectionStore, "connectionStore");
        this.cipher = Objects.requireNonNull(builder.cipher, "cipher");
        this.refresher = Objects.requireNonNull(builder.refresher, "refresher");
        this.safetyMargin = Objects.requireNonNull(builder.safetyMargin, "safetyMargin");
        if (safetyMargin.isNegative()) {
            throw new IllegalArgumentException("safetyMargin must be >= 0");
        }
        this.refreshLease = Objects.requireNonNull(builder.refreshLease, "refreshLease");
        if (refreshLease.isNegative() || refreshLease.isZero()) {
            throw new IllegalArgumentException("refreshLease must be positive");
        }
        this.ownerId = builder.ownerId != null ? builder.ownerId : "vault-" + UUID.randomUUID();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a token that stays valid for at least the safety margin, refreshing if needed.
     *
     * @throws TokenExpiredException if the connection is unknown, inactive, or expired
     *                               without a refresh token
     * @throws TokenRefreshException if the platform rejected the refresh
     */
    public AccessToken getValidToken(String connectionId) {
        Objects.requireNonNull(connectionId, "connectionId");
        PlatformConnection connection = loadActive(connectionId);
        if (!needsRefresh(connection)) {
            return toAccessToken(connection);
        }
        return refreshSingleFlight(connectionId, false);
    }

    /**
     * Refreshes the token regardless of its stored expiry. Used after the platform rejected
     * a token that looked valid.
     */
    public AccessToken forceRefresh(String connectionId) {
        Objects.requireNonNull(connectionId, "connectionId");
        return refreshSingleFlight(connectionId, true);
    }

    private AccessToken refreshSingleFlight(String connectionId, boolean force) {
        CompletableFuture<AccessToken> mine = new CompletableFuture<>();
        CompletableFuture<AccessToken> existing = inFlight.putIfAbsent(connectionId, mine);
        if (existing != null) {
            return await(existing, connectionId);
        }
        try {
            AccessToken token = refreshNow(connectionId, force);
            mine.complete(token);
            return token;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(connectionId, mine);
        }
    }

    private AccessToken await(CompletableFuture<AccessToken> refresh, String connectionId) {
        try {
            return refresh.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CredentialException credentialException) {
                throw credentialException;
            }
            throw new TokenRefreshException("Token refresh failed for connection " + connectionId, cause);
        }
    }

    private AccessToken refreshNow(String connectionId, boolean force) {
        // Re-read: a refresh that finished just before this one may already have rotated the token
        PlatformConnection seen = loadActive(connectionId);
        if (!force && !needsRefresh(seen)) {
            return toAccessToken(seen);
        }
        if (!seen.hasRefreshToken()) {
            throw new TokenExpiredException("Connection " + connectionId + " on "
                + seen.platform().tag() + " has no refresh token");
        }

        long deadline = System.nanoTime() + refreshLease.toNanos();
        while (true) {
            if (claimRefresh(connectionId)) {
                try {
                    return refreshUnderLease(connectionId, seen, force);
                } finally {
                    releaseRefresh(connectionId);
                }
            }
            // Another dispatcher is refreshing; wait for its tokens to land
            if (System.nanoTime() - deadline >= 0) {
                throw new TokenRefreshException("Timed out waiting for another dispatcher to refresh connection "
                    + connectionId, null);
            }
            pause(connectionId);
            PlatformConnection current = loadActive(connectionId);
            if (replacedSince(seen, current)) {
                return toAccessToken(current);
            }
        }
    }

    private AccessToken refreshUnderLease(String connectionId, PlatformConnection seen, boolean force) {
        PlatformConnection connection = loadActive(connectionId);
        if (replacedSince(seen, connection) || (!force && !needsRefresh(connection))) {
            return toAccessToken(connection);
        }
        if (!connection.hasRefreshToken()) {
            throw new TokenExpiredException("Connection " + connectionId + " on "
                + connection.platform().tag() + " has no refresh token");
        }

        String refreshToken = decrypt(connection.refreshTokenCiphertext(), connectionId);
        TokenRefresher.RefreshedTokens tokens;
        try {
            tokens = refresher.refresh(connection.platform(), refreshToken);
        } catch (RuntimeException e) {
            metrics.incrementTokenRefreshFailure(connection.platform());
            logger.log(Level.WARNING, "Token refresh failed for connection " + connectionId
                + " on " + connection.platform().tag() + ": " + e.getMessage());
            throw new TokenRefreshException("Token refresh failed for connection " + connectionId, e);
        }
        if (tokens == null) {
            metrics.incrementTokenRefreshFailure(connection.platform());
            throw new TokenRefreshException("Token refresher returned no tokens for connection "
                + connectionId, null);
        }

        Instant now = clock.instant();
        String accessCiphertext = cipher.encrypt(tokens.accessToken());
        String refreshCiphertext = tokens.refreshToken() == null ? null : cipher.encrypt(tokens.refreshToken());
        if (!persist(connection, accessCiphertext, refreshCiphertext, tokens.expiresAt(), now)) {
            // Lost the write to a refresh that ran after our lease lapsed; its tokens are the live ones
            PlatformConnection winner = loadActive(connectionId);
            if (!replacedSince(connection, winner)) {
                throw new TokenRefreshException("Refreshed tokens for connection " + connectionId
                    + " could not be stored", null);
            }
            logger.log(Level.WARNING, "Connection {0} was refreshed concurrently; using the stored tokens",
                connectionId);
            return toAccessToken(winner);
        }
        metrics.incrementTokenRefresh(connection.platform());
        logger.log(Level.FINE, "Refreshed token for connection {0}, expiresAt={1}",
            new Object[]{connectionId, tokens.expiresAt()});

        return new AccessToken(connectionId, connection.platform(), connection.platformAccountId(),
            tokens.accessToken(), tokens.expiresAt());
    }

    private static boolean replacedSince(PlatformConnection before, PlatformConnection after) {
        return !Objects.equals(before.accessTokenCiphertext(), after.accessTokenCiphertext());
    }

    private void pause(String connectionId) {
        try {
            Thread.sleep(REFRESH_WAIT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenRefreshException("Interrupted waiting for refresh of connection " + connectionId, e);
        }
    }

    private boolean needsRefresh(PlatformConnection connection) {
        Instant expiresAt = connection.expiresAt();
        return expiresAt != null && !expiresAt.isAfter(clock.instant().plus(safetyMargin));
    }

    private AccessToken toAccessToken(PlatformConnection connection) {
        return new AccessToken(connection.id(), connection.platform(), connection.platformAccountId(),
            decrypt(connection.accessTokenCiphertext(), connection.id()), connection.expiresAt());
    }

    private String decrypt(String ciphertext, String connectionId) {
        try {
            return cipher.decrypt(ciphertext);
        } catch (RuntimeException e) {
            throw new CredentialException("Stored token for connection " + connectionId
                + " cannot be decrypted", e);
        }
    }

    private PlatformConnection loadActive(String connectionId) {
        PlatformConnection connection;
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            connection = connectionStore.findById(conn, connectionId).orElse(null);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to load connection " + connectionId, e);
        }
        if (connection == null || !connection.active()) {
            throw new TokenExpiredException("Connection " + connectionId + " is unknown or inactive");
        }
        return connection;
    }

    private boolean claimRefresh(String connectionId) {
        Instant now = clock.instant();
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return connectionStore.claimRefresh(conn, connectionId, ownerId, now, now.plus(refreshLease)) == 1;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to claim refresh of connection " + connectionId, e);
        }
    }

    private void releaseRefresh(String connectionId) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            connectionStore.releaseRefresh(conn, connectionId, ownerId);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.WARNING, "Failed to release refresh lease on connection " + connectionId
                + "; it lapses after " + refreshLease, e);
        }
    }

    private boolean persist(PlatformConnection connection, String accessCiphertext, String refreshCiphertext,
                            Instant expiresAt, Instant now) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return connectionStore.updateTokens(conn, connection.id(), connection.refreshTokenCiphertext(),
                accessCiphertext, refreshCiphertext, expiresAt, now) == 1;
        } catch (SQLException | RuntimeException e) {
            // The platform may already have invalidated the old refresh token
            throw new TokenRefreshException("Failed to store refreshed tokens for connection "
                + connection.id(), e);
        }
    }

    /**
     * Builder for {@link CredentialVault}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private ConnectionStore connectionStore;
        private TokenCipher cipher;
        private TokenRefresher refresher;
        private Duration safetyMargin = Duration.ofMinutes(5);
        private Duration refreshLease = Duration.ofMinutes(1);
        private String ownerId;
        private Clock clock;
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder connectionStore(ConnectionStore connectionStore) {
            this.connectionStore = connectionStore;
            return this;
        }

        /**
         * Sets the cipher protecting tokens at rest.
         *
         * <p><b>Required.</b>
         */
        public Builder cipher(TokenCipher cipher) {
            this.cipher = cipher;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder refresher(TokenRefresher refresher) {
            this.refresher = refresher;
            return this;
        }

        /**
         * Sets how long before expiry a token is refreshed.
         *
         * <p>Optional. Defaults to 5 minutes.
         */
        public Builder safetyMargin(Duration safetyMargin) {
            this.safetyMargin = safetyMargin;
            return this;
        }

        /**
         * Sets how long a claimed refresh stays exclusive, and how long a vault waits for
         * another process's refresh before giving up.
         *
         * <p>Optional. Defaults to 1 minute.
         */
        public Builder refreshLease(Duration refreshLease) {
            this.refreshLease = refreshLease;
            return this;
        }

        /**
         * Refresh lease owner id. Optional. Defaults to {@code vault-<random>}.
         */
        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public CredentialVault build() {
            return new CredentialVault(this);
        }
    }
}
