package io.postflow.jdbc.store;

import io.postflow.Platform;
import io.postflow.jdbc.JdbcTemplate;
import io.postflow.model.PlatformConnection;
import io.postflow.spi.ConnectionStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Portable JDBC store for {@code platform_connections}. Token columns hold ciphertext only.
 */
public final class JdbcConnectionStore implements ConnectionStore {
  private static final String DEFAULT_TABLE = "platform_connections";

  private static final String COLUMNS = "id, user_id, platform, platform_account_id, access_token, "
      + "refresh_token, expires_at, is_active, created_at, updated_at";

  private static final JdbcTemplate.RowMapper<PlatformConnection> CONNECTION_ROW_MAPPER =
      rs -> new PlatformConnection(
          rs.getString("id"),
          rs.getString("user_id"),
          Platform.fromTag(rs.getString("platform")),
          rs.getString("platform_account_id"),
          rs.getString("access_token"),
          rs.getString("refresh_token"),
          JdbcTemplate.instant(rs, "expires_at"),
          rs.getBoolean("is_active"),
          JdbcTemplate.instant(rs, "created_at"),
          JdbcTemplate.instant(rs, "updated_at"));

  private final String tableName;

  public JdbcConnectionStore() {
    this(DEFAULT_TABLE);
  }

  public JdbcConnectionStore(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    this.tableName = tableName;
  }

  @Override
  public Optional<PlatformConnection> findById(Connection conn, String connectionId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id=?";
    return JdbcTemplate.queryOne(conn, sql, CONNECTION_ROW_MAPPER, connectionId);
  }

  /**
   * Most recently updated active connection of the user on the platform.
   */
  @Override
  public Optional<PlatformConnection> findActive(Connection conn, String userId, Platform platform) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName
        + " WHERE user_id=? AND platform=? AND is_active=? ORDER BY updated_at DESC LIMIT 1";
    return JdbcTemplate.queryOne(conn, sql, CONNECTION_ROW_MAPPER, userId, platform.tag(), true);
  }

  @Override
  public int claimRefresh(Connection conn, String connectionId, String owner, Instant now, Instant leaseUntil) {
    String sql = "UPDATE " + tableName + " SET refresh_owner=?, refresh_lease_until=?"
        + " WHERE id=? AND (refresh_lease_until IS NULL OR refresh_lease_until < ?)";
    return JdbcTemplate.update(conn, sql, owner, leaseUntil, connectionId, now);
  }

  @Override
  public int releaseRefresh(Connection conn, String connectionId, String owner) {
    String sql = "UPDATE " + tableName + " SET refresh_owner=NULL, refresh_lease_until=NULL"
        + " WHERE id=? AND refresh_owner=?";
    return JdbcTemplate.update(conn, sql, connectionId, owner);
  }

  @Override
  public int updateTokens(Connection conn, String connectionId, String expectedRefreshTokenCiphertext,
      String accessTokenCiphertext, String refreshTokenCiphertext, Instant expiresAt, Instant now) {
    Objects.requireNonNull(accessTokenCiphertext, "accessTokenCiphertext");
    String newRefresh = refreshTokenCiphertext != null ? refreshTokenCiphertext : expectedRefreshTokenCiphertext;
    String sql = "UPDATE " + tableName + " SET access_token=?, refresh_token=?, expires_at=?, updated_at=?,"
        + " refresh_owner=NULL, refresh_lease_until=NULL WHERE id=?";
    if (expectedRefreshTokenCiphertext == null) {
      return JdbcTemplate.update(conn, sql + " AND refresh_token IS NULL",
          accessTokenCiphertext, newRefresh, expiresAt, now, connectionId);
    }
    return JdbcTemplate.update(conn, sql + " AND refresh_token=?",
        accessTokenCiphertext, newRefresh, expiresAt, now, connectionId, expectedRefreshTokenCiphertext);
  }

  @Override
  public void insert(Connection conn, PlatformConnection connection) {
    Objects.requireNonNull(connection, "connection");
    String sql = "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        connection.id(), connection.userId(), connection.platform().tag(), connection.platformAccountId(),
        connection.accessTokenCiphertext(), connection.refreshTokenCiphertext(), connection.expiresAt(),
        connection.active(), connection.createdAt(), connection.updatedAt());
  }

  @Override
  public int deactivate(Connection conn, String connectionId, Instant now) {
    String sql = "UPDATE " + tableName + " SET is_active=?, updated_at=? WHERE id=?";
    return JdbcTemplate.update(conn, sql, false, now, connectionId);
  }
}
