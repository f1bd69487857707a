package io.postflow.jdbc.store;

import io.postflow.Platform;
import io.postflow.jdbc.JdbcTemplate;
import io.postflow.model.ErrorKind;
import io.postflow.model.Publication;
import io.postflow.model.PublicationStatus;
import io.postflow.spi.PublicationStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Base JDBC publication store with standard SQL implementations.
 *
 * <p>Every state change is a single conditional {@code UPDATE}: a claim only matches a
 * {@code pending} row without a live lease, and every settle only matches a
 * {@code publishing} row still owned by the caller. Zero rows affected means another
 * dispatcher got there first.
 *
 * <p>Subclasses override {@link #insertIfAbsent} with the database's idempotent insert.
 * Register custom implementations via
 * {@code META-INF/services/io.postflow.jdbc.store.AbstractJdbcPublicationStore}.
 *
 * @see JdbcPublicationStores
 */
public abstract class AbstractJdbcPublicationStore implements PublicationStore {
  protected static final String DEFAULT_TABLE = "publications";
  private static final String SCHEDULES_TABLE = "schedules";
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final String COLUMNS = "id, schedule_id, platform, status, attempt_count, next_retry_at, "
      + "lease_owner, lease_expires_at, last_error_kind, error_message, remote_post_id, published_at, "
      + "created_at, updated_at";

  protected static final JdbcTemplate.RowMapper<Publication> PUBLICATION_ROW_MAPPER = rs -> {
    String errorKind = rs.getString("last_error_kind");
    return new Publication(
        rs.getString("id"),
        rs.getString("schedule_id"),
        Platform.fromTag(rs.getString("platform")),
        PublicationStatus.fromCode(rs.getString("status")),
        rs.getInt("attempt_count"),
        JdbcTemplate.instant(rs, "next_retry_at"),
        rs.getString("lease_owner"),
        JdbcTemplate.instant(rs, "lease_expires_at"),
        errorKind == null ? null : ErrorKind.valueOf(errorKind),
        rs.getString("error_message"),
        rs.getString("remote_post_id"),
        JdbcTemplate.instant(rs, "published_at"),
        JdbcTemplate.instant(rs, "created_at"),
        JdbcTemplate.instant(rs, "updated_at"));
  };

  private static final String PENDING = "'" + PublicationStatus.PENDING.code() + "'";
  private static final String PUBLISHING = "'" + PublicationStatus.PUBLISHING.code() + "'";
  private static final String TERMINAL = "'" + PublicationStatus.PUBLISHED.code() + "', '"
      + PublicationStatus.FAILED.code() + "'";

  private final String tableName;

  protected AbstractJdbcPublicationStore() {
    this(DEFAULT_TABLE);
  }

  protected AbstractJdbcPublicationStore(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    this.tableName = tableName;
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  protected String tableName() {
    return tableName;
  }

  /**
   * Column list and values placeholder for a fresh {@code pending} row, in the order
   * produced by {@link #newRowParams}.
   */
  protected String insertColumnsAndValues() {
    return "(id, schedule_id, platform, status, attempt_count, next_retry_at, created_at, updated_at) "
        + "VALUES (?, ?, ?, " + PENDING + ", 0, ?, ?, ?)";
  }

  protected Object[] newRowParams(String scheduleId, Platform platform, Instant now) {
    return new Object[]{UUID.randomUUID().toString(), scheduleId, platform.tag(), now, now, now};
  }

  /**
   * Default: plain insert, treating a unique violation on {@code (schedule_id, platform)}
   * as "already exists".
   */
  @Override
  public int insertIfAbsent(Connection conn, String scheduleId, Platform platform, Instant now) {
    String sql = "INSERT INTO " + tableName() + " " + insertColumnsAndValues();
    return JdbcTemplate.insertIgnoringDuplicate(conn, sql, newRowParams(scheduleId, platform, now));
  }

  @Override
  public List<Publication> findClaimable(Connection conn, Instant now, int limit) {
    String sql = "SELECT " + qualified("p") + " FROM " + tableName() + " p"
        + " JOIN " + SCHEDULES_TABLE + " s ON s.id = p.schedule_id"
        + " WHERE p.status=" + PENDING + " AND p.next_retry_at <= ?"
        + " AND (p.lease_owner IS NULL OR p.lease_expires_at < ?)"
        + " AND s.is_active = ?"
        + " ORDER BY p.next_retry_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, PUBLICATION_ROW_MAPPER, now, now, true, limit);
  }

  @Override
  public int claim(Connection conn, String publicationId, String owner, Instant now, Instant leaseExpiresAt) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + PUBLISHING + ", lease_owner=?, lease_expires_at=?, updated_at=?"
        + " WHERE id=? AND status=" + PENDING + " AND next_retry_at <= ?"
        + " AND (lease_owner IS NULL OR lease_expires_at < ?)";
    return JdbcTemplate.update(conn, sql, owner, leaseExpiresAt, now, publicationId, now, now);
  }

  @Override
  public int renewLease(Connection conn, String publicationId, String owner, Instant now,
      Instant leaseExpiresAt) {
    String sql = "UPDATE " + tableName() + " SET lease_expires_at=?, updated_at=?"
        + " WHERE id=? AND status=" + PUBLISHING + " AND lease_owner=?";
    return JdbcTemplate.update(conn, sql, leaseExpiresAt, now, publicationId, owner);
  }

  @Override
  public int markPublished(Connection conn, String publicationId, String owner, String remotePostId,
      int attempts, Instant publishedAt) {
    String sql = "UPDATE " + tableName()
        + " SET status='" + PublicationStatus.PUBLISHED.code() + "', attempt_count=attempt_count+?,"
        + " remote_post_id=COALESCE(remote_post_id, ?), published_at=?, updated_at=?,"
        + " event_pending_since=?, lease_owner=NULL, lease_expires_at=NULL"
        + " WHERE id=? AND status=" + PUBLISHING + " AND lease_owner=?";
    return JdbcTemplate.update(conn, sql, attempts, remotePostId, publishedAt, publishedAt, publishedAt,
        publicationId, owner);
  }

  @Override
  public int recordRemotePostId(Connection conn, String publicationId, String remotePostId, Instant now) {
    String sql = "UPDATE " + tableName() + " SET remote_post_id=?, updated_at=?"
        + " WHERE id=? AND remote_post_id IS NULL";
    return JdbcTemplate.update(conn, sql, remotePostId, now, publicationId);
  }

  @Override
  public int markRetry(Connection conn, String publicationId, String owner, Instant nextRetryAt,
      int attempts, ErrorKind errorKind, String error, Instant now) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + PENDING + ", attempt_count=attempt_count+?, next_retry_at=?,"
        + " last_error_kind=?, error_message=?, updated_at=?, lease_owner=NULL, lease_expires_at=NULL"
        + " WHERE id=? AND status=" + PUBLISHING + " AND lease_owner=?";
    return JdbcTemplate.update(conn, sql, attempts, nextRetryAt, errorKind.name(), truncateError(error), now,
        publicationId, owner);
  }

  @Override
  public int markFailed(Connection conn, String publicationId, String owner, int attempts,
      ErrorKind errorKind, String error, Instant now) {
    String sql = "UPDATE " + tableName()
        + " SET status='" + PublicationStatus.FAILED.code() + "', attempt_count=attempt_count+?,"
        + " last_error_kind=?, error_message=?, updated_at=?, event_pending_since=?,"
        + " lease_owner=NULL, lease_expires_at=NULL"
        + " WHERE id=? AND status=" + PUBLISHING + " AND lease_owner=?";
    return JdbcTemplate.update(conn, sql, attempts, errorKind.name(), truncateError(error), now, now,
        publicationId, owner);
  }

  @Override
  public int releaseClaim(Connection conn, String publicationId, String owner, Instant now) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + PENDING + ", updated_at=?, lease_owner=NULL, lease_expires_at=NULL"
        + " WHERE id=? AND status=" + PUBLISHING + " AND lease_owner=?";
    return JdbcTemplate.update(conn, sql, now, publicationId, owner);
  }

  @Override
  public int reclaimExpired(Connection conn, Instant now) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + PENDING + ", updated_at=?, lease_owner=NULL, lease_expires_at=NULL"
        + " WHERE status=" + PUBLISHING + " AND lease_expires_at < ?";
    return JdbcTemplate.update(conn, sql, now, now);
  }

  @Override
  public List<Publication> findUnacknowledgedEvents(Connection conn, Instant pendingBefore, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE event_pending_since IS NOT NULL AND event_pending_since <= ?"
        + " AND status IN (" + TERMINAL + ")"
        + " ORDER BY event_pending_since LIMIT ?";
    return JdbcTemplate.query(conn, sql, PUBLICATION_ROW_MAPPER, pendingBefore, limit);
  }

  @Override
  public int claimEventRedelivery(Connection conn, String publicationId, Instant pendingBefore, Instant now) {
    String sql = "UPDATE " + tableName() + " SET event_pending_since=?"
        + " WHERE id=? AND event_pending_since IS NOT NULL AND event_pending_since <= ?";
    return JdbcTemplate.update(conn, sql, now, publicationId, pendingBefore);
  }

  @Override
  public int acknowledgeEvent(Connection conn, String publicationId) {
    String sql = "UPDATE " + tableName() + " SET event_pending_since=NULL"
        + " WHERE id=? AND event_pending_since IS NOT NULL";
    return JdbcTemplate.update(conn, sql, publicationId);
  }

  @Override
  public Optional<Publication> findById(Connection conn, String publicationId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?";
    return JdbcTemplate.queryOne(conn, sql, PUBLICATION_ROW_MAPPER, publicationId);
  }

  @Override
  public List<Publication> findBySchedule(Connection conn, String scheduleId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE schedule_id=? ORDER BY platform";
    return JdbcTemplate.query(conn, sql, PUBLICATION_ROW_MAPPER, scheduleId);
  }

  private static String qualified(String alias) {
    return alias + "." + COLUMNS.replace(", ", ", " + alias + ".");
  }

  protected static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
