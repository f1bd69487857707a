package io.postflow.jdbc.store;

import io.postflow.Platform;
import io.postflow.jdbc.JdbcTemplate;
import io.postflow.model.PublicationStatus;
import io.postflow.model.Schedule;
import io.postflow.spi.ScheduleStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Portable JDBC schedule store. Target platforms are persisted as a comma-separated list
 * of platform tags.
 */
public final class JdbcScheduleStore implements ScheduleStore {
  private static final String DEFAULT_TABLE = "schedules";
  private static final String PUBLICATIONS_TABLE = "publications";

  private static final String COLUMNS =
      "id, post_id, user_id, scheduled_time, platforms, is_active, is_completed, created_at, updated_at";

  private static final String TERMINAL_STATUS_IN = "('" + PublicationStatus.PUBLISHED.code() + "','"
      + PublicationStatus.FAILED.code() + "')";

  private static final JdbcTemplate.RowMapper<Schedule> SCHEDULE_ROW_MAPPER = rs -> new Schedule(
      rs.getString("id"),
      rs.getString("post_id"),
      rs.getString("user_id"),
      JdbcTemplate.instant(rs, "scheduled_time"),
      parsePlatforms(rs.getString("platforms")),
      rs.getBoolean("is_active"),
      rs.getBoolean("is_completed"),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "updated_at"));

  private final String tableName;
  private final String publicationsTable;

  public JdbcScheduleStore() {
    this(DEFAULT_TABLE, PUBLICATIONS_TABLE);
  }

  public JdbcScheduleStore(String tableName, String publicationsTable) {
    this.tableName = validTableName(tableName);
    this.publicationsTable = validTableName(publicationsTable);
  }

  /**
   * Active, not yet completed schedules whose time has come and which have no
   * publications yet, earliest first.
   */
  @Override
  public List<Schedule> findDue(Connection conn, Instant now, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " s"
        + " WHERE s.is_active = ? AND s.is_completed = ? AND s.scheduled_time <= ?"
        + " AND NOT EXISTS (SELECT 1 FROM " + publicationsTable + " p WHERE p.schedule_id = s.id)"
        + " ORDER BY s.scheduled_time LIMIT ?";
    return JdbcTemplate.query(conn, sql, SCHEDULE_ROW_MAPPER, true, false, now, limit);
  }

  @Override
  public Optional<Schedule> findById(Connection conn, String scheduleId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id=?";
    return JdbcTemplate.queryOne(conn, sql, SCHEDULE_ROW_MAPPER, scheduleId);
  }

  /**
   * Flips {@code is_completed} in one statement, so concurrent recomputes cannot both
   * observe an incomplete set and the flag is written at most once.
   */
  @Override
  public int refreshCompletion(Connection conn, String scheduleId, int expectedPublications, Instant now) {
    String sql = "UPDATE " + tableName + " SET is_completed = ?, updated_at = ?"
        + " WHERE id = ? AND is_completed = ?"
        + " AND (SELECT COUNT(*) FROM " + publicationsTable + " p"
        + " WHERE p.schedule_id = ? AND p.status IN " + TERMINAL_STATUS_IN + ") >= ?"
        + " AND NOT EXISTS (SELECT 1 FROM " + publicationsTable + " p"
        + " WHERE p.schedule_id = ? AND p.status NOT IN " + TERMINAL_STATUS_IN + ")";
    return JdbcTemplate.update(conn, sql, true, now, scheduleId, false, scheduleId, expectedPublications,
        scheduleId);
  }

  @Override
  public void insert(Connection conn, Schedule schedule) {
    Objects.requireNonNull(schedule, "schedule");
    String sql = "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        schedule.id(), schedule.postId(), schedule.userId(), schedule.scheduledTime(),
        formatPlatforms(schedule.platforms()), schedule.active(), schedule.completed(),
        schedule.createdAt(), schedule.updatedAt());
  }

  @Override
  public int setActive(Connection conn, String scheduleId, boolean active, Instant now) {
    String sql = "UPDATE " + tableName + " SET is_active = ?, updated_at = ? WHERE id = ?";
    return JdbcTemplate.update(conn, sql, active, now, scheduleId);
  }

  static String formatPlatforms(Set<Platform> platforms) {
    return platforms.stream().map(Platform::tag).collect(Collectors.joining(","));
  }

  static Set<Platform> parsePlatforms(String tags) {
    Set<Platform> platforms = EnumSet.noneOf(Platform.class);
    if (tags == null || tags.isBlank()) {
      return platforms;
    }
    for (String tag : tags.split(",")) {
      if (!tag.isBlank()) {
        platforms.add(Platform.fromTag(tag));
      }
    }
    return platforms;
  }

  private static String validTableName(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
