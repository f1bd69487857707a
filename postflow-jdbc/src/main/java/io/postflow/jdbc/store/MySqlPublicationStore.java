package io.postflow.jdbc.store;

import io.postflow.Platform;
import io.postflow.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * MySQL publication store. Also compatible with TiDB.
 *
 * <p>Uses {@code INSERT IGNORE} so an existing {@code (schedule_id, platform)} row is left
 * untouched without raising an error.
 */
public final class MySqlPublicationStore extends AbstractJdbcPublicationStore {

  public MySqlPublicationStore() {
    super();
  }

  public MySqlPublicationStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:", "jdbc:mariadb:");
  }

  @Override
  public int insertIfAbsent(Connection conn, String scheduleId, Platform platform, Instant now) {
    String sql = "INSERT IGNORE INTO " + tableName() + " " + insertColumnsAndValues();
    return JdbcTemplate.update(conn, sql, newRowParams(scheduleId, platform, now));
  }
}
