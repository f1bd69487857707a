package io.postflow.jdbc.store;

import io.postflow.Platform;
import io.postflow.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL publication store.
 *
 * <p>Uses {@code ON CONFLICT DO NOTHING}: a failed insert would abort the surrounding
 * transaction in PostgreSQL, so duplicates must not raise.
 */
public final class PostgresPublicationStore extends AbstractJdbcPublicationStore {

  public PostgresPublicationStore() {
    super();
  }

  public PostgresPublicationStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public int insertIfAbsent(Connection conn, String scheduleId, Platform platform, Instant now) {
    String sql = "INSERT INTO " + tableName() + " " + insertColumnsAndValues()
        + " ON CONFLICT (schedule_id, platform) DO NOTHING";
    return JdbcTemplate.update(conn, sql, newRowParams(scheduleId, platform, now));
  }
}
