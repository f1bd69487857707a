package io.postflow.jdbc;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies the bundled DDL script ({@code /schema/<name>.sql}) for a database.
 *
 * <p>Every statement uses {@code IF NOT EXISTS}, so applying the script to an existing
 * schema is a no-op.
 */
public final class SchemaInitializer {
  private static final Logger logger = Logger.getLogger(SchemaInitializer.class.getName());

  private SchemaInitializer() {}

  /**
   * Executes every statement of the script for {@code databaseName} ("h2", "mysql" or
   * "postgresql") on {@code conn}.
   *
   * @return number of statements executed
   */
  public static int apply(Connection conn, String databaseName) {
    Objects.requireNonNull(conn, "conn");
    List<String> statements = statements(databaseName);
    try (Statement stmt = conn.createStatement()) {
      for (String sql : statements) {
        stmt.execute(sql);
      }
    } catch (SQLException e) {
      throw new PostflowStoreException("Failed to apply " + databaseName + " schema", e);
    }
    logger.log(Level.INFO, "Applied {0} schema ({1} statements)", new Object[]{databaseName, statements.size()});
    return statements.size();
  }

  /**
   * Reads and splits the bundled script for {@code databaseName}.
   *
   * @throws IllegalArgumentException if no script ships for that database
   */
  public static List<String> statements(String databaseName) {
    Objects.requireNonNull(databaseName, "databaseName");
    String path = "/schema/" + databaseName + ".sql";
    String script;
    try (InputStream in = SchemaInitializer.class.getResourceAsStream(path)) {
      if (in == null) {
        throw new IllegalArgumentException("No schema script for database: " + databaseName);
      }
      script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + path, e);
    }
    List<String> statements = new ArrayList<>();
    for (String part : script.split(";")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        statements.add(trimmed);
      }
    }
    return statements;
  }
}
