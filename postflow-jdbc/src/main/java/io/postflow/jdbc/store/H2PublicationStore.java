package io.postflow.jdbc.store;

import java.util.List;

/**
 * H2 publication store. Primarily for testing.
 *
 * <p>Uses the default insert-and-ignore-duplicate strategy from
 * {@link AbstractJdbcPublicationStore}.
 */
public final class H2PublicationStore extends AbstractJdbcPublicationStore {

  public H2PublicationStore() {
    super();
  }

  public H2PublicationStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
