package io.postflow.event;

import io.postflow.spi.ConnectionProvider;
import io.postflow.spi.PublicationStore;

import java.sql.Connection;
import java.util.Objects;

/**
 * Clears the owed-event marker on the publication row. Until this runs the dispatch
 * poller keeps redelivering the event.
 */
public final class LedgerEventAcknowledger implements EventAcknowledger {
  private final ConnectionProvider connectionProvider;
  private final PublicationStore publicationStore;

  public LedgerEventAcknowledger(ConnectionProvider connectionProvider, PublicationStore publicationStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.publicationStore = Objects.requireNonNull(publicationStore, "publicationStore");
  }

  @Override
  public void acknowledge(PublicationEvent event) throws Exception {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      publicationStore.acknowledgeEvent(conn, event.publicationId());
    }
  }
}
