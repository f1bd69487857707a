package io.postflow.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of JDBC connections for the schedule, publication and connection stores.
 *
 * <p>Each poller tick and each ledger write borrows one connection and closes it when done,
 * so a pooled implementation is expected in production.
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * @throws SQLException when the database is unreachable; the caller treats it as a
     *                      failed tick or a failed settle
     */
    Connection getConnection() throws SQLException;
}
