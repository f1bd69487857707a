package io.postflow.jdbc;

import io.postflow.jdbc.store.AbstractJdbcPublicationStore;
import io.postflow.jdbc.store.MySqlPublicationStore;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;

import javax.sql.DataSource;

/**
 * Runs the MySQL store ({@code INSERT IGNORE}) against H2 in MySQL compatibility mode.
 */
class MySqlModePublicationStoreTest extends AbstractPublicationStoreIntegrationTest {
    private final MySqlPublicationStore store = new MySqlPublicationStore();
    private JdbcDataSource dataSource;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = H2Databases.create("MySQL");
    }

    @Override
    DataSource dataSource() {
        return dataSource;
    }

    @Override
    AbstractJdbcPublicationStore store() {
        return store;
    }
}
