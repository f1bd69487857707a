package io.postflow.spring.boot;

import io.postflow.jdbc.SchemaInitializer;
import org.springframework.beans.factory.InitializingBean;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies the bundled DDL for the detected database when {@code postflow.initialize-schema}
 * is enabled. The scripts are idempotent.
 */
public class PostflowSchemaInitializer implements InitializingBean {
    private static final Logger logger = Logger.getLogger(PostflowSchemaInitializer.class.getName());

    private final DataSource dataSource;
    private final String databaseName;

    public PostflowSchemaInitializer(DataSource dataSource, String databaseName) {
        this.dataSource = dataSource;
        this.databaseName = databaseName;
    }

    @Override
    public void afterPropertiesSet() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            int statements = SchemaInitializer.apply(conn, databaseName);
            logger.log(Level.INFO, "Applied {0} postflow schema statements for {1}",
                    new Object[]{statements, databaseName});
        }
    }
}
