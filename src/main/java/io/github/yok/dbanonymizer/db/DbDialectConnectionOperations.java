package io.github.yok.dbanonymizer.db;

import io.github.yok.dbanonymizer.config.ConnectionConfig;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Connection/session related operations for each database dialect.
 */
public interface DbDialectConnectionOperations {

    /**
     * Applies dialect-specific initialization to a freshly opened JDBC connection.
     *
     * @param connection JDBC connection to initialize
     * @throws SQLException if session initialization fails
     */
    void prepareConnection(Connection connection) throws SQLException;

    /**
     * Resolves the schema that holds the configured tables.
     *
     * @param entry connection-config entry
     * @return schema name, or {@code null} when the dialect addresses tables by catalog only
     */
    String resolveSchema(ConnectionConfig.Entry entry);
}
