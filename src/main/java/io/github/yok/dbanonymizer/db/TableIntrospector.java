package io.github.yok.dbanonymizer.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Reports table existence and key/column names.
 *
 * <p>
 * Names passed in are matched ignoring case; names returned are the physical names stored in the
 * database catalog, suitable for quoting.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface TableIntrospector {

    /**
     * Looks up the physical name of a table.
     *
     * @param connection JDBC connection
     * @param schema schema name (may be {@code null})
     * @param table configured table name
     * @return physical table name, or empty when the table does not exist
     * @throws SQLException if metadata retrieval fails
     */
    Optional<String> resolveTableName(Connection connection, String schema, String table)
            throws SQLException;

    /**
     * Checks whether the table exists.
     *
     * @param connection JDBC connection
     * @param schema schema name (may be {@code null})
     * @param table configured table name
     * @return true when the table exists
     * @throws SQLException if metadata retrieval fails
     */
    default boolean tableExists(Connection connection, String schema, String table)
            throws SQLException {
        return resolveTableName(connection, schema, table).isPresent();
    }

    /**
     * Retrieves ordered primary-key column names.
     *
     * @param connection JDBC connection
     * @param schema schema name (may be {@code null})
     * @param table physical table name
     * @return primary-key columns in key sequence order (empty if none)
     * @throws SQLException if metadata retrieval fails
     */
    List<String> getPrimaryKeyColumns(Connection connection, String schema, String table)
            throws SQLException;

    /**
     * Retrieves all column names of a table in ordinal order.
     *
     * @param connection JDBC connection
     * @param schema schema name (may be {@code null})
     * @param table physical table name
     * @return column names
     * @throws SQLException if metadata retrieval fails
     */
    List<String> getColumnNames(Connection connection, String schema, String table)
            throws SQLException;
}
