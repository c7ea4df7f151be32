package io.github.yok.dbanonymizer.db.mysql;

import io.github.yok.dbanonymizer.config.ConnectionConfig;
import io.github.yok.dbanonymizer.db.AbstractDbDialectHandler;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * MySQL dialect handler.
 *
 * <p>
 * MySQL addresses tables by catalog (database), so no schema is resolved; the connection's current
 * database is used by the introspector.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class MySqlDialectHandler extends AbstractDbDialectHandler {

    /**
     * Forces a UTF-8 session so that character lengths are measured on decoded text.
     *
     * @param connection JDBC connection
     * @throws SQLException on SQL errors
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET NAMES utf8mb4");
        }
    }

    /**
     * MySQL has no schema level below the database.
     *
     * @param entry connection config entry
     * @return {@code null}
     */
    @Override
    public String resolveSchema(ConnectionConfig.Entry entry) {
        return null;
    }

    /**
     * Applies {@code LIMIT offset, limit} pagination.
     *
     * @param baseSql base SQL
     * @param offset offset rows
     * @param limit fetch rows
     * @return paginated SQL
     */
    @Override
    public String applyPagination(String baseSql, int offset, int limit) {
        return baseSql + " LIMIT " + offset + ", " + limit;
    }

    /**
     * Quotes an identifier using backticks.
     *
     * @param identifier identifier to quote
     * @return quoted identifier
     */
    @Override
    public String quoteIdentifier(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }
}
