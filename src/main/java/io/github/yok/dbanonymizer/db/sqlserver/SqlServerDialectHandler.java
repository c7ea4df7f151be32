package io.github.yok.dbanonymizer.db.sqlserver;

import io.github.yok.dbanonymizer.config.ConnectionConfig;
import io.github.yok.dbanonymizer.db.AbstractDbDialectHandler;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * SQL Server dialect handler.
 *
 * @author Yasuharu.Okawauchi
 */
public class SqlServerDialectHandler extends AbstractDbDialectHandler {

    /**
     * Applies SQL Server session settings.
     *
     * @param connection JDBC connection
     * @throws SQLException on SQL errors
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET LANGUAGE us_english");
        }
    }

    /**
     * Resolves SQL Server schema name.
     *
     * @param entry connection config entry
     * @return SQL Server default schema
     */
    @Override
    public String resolveSchema(ConnectionConfig.Entry entry) {
        return "dbo";
    }

    /**
     * Quotes SQL Server identifier.
     *
     * @param identifier identifier
     * @return quoted identifier
     */
    @Override
    public String quoteIdentifier(String identifier) {
        return "[" + identifier.replace("]", "]]") + "]";
    }
}
