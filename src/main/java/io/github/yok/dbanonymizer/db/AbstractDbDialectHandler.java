package io.github.yok.dbanonymizer.db;

import io.github.yok.dbanonymizer.config.ConnectionConfig;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Base dialect with ANSI behavior: double-quoted identifiers and
 * {@code OFFSET n ROWS FETCH NEXT m ROWS ONLY} pagination.
 *
 * @author Yasuharu.Okawauchi
 */
public abstract class AbstractDbDialectHandler implements DbDialectHandler {

    /**
     * No session initialization by default.
     *
     * @param connection JDBC connection
     * @throws SQLException never thrown here; subclasses may
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        // nothing to prepare
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public abstract String resolveSchema(ConnectionConfig.Entry entry);

    /**
     * Applies ANSI SQL:2008 pagination.
     *
     * @param baseSql base SQL
     * @param offset offset rows
     * @param limit fetch rows
     * @return paginated SQL
     */
    @Override
    public String applyPagination(String baseSql, int offset, int limit) {
        return baseSql + " OFFSET " + offset + " ROWS FETCH NEXT " + limit + " ROWS ONLY";
    }

    /**
     * Quotes an identifier with double quotes, doubling embedded double quotes.
     *
     * @param identifier identifier
     * @return quoted identifier
     */
    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
