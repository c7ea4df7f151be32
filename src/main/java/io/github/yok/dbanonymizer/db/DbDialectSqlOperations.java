package io.github.yok.dbanonymizer.db;

/**
 * SQL grammar operations for each database dialect.
 */
public interface DbDialectSqlOperations {

    /**
     * Applies dialect pagination to an ordered base SELECT.
     *
     * @param baseSql base select SQL, already containing {@code ORDER BY}
     * @param offset rows to skip
     * @param limit max rows
     * @return paginated SQL
     */
    String applyPagination(String baseSql, int offset, int limit);

    /**
     * Quotes an identifier in dialect style, escaping embedded quote characters.
     *
     * @param identifier identifier
     * @return quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Quotes a table name, prefixed with its quoted schema when one is given.
     *
     * @param schema schema name (may be {@code null})
     * @param table table name
     * @return qualified, quoted table name
     */
    default String qualifyTable(String schema, String table) {
        if (schema == null || schema.isEmpty()) {
            return quoteIdentifier(table);
        }
        return quoteIdentifier(schema) + "." + quoteIdentifier(table);
    }
}
