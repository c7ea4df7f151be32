package io.github.yok.dbanonymizer.db.postgresql;

import io.github.yok.dbanonymizer.config.ConnectionConfig;
import io.github.yok.dbanonymizer.db.AbstractDbDialectHandler;

/**
 * PostgreSQL dialect handler.
 *
 * @author Yasuharu.Okawauchi
 */
public class PostgresqlDialectHandler extends AbstractDbDialectHandler {

    /**
     * Tables live in {@code public}.
     *
     * @param entry connection config entry
     * @return {@code public}
     */
    @Override
    public String resolveSchema(ConnectionConfig.Entry entry) {
        return "public";
    }

    /**
     * Applies {@code LIMIT ... OFFSET ...} pagination.
     *
     * @param baseSql base SQL
     * @param offset offset rows
     * @param limit fetch rows
     * @return paginated SQL
     */
    @Override
    public String applyPagination(String baseSql, int offset, int limit) {
        return baseSql + " LIMIT " + limit + " OFFSET " + offset;
    }
}
