package io.github.yok.dbanonymizer.core;

import com.google.common.base.Preconditions;
import io.github.yok.dbanonymizer.db.DbDialectHandler;
import io.github.yok.dbanonymizer.model.ColumnValue;
import io.github.yok.dbanonymizer.model.ResolvedTable;
import io.github.yok.dbanonymizer.model.Row;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads a table page by page, ordered by its first primary-key column.
 *
 * <p>
 * The remaining primary-key columns follow as ascending tie-breakers, so the order is total and
 * every row lands on exactly one page. Only the requested columns are selected. A page past the last row comes back empty, which is
 * the end-of-table signal; no separate row count is taken.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class RowPager {

    private final DbDialectHandler dialectHandler;

    /**
     * Fetches one page of a resolved table.
     *
     * @param connection JDBC connection
     * @param table resolved table
     * @param pageIndex zero-based page index
     * @param pageSize rows per page
     * @return rows of the page (empty when past the end)
     * @throws SQLException if the query fails
     */
    public List<Row> fetchPage(Connection connection, ResolvedTable table, int pageIndex,
            int pageSize) throws SQLException {
        return fetchPage(connection, table.getSchema(), table.getTableName(),
                table.getSelectColumns(), table.getOrderColumns(), pageIndex, pageSize);
    }

    /**
     * Fetches one page.
     *
     * @param connection JDBC connection
     * @param schema schema name (may be {@code null})
     * @param table physical table name
     * @param columns physical columns to select
     * @param orderColumns physical columns to order by (ascending), main key first
     * @param pageIndex zero-based page index
     * @param pageSize rows per page
     * @return rows of the page (empty when past the end)
     * @throws SQLException if the query fails
     */
    public List<Row> fetchPage(Connection connection, String schema, String table,
            List<String> columns, List<String> orderColumns, int pageIndex, int pageSize)
            throws SQLException {
        String sql = buildSelectSql(schema, table, columns, orderColumns, pageIndex, pageSize);
        log.debug("Table[{}] page={} SQL: {}", table, pageIndex, sql);

        List<Row> rows = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setFetchSize(pageSize);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(readRow(rs, columns));
                }
            }
        }
        return rows;
    }

    /**
     * Builds the paginated SELECT for a page.
     *
     * @param schema schema name (may be {@code null})
     * @param table physical table name
     * @param columns physical columns to select
     * @param orderColumns order columns, main key first
     * @param pageIndex zero-based page index
     * @param pageSize rows per page
     * @return SQL text
     */
    String buildSelectSql(String schema, String table, List<String> columns,
            List<String> orderColumns, int pageIndex, int pageSize) {
        Preconditions.checkArgument(!orderColumns.isEmpty(), "no order column for %s", table);
        String select = columns.stream().map(dialectHandler::quoteIdentifier)
                .collect(Collectors.joining(", "));
        String base = "SELECT " + select + " FROM " + dialectHandler.qualifyTable(schema, table)
                + " ORDER BY " + orderColumns.stream()
                        .map(c -> dialectHandler.quoteIdentifier(c) + " ASC")
                        .collect(Collectors.joining(", "));
        int offset = Math.multiplyExact(pageIndex, pageSize);
        return dialectHandler.applyPagination(base, offset, pageSize);
    }

    private Row readRow(ResultSet rs, List<String> columns) throws SQLException {
        Map<String, ColumnValue> values = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            Object value = rs.getObject(i + 1);
            if (value instanceof Clob) {
                value = rs.getString(i + 1);
            }
            values.put(columns.get(i), ColumnValue.of(value));
        }
        return new Row(values);
    }
}
