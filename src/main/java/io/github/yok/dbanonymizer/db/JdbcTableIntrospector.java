package io.github.yok.dbanonymizer.db;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link TableIntrospector} backed by {@link DatabaseMetaData}.
 *
 * <p>
 * Tables are listed with the {@code %} pattern and compared in Java so that configured names
 * containing {@code _} are not treated as wildcards and case differences between the
 * configuration and the catalog do not matter. An exact match wins over a case-insensitive one.
 * Only user tables count: {@code TABLE}, {@code BASE TABLE} (H2 2.x) or {@code PARTITIONED TABLE}
 * (PostgreSQL); views and system tables are ignored.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JdbcTableIntrospector implements TableIntrospector {

    @Override
    public Optional<String> resolveTableName(Connection connection, String schema, String table)
            throws SQLException {
        if (table == null || table.isBlank()) {
            return Optional.empty();
        }
        DatabaseMetaData meta = connection.getMetaData();
        String candidate = null;
        try (ResultSet rs = meta.getTables(connection.getCatalog(), schema, "%", null)) {
            while (rs.next()) {
                if (!isUserTable(rs.getString("TABLE_TYPE"))) {
                    continue;
                }
                String name = rs.getString("TABLE_NAME");
                if (table.equals(name)) {
                    return Optional.of(name);
                }
                if (candidate == null && table.equalsIgnoreCase(name)) {
                    candidate = name;
                }
            }
        }
        log.debug("Table[{}] resolved to {}", table, candidate);
        return Optional.ofNullable(candidate);
    }

    @Override
    public List<String> getPrimaryKeyColumns(Connection connection, String schema, String table)
            throws SQLException {
        DatabaseMetaData meta = connection.getMetaData();
        // KEY_SEQ is 1-based; metadata rows are ordered by COLUMN_NAME
        SortedMap<Short, String> bySequence = new TreeMap<>();
        try (ResultSet rs = meta.getPrimaryKeys(connection.getCatalog(), schema, table)) {
            while (rs.next()) {
                bySequence.put(rs.getShort("KEY_SEQ"), rs.getString("COLUMN_NAME"));
            }
        }
        return new ArrayList<>(bySequence.values());
    }

    @Override
    public List<String> getColumnNames(Connection connection, String schema, String table)
            throws SQLException {
        DatabaseMetaData meta = connection.getMetaData();
        List<String> columns = new ArrayList<>();
        // the table argument is a pattern here; '_' may match other tables
        try (ResultSet rs = meta.getColumns(connection.getCatalog(), schema, table, "%")) {
            while (rs.next()) {
                if (table.equals(rs.getString("TABLE_NAME"))) {
                    columns.add(rs.getString("COLUMN_NAME"));
                }
            }
        }
        return columns;
    }

    private static boolean isUserTable(String tableType) {
        if (tableType == null) {
            return false;
        }
        String type = tableType.toUpperCase(Locale.ROOT);
        return type.endsWith("TABLE") && !type.startsWith("SYSTEM")
                && !type.contains("TEMPORARY");
    }
}
