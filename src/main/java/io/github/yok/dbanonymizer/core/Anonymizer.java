package io.github.yok.dbanonymizer.core;

import com.google.common.base.Preconditions;
import io.github.yok.dbanonymizer.config.AnonymizerConfig;
import io.github.yok.dbanonymizer.db.DbDialectHandler;
import io.github.yok.dbanonymizer.db.JdbcTableIntrospector;
import io.github.yok.dbanonymizer.db.TableIntrospector;
import io.github.yok.dbanonymizer.model.AnonymizationSummary;
import io.github.yok.dbanonymizer.model.ResolvedTable;
import io.github.yok.dbanonymizer.model.Row;
import io.github.yok.dbanonymizer.model.SkipReason;
import io.github.yok.dbanonymizer.model.TableConfiguration;
import io.github.yok.dbanonymizer.model.TableResult;
import io.github.yok.dbanonymizer.model.TablesConfiguration;
import io.github.yok.dbanonymizer.model.UpdateBatch;
import io.github.yok.dbanonymizer.model.UpdateCommand;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Core class that anonymizes the configured tables of one database connection.
 *
 * <p>
 * <strong>Per table:</strong>
 * </p>
 * <ol>
 * <li>Validate the configuration and match it against the database: the table must exist, list at
 * least one column, list no column twice across both lists, name only existing columns and have a
 * primary key. Otherwise the table is skipped and the skip reported.</li>
 * <li>Fetch page 0, 1, 2, ... through {@link RowPager}, ordered by the first primary-key column
 * with the remaining key columns as tie-breakers.</li>
 * <li>Build one UPDATE per row with {@link UpdateStatementBuilder} and execute the page's commands
 * once through {@link UpdateBatchExecutor}.</li>
 * <li>Stop at the first empty page.</li>
 * </ol>
 *
 * <p>
 * Tables are processed sequentially in configuration order. A failing table is reported, recorded
 * as failed and does not prevent the following tables from being processed. Pages committed before
 * a failure stay anonymized.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class Anonymizer {

    private final TableIntrospector introspector;
    private final RowPager pager;
    private final UpdateStatementBuilder statementBuilder;
    private final UpdateBatchExecutor batchExecutor;
    private final AnonymizationListener listener;
    private final int batchSize;

    /**
     * Creates an anonymizer from its collaborators.
     *
     * @param introspector table metadata lookups
     * @param pager page reader
     * @param statementBuilder per-row UPDATE builder
     * @param batchExecutor per-page batch executor
     * @param listener progress listener
     * @param batchSize rows per page
     */
    public Anonymizer(TableIntrospector introspector, RowPager pager,
            UpdateStatementBuilder statementBuilder, UpdateBatchExecutor batchExecutor,
            AnonymizationListener listener, int batchSize) {
        Preconditions.checkArgument(batchSize > 0, "batchSize must be positive: %s", batchSize);
        this.introspector = introspector;
        this.pager = pager;
        this.statementBuilder = statementBuilder;
        this.batchExecutor = batchExecutor;
        this.listener = listener;
        this.batchSize = batchSize;
    }

    /**
     * Creates an anonymizer wired with the JDBC implementations.
     *
     * @param dialectHandler dialect of the target database
     * @param config anonymizer settings (batch size, protected accounts)
     * @param listener progress listener
     * @return anonymizer
     */
    public static Anonymizer create(DbDialectHandler dialectHandler, AnonymizerConfig config,
            AnonymizationListener listener) {
        UpdateStatementBuilder builder = new UpdateStatementBuilder(dialectHandler,
                SkipPolicy.from(config), new RandomValueGenerator());
        return new Anonymizer(new JdbcTableIntrospector(), new RowPager(dialectHandler), builder,
                new UpdateBatchExecutor(), listener, config.getBatchSize());
    }

    /**
     * Anonymizes all configured tables in the connection's current schema.
     *
     * @param connection JDBC connection, used exclusively for the duration of the run
     * @param tablesConfiguration tables to process, in order
     * @return per-table results
     * @throws SQLException if the current schema cannot be read
     */
    public AnonymizationSummary anonymize(Connection connection,
            TablesConfiguration tablesConfiguration) throws SQLException {
        return anonymize(connection, connection.getSchema(), tablesConfiguration);
    }

    /**
     * Anonymizes all configured tables in the given schema.
     *
     * @param connection JDBC connection, used exclusively for the duration of the run
     * @param schema schema holding the tables ({@code null} for catalog-only databases)
     * @param tablesConfiguration tables to process, in order
     * @return per-table results
     */
    public AnonymizationSummary anonymize(Connection connection, String schema,
            TablesConfiguration tablesConfiguration) {
        listener.onRunStart();
        AnonymizationSummary summary = new AnonymizationSummary();
        for (TableConfiguration table : tablesConfiguration.getTables()) {
            summary.add(anonymizeTable(connection, schema, table));
        }
        listener.onRunEnd(summary);
        return summary;
    }

    /**
     * Runs one table through validation and the page loop.
     *
     * @param connection JDBC connection
     * @param schema schema name
     * @param table table settings
     * @return result of the pass
     */
    TableResult anonymizeTable(Connection connection, String schema, TableConfiguration table) {
        String tableName = Objects.toString(table.getTableName(), "");
        listener.onTableStart(tableName);

        TableResult result;
        try {
            Resolution resolution = resolve(connection, schema, table);
            if (resolution.skipReason != null) {
                listener.onTableSkipped(tableName, resolution.skipReason);
                result = TableResult.skipped(tableName, resolution.skipReason);
            } else {
                result = processPages(connection, resolution.table);
            }
        } catch (SQLException | RuntimeException e) {
            listener.onTableFailed(tableName, e);
            result = TableResult.failed(tableName, 0, 0, e);
        }

        listener.onTableEnd(result);
        return result;
    }

    /**
     * Validates the settings of a table and matches its names against the database.
     *
     * <p>
     * Table existence is checked first through catalog metadata only; the table itself is not
     * queried before every check has passed.
     * </p>
     *
     * @param connection JDBC connection
     * @param schema schema name
     * @param table table settings
     * @return resolved table or skip reason
     * @throws SQLException if metadata retrieval fails
     */
    Resolution resolve(Connection connection, String schema, TableConfiguration table)
            throws SQLException {
        if (StringUtils.isBlank(table.getTableName())) {
            return Resolution.skip(SkipReason.MISSING_TABLE);
        }
        Optional<String> physicalName =
                introspector.resolveTableName(connection, schema, table.getTableName().trim());
        if (physicalName.isEmpty()) {
            return Resolution.skip(SkipReason.MISSING_TABLE);
        }
        String tableName = physicalName.get();

        List<String> anonymizeColumns = distinct(table.getAnonymizeColumns());
        List<String> nullColumns = distinct(table.getNullColumns());
        if (anonymizeColumns.isEmpty() && nullColumns.isEmpty()) {
            return Resolution.skip(SkipReason.NO_COLUMNS);
        }
        Set<String> anonymizeKeys = new LinkedHashSet<>();
        anonymizeColumns.forEach(c -> anonymizeKeys.add(key(c)));
        for (String column : nullColumns) {
            if (anonymizeKeys.contains(key(column))) {
                log.warn("Table[{}] column {} is listed as anonymize and null column",
                        tableName, column);
                return Resolution.skip(SkipReason.OVERLAPPING_COLUMNS);
            }
        }

        List<String> physicalColumns = introspector.getColumnNames(connection, schema, tableName);
        List<String> resolvedAnonymize = new ArrayList<>();
        List<String> resolvedNull = new ArrayList<>();
        if (!mapColumns(anonymizeColumns, physicalColumns, resolvedAnonymize, tableName)
                || !mapColumns(nullColumns, physicalColumns, resolvedNull, tableName)) {
            return Resolution.skip(SkipReason.UNKNOWN_COLUMN);
        }

        List<String> primaryKeyColumns =
                introspector.getPrimaryKeyColumns(connection, schema, tableName);
        if (primaryKeyColumns.isEmpty()) {
            return Resolution.skip(SkipReason.NO_PRIMARY_KEY);
        }
        return Resolution.of(new ResolvedTable(schema, tableName, resolvedAnonymize, resolvedNull,
                primaryKeyColumns));
    }

    /**
     * Pages through a resolved table until an empty page is fetched.
     *
     * @param connection JDBC connection
     * @param table resolved table
     * @return DONE result, or FAILED with the progress made before the failure
     */
    private TableResult processPages(Connection connection, ResolvedTable table) {
        String tableName = table.getTableName();
        int pageIndex = 0;
        int pages = 0;
        long rowsModified = 0;
        try {
            List<Row> rows;
            do {
                rows = pager.fetchPage(connection, table, pageIndex, batchSize);
                if (!rows.isEmpty()) {
                    pages++;
                    UpdateBatch batch = buildBatch(rows, table, pageIndex);
                    if (!batch.isEmpty()) {
                        int modified = batchExecutor.execute(connection, batch);
                        rowsModified += modified;
                        listener.onPageModified(tableName, pageIndex, modified);
                    } else {
                        log.debug("Table[{}] page={} nothing to update", tableName, pageIndex);
                    }
                }
                pageIndex++;
            } while (!rows.isEmpty());
            return TableResult.done(tableName, pages, rowsModified);
        } catch (SQLException | RuntimeException e) {
            listener.onTableFailed(tableName, e);
            return TableResult.failed(tableName, pages, rowsModified, e);
        }
    }

    private UpdateBatch buildBatch(List<Row> rows, ResolvedTable table, int pageIndex) {
        List<UpdateCommand> commands = new ArrayList<>();
        for (Row row : rows) {
            statementBuilder.build(row, table).ifPresent(commands::add);
        }
        return new UpdateBatch(table.getTableName(), pageIndex, commands);
    }

    private boolean mapColumns(List<String> configured, List<String> physicalColumns,
            List<String> target, String tableName) {
        for (String column : configured) {
            String physical = matchColumn(column, physicalColumns);
            if (physical == null) {
                log.warn("Table[{}] has no column {}", tableName, column);
                return false;
            }
            target.add(physical);
        }
        return true;
    }

    // exact match first, then the first case-insensitive one
    private static String matchColumn(String column, List<String> physicalColumns) {
        String candidate = null;
        for (String physical : physicalColumns) {
            if (physical.equals(column)) {
                return physical;
            }
            if (candidate == null && physical.equalsIgnoreCase(column)) {
                candidate = physical;
            }
        }
        return candidate;
    }

    private static List<String> distinct(List<String> columns) {
        Map<String, String> unique = new LinkedHashMap<>();
        if (columns == null) {
            return new ArrayList<>();
        }
        for (String column : columns) {
            if (StringUtils.isNotBlank(column)) {
                unique.putIfAbsent(key(column), column.trim());
            }
        }
        return new ArrayList<>(unique.values());
    }

    private static String key(String column) {
        return column.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Either a resolved table or the reason it is skipped.
     */
    static final class Resolution {

        final ResolvedTable table;
        final SkipReason skipReason;

        private Resolution(ResolvedTable table, SkipReason skipReason) {
            this.table = table;
            this.skipReason = skipReason;
        }

        static Resolution of(ResolvedTable table) {
            return new Resolution(table, null);
        }

        static Resolution skip(SkipReason reason) {
            return new Resolution(null, reason);
        }
    }
}
