package io.github.yok.dbanonymizer.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Value;

/**
 * A table configuration whose identifiers have been matched against the database.
 *
 * <p>
 * All names are physical names reported by JDBC metadata, so they can be quoted safely. Only
 * instances of this class reach SQL generation.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ResolvedTable {

    // Schema used to qualify the table; null means the connection default
    String schema;
    String tableName;
    List<String> anonymizeColumns;
    List<String> nullColumns;
    List<String> primaryKeyColumns;

    /**
     * Returns the columns to select: anonymize, null and primary-key columns, deduplicated in order
     * of first appearance.
     *
     * @return select list
     */
    public List<String> getSelectColumns() {
        Set<String> columns = new LinkedHashSet<>();
        columns.addAll(anonymizeColumns);
        columns.addAll(nullColumns);
        columns.addAll(primaryKeyColumns);
        return new ArrayList<>(columns);
    }

    /**
     * Returns the pagination order: the first primary-key column, then the remaining key columns
     * as tie-breakers so that the order is total.
     *
     * @return order columns
     */
    public List<String> getOrderColumns() {
        return new ArrayList<>(primaryKeyColumns);
    }
}
