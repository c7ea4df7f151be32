package io.github.yok.dbanonymizer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.ToString;

/**
 * Ordered table results of one run.
 *
 * @author Yasuharu.Okawauchi
 */
@ToString
public class AnonymizationSummary {

    private final List<TableResult> results = new ArrayList<>();

    /**
     * Appends the result of a table pass.
     *
     * @param result table result
     */
    public void add(TableResult result) {
        results.add(result);
    }

    /**
     * Returns the table results in processing order.
     *
     * @return unmodifiable list
     */
    public List<TableResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    /**
     * Total number of rows modified across all tables.
     *
     * @return row count
     */
    public long getTotalRowsModified() {
        return results.stream().mapToLong(TableResult::getRowsModified).sum();
    }

    /**
     * Number of tables with the given status.
     *
     * @param status status to count
     * @return table count
     */
    public long count(TableStatus status) {
        return results.stream().filter(r -> r.getStatus() == status).count();
    }

    /**
     * Returns whether any table pass failed.
     *
     * @return true when at least one table is {@link TableStatus#FAILED}
     */
    public boolean hasFailures() {
        return count(TableStatus.FAILED) > 0;
    }
}
