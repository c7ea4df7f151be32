package io.github.yok.dbanonymizer.model;

import lombok.Value;

/**
 * Outcome of one table pass.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class TableResult {

    String tableName;
    TableStatus status;
    // Set only for SKIPPED
    SkipReason skipReason;
    // Non-empty pages fetched
    int pages;
    long rowsModified;
    // Set only for FAILED
    String failureMessage;

    /**
     * Result of a completed pass.
     *
     * @param tableName table name
     * @param pages non-empty pages processed
     * @param rowsModified rows reported as modified
     * @return result
     */
    public static TableResult done(String tableName, int pages, long rowsModified) {
        return new TableResult(tableName, TableStatus.DONE, null, pages, rowsModified, null);
    }

    /**
     * Result of a skipped table.
     *
     * @param tableName table name as configured
     * @param reason skip reason
     * @return result
     */
    public static TableResult skipped(String tableName, SkipReason reason) {
        return new TableResult(tableName, TableStatus.SKIPPED, reason, 0, 0, null);
    }

    /**
     * Result of a pass aborted by an execution error.
     *
     * @param tableName table name
     * @param pages pages committed before the failure
     * @param rowsModified rows modified before the failure
     * @param cause failure
     * @return result
     */
    public static TableResult failed(String tableName, int pages, long rowsModified,
            Throwable cause) {
        return new TableResult(tableName, TableStatus.FAILED, null, pages, rowsModified,
                cause.getMessage());
    }
}
