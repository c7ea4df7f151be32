package io.github.yok.dbanonymizer.core;

import io.github.yok.dbanonymizer.model.AnonymizationSummary;
import io.github.yok.dbanonymizer.model.SkipReason;
import io.github.yok.dbanonymizer.model.TableResult;

/**
 * Receives lifecycle notifications of an anonymization run. Return values are not used by the
 * engine; implementations must not throw.
 *
 * @author Yasuharu.Okawauchi
 */
public interface AnonymizationListener {

    void onRunStart();

    void onRunEnd(AnonymizationSummary summary);

    void onTableStart(String tableName);

    void onTableEnd(TableResult result);

    /**
     * Called after each executed page.
     *
     * @param tableName table name
     * @param pageIndex zero-based page index
     * @param rowsModified rows reported as modified by the page's batch
     */
    void onPageModified(String tableName, int pageIndex, int rowsModified);

    void onTableSkipped(String tableName, SkipReason reason);

    void onTableFailed(String tableName, Exception cause);
}
