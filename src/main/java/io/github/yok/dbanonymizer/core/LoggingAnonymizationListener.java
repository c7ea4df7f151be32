package io.github.yok.dbanonymizer.core;

import io.github.yok.dbanonymizer.model.AnonymizationSummary;
import io.github.yok.dbanonymizer.model.SkipReason;
import io.github.yok.dbanonymizer.model.TableResult;
import io.github.yok.dbanonymizer.model.TableStatus;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link AnonymizationListener} that writes progress to the application log.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class LoggingAnonymizationListener implements AnonymizationListener {

    private final String dbId;

    /**
     * Creates a listener prefixing every line with the connection id.
     *
     * @param dbId connection id
     */
    public LoggingAnonymizationListener(String dbId) {
        this.dbId = dbId;
    }

    @Override
    public void onRunStart() {
        log.info("[{}] === Anonymization started ===", dbId);
    }

    @Override
    public void onRunEnd(AnonymizationSummary summary) {
        for (TableResult r : summary.getResults()) {
            log.info("[{}]   {} : {} (pages={}, rows={})", dbId, r.getTableName(), r.getStatus(),
                    r.getPages(), r.getRowsModified());
        }
        log.info("[{}] === Anonymization completed: done={}, skipped={}, failed={}, rows={} ===",
                dbId, summary.count(TableStatus.DONE), summary.count(TableStatus.SKIPPED),
                summary.count(TableStatus.FAILED), summary.getTotalRowsModified());
    }

    @Override
    public void onTableStart(String tableName) {
        log.info("[{}] Table[{}] started", dbId, tableName);
    }

    @Override
    public void onTableEnd(TableResult result) {
        log.info("[{}] Table[{}] finished: {}", dbId, result.getTableName(), result.getStatus());
    }

    @Override
    public void onPageModified(String tableName, int pageIndex, int rowsModified) {
        log.info("[{}] Table[{}] page={} modified-rows={}", dbId, tableName, pageIndex,
                rowsModified);
    }

    @Override
    public void onTableSkipped(String tableName, SkipReason reason) {
        log.warn("[{}] Skipped table {}: {}", dbId, tableName, reason.getDescription());
    }

    @Override
    public void onTableFailed(String tableName, Exception cause) {
        log.error("[{}] Table[{}] failed: {}", dbId, tableName, cause.getMessage(), cause);
    }
}
