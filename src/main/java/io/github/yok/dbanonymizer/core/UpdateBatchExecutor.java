package io.github.yok.dbanonymizer.core;

import io.github.yok.dbanonymizer.model.UpdateBatch;
import io.github.yok.dbanonymizer.model.UpdateCommand;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Executes the commands of one page as a single JDBC batch in its own transaction.
 *
 * <p>
 * Commands sharing the same SQL text (same set of assigned columns) are sent through one
 * {@link PreparedStatement} batch. The page is committed as a whole or rolled back as a whole;
 * pages committed earlier stay committed. The connection's auto-commit mode is restored afterwards.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class UpdateBatchExecutor {

    /**
     * Executes the batch.
     *
     * @param connection JDBC connection
     * @param batch commands of one page
     * @return number of rows modified
     * @throws SQLException if any statement fails (the page is rolled back)
     */
    public int execute(Connection connection, UpdateBatch batch) throws SQLException {
        if (batch.isEmpty()) {
            return 0;
        }
        Map<String, List<UpdateCommand>> bySql = new LinkedHashMap<>();
        for (UpdateCommand command : batch.getCommands()) {
            bySql.computeIfAbsent(command.getSql(), k -> new ArrayList<>()).add(command);
        }

        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        SQLException failure = null;
        try {
            int modified = 0;
            for (Map.Entry<String, List<UpdateCommand>> e : bySql.entrySet()) {
                log.debug("Table[{}] page={} SQL: {} x{}", batch.getTableName(),
                        batch.getPageIndex(), e.getKey(), e.getValue().size());
                try (PreparedStatement ps = connection.prepareStatement(e.getKey())) {
                    for (UpdateCommand command : e.getValue()) {
                        List<Object> params = command.getParameters();
                        for (int i = 0; i < params.size(); i++) {
                            ps.setObject(i + 1, params.get(i));
                        }
                        ps.addBatch();
                    }
                    modified += countModified(ps.executeBatch());
                }
            }
            connection.commit();
            return modified;
        } catch (SQLException e) {
            failure = e;
            rollbackQuietly(connection, e);
            throw e;
        } finally {
            restoreAutoCommit(connection, autoCommit, failure);
        }
    }

    /**
     * Sums batch update counts. {@link Statement#SUCCESS_NO_INFO} counts as one row.
     *
     * @param counts result of {@code executeBatch}
     * @return modified rows
     */
    static int countModified(int[] counts) {
        int total = 0;
        for (int count : counts) {
            if (count == Statement.SUCCESS_NO_INFO) {
                total++;
            } else if (count > 0) {
                total += count;
            }
        }
        return total;
    }

    // a restore failure must not mask the batch failure being rethrown
    private void restoreAutoCommit(Connection connection, boolean autoCommit,
            SQLException failure) throws SQLException {
        try {
            connection.setAutoCommit(autoCommit);
        } catch (SQLException restoreFailure) {
            if (failure == null) {
                throw restoreFailure;
            }
            failure.addSuppressed(restoreFailure);
        }
    }

    private void rollbackQuietly(Connection connection, SQLException failure) {
        try {
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            failure.addSuppressed(rollbackFailure);
        }
    }
}
