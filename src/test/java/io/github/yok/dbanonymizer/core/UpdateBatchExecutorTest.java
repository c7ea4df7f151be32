package io.github.yok.dbanonymizer.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import io.github.yok.dbanonymizer.model.UpdateBatch;
import io.github.yok.dbanonymizer.model.UpdateCommand;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class UpdateBatchExecutorTest {

    private final UpdateBatchExecutor executor = new UpdateBatchExecutor();

    @Test
    void execute_正常ケース_空バッチを指定する_DBへアクセスせず0が返ること() throws Exception {
        Connection conn = mock(Connection.class);

        int modified = executor.execute(conn, new UpdateBatch("T", 0, List.of()));

        assertEquals(0, modified);
        verifyNoInteractions(conn);
    }

    @Test
    void execute_正常ケース_同一SQLのコマンドを指定する_1回のバッチ実行でコミットされること() throws Exception {
        Connection conn = mock(Connection.class);
        PreparedStatement ps = mock(PreparedStatement.class);
        when(conn.getAutoCommit()).thenReturn(true);
        when(conn.prepareStatement("UPDATE T SET a = ? WHERE pk = ?")).thenReturn(ps);
        when(ps.executeBatch()).thenReturn(new int[] {1, 1, 1});

        UpdateBatch batch = new UpdateBatch("T", 2,
                List.of(new UpdateCommand("UPDATE T SET a = ? WHERE pk = ?", List.of("x", 1)),
                        new UpdateCommand("UPDATE T SET a = ? WHERE pk = ?", List.of("y", 2)),
                        new UpdateCommand("UPDATE T SET a = ? WHERE pk = ?", List.of("z", 3))));

        int modified = executor.execute(conn, batch);

        assertEquals(3, modified);
        verify(conn, times(1)).prepareStatement(anyString());
        verify(ps, times(3)).addBatch();
        verify(ps).setObject(1, "y");
        verify(ps).setObject(2, 3);
        verify(ps, times(1)).executeBatch();
        InOrder order = inOrder(conn);
        order.verify(conn).setAutoCommit(false);
        order.verify(conn).commit();
        order.verify(conn).setAutoCommit(true);
        verify(conn, never()).rollback();
    }

    @Test
    void execute_正常ケース_異なるSQLのコマンドを指定する_SQLごとにバッチ実行されること() throws Exception {
        Connection conn = mock(Connection.class);
        PreparedStatement ps1 = mock(PreparedStatement.class);
        PreparedStatement ps2 = mock(PreparedStatement.class);
        when(conn.getAutoCommit()).thenReturn(true);
        when(conn.prepareStatement("S1")).thenReturn(ps1);
        when(conn.prepareStatement("S2")).thenReturn(ps2);
        when(ps1.executeBatch()).thenReturn(new int[] {1, 1});
        when(ps2.executeBatch()).thenReturn(new int[] {Statement.SUCCESS_NO_INFO});

        UpdateBatch batch = new UpdateBatch("T", 0,
                List.of(new UpdateCommand("S1", List.of(1)), new UpdateCommand("S2", List.of(2)),
                        new UpdateCommand("S1", List.of(3))));

        assertEquals(3, executor.execute(conn, batch));
        verify(ps1, times(2)).addBatch();
        verify(ps2, times(1)).addBatch();
        verify(conn, times(1)).commit();
    }

    @Test
    void execute_異常ケース_バッチ実行が失敗する_ロールバックされ例外が再送出されること() throws Exception {
        Connection conn = mock(Connection.class);
        PreparedStatement ps = mock(PreparedStatement.class);
        when(conn.getAutoCommit()).thenReturn(true);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        SQLException failure = new SQLException("deadlock");
        when(ps.executeBatch()).thenThrow(failure);

        UpdateBatch batch =
                new UpdateBatch("T", 0, List.of(new UpdateCommand("S1", List.of(1))));

        SQLException ex = assertThrows(SQLException.class, () -> executor.execute(conn, batch));
        assertSame(failure, ex);
        verify(conn).rollback();
        verify(conn, never()).commit();
        verify(conn).setAutoCommit(true);
    }

    @Test
    void execute_異常ケース_ロールバックも失敗する_抑制例外として追加されること() throws Exception {
        Connection conn = mock(Connection.class);
        PreparedStatement ps = mock(PreparedStatement.class);
        when(conn.getAutoCommit()).thenReturn(false);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        doThrow(new SQLException("bad value")).when(ps).setObject(anyInt(), any());
        SQLException rollbackFailure = new SQLException("connection lost");
        doThrow(rollbackFailure).when(conn).rollback();

        UpdateBatch batch =
                new UpdateBatch("T", 0, List.of(new UpdateCommand("S1", List.of(1))));

        SQLException ex = assertThrows(SQLException.class, () -> executor.execute(conn, batch));
        assertEquals("bad value", ex.getMessage());
        assertEquals(1, ex.getSuppressed().length);
        assertSame(rollbackFailure, ex.getSuppressed()[0]);
        verify(conn, times(2)).setAutoCommit(false);
    }

    @Test
    void execute_異常ケース_自動コミットの復元も失敗する_バッチの例外が送出され復元の例外が抑制例外になること()
            throws Exception {
        Connection conn = mock(Connection.class);
        PreparedStatement ps = mock(PreparedStatement.class);
        when(conn.getAutoCommit()).thenReturn(true);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        SQLException failure = new SQLException("constraint violation");
        when(ps.executeBatch()).thenThrow(failure);
        SQLException restoreFailure = new SQLException("connection reset");
        doThrow(restoreFailure).when(conn).setAutoCommit(true);

        UpdateBatch batch =
                new UpdateBatch("T", 0, List.of(new UpdateCommand("S1", List.of(1))));

        SQLException ex = assertThrows(SQLException.class, () -> executor.execute(conn, batch));
        assertSame(failure, ex);
        assertEquals(1, ex.getSuppressed().length);
        assertSame(restoreFailure, ex.getSuppressed()[0]);
        verify(conn).rollback();
    }

    @Test
    void execute_異常ケース_コミット後の自動コミット復元が失敗する_復元の例外が送出されること()
            throws Exception {
        Connection conn = mock(Connection.class);
        PreparedStatement ps = mock(PreparedStatement.class);
        when(conn.getAutoCommit()).thenReturn(true);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        when(ps.executeBatch()).thenReturn(new int[] {1});
        SQLException restoreFailure = new SQLException("connection reset");
        doThrow(restoreFailure).when(conn).setAutoCommit(true);

        UpdateBatch batch =
                new UpdateBatch("T", 0, List.of(new UpdateCommand("S1", List.of(1))));

        SQLException ex = assertThrows(SQLException.class, () -> executor.execute(conn, batch));
        assertSame(restoreFailure, ex);
        verify(conn).commit();
    }

    @Test
    void countModified_正常ケース_各種件数を指定する_正の件数とSUCCESS_NO_INFOが加算されること() {
        assertEquals(4, UpdateBatchExecutor.countModified(
                new int[] {1, 0, Statement.SUCCESS_NO_INFO, 2, Statement.EXECUTE_FAILED}));
        assertEquals(0, UpdateBatchExecutor.countModified(new int[0]));
    }
}
