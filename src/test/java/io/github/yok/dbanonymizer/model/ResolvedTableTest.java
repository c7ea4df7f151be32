package io.github.yok.dbanonymizer.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResolvedTableTest {

    @Test
    void getSelectColumns_正常ケース_主キーが匿名化列にも含まれる_重複なく順序どおり返ること() {
        ResolvedTable table = new ResolvedTable("dbo", "T", List.of("Code", "Email"),
                List.of("Phone"), List.of("Id", "Code"));

        assertEquals(List.of("Code", "Email", "Phone", "Id"), table.getSelectColumns());
        assertEquals(List.of("Id", "Code"), table.getOrderColumns());
    }

    @Test
    void row_異常ケース_選択していない列を参照する_IllegalArgumentExceptionが送出されること() {
        Map<String, ColumnValue> values = new LinkedHashMap<>();
        values.put("Id", ColumnValue.of(1));
        Row row = new Row(values);
        values.put("Other", ColumnValue.of(2));

        assertEquals(1, row.asMap().size());
        assertThrows(IllegalArgumentException.class, () -> row.get("Other"));
        assertThrows(UnsupportedOperationException.class,
                () -> row.asMap().put("X", ColumnValue.ofNull()));
    }

    @Test
    void summary_正常ケース_各結果を追加する_件数と失敗有無が集計されること() {
        AnonymizationSummary summary = new AnonymizationSummary();
        summary.add(TableResult.done("A", 3, 1203));
        summary.add(TableResult.skipped("B", SkipReason.NO_PRIMARY_KEY));
        assertFalse(summary.hasFailures());
        summary.add(TableResult.failed("C", 1, 500, new IllegalStateException("boom")));

        assertEquals(1703, summary.getTotalRowsModified());
        assertEquals(1, summary.count(TableStatus.DONE));
        assertEquals(1, summary.count(TableStatus.SKIPPED));
        assertTrue(summary.hasFailures());
        assertEquals("boom", summary.getResults().get(2).getFailureMessage());
        assertEquals("no primary key", summary.getResults().get(1).getSkipReason().getDescription());
    }

    @Test
    void updateBatch_正常ケース_コマンドを指定する_件数と空判定が返ること() {
        UpdateBatch empty = new UpdateBatch("T", 0, List.of());
        UpdateBatch batch = new UpdateBatch("T", 1,
                List.of(new UpdateCommand("UPDATE T SET a = NULL WHERE id = ?", List.of(1))));

        assertTrue(empty.isEmpty());
        assertEquals(1, batch.size());
        assertEquals(1, batch.getPageIndex());
    }
}
