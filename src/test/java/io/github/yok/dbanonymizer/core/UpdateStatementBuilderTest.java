package io.github.yok.dbanonymizer.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.dbanonymizer.config.AnonymizerConfig;
import io.github.yok.dbanonymizer.db.h2.H2DialectHandler;
import io.github.yok.dbanonymizer.db.sqlserver.SqlServerDialectHandler;
import io.github.yok.dbanonymizer.model.ColumnValue;
import io.github.yok.dbanonymizer.model.ResolvedTable;
import io.github.yok.dbanonymizer.model.Row;
import io.github.yok.dbanonymizer.model.UpdateCommand;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class UpdateStatementBuilderTest {

    private final UpdateStatementBuilder builder = new UpdateStatementBuilder(
            new SqlServerDialectHandler(), SkipPolicy.from(new AnonymizerConfig()),
            new RandomValueGenerator());

    private static Row row(Object... keyValues) {
        Map<String, ColumnValue> values = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put((String) keyValues[i], ColumnValue.of(keyValues[i + 1]));
        }
        return new Row(values);
    }

    @Test
    void build_正常ケース_匿名化列とNULL化列を指定する_UPDATE文が生成されること() {
        ResolvedTable table =
                new ResolvedTable("dbo", "T", List.of("a"), List.of("n"), List.of("pk"));

        Optional<UpdateCommand> command = builder.build(row("a", "secret", "n", "x", "pk", 7), table);

        assertTrue(command.isPresent());
        assertEquals("UPDATE [dbo].[T] SET [a] = ?, [n] = NULL WHERE [pk] = ?",
                command.get().getSql());
        List<Object> params = command.get().getParameters();
        assertEquals(2, params.size());
        String replaced = (String) params.get(0);
        assertEquals(6, replaced.length());
        assertTrue(replaced.matches("[a-zA-Z0-9]{6}"));
        assertEquals(7, params.get(1));
    }

    @Test
    void build_正常ケース_全列がスキップ対象である_空が返ること() {
        ResolvedTable table =
                new ResolvedTable("dbo", "T", List.of("a"), List.of("n"), List.of("pk"));

        Optional<UpdateCommand> command = builder.build(row("a", "", "n", null, "pk", 1), table);

        assertTrue(command.isEmpty());
    }

    @Test
    void build_正常ケース_保護アカウントの行である_保護列のみ更新されないこと() {
        ResolvedTable table = new ResolvedTable("dbo", "CMS_User", List.of("UserName", "Email"),
                List.of(), List.of("UserID"));

        Optional<UpdateCommand> command = builder.build(
                row("UserName", "administrator", "Email", "admin@example.com", "UserID", 53),
                table);

        assertTrue(command.isPresent());
        assertEquals("UPDATE [dbo].[CMS_User] SET [Email] = ? WHERE [UserID] = ?",
                command.get().getSql());
        assertEquals(17, ((String) command.get().getParameters().get(0)).length());
    }

    @Test
    void build_正常ケース_数値の列を匿名化する_桁数と同じ長さの値が生成されること() {
        ResolvedTable table =
                new ResolvedTable("dbo", "T", List.of("phone"), List.of(), List.of("id"));

        Optional<UpdateCommand> command =
                builder.build(row("phone", 9012345678L, "id", 1), table);

        assertTrue(command.isPresent());
        assertEquals(10, ((String) command.get().getParameters().get(0)).length());
    }

    @Test
    void build_正常ケース_複合主キーを持つ_全主キー列がWHERE句に含まれること() {
        ResolvedTable table = new ResolvedTable(null, "T", List.of("a"), List.of(),
                List.of("k1", "k2"));
        UpdateStatementBuilder h2Builder = new UpdateStatementBuilder(new H2DialectHandler(),
                SkipPolicy.from(new AnonymizerConfig()), new RandomValueGenerator());

        Optional<UpdateCommand> command =
                h2Builder.build(row("a", "xy", "k1", 1, "k2", "B"), table);

        assertTrue(command.isPresent());
        assertEquals("UPDATE \"T\" SET \"a\" = ? WHERE \"k1\" = ? AND \"k2\" = ?",
                command.get().getSql());
        assertEquals(List.of(1, "B"), command.get().getParameters().subList(1, 3));
    }

    @Test
    void build_正常ケース_主キー値がNULLである_IS_NULLで比較されること() {
        ResolvedTable table = new ResolvedTable("dbo", "T", List.of("a"), List.of(),
                List.of("k1", "k2"));

        Optional<UpdateCommand> command =
                builder.build(row("a", "abc", "k1", 5, "k2", null), table);

        assertTrue(command.isPresent());
        assertEquals("UPDATE [dbo].[T] SET [a] = ? WHERE [k1] = ? AND [k2] IS NULL",
                command.get().getSql());
        assertEquals(2, command.get().getParameters().size());
    }

    @Test
    void build_正常ケース_同じ値を持つ2行を処理する_異なる置換値が生成されること() {
        ResolvedTable table =
                new ResolvedTable("dbo", "T", List.of("a"), List.of(), List.of("pk"));

        String first = (String) builder.build(row("a", "same-value-here", "pk", 1), table)
                .get().getParameters().get(0);
        String second = (String) builder.build(row("a", "same-value-here", "pk", 2), table)
                .get().getParameters().get(0);

        assertNotEquals(first, second);
    }

    @Test
    void build_正常ケース_サロゲートペアを含む値である_コードポイント数の長さになること() {
        ResolvedTable table =
                new ResolvedTable("dbo", "T", List.of("a"), List.of(), List.of("pk"));
        String value = "𠮷野家";

        Optional<UpdateCommand> command = builder.build(row("a", value, "pk", 1), table);

        assertEquals(3, ((String) command.get().getParameters().get(0)).length());
    }
}
