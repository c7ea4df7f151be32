package io.github.yok.dbanonymizer.core;

import io.github.yok.dbanonymizer.db.DbDialectHandler;
import io.github.yok.dbanonymizer.model.ColumnValue;
import io.github.yok.dbanonymizer.model.ResolvedTable;
import io.github.yok.dbanonymizer.model.Row;
import io.github.yok.dbanonymizer.model.UpdateCommand;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;

/**
 * Builds the UPDATE that anonymizes one fetched row.
 *
 * <p>
 * Anonymize columns get a random value with as many characters as the current value; null columns
 * are set to {@code NULL}. Values rejected by the {@link SkipPolicy} produce no assignment, and a
 * row without any assignment produces no statement. The WHERE clause compares every primary-key
 * column, so the statement touches exactly the fetched row.
 * </p>
 *
 * <p>
 * Generated values and key values are bind parameters; only physical identifiers, quoted by the
 * dialect, appear in the SQL text.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@RequiredArgsConstructor
public class UpdateStatementBuilder {

    private final DbDialectHandler dialectHandler;
    private final SkipPolicy skipPolicy;
    private final RandomValueGenerator generator;

    /**
     * Builds the command for one row.
     *
     * @param row fetched row containing all select columns of {@code table}
     * @param table resolved table
     * @return the command, or empty when every column was skipped
     */
    public Optional<UpdateCommand> build(Row row, ResolvedTable table) {
        List<String> assignments = new ArrayList<>();
        List<Object> parameters = new ArrayList<>();

        for (String column : table.getAnonymizeColumns()) {
            String current = row.get(column).asText();
            if (skipPolicy.shouldSkip(current, column)) {
                continue;
            }
            assignments.add(dialectHandler.quoteIdentifier(column) + " = ?");
            parameters.add(generator.generate(current.codePointCount(0, current.length())));
        }

        for (String column : table.getNullColumns()) {
            String current = row.get(column).asText();
            if (skipPolicy.shouldSkip(current, column)) {
                continue;
            }
            assignments.add(dialectHandler.quoteIdentifier(column) + " = NULL");
        }

        if (assignments.isEmpty()) {
            return Optional.empty();
        }

        List<String> predicates = new ArrayList<>();
        for (String pk : table.getPrimaryKeyColumns()) {
            ColumnValue key = row.get(pk);
            if (key.isNull()) {
                predicates.add(dialectHandler.quoteIdentifier(pk) + " IS NULL");
            } else {
                predicates.add(dialectHandler.quoteIdentifier(pk) + " = ?");
                parameters.add(key.getRaw());
            }
        }

        String sql = "UPDATE " + dialectHandler.qualifyTable(table.getSchema(), table.getTableName())
                + " SET " + String.join(", ", assignments) + " WHERE "
                + String.join(" AND ", predicates);
        return Optional.of(new UpdateCommand(sql, parameters));
    }
}
