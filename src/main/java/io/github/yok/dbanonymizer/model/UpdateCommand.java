package io.github.yok.dbanonymizer.model;

import java.util.Collections;
import java.util.List;
import lombok.Value;

/**
 * Parameterized UPDATE statement targeting exactly one row.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class UpdateCommand {

    // SQL text with ? placeholders
    String sql;

    // Bind values in placeholder order
    List<Object> parameters;

    /**
     * Creates a command.
     *
     * @param sql SQL text with {@code ?} placeholders
     * @param parameters bind values in placeholder order
     */
    public UpdateCommand(String sql, List<Object> parameters) {
        this.sql = sql;
        this.parameters = Collections.unmodifiableList(parameters);
    }
}
