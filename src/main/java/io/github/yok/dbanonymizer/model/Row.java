package io.github.yok.dbanonymizer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Read-only projection of the selected columns of one record, valid for a single page.
 *
 * @author Yasuharu.Okawauchi
 */
@ToString
@EqualsAndHashCode
public final class Row {

    private final Map<String, ColumnValue> values;

    /**
     * Creates a row from column values in select order.
     *
     * @param values column name to value
     */
    public Row(Map<String, ColumnValue> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Returns the value of a selected column.
     *
     * @param column physical column name
     * @return value
     * @throws IllegalArgumentException if the column was not selected
     */
    public ColumnValue get(String column) {
        ColumnValue value = values.get(column);
        if (value == null) {
            throw new IllegalArgumentException("Column not selected: " + column);
        }
        return value;
    }

    /**
     * Returns all values in select order.
     *
     * @return unmodifiable map
     */
    public Map<String, ColumnValue> asMap() {
        return values;
    }
}
