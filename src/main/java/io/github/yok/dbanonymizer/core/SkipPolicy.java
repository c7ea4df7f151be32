package io.github.yok.dbanonymizer.core;

import io.github.yok.dbanonymizer.config.AnonymizerConfig;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether a column value of a row must be left untouched.
 *
 * <p>
 * A value is skipped when it is {@code null} or empty, or when the column is the protected account
 * column (e.g. {@code UserName}) and the value names a built-in account such as
 * {@code administrator}. Both comparisons ignore case.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class SkipPolicy {

    private final String protectedColumn;
    private final Set<String> protectedValues;

    /**
     * Creates a policy.
     *
     * @param protectedColumn column holding account names (may be {@code null} to disable)
     * @param protectedValues account names never to modify
     */
    public SkipPolicy(String protectedColumn, List<String> protectedValues) {
        this.protectedColumn = protectedColumn;
        this.protectedValues = protectedValues.stream().map(v -> v.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Creates the policy described by the {@code anonymizer} settings.
     *
     * @param config anonymizer settings
     * @return policy
     */
    public static SkipPolicy from(AnonymizerConfig config) {
        return new SkipPolicy(config.getProtectedColumn(), config.getProtectedValues());
    }

    /**
     * Returns whether the given value of the given column must not be modified.
     *
     * @param value current value as text (may be {@code null})
     * @param columnName column name
     * @return true to skip
     */
    public boolean shouldSkip(String value, String columnName) {
        if (value == null || value.isEmpty()) {
            return true;
        }
        return columnName != null && columnName.equalsIgnoreCase(protectedColumn)
                && protectedValues.contains(value.toLowerCase(Locale.ROOT));
    }
}
