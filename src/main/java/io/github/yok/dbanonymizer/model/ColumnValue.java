package io.github.yok.dbanonymizer.model;

import java.math.BigDecimal;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Tagged value of one fetched column.
 *
 * <p>
 * The raw JDBC object is kept so that primary-key values can be bound back unchanged; the textual
 * form is what the skip policy and the random generator look at.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ColumnValue {

    /**
     * Kind of a fetched value.
     */
    public enum Kind {
        NULL, TEXT, NUMBER, OTHER
    }

    private static final ColumnValue NULL_VALUE = new ColumnValue(Kind.NULL, null);

    private final Kind kind;
    private final Object raw;

    /**
     * Wraps a value read from a result set.
     *
     * @param raw JDBC value (may be {@code null})
     * @return tagged value
     */
    public static ColumnValue of(Object raw) {
        if (raw == null) {
            return NULL_VALUE;
        }
        if (raw instanceof CharSequence || raw instanceof Character) {
            return new ColumnValue(Kind.TEXT, raw.toString());
        }
        if (raw instanceof Number) {
            return new ColumnValue(Kind.NUMBER, raw);
        }
        return new ColumnValue(Kind.OTHER, raw);
    }

    /**
     * Returns the null value.
     *
     * @return tagged {@code NULL}
     */
    public static ColumnValue ofNull() {
        return NULL_VALUE;
    }

    /**
     * Returns whether the value is SQL {@code NULL}.
     *
     * @return true for {@link Kind#NULL}
     */
    public boolean isNull() {
        return kind == Kind.NULL;
    }

    /**
     * Textual rendering of the value; {@code NULL} renders as the empty string.
     *
     * @return text form, never {@code null}
     */
    public String asText() {
        if (raw == null) {
            return "";
        }
        if (raw instanceof BigDecimal) {
            return ((BigDecimal) raw).toPlainString();
        }
        return raw.toString();
    }
}
