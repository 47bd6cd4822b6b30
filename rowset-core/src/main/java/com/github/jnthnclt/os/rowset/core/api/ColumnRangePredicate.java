package com.github.jnthnclt.os.rowset.core.api;

import com.google.common.base.Preconditions;

/**
 * A range over one column's values. Either bound may be absent and each present bound is inclusive or exclusive.
 *
 * @author jonathan.colt
 */
public class ColumnRangePredicate {

    public final String column;
    public final Object lower;
    public final boolean lowerInclusive;
    public final Object upper;
    public final boolean upperInclusive;

    private ColumnRangePredicate(String column, Object lower, boolean lowerInclusive, Object upper, boolean upperInclusive) {
        Preconditions.checkNotNull(column, "Predicate requires a column");
        Preconditions.checkArgument(lower != null || upper != null, "Predicate on %s requires at least one bound", column);
        this.column = column;
        this.lower = lower;
        this.lowerInclusive = lowerInclusive;
        this.upper = upper;
        this.upperInclusive = upperInclusive;
    }

    public static ColumnRangePredicate equality(String column, Object value) {
        Preconditions.checkNotNull(value);
        return new ColumnRangePredicate(column, value, true, value, true);
    }

    /**
     * Inclusive on both ends. Either bound may be null.
     */
    public static ColumnRangePredicate range(String column, Object lower, Object upper) {
        return new ColumnRangePredicate(column, lower, true, upper, true);
    }

    public static ColumnRangePredicate range(String column, Object lower, boolean lowerInclusive, Object upper, boolean upperInclusive) {
        return new ColumnRangePredicate(column, lower, lowerInclusive, upper, upperInclusive);
    }

    public static ColumnRangePredicate atLeast(String column, Object lower) {
        return new ColumnRangePredicate(column, Preconditions.checkNotNull(lower), true, null, true);
    }

    public static ColumnRangePredicate greaterThan(String column, Object lower) {
        return new ColumnRangePredicate(column, Preconditions.checkNotNull(lower), false, null, true);
    }

    public static ColumnRangePredicate atMost(String column, Object upper) {
        return new ColumnRangePredicate(column, null, true, Preconditions.checkNotNull(upper), true);
    }

    public static ColumnRangePredicate lessThan(String column, Object upper) {
        return new ColumnRangePredicate(column, null, true, Preconditions.checkNotNull(upper), false);
    }

    public boolean isEquality() {
        return lower != null && upper != null && lowerInclusive && upperInclusive && lower.equals(upper);
    }

    /**
     * Evaluates this predicate against a single value of the given type.
     */
    public boolean matches(ColumnType type, Object value) {
        if (lower != null) {
            int c = type.compare(value, lower);
            if (c < 0 || (c == 0 && !lowerInclusive)) {
                return false;
            }
        }
        if (upper != null) {
            int c = type.compare(value, upper);
            if (c > 0 || (c == 0 && !upperInclusive)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return column + " in "
            + (lower == null ? "(-inf" : (lowerInclusive ? "[" : "(") + lower)
            + ", "
            + (upper == null ? "+inf)" : upper + (upperInclusive ? "]" : ")"));
    }
}
