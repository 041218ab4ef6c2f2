package ed.inf.adbs.emberdb.plan;

import ed.inf.adbs.emberdb.expression.ScalarExpression;

import java.util.Objects;

/**
 * One ORDER BY key, bound against the input schema of the sort.
 */
public final class SortKey {

    private final ScalarExpression expression;
    private final boolean ascending;
    private final boolean nullsFirst;

    public SortKey(ScalarExpression expression, boolean ascending, boolean nullsFirst) {
        this.expression = expression;
        this.ascending = ascending;
        this.nullsFirst = nullsFirst;
    }

    /**
     * A key with the default NULL placement: last when ascending, first when descending.
     */
    public static SortKey of(ScalarExpression expression, boolean ascending) {
        return new SortKey(expression, ascending, !ascending);
    }

    public ScalarExpression getExpression() {
        return expression;
    }

    public boolean isAscending() {
        return ascending;
    }

    public boolean isNullsFirst() {
        return nullsFirst;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SortKey)) return false;
        SortKey that = (SortKey) o;
        return ascending == that.ascending && nullsFirst == that.nullsFirst && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, ascending, nullsFirst);
    }

    @Override
    public String toString() {
        return expression + (ascending ? " ASC" : " DESC") + (nullsFirst ? " NULLS FIRST" : " NULLS LAST");
    }
}
