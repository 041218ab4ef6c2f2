package ed.inf.adbs.emberdb.expression;

import ed.inf.adbs.emberdb.catalog.DataType;

import java.util.Objects;

/**
 * One aggregate in a GroupAggregate node, e.g. {@code SUM(DISTINCT Enrolled.H)}.
 * The argument is bound against the aggregate's input schema and is null for COUNT(*).
 */
public final class AggregateCall {

    private final AggregateFunction function;
    private final ScalarExpression argument;
    private final boolean distinct;
    private final DataType type;

    public AggregateCall(AggregateFunction function, ScalarExpression argument, boolean distinct) {
        if (argument == null && (function != AggregateFunction.COUNT || distinct)) {
            throw new IllegalArgumentException(function + " requires an argument");
        }
        this.function = function;
        this.argument = argument;
        this.distinct = distinct;
        this.type = function.resultType(argument == null ? null : argument.getType());
    }

    public static AggregateCall countStar() {
        return new AggregateCall(AggregateFunction.COUNT, null, false);
    }

    public AggregateFunction getFunction() {
        return function;
    }

    public ScalarExpression getArgument() {
        return argument;
    }

    public boolean isDistinct() {
        return distinct;
    }

    public DataType getType() {
        return type;
    }

    public String digest() {
        return function.name() + "(" + (distinct ? "DISTINCT " : "")
                + (argument == null ? "*" : argument.digest()) + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateCall)) return false;
        AggregateCall that = (AggregateCall) o;
        return distinct == that.distinct && function == that.function && Objects.equals(argument, that.argument);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, argument, distinct);
    }

    /**
     * Also used as the output column name of the aggregate.
     */
    @Override
    public String toString() {
        return function.name() + "(" + (distinct ? "DISTINCT " : "")
                + (argument == null ? "*" : argument.toString()) + ")";
    }
}
