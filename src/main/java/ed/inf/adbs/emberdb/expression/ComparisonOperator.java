package ed.inf.adbs.emberdb.expression;

/**
 * The six SQL comparison operators.
 */
public enum ComparisonOperator {

    EQUALS("="),
    NOT_EQUALS("<>"),
    GREATER_THAN(">"),
    GREATER_THAN_EQUALS(">="),
    LESS_THAN("<"),
    LESS_THAN_EQUALS("<=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * @return true for = and &lt;&gt;, the only comparisons defined on unordered types.
     */
    public boolean isEquality() {
        return this == EQUALS || this == NOT_EQUALS;
    }

    /**
     * Interprets the result of a three-way comparison.
     * @param comparison Negative, zero or positive as in {@link java.util.Comparator}.
     * @return Whether the operator holds.
     */
    public boolean test(int comparison) {
        switch (this) {
            case EQUALS:
                return comparison == 0;
            case NOT_EQUALS:
                return comparison != 0;
            case GREATER_THAN:
                return comparison > 0;
            case GREATER_THAN_EQUALS:
                return comparison >= 0;
            case LESS_THAN:
                return comparison < 0;
            case LESS_THAN_EQUALS:
                return comparison <= 0;
            default:
                throw new AssertionError(this);
        }
    }
}
