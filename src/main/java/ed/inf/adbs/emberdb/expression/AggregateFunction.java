package ed.inf.adbs.emberdb.expression;

import ed.inf.adbs.emberdb.catalog.DataType;
import ed.inf.adbs.emberdb.exception.TypeMismatchException;

import java.util.Locale;

/**
 * The supported aggregate functions and their typing rules.
 */
public enum AggregateFunction {

    COUNT,
    SUM,
    AVG,
    MIN,
    MAX;

    /**
     * Looks up an aggregate function by its SQL name.
     * @param name The function name, case-insensitive.
     * @return The function, or null if the name is not an aggregate.
     */
    public static AggregateFunction fromName(String name) {
        if (name == null) {
            return null;
        }
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Derives the result type of the function applied to an argument.
     * @param argumentType The argument type, null for COUNT(*).
     * @return The result type.
     * @throws TypeMismatchException If the argument type is not accepted by the function.
     */
    public DataType resultType(DataType argumentType) {
        switch (this) {
            case COUNT:
                return DataType.INTEGER;
            case SUM:
                requireNumeric(argumentType);
                return argumentType;
            case AVG:
                requireNumeric(argumentType);
                return DataType.DOUBLE;
            case MIN:
            case MAX:
                if (argumentType == null || !argumentType.isOrderable()) {
                    throw new TypeMismatchException(name() + " requires an orderable argument, got " + argumentType);
                }
                return argumentType;
            default:
                throw new AssertionError(this);
        }
    }

    private void requireNumeric(DataType argumentType) {
        if (argumentType == null || !argumentType.isNumeric()) {
            throw new TypeMismatchException(name() + " requires a numeric argument, got " + argumentType);
        }
    }
}
