package ed.inf.adbs.emberdb.expression;

import ed.inf.adbs.emberdb.Tuple;
import ed.inf.adbs.emberdb.Values;
import ed.inf.adbs.emberdb.catalog.DataType;

import java.util.function.Predicate;

/**
 * Compiles bound expressions into closures evaluated once per row.
 * Compilation dispatches on {@link ExpressionKind}; NULL propagates through comparisons
 * and arithmetic, and AND / OR follow SQL three-valued logic.
 */
public final class ExpressionCompiler {

    private ExpressionCompiler() {
    }

    /**
     * @param expression A bound expression.
     * @return A closure computing its value for a row.
     */
    public static CompiledExpression compile(ScalarExpression expression) {
        switch (expression.getKind()) {
            case COLUMN: {
                int index = ((ColumnReference) expression).getIndex();
                return row -> row.getAttribute(index);
            }
            case LITERAL: {
                Object value = ((Literal) expression).getValue();
                return row -> value;
            }
            case COMPARISON:
                return compileComparison((ComparisonExpression) expression);
            case AND: {
                BooleanExpression and = (BooleanExpression) expression;
                CompiledExpression left = compile(and.getLeft());
                CompiledExpression right = compile(and.getRight());
                return row -> {
                    Object l = left.evaluate(row);
                    if (Boolean.FALSE.equals(l)) {
                        return Boolean.FALSE;
                    }
                    Object r = right.evaluate(row);
                    if (Boolean.FALSE.equals(r)) {
                        return Boolean.FALSE;
                    }
                    return l == null || r == null ? null : Boolean.TRUE;
                };
            }
            case OR: {
                BooleanExpression or = (BooleanExpression) expression;
                CompiledExpression left = compile(or.getLeft());
                CompiledExpression right = compile(or.getRight());
                return row -> {
                    Object l = left.evaluate(row);
                    if (Boolean.TRUE.equals(l)) {
                        return Boolean.TRUE;
                    }
                    Object r = right.evaluate(row);
                    if (Boolean.TRUE.equals(r)) {
                        return Boolean.TRUE;
                    }
                    return l == null || r == null ? null : Boolean.FALSE;
                };
            }
            case NOT: {
                CompiledExpression operand = compile(((NotExpression) expression).getOperand());
                return row -> {
                    Object value = operand.evaluate(row);
                    return value == null ? null : !((Boolean) value);
                };
            }
            case ARITHMETIC:
                return compileArithmetic((ArithmeticExpression) expression);
            case IS_NULL: {
                NullTestExpression test = (NullTestExpression) expression;
                CompiledExpression operand = compile(test.getOperand());
                boolean negated = test.isNegated();
                return row -> (operand.evaluate(row) == null) != negated;
            }
            default:
                throw new AssertionError(expression.getKind());
        }
    }

    /**
     * Compiles a BOOLEAN expression into a row filter. Only TRUE passes; FALSE and NULL reject.
     * @param predicate A bound BOOLEAN expression.
     * @return The filter.
     */
    public static Predicate<Tuple> compilePredicate(ScalarExpression predicate) {
        if (predicate.getType() != DataType.BOOLEAN) {
            throw new IllegalArgumentException("Predicate must be BOOLEAN: " + predicate);
        }
        CompiledExpression compiled = compile(predicate);
        return row -> Boolean.TRUE.equals(compiled.evaluate(row));
    }

    private static CompiledExpression compileComparison(ComparisonExpression comparison) {
        CompiledExpression left = compile(comparison.getLeft());
        CompiledExpression right = compile(comparison.getRight());
        ComparisonOperator operator = comparison.getOperator();
        if (!comparison.getLeft().getType().isOrderable()) {
            boolean negate = operator == ComparisonOperator.NOT_EQUALS;
            return row -> {
                Object l = left.evaluate(row);
                Object r = right.evaluate(row);
                if (l == null || r == null) {
                    return null;
                }
                return Values.equal(l, r) != negate;
            };
        }
        return row -> {
            Object l = left.evaluate(row);
            Object r = right.evaluate(row);
            if (l == null || r == null) {
                return null;
            }
            return operator.test(Values.compare(l, r));
        };
    }

    private static CompiledExpression compileArithmetic(ArithmeticExpression arithmetic) {
        CompiledExpression left = compile(arithmetic.getLeft());
        CompiledExpression right = compile(arithmetic.getRight());
        ArithmeticOperator operator = arithmetic.getOperator();
        if (arithmetic.getType() == DataType.INTEGER) {
            return row -> {
                Object l = left.evaluate(row);
                Object r = right.evaluate(row);
                if (l == null || r == null) {
                    return null;
                }
                long a = (Long) l;
                long b = (Long) r;
                switch (operator) {
                    case ADD:
                        return Math.addExact(a, b);
                    case SUBTRACT:
                        return Math.subtractExact(a, b);
                    case MULTIPLY:
                        return Math.multiplyExact(a, b);
                    case DIVIDE:
                        if (b == 0) {
                            throw new ArithmeticException("Integer division by zero in " + arithmetic);
                        }
                        if (a == Long.MIN_VALUE && b == -1) {
                            throw new ArithmeticException("Integer overflow in " + arithmetic);
                        }
                        return a / b;
                    default:
                        throw new AssertionError(operator);
                }
            };
        }
        return row -> {
            Object l = left.evaluate(row);
            Object r = right.evaluate(row);
            if (l == null || r == null) {
                return null;
            }
            double a = ((Number) l).doubleValue();
            double b = ((Number) r).doubleValue();
            switch (operator) {
                case ADD:
                    return a + b;
                case SUBTRACT:
                    return a - b;
                case MULTIPLY:
                    return a * b;
                case DIVIDE:
                    return a / b;
                default:
                    throw new AssertionError(operator);
            }
        };
    }
}
