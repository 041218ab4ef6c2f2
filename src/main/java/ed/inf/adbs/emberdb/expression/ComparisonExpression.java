package ed.inf.adbs.emberdb.expression;

import ed.inf.adbs.emberdb.catalog.DataType;

import java.util.Arrays;
import java.util.List;

/**
 * A binary comparison producing a BOOLEAN, or NULL when either operand is NULL.
 */
public final class ComparisonExpression extends ScalarExpression {

    private final ComparisonOperator operator;
    private final ScalarExpression left;
    private final ScalarExpression right;

    public ComparisonExpression(ComparisonOperator operator, ScalarExpression left, ScalarExpression right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public ScalarExpression getLeft() {
        return left;
    }

    public ScalarExpression getRight() {
        return right;
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.COMPARISON;
    }

    @Override
    public DataType getType() {
        return DataType.BOOLEAN;
    }

    @Override
    public List<ScalarExpression> getChildren() {
        return Arrays.asList(left, right);
    }

    @Override
    public String digest() {
        return "(" + left.digest() + " " + operator.getSymbol() + " " + right.digest() + ")";
    }

    @Override
    public String toString() {
        return left + " " + operator.getSymbol() + " " + right;
    }
}
