package ed.inf.adbs.emberdb.expression;

import ed.inf.adbs.emberdb.catalog.DataType;

import java.util.Arrays;
import java.util.List;

/**
 * Arithmetic over numeric operands. The result is INTEGER when both operands are
 * INTEGER (integer division truncates), DOUBLE otherwise.
 */
public final class ArithmeticExpression extends ScalarExpression {

    private final ArithmeticOperator operator;
    private final ScalarExpression left;
    private final ScalarExpression right;

    public ArithmeticExpression(ArithmeticOperator operator, ScalarExpression left, ScalarExpression right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public ArithmeticOperator getOperator() {
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
        return ExpressionKind.ARITHMETIC;
    }

    @Override
    public DataType getType() {
        return left.getType() == DataType.INTEGER && right.getType() == DataType.INTEGER
                ? DataType.INTEGER : DataType.DOUBLE;
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
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
