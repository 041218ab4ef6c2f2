package ed.inf.adbs.emberdb.expression;

import ed.inf.adbs.emberdb.catalog.DataType;

import java.util.Collections;
import java.util.List;

/**
 * Logical negation; NOT NULL is NULL.
 */
public final class NotExpression extends ScalarExpression {

    private final ScalarExpression operand;

    public NotExpression(ScalarExpression operand) {
        this.operand = operand;
    }

    public ScalarExpression getOperand() {
        return operand;
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.NOT;
    }

    @Override
    public DataType getType() {
        return DataType.BOOLEAN;
    }

    @Override
    public List<ScalarExpression> getChildren() {
        return Collections.singletonList(operand);
    }

    @Override
    public String digest() {
        return "NOT " + operand.digest();
    }

    @Override
    public String toString() {
        return "NOT " + operand;
    }
}
