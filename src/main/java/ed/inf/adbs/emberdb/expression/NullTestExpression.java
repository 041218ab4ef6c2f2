package ed.inf.adbs.emberdb.expression;

import ed.inf.adbs.emberdb.catalog.DataType;

import java.util.Collections;
import java.util.List;

/**
 * {@code x IS NULL} or {@code x IS NOT NULL}; never evaluates to NULL itself.
 */
public final class NullTestExpression extends ScalarExpression {

    private final ScalarExpression operand;
    private final boolean negated;

    public NullTestExpression(ScalarExpression operand, boolean negated) {
        this.operand = operand;
        this.negated = negated;
    }

    public ScalarExpression getOperand() {
        return operand;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.IS_NULL;
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
        return operand.digest() + (negated ? " IS NOT NULL" : " IS NULL");
    }

    @Override
    public String toString() {
        return operand + (negated ? " IS NOT NULL" : " IS NULL");
    }
}
