package ed.inf.adbs.emberdb.expression;

import ed.inf.adbs.emberdb.catalog.DataType;

import java.util.List;

/**
 * A scalar expression whose column references have been bound to positions in the
 * input schema of the operator that evaluates it.
 * Expressions are immutable trees. Two expressions are equal when their digests are,
 * the digest being a canonical rendering that names columns by position.
 * @see ExpressionCompiler for turning an expression into a row-evaluable closure.
 */
public abstract class ScalarExpression {

    public abstract ExpressionKind getKind();

    /**
     * @return The type of the values this expression produces.
     */
    public abstract DataType getType();

    public abstract List<ScalarExpression> getChildren();

    /**
     * @return A canonical rendering identifying the expression structurally.
     */
    public abstract String digest();

    /**
     * @return A human-readable rendering using column names.
     */
    @Override
    public abstract String toString();

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return digest().equals(((ScalarExpression) o).digest());
    }

    @Override
    public final int hashCode() {
        return digest().hashCode();
    }
}
