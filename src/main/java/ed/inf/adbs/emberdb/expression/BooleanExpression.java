package ed.inf.adbs.emberdb.expression;

import ed.inf.adbs.emberdb.catalog.DataType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * AND / OR over two BOOLEAN operands, with SQL three-valued logic.
 */
public final class BooleanExpression extends ScalarExpression {

    private final ExpressionKind kind;
    private final ScalarExpression left;
    private final ScalarExpression right;

    private BooleanExpression(ExpressionKind kind, ScalarExpression left, ScalarExpression right) {
        this.kind = kind;
        this.left = left;
        this.right = right;
    }

    public static BooleanExpression and(ScalarExpression left, ScalarExpression right) {
        return new BooleanExpression(ExpressionKind.AND, left, right);
    }

    public static BooleanExpression or(ScalarExpression left, ScalarExpression right) {
        return new BooleanExpression(ExpressionKind.OR, left, right);
    }

    /**
     * Combines predicates into a left-deep AND chain.
     * @param conjuncts The predicates, may be empty.
     * @return The conjunction, or null if the list is empty.
     */
    public static ScalarExpression conjunction(List<ScalarExpression> conjuncts) {
        if (conjuncts == null || conjuncts.isEmpty()) {
            return null;
        }
        ScalarExpression result = conjuncts.get(0);
        for (int i = 1; i < conjuncts.size(); i++) {
            result = and(result, conjuncts.get(i));
        }
        return result;
    }

    /**
     * Flattens nested ANDs into their conjuncts.
     * @param predicate A predicate, may be null.
     * @return The conjuncts in left-to-right order, empty for null.
     */
    public static List<ScalarExpression> conjuncts(ScalarExpression predicate) {
        List<ScalarExpression> result = new ArrayList<>();
        collectConjuncts(predicate, result);
        return result;
    }

    private static void collectConjuncts(ScalarExpression predicate, List<ScalarExpression> result) {
        if (predicate == null) {
            return;
        }
        if (predicate.getKind() == ExpressionKind.AND) {
            BooleanExpression and = (BooleanExpression) predicate;
            collectConjuncts(and.left, result);
            collectConjuncts(and.right, result);
        } else {
            result.add(predicate);
        }
    }

    public ScalarExpression getLeft() {
        return left;
    }

    public ScalarExpression getRight() {
        return right;
    }

    @Override
    public ExpressionKind getKind() {
        return kind;
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
        return "(" + left.digest() + " " + kind.name() + " " + right.digest() + ")";
    }

    @Override
    public String toString() {
        return "(" + left + " " + kind.name() + " " + right + ")";
    }
}
