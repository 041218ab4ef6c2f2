package ed.inf.adbs.emberdb.plan;

import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.relational.ParenthesedExpressionList;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a parsed predicate into its top-level conjuncts so each one can be placed
 * as low in the plan as the tables it references allow.
 */
public final class ConditionSplitter {

    private ConditionSplitter() {
    }

    /**
     * @param predicate A WHERE clause, may be null.
     * @return Its conjuncts in source order; parentheses around AND chains are looked through.
     */
    public static List<Expression> split(Expression predicate) {
        List<Expression> conjuncts = new ArrayList<>();
        collect(predicate, conjuncts);
        return conjuncts;
    }

    private static void collect(Expression expression, List<Expression> conjuncts) {
        if (expression == null) {
            return;
        }
        if (expression instanceof AndExpression) {
            AndExpression and = (AndExpression) expression;
            collect(and.getLeftExpression(), conjuncts);
            collect(and.getRightExpression(), conjuncts);
        } else if (expression instanceof ParenthesedExpressionList
                && ((ParenthesedExpressionList<?>) expression).size() == 1
                && ((ParenthesedExpressionList<?>) expression).get(0) instanceof AndExpression) {
            collect(((ParenthesedExpressionList<?>) expression).get(0), conjuncts);
        } else {
            conjuncts.add(expression);
        }
    }
}
