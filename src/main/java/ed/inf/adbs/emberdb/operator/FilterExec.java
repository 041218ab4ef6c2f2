package ed.inf.adbs.emberdb.operator;

import ed.inf.adbs.emberdb.Tuple;
import ed.inf.adbs.emberdb.expression.ExpressionCompiler;
import ed.inf.adbs.emberdb.expression.ScalarExpression;

import java.util.Collections;
import java.util.function.Predicate;

/**
 * Passes through the child rows for which the predicate evaluates to TRUE.
 */
public class FilterExec extends PhysicalOperator {

    private final ScalarExpression predicate;
    private final Predicate<Tuple> compiled;

    public FilterExec(ScalarExpression predicate, PhysicalOperator child) {
        super(child.getSchema(), Collections.singletonList(child), RowEstimates.filter(child.getEstimatedRowCount()));
        this.predicate = predicate;
        this.compiled = ExpressionCompiler.compilePredicate(predicate);
    }

    @Override
    public PhysicalOperatorType getType() {
        return PhysicalOperatorType.FILTER;
    }

    @Override
    protected String describeParameters() {
        return predicate.toString();
    }

    @Override
    protected void doOpen() {
    }

    @Override
    protected Tuple doNext() {
        Tuple tuple;
        while ((tuple = getChild(0).next()) != null) {
            if (compiled.test(tuple)) {
                return tuple;
            }
        }
        return null;
    }

    @Override
    protected void doClose() {
    }
}
