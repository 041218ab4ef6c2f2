package ed.inf.adbs.emberdb.plan;

import ed.inf.adbs.emberdb.catalog.Schema;
import ed.inf.adbs.emberdb.expression.ScalarExpression;

import java.util.Collections;
import java.util.List;

/**
 * Keeps the child rows for which the BOOLEAN predicate is TRUE.
 */
public final class FilterNode extends LogicalOperator {

    private final ScalarExpression predicate;

    public FilterNode(ScalarExpression predicate, LogicalOperator child) {
        super(Collections.singletonList(child));
        this.predicate = predicate;
        initSchema();
    }

    public ScalarExpression getPredicate() {
        return predicate;
    }

    @Override
    protected Schema deriveSchema() {
        return getChild(0).getSchema();
    }

    @Override
    public LogicalOperatorType getType() {
        return LogicalOperatorType.FILTER;
    }

    @Override
    public String describe() {
        return "Filter(" + predicate + ")";
    }

    @Override
    public LogicalOperator withChildren(List<LogicalOperator> newChildren) {
        checkArity(newChildren, 1);
        return new FilterNode(predicate, newChildren.get(0));
    }
}
