package ed.inf.adbs.emberdb.optimizer.rule;

import ed.inf.adbs.emberdb.operator.FilterExec;
import ed.inf.adbs.emberdb.operator.PhysicalOperator;
import ed.inf.adbs.emberdb.optimizer.Rule;
import ed.inf.adbs.emberdb.plan.FilterNode;
import ed.inf.adbs.emberdb.plan.LogicalOperator;
import ed.inf.adbs.emberdb.plan.LogicalOperatorType;

import java.util.List;

public class FilterToFilterExecRule implements Rule {

    @Override
    public String getName() {
        return "FilterToFilterExec";
    }

    @Override
    public LogicalOperatorType getTarget() {
        return LogicalOperatorType.FILTER;
    }

    @Override
    public boolean matches(LogicalOperator node, List<PhysicalOperator> loweredChildren) {
        return true;
    }

    @Override
    public PhysicalOperator apply(LogicalOperator node, List<PhysicalOperator> loweredChildren) {
        return new FilterExec(((FilterNode) node).getPredicate(), loweredChildren.get(0));
    }
}
