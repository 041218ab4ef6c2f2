package ed.inf.adbs.emberdb.optimizer.rule;

import ed.inf.adbs.emberdb.operator.LimitExec;
import ed.inf.adbs.emberdb.operator.PhysicalOperator;
import ed.inf.adbs.emberdb.optimizer.Rule;
import ed.inf.adbs.emberdb.plan.LimitNode;
import ed.inf.adbs.emberdb.plan.LogicalOperator;
import ed.inf.adbs.emberdb.plan.LogicalOperatorType;

import java.util.List;

public class LimitToLimitExecRule implements Rule {

    @Override
    public String getName() {
        return "LimitToLimitExec";
    }

    @Override
    public LogicalOperatorType getTarget() {
        return LogicalOperatorType.LIMIT;
    }

    @Override
    public boolean matches(LogicalOperator node, List<PhysicalOperator> loweredChildren) {
        return true;
    }

    @Override
    public PhysicalOperator apply(LogicalOperator node, List<PhysicalOperator> loweredChildren) {
        LimitNode limit = (LimitNode) node;
        return new LimitExec(limit.getCount(), limit.getOffset(), loweredChildren.get(0));
    }
}
