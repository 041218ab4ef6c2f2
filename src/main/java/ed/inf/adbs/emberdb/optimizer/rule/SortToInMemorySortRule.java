package ed.inf.adbs.emberdb.optimizer.rule;

import ed.inf.adbs.emberdb.EngineOptions;
import ed.inf.adbs.emberdb.operator.PhysicalOperator;
import ed.inf.adbs.emberdb.operator.SortExec;
import ed.inf.adbs.emberdb.optimizer.Rule;
import ed.inf.adbs.emberdb.plan.LogicalOperator;
import ed.inf.adbs.emberdb.plan.LogicalOperatorType;
import ed.inf.adbs.emberdb.plan.SortNode;

import java.util.List;

public class SortToInMemorySortRule implements Rule {

    private final EngineOptions options;

    public SortToInMemorySortRule(EngineOptions options) {
        this.options = options;
    }

    @Override
    public String getName() {
        return "SortToInMemorySort";
    }

    @Override
    public LogicalOperatorType getTarget() {
        return LogicalOperatorType.SORT;
    }

    @Override
    public boolean matches(LogicalOperator node, List<PhysicalOperator> loweredChildren) {
        return true;
    }

    @Override
    public PhysicalOperator apply(LogicalOperator node, List<PhysicalOperator> loweredChildren) {
        return new SortExec(((SortNode) node).getSortKeys(), SortExec.SortMode.IN_MEMORY,
                options.getSortRunSize(), options.getSpillDirectory(), loweredChildren.get(0));
    }
}
