package ed.inf.adbs.emberdb.optimizer.rule;

import ed.inf.adbs.emberdb.EngineOptions;
import ed.inf.adbs.emberdb.operator.PhysicalOperator;
import ed.inf.adbs.emberdb.operator.RowEstimates;
import ed.inf.adbs.emberdb.operator.SortExec;
import ed.inf.adbs.emberdb.optimizer.Rule;
import ed.inf.adbs.emberdb.plan.LogicalOperator;
import ed.inf.adbs.emberdb.plan.LogicalOperatorType;
import ed.inf.adbs.emberdb.plan.SortNode;

import java.util.List;

/**
 * Sort to an external SortExec, when the input is estimated above the spill threshold.
 */
public class SortToExternalSortRule implements Rule {

    private final EngineOptions options;

    public SortToExternalSortRule(EngineOptions options) {
        this.options = options;
    }

    @Override
    public String getName() {
        return "SortToExternalSort";
    }

    @Override
    public LogicalOperatorType getTarget() {
        return LogicalOperatorType.SORT;
    }

    @Override
    public boolean matches(LogicalOperator node, List<PhysicalOperator> loweredChildren) {
        long estimate = loweredChildren.get(0).getEstimatedRowCount();
        return RowEstimates.isKnown(estimate) && estimate > options.getSortSpillThreshold();
    }

    @Override
    public PhysicalOperator apply(LogicalOperator node, List<PhysicalOperator> loweredChildren) {
        return new SortExec(((SortNode) node).getSortKeys(), SortExec.SortMode.EXTERNAL,
                options.getSortRunSize(), options.getSpillDirectory(), loweredChildren.get(0));
    }
}
