package ed.inf.adbs.emberdb.optimizer.rule;

import ed.inf.adbs.emberdb.expression.AggregateCall;
import ed.inf.adbs.emberdb.expression.ColumnReference;
import ed.inf.adbs.emberdb.operator.HashAggregate;
import ed.inf.adbs.emberdb.operator.PhysicalOperator;
import ed.inf.adbs.emberdb.optimizer.Rule;
import ed.inf.adbs.emberdb.plan.GroupAggregateNode;
import ed.inf.adbs.emberdb.plan.LogicalOperator;
import ed.inf.adbs.emberdb.plan.LogicalOperatorType;

import java.util.List;

/**
 * GroupAggregate to HashAggregate, when every group key and every DISTINCT argument
 * is of a hashable type.
 */
public class GroupAggregateToHashAggregateRule implements Rule {

    @Override
    public String getName() {
        return "GroupAggregateToHashAggregate";
    }

    @Override
    public LogicalOperatorType getTarget() {
        return LogicalOperatorType.GROUP_AGGREGATE;
    }

    @Override
    public boolean matches(LogicalOperator node, List<PhysicalOperator> loweredChildren) {
        GroupAggregateNode aggregate = (GroupAggregateNode) node;
        for (ColumnReference key : aggregate.getGroupKeys()) {
            if (!key.getType().isHashable()) {
                return false;
            }
        }
        for (AggregateCall call : aggregate.getAggregates()) {
            if (call.isDistinct() && !call.getArgument().getType().isHashable()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public PhysicalOperator apply(LogicalOperator node, List<PhysicalOperator> loweredChildren) {
        GroupAggregateNode aggregate = (GroupAggregateNode) node;
        return new HashAggregate(aggregate.getGroupKeys(), aggregate.getAggregates(), loweredChildren.get(0));
    }
}
