package ed.inf.adbs.emberdb.exception;

import ed.inf.adbs.emberdb.plan.LogicalOperator;

/**
 * Raised by the optimizer when a grouping cannot be executed by hashing,
 * i.e. a group key or a DISTINCT aggregate argument has a non-hashable type.
 */
public class UnsupportedAggregateException extends PlanningException {

    private final LogicalOperator failedNode;

    public UnsupportedAggregateException(String message, LogicalOperator failedNode) {
        super(message + " (node: " + (failedNode != null ? failedNode.describe() : "null") + ")");
        this.failedNode = failedNode;
    }

    public LogicalOperator getFailedNode() {
        return failedNode;
    }
}
