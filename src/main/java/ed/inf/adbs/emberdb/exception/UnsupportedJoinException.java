package ed.inf.adbs.emberdb.exception;

import ed.inf.adbs.emberdb.plan.LogicalOperator;

/**
 * Raised by the optimizer when no physical rule can implement a join,
 * typically because its condition is not a conjunction of column equalities.
 */
public class UnsupportedJoinException extends PlanningException {

    private final LogicalOperator failedNode;

    public UnsupportedJoinException(String message, LogicalOperator failedNode) {
        super(message + " (node: " + (failedNode != null ? failedNode.describe() : "null") + ")");
        this.failedNode = failedNode;
    }

    /**
     * @return The logical join node that could not be lowered.
     */
    public LogicalOperator getFailedNode() {
        return failedNode;
    }
}
