package ed.inf.adbs.emberdb.optimizer;

import ed.inf.adbs.emberdb.operator.PhysicalOperator;
import ed.inf.adbs.emberdb.plan.LogicalOperator;
import ed.inf.adbs.emberdb.plan.LogicalOperatorType;

import java.util.List;

/**
 * A lowering rule from one kind of logical node to a physical operator.
 * Rules are consulted bottom-up, so they see the node's children already lowered and may
 * inspect their strategies and row estimates.
 */
public interface Rule {

    /**
     * @return A short name used in logs.
     */
    String getName();

    /**
     * @return The kind of logical node this rule lowers.
     */
    LogicalOperatorType getTarget();

    /**
     * @param node A logical node of the target kind.
     * @param loweredChildren The physical forms of its children, in order.
     * @return true if this rule can lower the node.
     */
    boolean matches(LogicalOperator node, List<PhysicalOperator> loweredChildren);

    /**
     * Only called when {@link #matches} returned true.
     * @return The physical operator implementing the node over the lowered children.
     */
    PhysicalOperator apply(LogicalOperator node, List<PhysicalOperator> loweredChildren);
}
