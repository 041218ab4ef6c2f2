package ed.inf.adbs.emberdb;

import ed.inf.adbs.emberdb.operator.OperatorState;
import ed.inf.adbs.emberdb.operator.PhysicalOperator;
import ed.inf.adbs.emberdb.optimizer.RuleBasedOptimizer;
import ed.inf.adbs.emberdb.plan.LogicalOperator;

/**
 * Execution entry point: turns a plan root into a lazy stream of result rows.
 */
public class QueryExecutor {

    private final RuleBasedOptimizer optimizer;

    public QueryExecutor(RuleBasedOptimizer optimizer) {
        this.optimizer = optimizer;
    }

    /**
     * Optimizes a logical plan and executes the result.
     */
    public ResultStream execute(LogicalOperator root) {
        return execute(optimizer.optimize(root));
    }

    /**
     * @param root A physical plan that has never been opened.
     * @throws IllegalStateException If the plan was already executed.
     */
    public ResultStream execute(PhysicalOperator root) {
        if (root.getState() != OperatorState.CREATED) {
            throw new IllegalStateException("A physical plan executes once; lower the logical plan again");
        }
        return new ResultStream(root);
    }
}
