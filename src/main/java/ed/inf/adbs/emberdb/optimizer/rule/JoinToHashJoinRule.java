package ed.inf.adbs.emberdb.optimizer.rule;

import ed.inf.adbs.emberdb.expression.BooleanExpression;
import ed.inf.adbs.emberdb.expression.ColumnReference;
import ed.inf.adbs.emberdb.expression.ComparisonExpression;
import ed.inf.adbs.emberdb.expression.ComparisonOperator;
import ed.inf.adbs.emberdb.expression.ScalarExpression;
import ed.inf.adbs.emberdb.operator.HashJoin;
import ed.inf.adbs.emberdb.operator.PhysicalOperator;
import ed.inf.adbs.emberdb.operator.RowEstimates;
import ed.inf.adbs.emberdb.optimizer.Rule;
import ed.inf.adbs.emberdb.plan.JoinNode;
import ed.inf.adbs.emberdb.plan.LogicalOperator;
import ed.inf.adbs.emberdb.plan.LogicalOperatorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Join to HashJoin, when the condition is a conjunction of equalities each pairing one
 * left column with one right column of a hashable type.
 * <p>
 * The build side is the input with the smaller estimated row count. When the estimates are
 * equal, or either is unknown, the left input is built.
 */
public class JoinToHashJoinRule implements Rule {

    private static final Logger logger = LoggerFactory.getLogger(JoinToHashJoinRule.class);

    @Override
    public String getName() {
        return "JoinToHashJoin";
    }

    @Override
    public LogicalOperatorType getTarget() {
        return LogicalOperatorType.JOIN;
    }

    @Override
    public boolean matches(LogicalOperator node, List<PhysicalOperator> loweredChildren) {
        return extractKeys((JoinNode) node) != null;
    }

    @Override
    public PhysicalOperator apply(LogicalOperator node, List<PhysicalOperator> loweredChildren) {
        JoinNode join = (JoinNode) node;
        int[][] keys = extractKeys(join);
        PhysicalOperator left = loweredChildren.get(0);
        PhysicalOperator right = loweredChildren.get(1);
        HashJoin.BuildSide buildSide = chooseBuildSide(left.getEstimatedRowCount(), right.getEstimatedRowCount());
        logger.debug("HashJoin builds {} (estimates left={}, right={})", buildSide,
                left.getEstimatedRowCount(), right.getEstimatedRowCount());
        return new HashJoin(join.getJoinType(), keys[0], keys[1], buildSide, left, right, join.getUsingColumns());
    }

    static HashJoin.BuildSide chooseBuildSide(long leftEstimate, long rightEstimate) {
        if (RowEstimates.isKnown(leftEstimate) && RowEstimates.isKnown(rightEstimate) && rightEstimate < leftEstimate) {
            return HashJoin.BuildSide.RIGHT;
        }
        return HashJoin.BuildSide.LEFT;
    }

    /**
     * @return Left key positions and right key positions (relative to the right input),
     * or null if the condition is not a hashable equi-join condition.
     */
    static int[][] extractKeys(JoinNode join) {
        ScalarExpression condition = join.getCondition();
        if (condition == null) {
            return null;
        }
        int leftWidth = join.getLeft().getSchema().size();
        List<ScalarExpression> conjuncts = BooleanExpression.conjuncts(condition);
        int[] leftKeys = new int[conjuncts.size()];
        int[] rightKeys = new int[conjuncts.size()];
        for (int i = 0; i < conjuncts.size(); i++) {
            if (!(conjuncts.get(i) instanceof ComparisonExpression)) {
                return null;
            }
            ComparisonExpression comparison = (ComparisonExpression) conjuncts.get(i);
            if (comparison.getOperator() != ComparisonOperator.EQUALS
                    || !(comparison.getLeft() instanceof ColumnReference)
                    || !(comparison.getRight() instanceof ColumnReference)) {
                return null;
            }
            ColumnReference a = (ColumnReference) comparison.getLeft();
            ColumnReference b = (ColumnReference) comparison.getRight();
            if (!a.getType().isHashable() || !b.getType().isHashable()) {
                return null;
            }
            if (a.getIndex() < leftWidth && b.getIndex() >= leftWidth) {
                leftKeys[i] = a.getIndex();
                rightKeys[i] = b.getIndex() - leftWidth;
            } else if (b.getIndex() < leftWidth && a.getIndex() >= leftWidth) {
                leftKeys[i] = b.getIndex();
                rightKeys[i] = a.getIndex() - leftWidth;
            } else {
                return null;
            }
        }
        return new int[][]{leftKeys, rightKeys};
    }
}
