package ed.inf.adbs.emberdb.plan;

import ed.inf.adbs.emberdb.catalog.Schema;
import ed.inf.adbs.emberdb.expression.ScalarExpression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Joins two inputs. The condition is bound against the left schema followed by the full right
 * schema and is null for a join without a condition. USING columns appear once in the output,
 * on the left, holding the coalesced key value.
 */
public final class JoinNode extends LogicalOperator {

    private final JoinType joinType;
    private final ScalarExpression condition;
    private final List<String> usingColumns;

    public JoinNode(JoinType joinType, ScalarExpression condition, LogicalOperator left, LogicalOperator right) {
        this(joinType, condition, left, right, Collections.emptyList());
    }

    public JoinNode(JoinType joinType, ScalarExpression condition, LogicalOperator left, LogicalOperator right,
                    List<String> usingColumns) {
        super(Arrays.asList(left, right));
        this.joinType = joinType;
        this.condition = condition;
        this.usingColumns = Collections.unmodifiableList(new ArrayList<>(usingColumns));
        initSchema();
    }

    public JoinType getJoinType() {
        return joinType;
    }

    public ScalarExpression getCondition() {
        return condition;
    }

    public List<String> getUsingColumns() {
        return usingColumns;
    }

    public LogicalOperator getLeft() {
        return getChild(0);
    }

    public LogicalOperator getRight() {
        return getChild(1);
    }

    @Override
    protected Schema deriveSchema() {
        return SchemaDerivations.join(getLeft().getSchema(), getRight().getSchema(), usingColumns);
    }

    @Override
    public LogicalOperatorType getType() {
        return LogicalOperatorType.JOIN;
    }

    @Override
    public String describe() {
        StringBuilder sb = new StringBuilder("Join(").append(joinType);
        if (condition != null) {
            sb.append(", ").append(condition);
        }
        if (!usingColumns.isEmpty()) {
            sb.append(", USING ").append(usingColumns);
        }
        return sb.append(")").toString();
    }

    @Override
    public LogicalOperator withChildren(List<LogicalOperator> newChildren) {
        checkArity(newChildren, 2);
        return new JoinNode(joinType, condition, newChildren.get(0), newChildren.get(1), usingColumns);
    }
}
