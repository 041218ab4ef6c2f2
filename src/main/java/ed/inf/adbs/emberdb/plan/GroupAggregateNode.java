package ed.inf.adbs.emberdb.plan;

import ed.inf.adbs.emberdb.catalog.Schema;
import ed.inf.adbs.emberdb.expression.AggregateCall;
import ed.inf.adbs.emberdb.expression.ColumnReference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Groups the child rows by the key columns and computes the aggregates per group.
 * With no keys the whole input is one group; with no aggregates the node removes duplicates.
 */
public final class GroupAggregateNode extends LogicalOperator {

    private final List<ColumnReference> groupKeys;
    private final List<AggregateCall> aggregates;

    public GroupAggregateNode(List<ColumnReference> groupKeys, List<AggregateCall> aggregates, LogicalOperator child) {
        super(Collections.singletonList(child));
        this.groupKeys = Collections.unmodifiableList(new ArrayList<>(groupKeys));
        this.aggregates = Collections.unmodifiableList(new ArrayList<>(aggregates));
        initSchema();
    }

    public List<ColumnReference> getGroupKeys() {
        return groupKeys;
    }

    public List<AggregateCall> getAggregates() {
        return aggregates;
    }

    @Override
    protected Schema deriveSchema() {
        return SchemaDerivations.aggregate(groupKeys, aggregates, getChild(0).getSchema());
    }

    @Override
    public LogicalOperatorType getType() {
        return LogicalOperatorType.GROUP_AGGREGATE;
    }

    @Override
    public String describe() {
        return "GroupAggregate(keys=" + groupKeys + ", aggregates=" + aggregates + ")";
    }

    @Override
    public LogicalOperator withChildren(List<LogicalOperator> newChildren) {
        checkArity(newChildren, 1);
        return new GroupAggregateNode(groupKeys, aggregates, newChildren.get(0));
    }
}
