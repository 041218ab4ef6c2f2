package ed.inf.adbs.emberdb.plan;

import ed.inf.adbs.emberdb.catalog.Schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Orders the child rows by the keys, stably.
 */
public final class SortNode extends LogicalOperator {

    private final List<SortKey> sortKeys;

    public SortNode(List<SortKey> sortKeys, LogicalOperator child) {
        super(Collections.singletonList(child));
        if (sortKeys.isEmpty()) {
            throw new IllegalArgumentException("Sort needs at least one key");
        }
        this.sortKeys = Collections.unmodifiableList(new ArrayList<>(sortKeys));
        initSchema();
    }

    public List<SortKey> getSortKeys() {
        return sortKeys;
    }

    @Override
    protected Schema deriveSchema() {
        return getChild(0).getSchema();
    }

    @Override
    public LogicalOperatorType getType() {
        return LogicalOperatorType.SORT;
    }

    @Override
    public String describe() {
        return "Sort(" + sortKeys + ")";
    }

    @Override
    public LogicalOperator withChildren(List<LogicalOperator> newChildren) {
        checkArity(newChildren, 1);
        return new SortNode(sortKeys, newChildren.get(0));
    }
}
