package ed.inf.adbs.emberdb.plan;

import ed.inf.adbs.emberdb.catalog.Schema;

import java.util.Collections;
import java.util.List;

/**
 * Skips {@code offset} child rows, then passes at most {@code count} rows through.
 */
public final class LimitNode extends LogicalOperator {

    private final long count;
    private final long offset;

    public LimitNode(long count, LogicalOperator child) {
        this(count, 0, child);
    }

    public LimitNode(long count, long offset, LogicalOperator child) {
        super(Collections.singletonList(child));
        if (count < 0 || offset < 0) {
            throw new IllegalArgumentException("LIMIT and OFFSET must not be negative");
        }
        this.count = count;
        this.offset = offset;
        initSchema();
    }

    public long getCount() {
        return count;
    }

    public long getOffset() {
        return offset;
    }

    @Override
    protected Schema deriveSchema() {
        return getChild(0).getSchema();
    }

    @Override
    public LogicalOperatorType getType() {
        return LogicalOperatorType.LIMIT;
    }

    @Override
    public String describe() {
        return "Limit(" + count + (offset > 0 ? " OFFSET " + offset : "") + ")";
    }

    @Override
    public LogicalOperator withChildren(List<LogicalOperator> newChildren) {
        checkArity(newChildren, 1);
        return new LimitNode(count, offset, newChildren.get(0));
    }
}
