package ed.inf.adbs.emberdb.operator;

import ed.inf.adbs.emberdb.Tuple;

import java.util.Collections;

/**
 * Skips {@code offset} child rows and then returns at most {@code count} rows.
 * Once the count is reached the child is not pulled again.
 */
public class LimitExec extends PhysicalOperator {

    private final long count;
    private final long offset;

    private long skipped;
    private long returned;

    public LimitExec(long count, long offset, PhysicalOperator child) {
        super(child.getSchema(), Collections.singletonList(child), RowEstimates.limit(child.getEstimatedRowCount(), count));
        this.count = count;
        this.offset = offset;
    }

    @Override
    public PhysicalOperatorType getType() {
        return PhysicalOperatorType.LIMIT;
    }

    @Override
    protected String describeParameters() {
        return offset > 0 ? count + " OFFSET " + offset : String.valueOf(count);
    }

    @Override
    protected void doOpen() {
        skipped = 0;
        returned = 0;
    }

    @Override
    protected Tuple doNext() {
        if (returned >= count) {
            return null;
        }
        while (skipped < offset) {
            if (getChild(0).next() == null) {
                return null;
            }
            skipped++;
        }
        Tuple tuple = getChild(0).next();
        if (tuple != null) {
            returned++;
        }
        return tuple;
    }

    @Override
    protected void doClose() {
    }
}
