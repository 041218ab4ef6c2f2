package ed.inf.adbs.emberdb.operator;

import ed.inf.adbs.emberdb.Tuple;
import ed.inf.adbs.emberdb.catalog.Schema;
import ed.inf.adbs.emberdb.exception.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * Abstract class representing a physical operator in EmberDB, following the iterator model.
 * <p>
 * Every operator is driven through {@link #open()}, {@link #next()} and {@link #close()}.
 * These are final: they enforce the lifecycle ({@link OperatorState}) and the recursion over
 * children, and delegate the operator-specific work to {@link #doOpen()}, {@link #doNext()} and
 * {@link #doClose()}.
 * <ul>
 *     <li>open opens the children first, in order, then the operator itself. If anything fails,
 *     what was already acquired is released before an {@link ExecutionException} propagates.</li>
 *     <li>next returns the next row or null once exhausted, and keeps returning null after that.</li>
 *     <li>close releases the operator's own state, then closes the children in reverse order.
 *     It may be called at any point and any number of times.</li>
 * </ul>
 * An operator instance serves one execution only.
 */
public abstract class PhysicalOperator {

    private static final Logger logger = LoggerFactory.getLogger(PhysicalOperator.class);

    private final Schema schema;
    private final List<PhysicalOperator> children;
    private final long estimatedRowCount;

    private OperatorState state = OperatorState.CREATED;
    private boolean exhausted;

    protected PhysicalOperator(Schema schema, List<PhysicalOperator> children, long estimatedRowCount) {
        this.schema = schema;
        this.children = Collections.unmodifiableList(children);
        this.estimatedRowCount = estimatedRowCount;
    }

    public abstract PhysicalOperatorType getType();

    /**
     * @return The operator parameters as shown by {@link #explain()}.
     */
    protected abstract String describeParameters();

    /**
     * Acquires the operator's own resources. Children are already open.
     */
    protected abstract void doOpen() throws IOException;

    /**
     * @return The next row, or null when exhausted.
     */
    protected abstract Tuple doNext() throws IOException;

    /**
     * Releases the operator's own resources. Must tolerate being called after a failed
     * or partial {@link #doOpen()}.
     */
    protected abstract void doClose() throws IOException;

    public final void open() {
        if (state != OperatorState.CREATED) {
            throw new IllegalStateException(getType().getDisplayName() + " cannot be opened in state " + state);
        }
        state = OperatorState.OPEN;
        int opened = 0;
        try {
            for (PhysicalOperator child : children) {
                child.open();
                opened++;
            }
            doOpen();
        } catch (IOException | RuntimeException e) {
            ExecutionException failure = e instanceof ExecutionException
                    ? (ExecutionException) e
                    : new ExecutionException(getType().getDisplayName() + " failed to open: " + e.getMessage(), e);
            try {
                doClose();
            } catch (IOException | RuntimeException closeFailure) {
                failure.addSuppressed(closeFailure);
            }
            for (int i = opened - 1; i >= 0; i--) {
                try {
                    children.get(i).close();
                } catch (RuntimeException closeFailure) {
                    failure.addSuppressed(closeFailure);
                }
            }
            state = OperatorState.CLOSED;
            logger.debug("{} failed to open", getType().getDisplayName(), failure);
            throw failure;
        }
    }

    public final Tuple next() {
        if (state != OperatorState.OPEN) {
            throw new IllegalStateException(getType().getDisplayName() + " is not open (state " + state + ")");
        }
        if (exhausted) {
            return null;
        }
        try {
            Tuple tuple = doNext();
            if (tuple == null) {
                exhausted = true;
            }
            return tuple;
        } catch (ExecutionException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new ExecutionException(getType().getDisplayName() + " failed: " + e.getMessage(), e);
        }
    }

    public final void close() {
        if (state == OperatorState.CLOSED) {
            return;
        }
        boolean wasOpen = state == OperatorState.OPEN;
        state = OperatorState.CLOSED;
        if (!wasOpen) {
            return;
        }

        RuntimeException failure = null;
        try {
            doClose();
        } catch (IOException | RuntimeException e) {
            failure = new ExecutionException(getType().getDisplayName() + " failed to close: " + e.getMessage(), e);
        }
        for (int i = children.size() - 1; i >= 0; i--) {
            try {
                children.get(i).close();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    public Schema getSchema() {
        return schema;
    }

    public List<PhysicalOperator> getChildren() {
        return children;
    }

    public PhysicalOperator getChild(int index) {
        return children.get(index);
    }

    public OperatorState getState() {
        return state;
    }

    /**
     * @return The estimated number of output rows, or {@link ed.inf.adbs.emberdb.Constants#UNKNOWN_ROW_COUNT}.
     */
    public long getEstimatedRowCount() {
        return estimatedRowCount;
    }

    /**
     * Renders the subtree rooted here, one operator per line. The rendering only depends on
     * the plan, so two plans are structurally identical exactly when their renderings are.
     */
    public String explain() {
        StringBuilder sb = new StringBuilder();
        explain(0, sb);
        return sb.toString();
    }

    private void explain(int depth, StringBuilder sb) {
        for (int i = 0; i < depth; i++) {
            sb.append("  ");
        }
        sb.append(getType().getDisplayName()).append('(').append(describeParameters()).append(')')
                .append(" rows=").append(estimatedRowCount).append('\n');
        for (PhysicalOperator child : children) {
            child.explain(depth + 1, sb);
        }
    }

    @Override
    public String toString() {
        return getType().getDisplayName() + "(" + describeParameters() + ")";
    }
}
