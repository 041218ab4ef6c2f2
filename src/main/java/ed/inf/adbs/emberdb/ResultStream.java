package ed.inf.adbs.emberdb;

import ed.inf.adbs.emberdb.catalog.Schema;
import ed.inf.adbs.emberdb.operator.PhysicalOperator;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * The rows of one query execution, pulled lazily from a physical plan.
 * The plan is opened by the first pull and closed when the rows are exhausted, when pulling
 * fails, or when the stream is closed. A stream is single-pass.
 */
public class ResultStream implements Iterator<Tuple>, AutoCloseable {

    private final PhysicalOperator root;
    private boolean opened;
    private boolean finished;
    private Tuple lookahead;

    ResultStream(PhysicalOperator root) {
        this.root = root;
    }

    public Schema getSchema() {
        return root.getSchema();
    }

    /**
     * @return The physical plan being executed.
     */
    public PhysicalOperator getPlan() {
        return root;
    }

    @Override
    public boolean hasNext() {
        if (finished) {
            return false;
        }
        if (lookahead != null) {
            return true;
        }
        try {
            if (!opened) {
                opened = true;
                root.open();
            }
            lookahead = root.next();
        } catch (RuntimeException e) {
            finished = true;
            try {
                root.close();
            } catch (RuntimeException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        if (lookahead == null) {
            close();
            return false;
        }
        return true;
    }

    @Override
    public Tuple next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Result stream is exhausted");
        }
        Tuple tuple = lookahead;
        lookahead = null;
        return tuple;
    }

    /**
     * Drains the remaining rows.
     */
    public List<Tuple> toList() {
        List<Tuple> rows = new ArrayList<>();
        while (hasNext()) {
            rows.add(next());
        }
        return rows;
    }

    /**
     * Stops the execution and releases every resource of the plan. Safe to call repeatedly.
     */
    @Override
    public void close() {
        finished = true;
        lookahead = null;
        root.close();
    }
}
