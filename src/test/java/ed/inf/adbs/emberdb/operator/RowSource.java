package ed.inf.adbs.emberdb.operator;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

import ed.inf.adbs.emberdb.Constants;
import ed.inf.adbs.emberdb.Tuple;
import ed.inf.adbs.emberdb.catalog.Schema;

/**
 * Leaf operator over fixed rows that records how it is driven.
 */
class RowSource extends PhysicalOperator {

    private final List<Tuple> rows;
    private boolean failOnOpen;
    private int failOnPull;
    private int position;
    private int pulls;
    private int closes;

    RowSource(Schema schema, List<Tuple> rows) {
        this(schema, rows, rows.size());
    }

    RowSource(Schema schema, List<Tuple> rows, long estimate) {
        super(schema, Collections.emptyList(), estimate);
        this.rows = rows;
    }

    static RowSource unknownSize(Schema schema, List<Tuple> rows) {
        return new RowSource(schema, rows, Constants.UNKNOWN_ROW_COUNT);
    }

    RowSource failingOnOpen() {
        failOnOpen = true;
        return this;
    }

    /**
     * Makes the given pull (1-based) throw an {@code IOException}.
     */
    RowSource failingOnNext(int pull) {
        failOnPull = pull;
        return this;
    }

    int getPulls() {
        return pulls;
    }

    int getCloses() {
        return closes;
    }

    @Override
    public PhysicalOperatorType getType() {
        return PhysicalOperatorType.TABLE_SCAN;
    }

    @Override
    protected String describeParameters() {
        return "source";
    }

    @Override
    protected void doOpen() throws IOException {
        if (failOnOpen) {
            throw new IOException("source unavailable");
        }
        position = 0;
    }

    @Override
    protected Tuple doNext() throws IOException {
        pulls++;
        if (pulls == failOnPull) {
            throw new IOException("disk gone");
        }
        return position < rows.size() ? rows.get(position++) : null;
    }

    @Override
    protected void doClose() {
        closes++;
    }
}
