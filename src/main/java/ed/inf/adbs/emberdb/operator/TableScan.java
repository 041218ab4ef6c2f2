package ed.inf.adbs.emberdb.operator;

import ed.inf.adbs.emberdb.Tuple;
import ed.inf.adbs.emberdb.catalog.Catalog;
import ed.inf.adbs.emberdb.catalog.RowCursor;
import ed.inf.adbs.emberdb.catalog.Schema;
import ed.inf.adbs.emberdb.plan.SchemaDerivations;

import java.io.IOException;
import java.util.Collections;

/**
 * Reads a table through a catalog cursor. The cursor is requested and opened in open,
 * and released in close.
 */
public class TableScan extends PhysicalOperator {

    private final Catalog catalog;
    private final String tableName;
    private final String referenceName;

    private RowCursor cursor;

    public TableScan(Catalog catalog, String tableName, String referenceName, Schema tableSchema, long estimatedRowCount) {
        super(SchemaDerivations.scan(tableSchema, referenceName), Collections.emptyList(), estimatedRowCount);
        this.catalog = catalog;
        this.tableName = tableName;
        this.referenceName = referenceName;
    }

    public String getTableName() {
        return tableName;
    }

    @Override
    public PhysicalOperatorType getType() {
        return PhysicalOperatorType.TABLE_SCAN;
    }

    @Override
    protected String describeParameters() {
        return referenceName.equals(tableName) ? tableName : tableName + " AS " + referenceName;
    }

    @Override
    protected void doOpen() throws IOException {
        cursor = catalog.openCursor(tableName);
        cursor.open();
    }

    @Override
    protected Tuple doNext() throws IOException {
        Tuple tuple = cursor.next();
        if (tuple != null && tuple.size() != getSchema().size()) {
            throw new IOException("Row of " + tableName + " has " + tuple.size()
                    + " values, expected " + getSchema().size());
        }
        return tuple;
    }

    @Override
    protected void doClose() throws IOException {
        if (cursor != null) {
            RowCursor toClose = cursor;
            cursor = null;
            toClose.close();
        }
    }
}
