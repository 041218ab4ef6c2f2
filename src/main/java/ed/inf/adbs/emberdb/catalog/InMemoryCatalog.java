package ed.inf.adbs.emberdb.catalog;

import ed.inf.adbs.emberdb.Constants;
import ed.inf.adbs.emberdb.Tuple;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A catalog whose tables live in memory, for embedding and testing.
 * It counts cursors that were opened but not yet closed so that callers can
 * check that an execution released its storage resources.
 */
public class InMemoryCatalog implements Catalog {

    private final Map<String, Table> tables = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private int openCursors;
    private int cursorsOpened;

    /**
     * Registers a table whose row estimate is its actual size.
     * @param tableName The table name.
     * @param schema The column layout; fields are re-qualified with the table name.
     * @param rows The stored rows.
     * @return This catalog, for chaining.
     */
    public InMemoryCatalog addTable(String tableName, Schema schema, List<Tuple> rows) {
        return addTable(tableName, schema, rows, rows.size());
    }

    /**
     * Registers a table with an explicit row estimate, which may differ from the real size
     * or be {@link Constants#UNKNOWN_ROW_COUNT}.
     */
    public InMemoryCatalog addTable(String tableName, Schema schema, List<Tuple> rows, long estimatedRows) {
        for (Tuple row : rows) {
            if (row.size() != schema.size()) {
                throw new IllegalArgumentException("Row " + row + " does not match schema " + schema);
            }
        }
        tables.put(tableName, new Table(schema.withQualifier(tableName),
                Collections.unmodifiableList(new ArrayList<>(rows)), estimatedRows));
        return this;
    }

    @Override
    public boolean hasTable(String tableName) {
        return tables.containsKey(tableName);
    }

    @Override
    public Schema schemaOf(String tableName) {
        return table(tableName).schema;
    }

    @Override
    public long estimatedRowCount(String tableName) {
        return table(tableName).estimatedRows;
    }

    @Override
    public RowCursor openCursor(String tableName) {
        final List<Tuple> rows = table(tableName).rows;
        return new RowCursor() {
            private Iterator<Tuple> iterator;
            private boolean closed;

            @Override
            public void open() {
                if (iterator != null || closed) {
                    throw new IllegalStateException("Cursor over " + tableName + " cannot be reopened");
                }
                iterator = rows.iterator();
                openCursors++;
                cursorsOpened++;
            }

            @Override
            public Tuple next() {
                if (iterator == null || closed || !iterator.hasNext()) {
                    return null;
                }
                return iterator.next();
            }

            @Override
            public void close() {
                if (iterator != null && !closed) {
                    openCursors--;
                }
                closed = true;
            }
        };
    }

    /**
     * @return The number of cursors currently open.
     */
    public int getOpenCursorCount() {
        return openCursors;
    }

    /**
     * @return The number of cursors opened since this catalog was created.
     */
    public int getCursorsOpened() {
        return cursorsOpened;
    }

    private Table table(String tableName) {
        Table table = tables.get(tableName);
        if (table == null) {
            throw new IllegalArgumentException("Unknown table " + tableName);
        }
        return table;
    }

    private static final class Table {
        final Schema schema;
        final List<Tuple> rows;
        final long estimatedRows;

        Table(Schema schema, List<Tuple> rows, long estimatedRows) {
            this.schema = schema;
            this.rows = rows;
            this.estimatedRows = estimatedRows;
        }
    }
}
