package ed.inf.adbs.emberdb.catalog;

/**
 * The storage and metadata boundary of the engine.
 * The planner asks it for schemas and row estimates, the table scan operator for cursors;
 * EmberDB never touches files or the network itself.
 * Table names are matched case-insensitively by the provided implementations.
 */
public interface Catalog {

    /**
     * @param tableName A table name.
     * @return true if the table exists.
     */
    boolean hasTable(String tableName);

    /**
     * @param tableName An existing table.
     * @return The declared schema, with every field qualified by the table name.
     * @throws IllegalArgumentException If the table does not exist.
     */
    Schema schemaOf(String tableName);

    /**
     * @param tableName An existing table.
     * @return The estimated number of rows, or {@link ed.inf.adbs.emberdb.Constants#UNKNOWN_ROW_COUNT}.
     */
    long estimatedRowCount(String tableName);

    /**
     * @param tableName An existing table.
     * @return A fresh, unopened cursor over the table's rows.
     */
    RowCursor openCursor(String tableName);
}
