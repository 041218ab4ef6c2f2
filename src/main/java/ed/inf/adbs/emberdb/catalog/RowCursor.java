package ed.inf.adbs.emberdb.catalog;

import ed.inf.adbs.emberdb.Tuple;

import java.io.IOException;

/**
 * Raw row access to a stored table, following the same open/next/close discipline
 * as the physical operators that consume it.
 * A cursor is single-pass: re-reading a table requires a new cursor from the catalog.
 */
public interface RowCursor {

    /**
     * Acquires the underlying storage resources. Called exactly once before {@link #next()}.
     */
    void open() throws IOException;

    /**
     * @return The next stored row, or null once the table is exhausted.
     */
    Tuple next() throws IOException;

    /**
     * Releases the storage resources. Safe to call more than once and before exhaustion.
     */
    void close() throws IOException;
}
