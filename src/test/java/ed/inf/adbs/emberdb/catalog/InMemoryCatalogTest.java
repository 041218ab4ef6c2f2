package ed.inf.adbs.emberdb.catalog;

import static org.junit.Assert.*;

import java.util.Collections;

import org.junit.Before;
import org.junit.Test;

import ed.inf.adbs.emberdb.Constants;
import ed.inf.adbs.emberdb.TestFixtures;
import ed.inf.adbs.emberdb.Tuple;

public class InMemoryCatalogTest {

    private InMemoryCatalog catalog;

    @Before
    public void setUp() {
        catalog = TestFixtures.catalog();
    }

    @Test
    public void testSchemaIsQualifiedWithTableName() {
        Schema schema = catalog.schemaOf("student");
        assertEquals("Student", schema.getField(0).getQualifier());
        assertEquals(0, schema.indexOf("Student", "SID"));
        assertEquals(5L, catalog.estimatedRowCount("Student"));
    }

    @Test
    public void testCursorAccounting() throws Exception {
        RowCursor first = catalog.openCursor("Course");
        RowCursor second = catalog.openCursor("Course");
        assertEquals("Cursors count as open only once opened", 0, catalog.getOpenCursorCount());

        first.open();
        second.open();
        assertEquals(2, catalog.getOpenCursorCount());
        assertEquals(Tuple.of(101L, "DB"), first.next());

        first.close();
        first.close();
        assertEquals("Closing twice releases once", 1, catalog.getOpenCursorCount());
        second.close();
        assertEquals(0, catalog.getOpenCursorCount());
        assertEquals(2, catalog.getCursorsOpened());
    }

    @Test(expected = IllegalStateException.class)
    public void testCursorCannotBeReopened() throws Exception {
        RowCursor cursor = catalog.openCursor("Course");
        cursor.open();
        cursor.close();
        cursor.open();
    }

    @Test
    public void testExplicitEstimate() {
        catalog.addTable("Empty", TestFixtures.COURSE, Collections.emptyList(), Constants.UNKNOWN_ROW_COUNT);
        assertEquals(Constants.UNKNOWN_ROW_COUNT, catalog.estimatedRowCount("Empty"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRowWidthIsChecked() {
        catalog.addTable("Bad", TestFixtures.COURSE, Collections.singletonList(Tuple.of(1L)));
    }
}
