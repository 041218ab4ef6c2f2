package ed.inf.adbs.emberdb.operator;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.io.ObjectOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import ed.inf.adbs.emberdb.TestFixtures;
import ed.inf.adbs.emberdb.Tuple;
import ed.inf.adbs.emberdb.catalog.DataType;
import ed.inf.adbs.emberdb.catalog.Field;
import ed.inf.adbs.emberdb.catalog.Schema;
import ed.inf.adbs.emberdb.expression.ColumnReference;
import ed.inf.adbs.emberdb.plan.SortKey;

public class SortExecTest {

    @Rule
    public TemporaryFolder spillFolder = new TemporaryFolder();

    private static final Schema SCORES = Schema.of(
            new Field("Scores", "id", DataType.INTEGER),
            new Field("Scores", "score", DataType.INTEGER));

    private static final ColumnReference ID = ColumnReference.of(0, SCORES.getField(0));
    private static final ColumnReference SCORE = ColumnReference.of(1, SCORES.getField(1));

    private static final List<Tuple> ROWS = Arrays.asList(
            Tuple.of(1L, 50L),
            Tuple.of(2L, 20L),
            Tuple.of(3L, null),
            Tuple.of(4L, 50L),
            Tuple.of(5L, 10L),
            Tuple.of(6L, 20L),
            Tuple.of(7L, 50L));

    private SortExec sort(SortExec.SortMode mode, int runSize, List<SortKey> keys) {
        return new SortExec(keys, mode, runSize, spillFolder.getRoot().toPath(), new RowSource(SCORES, ROWS));
    }

    private static List<Object> ids(List<Tuple> rows) {
        List<Object> ids = new ArrayList<>();
        for (Tuple row : rows) {
            ids.add(row.getAttribute(0));
        }
        return ids;
    }

    @Test
    public void testInMemorySortIsStable() {
        List<Tuple> rows = TestFixtures.drain(sort(SortExec.SortMode.IN_MEMORY, 100,
                Collections.singletonList(SortKey.of(SCORE, true))));

        assertEquals("Ascending puts NULL last, equal keys keep input order",
                Arrays.<Object>asList(5L, 2L, 6L, 1L, 4L, 7L, 3L), ids(rows));
    }

    @Test
    public void testDescendingPutsNullsFirst() {
        List<Tuple> rows = TestFixtures.drain(sort(SortExec.SortMode.IN_MEMORY, 100,
                Arrays.asList(SortKey.of(SCORE, false), SortKey.of(ID, false))));

        assertEquals(Arrays.<Object>asList(3L, 7L, 4L, 1L, 6L, 2L, 5L), ids(rows));
    }

    @Test
    public void testExplicitNullPlacement() {
        List<Tuple> rows = TestFixtures.drain(sort(SortExec.SortMode.IN_MEMORY, 100,
                Collections.singletonList(new SortKey(SCORE, true, true))));

        assertEquals(3L, rows.get(0).getAttribute(0));
        assertEquals(5L, rows.get(1).getAttribute(0));
    }

    @Test
    public void testExternalSortMatchesInMemorySort() {
        List<SortKey> keys = Collections.singletonList(SortKey.of(SCORE, true));
        List<Tuple> expected = TestFixtures.drain(sort(SortExec.SortMode.IN_MEMORY, 100, keys));

        SortExec external = sort(SortExec.SortMode.EXTERNAL, 2, keys);
        external.open();
        assertEquals("Seven rows in runs of two make four runs", 4, external.getSpilledRunCount());
        assertEquals(4, spillFolder.getRoot().listFiles().length);

        List<Tuple> rows = new ArrayList<>();
        Tuple tuple;
        while ((tuple = external.next()) != null) {
            rows.add(tuple);
        }
        external.close();

        assertEquals("Merging runs must keep the sort stable", expected, rows);
        File[] remaining = spillFolder.getRoot().listFiles();
        assertEquals("Run files should be deleted on close", 0, remaining.length);
        assertFalse(external.hasBufferedState());
    }

    @Test
    public void testExternalSortWithoutSpillStaysInMemory() {
        SortExec external = sort(SortExec.SortMode.EXTERNAL, 100, Collections.singletonList(SortKey.of(ID, false)));

        List<Tuple> rows = TestFixtures.drain(external);
        assertEquals(7L, rows.get(0).getAttribute(0));
        assertEquals(0, spillFolder.getRoot().listFiles().length);
    }

    @Test
    public void testCloseBeforeExhaustionDeletesRuns() {
        SortExec external = sort(SortExec.SortMode.EXTERNAL, 3, Collections.singletonList(SortKey.of(ID, true)));

        external.open();
        assertEquals(Tuple.of(1L, 50L), external.next());
        external.close();

        assertEquals(0, spillFolder.getRoot().listFiles().length);
        assertFalse(external.hasBufferedState());
    }

    @Test
    public void testTruncatedRunIsReported() throws IOException {
        Path run = spillFolder.newFile("truncated.run").toPath();
        try (ObjectOutputStream out = new ObjectOutputStream(Files.newOutputStream(run))) {
            out.flush();
        }

        try {
            new SortExec.RunReader(0, run);
            fail("A run without its row count cannot be read");
        } catch (IOException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("Corrupt sort run 0"));
        }
        Files.delete(run);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRunSizeMustBePositive() {
        sort(SortExec.SortMode.EXTERNAL, 0, Collections.singletonList(SortKey.of(ID, true)));
    }
}
