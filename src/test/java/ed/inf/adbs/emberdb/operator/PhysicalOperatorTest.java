package ed.inf.adbs.emberdb.operator;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import ed.inf.adbs.emberdb.EngineOptions;
import ed.inf.adbs.emberdb.QueryExecutor;
import ed.inf.adbs.emberdb.ResultStream;
import ed.inf.adbs.emberdb.TestFixtures;
import ed.inf.adbs.emberdb.Tuple;
import ed.inf.adbs.emberdb.catalog.InMemoryCatalog;
import ed.inf.adbs.emberdb.exception.ExecutionException;
import ed.inf.adbs.emberdb.expression.ColumnReference;
import ed.inf.adbs.emberdb.optimizer.RuleBasedOptimizer;
import ed.inf.adbs.emberdb.plan.JoinType;
import ed.inf.adbs.emberdb.plan.SortKey;

public class PhysicalOperatorTest {

    @Test
    public void testFailedOpenClosesOpenedSiblings() {
        RowSource left = new RowSource(TestFixtures.ENROLLED, TestFixtures.numbers(0));
        RowSource right = new RowSource(TestFixtures.COURSE, TestFixtures.numbers(0)).failingOnOpen();
        HashJoin join = new HashJoin(JoinType.INNER, new int[]{1}, new int[]{0}, HashJoin.BuildSide.LEFT,
                left, right, Collections.emptyList());

        try {
            join.open();
            fail("Opening should fail");
        } catch (ExecutionException e) {
            assertTrue(e.getMessage().contains("source unavailable"));
        }

        assertEquals(OperatorState.CLOSED, join.getState());
        assertEquals("The already opened child is released", OperatorState.CLOSED, left.getState());
        assertEquals(1, left.getCloses());
        assertEquals(OperatorState.CLOSED, right.getState());
        assertFalse(join.hasBufferedState());

        join.close();
        assertEquals("Closing again is a no-op", 1, left.getCloses());
    }

    @Test
    public void testStorageFailureDuringNextClosesWholeTree() {
        InMemoryCatalog catalog = TestFixtures.catalog();
        TableScan students = new TableScan(catalog, "Student", "Student", catalog.schemaOf("Student"), 5);
        RowSource enrolled = new RowSource(TestFixtures.ENROLLED, Arrays.asList(
                Tuple.of(1L, 101L, 80L),
                Tuple.of(2L, 101L, 65L),
                Tuple.of(3L, 103L, 90L),
                Tuple.of(1L, 102L, 70L))).failingOnNext(3);
        HashJoin join = new HashJoin(JoinType.INNER, new int[]{0}, new int[]{0}, HashJoin.BuildSide.LEFT,
                students, enrolled, Collections.emptyList());
        SortExec sort = new SortExec(Collections.singletonList(SortKey.of(ColumnReference.of(6, join.getSchema().getField(6)), true)),
                SortExec.SortMode.IN_MEMORY, 100, null, join);
        QueryExecutor executor = new QueryExecutor(new RuleBasedOptimizer(catalog, EngineOptions.defaults()));

        ResultStream stream = executor.execute(sort);
        try {
            stream.toList();
            fail("The failing source should abort the query");
        } catch (ExecutionException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("disk gone"));
        }

        assertEquals(0, catalog.getOpenCursorCount());
        assertEquals(1, enrolled.getCloses());
        assertFalse(sort.hasBufferedState());
        assertFalse(join.hasBufferedState());
        for (PhysicalOperator operator : Arrays.<PhysicalOperator>asList(sort, join, students, enrolled)) {
            assertEquals(operator.explain(), OperatorState.CLOSED, operator.getState());
        }
        assertFalse(stream.hasNext());
    }

    @Test
    public void testCloseBeforeOpen() {
        RowSource source = new RowSource(TestFixtures.COURSE, TestFixtures.numbers(0));
        LimitExec limit = new LimitExec(1, 0, source);

        limit.close();
        assertEquals(OperatorState.CLOSED, limit.getState());
        assertEquals("Nothing was acquired, so nothing is released", 0, source.getCloses());
    }

    @Test
    public void testCloseWithoutNextReleasesEverything() {
        InMemoryCatalog catalog = TestFixtures.catalog();
        TableScan students = new TableScan(catalog, "Student", "Student", catalog.schemaOf("Student"), 5);
        TableScan enrolled = new TableScan(catalog, "Enrolled", "Enrolled", catalog.schemaOf("Enrolled"), 5);
        HashJoin join = new HashJoin(JoinType.INNER, new int[]{0}, new int[]{0}, HashJoin.BuildSide.LEFT,
                students, enrolled, Collections.emptyList());

        join.open();
        assertEquals(2, catalog.getOpenCursorCount());
        join.close();

        assertEquals(0, catalog.getOpenCursorCount());
        assertFalse(join.hasBufferedState());
        assertEquals(OperatorState.CLOSED, students.getState());
        assertEquals(OperatorState.CLOSED, enrolled.getState());
    }

    @Test
    public void testExplainShowsTreeWithEstimates() {
        InMemoryCatalog catalog = TestFixtures.catalog();
        TableScan scan = new TableScan(catalog, "Student", "S", catalog.schemaOf("Student"), 5);
        LimitExec limit = new LimitExec(2, 0, scan);

        assertEquals("LimitExec(2) rows=2\n  TableScan(Student AS S) rows=5\n", limit.explain());
        assertEquals("S", scan.getSchema().getField(0).getQualifier());
    }
}
