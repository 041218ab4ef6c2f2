package ed.inf.adbs.emberdb.operator;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.Test;

import ed.inf.adbs.emberdb.Tuple;
import ed.inf.adbs.emberdb.TestFixtures;
import ed.inf.adbs.emberdb.catalog.DataType;
import ed.inf.adbs.emberdb.catalog.Field;
import ed.inf.adbs.emberdb.catalog.Schema;
import ed.inf.adbs.emberdb.plan.JoinType;

public class HashJoinTest {

    private static final Schema LEFT = Schema.of(
            new Field("L", "k", DataType.INTEGER),
            new Field("L", "lv", DataType.STRING));
    private static final Schema RIGHT = Schema.of(
            new Field("R", "k", DataType.INTEGER),
            new Field("R", "rv", DataType.STRING));

    private static final List<Tuple> LEFT_ROWS = Arrays.asList(
            Tuple.of(1L, "l1"),
            Tuple.of(2L, "l2"),
            Tuple.of(null, "lnull"));
    private static final List<Tuple> RIGHT_ROWS = Arrays.asList(
            Tuple.of(1L, "r1a"),
            Tuple.of(1L, "r1b"),
            Tuple.of(3L, "r3"),
            Tuple.of(null, "rnull"));

    private static HashJoin join(JoinType type, HashJoin.BuildSide buildSide) {
        return new HashJoin(type, new int[]{0}, new int[]{0}, buildSide,
                new RowSource(LEFT, LEFT_ROWS), new RowSource(RIGHT, RIGHT_ROWS), Collections.emptyList());
    }

    private static Set<Tuple> joinAsSet(JoinType type, HashJoin.BuildSide buildSide) {
        List<Tuple> rows = TestFixtures.drain(join(type, buildSide));
        Set<Tuple> set = new HashSet<>(rows);
        assertEquals("Join output should hold no duplicates here", rows.size(), set.size());
        return set;
    }

    @Test
    public void testEveryMatchingPairIsEmitted() {
        RowSource build = new RowSource(LEFT, Arrays.asList(Tuple.of(1L, "a"), Tuple.of(2L, "b")));
        RowSource probe = new RowSource(RIGHT, Arrays.asList(Tuple.of(1L, "x"), Tuple.of(1L, "y"), Tuple.of(3L, "z")));
        HashJoin join = new HashJoin(JoinType.INNER, new int[]{0}, new int[]{0}, HashJoin.BuildSide.LEFT,
                build, probe, Collections.emptyList());

        List<Tuple> rows = TestFixtures.drain(join);
        assertEquals(2, rows.size());
        assertEquals(Tuple.of(1L, "a", 1L, "x"), rows.get(0));
        assertEquals(Tuple.of(1L, "a", 1L, "y"), rows.get(1));
    }

    @Test
    public void testInnerJoinIgnoresNullKeys() {
        Set<Tuple> expected = new HashSet<>(Arrays.asList(
                Tuple.of(1L, "l1", 1L, "r1a"),
                Tuple.of(1L, "l1", 1L, "r1b")));

        assertEquals(expected, joinAsSet(JoinType.INNER, HashJoin.BuildSide.LEFT));
        assertEquals("Build side must not change the result",
                expected, joinAsSet(JoinType.INNER, HashJoin.BuildSide.RIGHT));
    }

    @Test
    public void testLeftJoinPadsUnmatchedLeftRows() {
        Set<Tuple> expected = new HashSet<>(Arrays.asList(
                Tuple.of(1L, "l1", 1L, "r1a"),
                Tuple.of(1L, "l1", 1L, "r1b"),
                Tuple.of(2L, "l2", null, null),
                Tuple.of(null, "lnull", null, null)));

        assertEquals(expected, joinAsSet(JoinType.LEFT, HashJoin.BuildSide.LEFT));
        assertEquals(expected, joinAsSet(JoinType.LEFT, HashJoin.BuildSide.RIGHT));
    }

    @Test
    public void testRightJoinPadsUnmatchedRightRows() {
        Set<Tuple> expected = new HashSet<>(Arrays.asList(
                Tuple.of(1L, "l1", 1L, "r1a"),
                Tuple.of(1L, "l1", 1L, "r1b"),
                Tuple.of(null, null, 3L, "r3"),
                Tuple.of(null, null, null, "rnull")));

        assertEquals(expected, joinAsSet(JoinType.RIGHT, HashJoin.BuildSide.LEFT));
        assertEquals(expected, joinAsSet(JoinType.RIGHT, HashJoin.BuildSide.RIGHT));
    }

    @Test
    public void testFullJoinPadsBothSides() {
        Set<Tuple> result = joinAsSet(JoinType.FULL, HashJoin.BuildSide.LEFT);

        assertEquals(6, result.size());
        assertTrue(result.contains(Tuple.of(2L, "l2", null, null)));
        assertTrue(result.contains(Tuple.of(null, "lnull", null, null)));
        assertTrue(result.contains(Tuple.of(null, null, 3L, "r3")));
        assertTrue(result.contains(Tuple.of(null, null, null, "rnull")));
        assertEquals(result, joinAsSet(JoinType.FULL, HashJoin.BuildSide.RIGHT));
    }

    @Test
    public void testUsingColumnAppearsOnce() {
        HashJoin join = new HashJoin(JoinType.FULL, new int[]{0}, new int[]{0}, HashJoin.BuildSide.LEFT,
                new RowSource(LEFT, LEFT_ROWS), new RowSource(RIGHT, RIGHT_ROWS), Collections.singletonList("k"));

        assertEquals(3, join.getSchema().size());
        assertEquals("rv", join.getSchema().getField(2).getName());

        Set<Tuple> result = new HashSet<>(TestFixtures.drain(join));
        assertTrue(result.contains(Tuple.of(1L, "l1", "r1a")));
        assertTrue("The key of a right-only row comes from the right side",
                result.contains(Tuple.of(3L, null, "r3")));
    }

    @Test
    public void testMixedNumericKeysMatch() {
        Schema doubles = Schema.of(new Field("D", "x", DataType.DOUBLE));
        HashJoin join = new HashJoin(JoinType.INNER, new int[]{0}, new int[]{0}, HashJoin.BuildSide.RIGHT,
                new RowSource(LEFT, LEFT_ROWS), new RowSource(doubles, Arrays.asList(Tuple.of(2.0), Tuple.of(2.5))),
                Collections.emptyList());

        List<Tuple> rows = TestFixtures.drain(join);
        assertEquals(1, rows.size());
        assertEquals(Tuple.of(2L, "l2", 2.0), rows.get(0));
    }

    @Test
    public void testCloseReleasesBuildTable() {
        RowSource left = new RowSource(LEFT, LEFT_ROWS);
        RowSource right = new RowSource(RIGHT, RIGHT_ROWS);
        HashJoin join = new HashJoin(JoinType.INNER, new int[]{0}, new int[]{0}, HashJoin.BuildSide.RIGHT,
                left, right, Collections.emptyList());

        join.open();
        assertSame(right, join.getBuildChild());
        assertSame(left, join.getProbeChild());
        assertTrue(join.hasBufferedState());
        join.close();

        assertFalse(join.hasBufferedState());
        assertEquals(OperatorState.CLOSED, left.getState());
        assertEquals(OperatorState.CLOSED, right.getState());
    }
}
