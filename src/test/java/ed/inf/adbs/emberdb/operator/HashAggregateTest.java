package ed.inf.adbs.emberdb.operator;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import ed.inf.adbs.emberdb.TestFixtures;
import ed.inf.adbs.emberdb.Tuple;
import ed.inf.adbs.emberdb.catalog.DataType;
import ed.inf.adbs.emberdb.catalog.Field;
import ed.inf.adbs.emberdb.catalog.Schema;
import ed.inf.adbs.emberdb.expression.AggregateCall;
import ed.inf.adbs.emberdb.expression.AggregateFunction;
import ed.inf.adbs.emberdb.expression.ColumnReference;

public class HashAggregateTest {

    private static final Schema SALES = Schema.of(
            new Field("Sales", "region", DataType.STRING),
            new Field("Sales", "amount", DataType.INTEGER));

    private static final ColumnReference REGION = ColumnReference.of(0, SALES.getField(0));
    private static final ColumnReference AMOUNT = ColumnReference.of(1, SALES.getField(1));

    private static final List<Tuple> ROWS = Arrays.asList(
            Tuple.of("north", 10L),
            Tuple.of("south", 5L),
            Tuple.of("north", 20L),
            Tuple.of("south", null),
            Tuple.of("north", 30L));

    @Test
    public void testGroupCountsCoverEveryRow() {
        HashAggregate aggregate = new HashAggregate(Collections.singletonList(REGION),
                Collections.singletonList(AggregateCall.countStar()), new RowSource(SALES, ROWS));

        List<Tuple> groups = TestFixtures.drain(aggregate);
        assertEquals(2, groups.size());
        long total = 0;
        for (Tuple group : groups) {
            total += (Long) group.getAttribute(1);
        }
        assertEquals(5L, total);
        assertEquals("Groups come out in order of first appearance", Tuple.of("north", 3L), groups.get(0));
        assertEquals(Tuple.of("south", 2L), groups.get(1));
    }

    @Test
    public void testSchemaNamesAggregatesAfterTheirCall() {
        AggregateCall sum = new AggregateCall(AggregateFunction.SUM, AMOUNT, false);
        HashAggregate aggregate = new HashAggregate(Collections.singletonList(REGION),
                Arrays.asList(sum, new AggregateCall(AggregateFunction.AVG, AMOUNT, false)), new RowSource(SALES, ROWS));

        assertEquals(SALES.getField(0), aggregate.getSchema().getField(0));
        assertEquals(new Field(null, "SUM(Sales.amount)", DataType.INTEGER), aggregate.getSchema().getField(1));
        assertEquals(DataType.DOUBLE, aggregate.getSchema().getField(2).getType());

        List<Tuple> groups = TestFixtures.drain(aggregate);
        assertEquals(Tuple.of("north", 60L, 20.0), groups.get(0));
        assertEquals(Tuple.of("south", 5L, 5.0), groups.get(1));
    }

    @Test
    public void testGlobalAggregateOverEmptyInput() {
        HashAggregate aggregate = new HashAggregate(Collections.emptyList(),
                Arrays.asList(AggregateCall.countStar(), new AggregateCall(AggregateFunction.MAX, AMOUNT, false)),
                new RowSource(SALES, Collections.emptyList()));

        List<Tuple> rows = TestFixtures.drain(aggregate);
        assertEquals("A global aggregate always yields one row", 1, rows.size());
        assertEquals(Tuple.of(0L, null), rows.get(0));
        assertEquals(1L, aggregate.getEstimatedRowCount());
    }

    @Test
    public void testGroupedAggregateOverEmptyInput() {
        HashAggregate aggregate = new HashAggregate(Collections.singletonList(REGION),
                Collections.singletonList(AggregateCall.countStar()), new RowSource(SALES, Collections.emptyList()));

        assertTrue(TestFixtures.drain(aggregate).isEmpty());
    }

    @Test
    public void testNullKeysFormOneGroup() {
        List<Tuple> rows = Arrays.asList(Tuple.of(null, 1L), Tuple.of("east", 2L), Tuple.of(null, 3L));
        HashAggregate aggregate = new HashAggregate(Collections.singletonList(REGION),
                Collections.singletonList(new AggregateCall(AggregateFunction.SUM, AMOUNT, false)),
                new RowSource(SALES, rows));

        List<Tuple> groups = TestFixtures.drain(aggregate);
        assertEquals(2, groups.size());
        assertEquals(Tuple.of(null, 4L), groups.get(0));
    }

    @Test
    public void testCloseWithoutNextReleasesState() {
        RowSource source = new RowSource(SALES, ROWS);
        HashAggregate aggregate = new HashAggregate(Collections.singletonList(REGION),
                Collections.singletonList(AggregateCall.countStar()), source);

        aggregate.open();
        assertTrue(aggregate.hasBufferedState());
        aggregate.close();

        assertFalse(aggregate.hasBufferedState());
        assertEquals(OperatorState.CLOSED, source.getState());
    }
}
