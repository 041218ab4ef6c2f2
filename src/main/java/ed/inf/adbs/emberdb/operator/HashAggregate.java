package ed.inf.adbs.emberdb.operator;

import ed.inf.adbs.emberdb.Tuple;
import ed.inf.adbs.emberdb.expression.Accumulator;
import ed.inf.adbs.emberdb.expression.AggregateCall;
import ed.inf.adbs.emberdb.expression.ColumnReference;
import ed.inf.adbs.emberdb.expression.CompiledExpression;
import ed.inf.adbs.emberdb.expression.ExpressionCompiler;
import ed.inf.adbs.emberdb.plan.SchemaDerivations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hash-based grouping and aggregation.
 * Open drains the child into a table from group key to one accumulator per aggregate;
 * next then emits one row per group, in order of first appearance. NULL keys form a group
 * of their own. Without group keys the whole input is one group, so an empty input still
 * yields a single row.
 */
public class HashAggregate extends PhysicalOperator {

    private static final Logger logger = LoggerFactory.getLogger(HashAggregate.class);

    private final List<ColumnReference> groupKeys;
    private final List<AggregateCall> aggregates;
    private final List<CompiledExpression> arguments = new ArrayList<>();

    private Map<List<Object>, Accumulator[]> groups;
    private Iterator<Map.Entry<List<Object>, Accumulator[]>> output;

    public HashAggregate(List<ColumnReference> groupKeys, List<AggregateCall> aggregates, PhysicalOperator child) {
        super(SchemaDerivations.aggregate(groupKeys, aggregates, child.getSchema()), Collections.singletonList(child),
                RowEstimates.aggregate(child.getEstimatedRowCount(), !groupKeys.isEmpty()));
        this.groupKeys = groupKeys;
        this.aggregates = aggregates;
        for (AggregateCall call : aggregates) {
            // COUNT(*) counts every row: feed it a non-null marker
            arguments.add(call.getArgument() == null
                    ? row -> Boolean.TRUE
                    : ExpressionCompiler.compile(call.getArgument()));
        }
    }

    @Override
    public PhysicalOperatorType getType() {
        return PhysicalOperatorType.HASH_AGGREGATE;
    }

    @Override
    protected String describeParameters() {
        return "keys=" + groupKeys + ", aggregates=" + aggregates;
    }

    @Override
    protected void doOpen() {
        groups = new LinkedHashMap<>();
        Tuple tuple;
        long rows = 0;
        while ((tuple = getChild(0).next()) != null) {
            Object[] key = new Object[groupKeys.size()];
            for (int i = 0; i < key.length; i++) {
                key[i] = tuple.getAttribute(groupKeys.get(i).getIndex());
            }
            Accumulator[] state = groups.computeIfAbsent(Arrays.asList(key), k -> newState());
            for (int i = 0; i < state.length; i++) {
                state[i].add(arguments.get(i).evaluate(tuple));
            }
            rows++;
        }
        if (groups.isEmpty() && groupKeys.isEmpty()) {
            groups.put(Collections.emptyList(), newState());
        }
        logger.debug("HashAggregate built {} groups from {} rows", groups.size(), rows);
        output = groups.entrySet().iterator();
    }

    private Accumulator[] newState() {
        Accumulator[] state = new Accumulator[aggregates.size()];
        for (int i = 0; i < state.length; i++) {
            state[i] = Accumulator.create(aggregates.get(i));
        }
        return state;
    }

    @Override
    protected Tuple doNext() {
        if (!output.hasNext()) {
            return null;
        }
        Map.Entry<List<Object>, Accumulator[]> group = output.next();
        List<Object> values = new ArrayList<>(group.getKey());
        for (Accumulator accumulator : group.getValue()) {
            values.add(accumulator.result());
        }
        return new Tuple(values);
    }

    @Override
    protected void doClose() {
        groups = null;
        output = null;
    }

    /**
     * @return true while the group table is held in memory.
     */
    public boolean hasBufferedState() {
        return groups != null;
    }
}
