package ed.inf.adbs.emberdb;

import ed.inf.adbs.emberdb.expression.CompiledExpression;
import ed.inf.adbs.emberdb.expression.ExpressionCompiler;
import ed.inf.adbs.emberdb.plan.SortKey;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders tuples by a list of sort keys.
 * Each key is evaluated on both tuples; the first key that differs decides.
 * NULL is placed before or after every value as the key says, independently of the direction.
 * @see ed.inf.adbs.emberdb.operator.SortExec
 */
public class TupleComparator implements Comparator<Tuple> {

    private final List<CompiledExpression> keys = new ArrayList<>();
    private final boolean[] ascending;
    private final boolean[] nullsFirst;

    /**
     * @param sortKeys The keys in ORDER BY precedence, bound against the sorted rows.
     */
    public TupleComparator(List<SortKey> sortKeys) {
        this.ascending = new boolean[sortKeys.size()];
        this.nullsFirst = new boolean[sortKeys.size()];
        for (int i = 0; i < sortKeys.size(); i++) {
            SortKey key = sortKeys.get(i);
            keys.add(ExpressionCompiler.compile(key.getExpression()));
            ascending[i] = key.isAscending();
            nullsFirst[i] = key.isNullsFirst();
        }
    }

    @Override
    public int compare(Tuple t1, Tuple t2) {
        for (int i = 0; i < keys.size(); i++) {
            Object value1 = keys.get(i).evaluate(t1);
            Object value2 = keys.get(i).evaluate(t2);

            if (value1 == null || value2 == null) {
                if (value1 == value2) {
                    continue;
                }
                return (value1 == null) == nullsFirst[i] ? -1 : 1;
            }
            int cmp = Values.compare(value1, value2);
            if (cmp != 0) {
                return ascending[i] ? cmp : -cmp;
            }
        }
        return 0;
    }
}
