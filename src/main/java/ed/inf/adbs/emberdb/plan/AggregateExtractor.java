package ed.inf.adbs.emberdb.plan;

import ed.inf.adbs.emberdb.expression.AggregateFunction;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.Function;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the outermost aggregate function calls of a parsed expression.
 * Arguments are not searched: a nested aggregate is reported when the call is bound.
 */
public class AggregateExtractor extends ExpressionVisitorAdapter {

    private final List<Function> aggregates = new ArrayList<>();

    /**
     * @param expression A parsed expression, may be null.
     * @return The aggregate calls it contains.
     */
    public static List<Function> extract(Expression expression) {
        AggregateExtractor extractor = new AggregateExtractor();
        if (expression != null) {
            expression.accept(extractor);
        }
        return extractor.getAggregates();
    }

    public static boolean containsAggregate(Expression expression) {
        return !extract(expression).isEmpty();
    }

    @Override
    public void visit(Function function) {
        if (AggregateFunction.fromName(function.getName()) != null) {
            aggregates.add(function);
        } else {
            super.visit(function);
        }
    }

    public List<Function> getAggregates() {
        return aggregates;
    }
}
