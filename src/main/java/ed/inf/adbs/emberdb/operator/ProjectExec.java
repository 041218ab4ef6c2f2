package ed.inf.adbs.emberdb.operator;

import ed.inf.adbs.emberdb.Tuple;
import ed.inf.adbs.emberdb.expression.CompiledExpression;
import ed.inf.adbs.emberdb.expression.ExpressionCompiler;
import ed.inf.adbs.emberdb.expression.ScalarExpression;
import ed.inf.adbs.emberdb.plan.SchemaDerivations;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Evaluates the projection expressions over each child row.
 */
public class ProjectExec extends PhysicalOperator {

    private final List<ScalarExpression> expressions;
    private final List<CompiledExpression> compiled = new ArrayList<>();

    public ProjectExec(List<ScalarExpression> expressions, List<String> names, PhysicalOperator child) {
        super(SchemaDerivations.project(expressions, names, child.getSchema()),
                Collections.singletonList(child), child.getEstimatedRowCount());
        this.expressions = expressions;
        for (ScalarExpression expression : expressions) {
            compiled.add(ExpressionCompiler.compile(expression));
        }
    }

    @Override
    public PhysicalOperatorType getType() {
        return PhysicalOperatorType.PROJECT;
    }

    @Override
    protected String describeParameters() {
        return expressions.toString();
    }

    @Override
    protected void doOpen() {
    }

    @Override
    protected Tuple doNext() {
        Tuple tuple = getChild(0).next();
        if (tuple == null) {
            return null;
        }
        List<Object> values = new ArrayList<>(compiled.size());
        for (CompiledExpression expression : compiled) {
            values.add(expression.evaluate(tuple));
        }
        return new Tuple(values);
    }

    @Override
    protected void doClose() {
    }
}
