package ed.inf.adbs.emberdb.plan;

import ed.inf.adbs.emberdb.catalog.Schema;
import ed.inf.adbs.emberdb.expression.ScalarExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Computes one output column per expression, named by the matching entry of {@code names}.
 */
public final class ProjectNode extends LogicalOperator {

    private final List<ScalarExpression> expressions;
    private final List<String> names;

    public ProjectNode(List<ScalarExpression> expressions, List<String> names, LogicalOperator child) {
        super(Collections.singletonList(child));
        if (expressions.size() != names.size()) {
            throw new IllegalArgumentException("Every projected expression needs a name");
        }
        this.expressions = Collections.unmodifiableList(new ArrayList<>(expressions));
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
        initSchema();
    }

    public List<ScalarExpression> getExpressions() {
        return expressions;
    }

    public List<String> getNames() {
        return names;
    }

    @Override
    protected Schema deriveSchema() {
        return SchemaDerivations.project(expressions, names, getChild(0).getSchema());
    }

    @Override
    public LogicalOperatorType getType() {
        return LogicalOperatorType.PROJECT;
    }

    @Override
    public String describe() {
        List<String> items = new ArrayList<>();
        for (int i = 0; i < expressions.size(); i++) {
            String rendered = expressions.get(i).toString();
            String name = names.get(i);
            items.add(rendered.equals(name) || rendered.endsWith("." + name) ? rendered : rendered + " AS " + name);
        }
        return "Project(" + String.join(", ", items) + ")";
    }

    @Override
    public LogicalOperator withChildren(List<LogicalOperator> newChildren) {
        checkArity(newChildren, 1);
        return new ProjectNode(expressions, names, newChildren.get(0));
    }
}
