package ed.inf.adbs.emberdb.plan;

import ed.inf.adbs.emberdb.catalog.Schema;

import java.util.Collections;
import java.util.List;

/**
 * A node of a logical plan: relational intent without an execution strategy.
 * Nodes are immutable. The output schema is derived once, in the constructor, from the
 * children's schemas and the node's own parameters; replacing a subtree means building a
 * new node through {@link #withChildren(List)}, which derives the schema again.
 * Each node owns its children exclusively.
 */
public abstract class LogicalOperator {

    private final List<LogicalOperator> children;
    private Schema schema;

    protected LogicalOperator(List<LogicalOperator> children) {
        this.children = Collections.unmodifiableList(children);
    }

    /**
     * Called at the end of each subclass constructor, once its parameters are set.
     */
    protected final void initSchema() {
        this.schema = deriveSchema();
    }

    protected abstract Schema deriveSchema();

    public abstract LogicalOperatorType getType();

    /**
     * @return A one-line rendering of the node and its parameters, without children.
     */
    public abstract String describe();

    /**
     * @param newChildren Replacement children, as many as this node has.
     * @return A copy of this node over the given children.
     */
    public abstract LogicalOperator withChildren(List<LogicalOperator> newChildren);

    public List<LogicalOperator> getChildren() {
        return children;
    }

    public LogicalOperator getChild(int index) {
        return children.get(index);
    }

    public Schema getSchema() {
        return schema;
    }

    protected static void checkArity(List<LogicalOperator> newChildren, int expected) {
        if (newChildren.size() != expected) {
            throw new IllegalArgumentException("Expected " + expected + " children, got " + newChildren.size());
        }
    }

    @Override
    public String toString() {
        return describe();
    }
}
