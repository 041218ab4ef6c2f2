package ed.inf.adbs.emberdb.plan;

/**
 * Renders a logical plan as an indented tree, one node per line, root first.
 */
public final class PlanPrinter {

    private PlanPrinter() {
    }

    public static String print(LogicalOperator root) {
        StringBuilder sb = new StringBuilder();
        print(root, 0, sb);
        return sb.toString();
    }

    private static void print(LogicalOperator node, int depth, StringBuilder sb) {
        for (int i = 0; i < depth; i++) {
            sb.append("  ");
        }
        sb.append(node.describe()).append(" -> ").append(node.getSchema()).append('\n');
        for (LogicalOperator child : node.getChildren()) {
            print(child, depth + 1, sb);
        }
    }
}
