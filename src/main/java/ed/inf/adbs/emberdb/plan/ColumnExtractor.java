package ed.inf.adbs.emberdb.plan;

import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.schema.Column;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects every column reference of a parsed expression, in visiting order.
 * The plan builder uses it to find which tables a WHERE conjunct depends on.
 */
public class ColumnExtractor extends ExpressionVisitorAdapter {

    private final List<Column> columns = new ArrayList<>();

    @Override
    public void visit(Column column) {
        columns.add(column);
    }

    public List<Column> getColumns() {
        return columns;
    }
}
