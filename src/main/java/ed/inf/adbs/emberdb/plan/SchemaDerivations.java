package ed.inf.adbs.emberdb.plan;

import ed.inf.adbs.emberdb.catalog.Field;
import ed.inf.adbs.emberdb.catalog.Schema;
import ed.inf.adbs.emberdb.exception.UnresolvedReferenceException;
import ed.inf.adbs.emberdb.expression.AggregateCall;
import ed.inf.adbs.emberdb.expression.ColumnReference;
import ed.inf.adbs.emberdb.expression.ScalarExpression;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Output schema rules shared by logical nodes and the physical operators lowered from them,
 * so that both sides of a lowering derive identical schemas from identical parameters.
 */
public final class SchemaDerivations {

    private SchemaDerivations() {
    }

    public static Schema scan(Schema tableSchema, String referenceName) {
        return tableSchema.withQualifier(referenceName);
    }

    /**
     * A plain column keeps its field when projected under its own name;
     * anything else becomes an unqualified field named by its alias.
     */
    public static Schema project(List<ScalarExpression> expressions, List<String> names, Schema input) {
        List<Field> fields = new ArrayList<>();
        for (int i = 0; i < expressions.size(); i++) {
            ScalarExpression expression = expressions.get(i);
            String name = names.get(i);
            if (expression instanceof ColumnReference) {
                Field source = input.getField(((ColumnReference) expression).getIndex());
                if (source.getName().equals(name)) {
                    fields.add(source);
                    continue;
                }
            }
            fields.add(new Field(null, name, expression.getType()));
        }
        return new Schema(fields);
    }

    /**
     * Group keys first, then one column per aggregate named after the call.
     */
    public static Schema aggregate(List<ColumnReference> keys, List<AggregateCall> aggregates, Schema input) {
        List<Field> fields = new ArrayList<>();
        for (ColumnReference key : keys) {
            fields.add(input.getField(key.getIndex()));
        }
        for (AggregateCall call : aggregates) {
            fields.add(new Field(null, call.toString(), call.getType()));
        }
        return new Schema(fields);
    }

    /**
     * Left columns then right columns, without the right-hand copies of USING columns.
     */
    public static Schema join(Schema left, Schema right, List<String> usingColumns) {
        Set<Integer> dropped = new HashSet<>(usingIndices(right, usingColumns));
        List<Field> fields = new ArrayList<>(left.getFields());
        for (int i = 0; i < right.size(); i++) {
            if (!dropped.contains(i)) {
                fields.add(right.getField(i));
            }
        }
        return new Schema(fields);
    }

    /**
     * Resolves USING column names against one join input.
     * @return The positions of the columns, in USING order.
     * @throws UnresolvedReferenceException If a column is missing or ambiguous on that side.
     */
    public static List<Integer> usingIndices(Schema side, List<String> usingColumns) {
        List<Integer> indices = new ArrayList<>();
        for (String column : usingColumns) {
            int index = side.indexOf(null, column);
            if (index < 0) {
                throw new UnresolvedReferenceException(column, "USING column " + column + " not found in " + side);
            }
            indices.add(index);
        }
        return indices;
    }
}
