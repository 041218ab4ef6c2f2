package ed.inf.adbs.emberdb.expression;

import ed.inf.adbs.emberdb.catalog.DataType;
import ed.inf.adbs.emberdb.catalog.Field;

import java.util.Collections;
import java.util.List;

/**
 * A reference to the column at a fixed position of the input row.
 * The qualifier and name are kept for display and for naming projected columns.
 */
public final class ColumnReference extends ScalarExpression {

    private final int index;
    private final String qualifier;
    private final String name;
    private final DataType type;

    public ColumnReference(int index, String qualifier, String name, DataType type) {
        if (index < 0) {
            throw new IllegalArgumentException("Column index must not be negative: " + index);
        }
        this.index = index;
        this.qualifier = qualifier;
        this.name = name;
        this.type = type;
    }

    /**
     * @param index The position of the field in the input schema.
     * @param field The field at that position.
     * @return A reference to it.
     */
    public static ColumnReference of(int index, Field field) {
        return new ColumnReference(index, field.getQualifier(), field.getName(), field.getType());
    }

    public int getIndex() {
        return index;
    }

    public String getQualifier() {
        return qualifier;
    }

    public String getName() {
        return name;
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.COLUMN;
    }

    @Override
    public DataType getType() {
        return type;
    }

    @Override
    public List<ScalarExpression> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public String digest() {
        return "$" + index + ":" + type.name();
    }

    @Override
    public String toString() {
        return qualifier == null ? name : qualifier + "." + name;
    }
}
