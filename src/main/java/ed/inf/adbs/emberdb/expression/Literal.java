package ed.inf.adbs.emberdb.expression;

import ed.inf.adbs.emberdb.Values;
import ed.inf.adbs.emberdb.catalog.DataType;

import java.util.Collections;
import java.util.List;

/**
 * A constant value. Literals are never NULL: an untyped NULL is rejected by the binder.
 */
public final class Literal extends ScalarExpression {

    private final Object value;
    private final DataType type;

    public Literal(Object value, DataType type) {
        if (value == null || !type.getJavaType().isInstance(value)) {
            throw new IllegalArgumentException("Value " + value + " is not a " + type);
        }
        this.value = value;
        this.type = type;
    }

    public static Literal of(long value) {
        return new Literal(value, DataType.INTEGER);
    }

    public static Literal of(double value) {
        return new Literal(value, DataType.DOUBLE);
    }

    public static Literal of(String value) {
        return new Literal(value, DataType.STRING);
    }

    public static Literal of(boolean value) {
        return new Literal(value, DataType.BOOLEAN);
    }

    public Object getValue() {
        return value;
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.LITERAL;
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
        return type.name() + "'" + Values.format(value) + "'";
    }

    @Override
    public String toString() {
        return type == DataType.STRING ? "'" + value + "'" : Values.format(value);
    }
}
