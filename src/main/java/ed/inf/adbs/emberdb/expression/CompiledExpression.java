package ed.inf.adbs.emberdb.expression;

import ed.inf.adbs.emberdb.Tuple;

/**
 * A scalar expression compiled into a closure over input rows.
 */
@FunctionalInterface
public interface CompiledExpression {

    /**
     * @param row The input row, laid out as the schema the expression was bound against.
     * @return The value, null for SQL NULL.
     */
    Object evaluate(Tuple row);
}
