package ed.inf.adbs.emberdb.plan;

import ed.inf.adbs.emberdb.catalog.DataType;
import ed.inf.adbs.emberdb.catalog.Schema;
import ed.inf.adbs.emberdb.exception.PlanningException;
import ed.inf.adbs.emberdb.exception.TypeMismatchException;
import ed.inf.adbs.emberdb.exception.UnresolvedReferenceException;
import ed.inf.adbs.emberdb.expression.AggregateCall;
import ed.inf.adbs.emberdb.expression.AggregateFunction;
import ed.inf.adbs.emberdb.expression.ArithmeticExpression;
import ed.inf.adbs.emberdb.expression.ArithmeticOperator;
import ed.inf.adbs.emberdb.expression.BooleanExpression;
import ed.inf.adbs.emberdb.expression.ColumnReference;
import ed.inf.adbs.emberdb.expression.ComparisonExpression;
import ed.inf.adbs.emberdb.expression.ComparisonOperator;
import ed.inf.adbs.emberdb.expression.Literal;
import ed.inf.adbs.emberdb.expression.NullTestExpression;
import ed.inf.adbs.emberdb.expression.ScalarExpression;
import net.sf.jsqlparser.expression.BinaryExpression;
import net.sf.jsqlparser.expression.DoubleValue;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.NullValue;
import net.sf.jsqlparser.expression.SignedExpression;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.operators.arithmetic.Addition;
import net.sf.jsqlparser.expression.operators.arithmetic.Division;
import net.sf.jsqlparser.expression.operators.arithmetic.Multiplication;
import net.sf.jsqlparser.expression.operators.arithmetic.Subtraction;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.conditional.OrExpression;
import net.sf.jsqlparser.expression.operators.relational.EqualsTo;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.expression.operators.relational.GreaterThan;
import net.sf.jsqlparser.expression.operators.relational.GreaterThanEquals;
import net.sf.jsqlparser.expression.operators.relational.IsNullExpression;
import net.sf.jsqlparser.expression.operators.relational.MinorThan;
import net.sf.jsqlparser.expression.operators.relational.MinorThanEquals;
import net.sf.jsqlparser.expression.operators.relational.NotEqualsTo;
import net.sf.jsqlparser.expression.operators.relational.ParenthesedExpressionList;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.statement.select.AllColumns;

import java.util.List;

/**
 * Binds parsed JSqlParser expressions to {@link ScalarExpression}s over a schema,
 * resolving column names to positions and checking operand types.
 * <p>
 * A binder works in one of two scopes. The plain scope resolves columns against a schema
 * and rejects aggregate functions. The aggregate scope binds expressions evaluated above a
 * {@link GroupAggregateNode}: columns must be group keys and aggregate calls are mapped to
 * the node's aggregate output columns.
 */
public class ExpressionBinder {

    private final Schema schema;
    private final String context;

    // Aggregate scope only
    private final Schema aggregateInput;
    private final List<AggregateCall> aggregates;
    private final int keyCount;

    private ExpressionBinder(Schema schema, String context, Schema aggregateInput,
                             List<AggregateCall> aggregates, int keyCount) {
        this.schema = schema;
        this.context = context;
        this.aggregateInput = aggregateInput;
        this.aggregates = aggregates;
        this.keyCount = keyCount;
    }

    /**
     * @param schema The schema columns resolve against.
     * @param context The clause being bound, used in error messages.
     */
    public static ExpressionBinder forSchema(Schema schema, String context) {
        return new ExpressionBinder(schema, context, null, null, 0);
    }

    /**
     * @param node The aggregate whose output the bound expressions read.
     * @param context The clause being bound, used in error messages.
     */
    public static ExpressionBinder forAggregate(GroupAggregateNode node, String context) {
        return new ExpressionBinder(node.getSchema(), context, node.getChild(0).getSchema(),
                node.getAggregates(), node.getGroupKeys().size());
    }

    public Schema getSchema() {
        return schema;
    }

    /**
     * Binds an expression that must evaluate to BOOLEAN.
     * @throws TypeMismatchException If it does not.
     */
    public ScalarExpression bindPredicate(Expression expression) {
        ScalarExpression bound = bind(expression);
        if (bound.getType() != DataType.BOOLEAN) {
            throw new TypeMismatchException(context + " predicate must be BOOLEAN, got "
                    + bound.getType() + ": " + expression);
        }
        return bound;
    }

    /**
     * @param expression A parsed expression.
     * @return The bound, type-checked expression.
     * @throws UnresolvedReferenceException On unknown or ambiguous columns and unknown functions.
     * @throws TypeMismatchException On ill-typed operands or misplaced aggregates.
     */
    public ScalarExpression bind(Expression expression) {
        if (expression instanceof Column) {
            return bindColumn((Column) expression);
        }
        if (expression instanceof LongValue) {
            return Literal.of(((LongValue) expression).getValue());
        }
        if (expression instanceof DoubleValue) {
            return Literal.of(((DoubleValue) expression).getValue());
        }
        if (expression instanceof StringValue) {
            return Literal.of(((StringValue) expression).getValue());
        }
        if (expression instanceof NullValue) {
            throw new TypeMismatchException("Untyped NULL literal in " + context + "; use IS NULL to test for NULL");
        }
        if (expression instanceof SignedExpression) {
            return bindSigned((SignedExpression) expression);
        }
        if (expression instanceof ParenthesedExpressionList) {
            ParenthesedExpressionList<?> list = (ParenthesedExpressionList<?>) expression;
            if (list.size() != 1) {
                throw new PlanningException("Row values are not supported: " + expression);
            }
            return bind(list.get(0));
        }
        if (expression instanceof AndExpression) {
            AndExpression and = (AndExpression) expression;
            return BooleanExpression.and(bindBoolean(and.getLeftExpression()), bindBoolean(and.getRightExpression()));
        }
        if (expression instanceof OrExpression) {
            OrExpression or = (OrExpression) expression;
            return BooleanExpression.or(bindBoolean(or.getLeftExpression()), bindBoolean(or.getRightExpression()));
        }
        if (expression instanceof net.sf.jsqlparser.expression.NotExpression) {
            Expression operand = ((net.sf.jsqlparser.expression.NotExpression) expression).getExpression();
            return new ed.inf.adbs.emberdb.expression.NotExpression(bindBoolean(operand));
        }
        if (expression instanceof IsNullExpression) {
            IsNullExpression isNull = (IsNullExpression) expression;
            return new NullTestExpression(bind(isNull.getLeftExpression()), isNull.isNot());
        }
        if (expression instanceof BinaryExpression) {
            ComparisonOperator comparison = comparisonOperator(expression);
            if (comparison != null) {
                BinaryExpression binary = (BinaryExpression) expression;
                return compare(comparison, bind(binary.getLeftExpression()), bind(binary.getRightExpression()));
            }
            ArithmeticOperator arithmetic = arithmeticOperator(expression);
            if (arithmetic != null) {
                BinaryExpression binary = (BinaryExpression) expression;
                return arithmetic(arithmetic, bind(binary.getLeftExpression()), bind(binary.getRightExpression()));
            }
        }
        if (expression instanceof Function) {
            return bindFunction((Function) expression);
        }
        throw new PlanningException("Unsupported expression in " + context + ": " + expression);
    }

    /**
     * Binds an aggregate call whose argument is evaluated over this binder's schema.
     * @param function A parsed call to COUNT, SUM, AVG, MIN or MAX.
     * @return The bound call.
     */
    public AggregateCall bindAggregateCall(Function function) {
        AggregateFunction aggregate = AggregateFunction.fromName(function.getName());
        if (aggregate == null) {
            throw new UnresolvedReferenceException(function.getName(), "Unknown function " + function.getName());
        }
        ExpressionList<?> parameters = function.getParameters();
        boolean star = function.isAllColumns() || parameters == null || parameters.isEmpty()
                || parameters.get(0) instanceof AllColumns;
        if (star) {
            if (aggregate != AggregateFunction.COUNT || function.isDistinct()) {
                throw new TypeMismatchException(function + " is not a valid aggregate");
            }
            return AggregateCall.countStar();
        }
        if (parameters.size() != 1) {
            throw new TypeMismatchException(aggregate + " takes exactly one argument: " + function);
        }
        ScalarExpression argument = forSchema(schema, "argument of " + aggregate).bind(parameters.get(0));
        if (function.isDistinct() && !argument.getType().isHashable()) {
            throw new TypeMismatchException("DISTINCT argument of " + aggregate + " is not hashable: " + argument.getType());
        }
        return new AggregateCall(aggregate, argument, function.isDistinct());
    }

    /**
     * Builds a comparison after checking that its operands are comparable.
     */
    public static ComparisonExpression compare(ComparisonOperator operator, ScalarExpression left, ScalarExpression right) {
        if (!left.getType().isComparableWith(right.getType())) {
            throw new TypeMismatchException("Cannot compare " + left.getType() + " with " + right.getType()
                    + " in " + left + " " + operator.getSymbol() + " " + right);
        }
        if (!left.getType().isOrderable() && !operator.isEquality()) {
            throw new TypeMismatchException(left.getType() + " values only support = and <>: "
                    + left + " " + operator.getSymbol() + " " + right);
        }
        return new ComparisonExpression(operator, left, right);
    }

    private static ArithmeticExpression arithmetic(ArithmeticOperator operator, ScalarExpression left, ScalarExpression right) {
        if (!left.getType().isNumeric() || !right.getType().isNumeric()) {
            throw new TypeMismatchException("Arithmetic needs numeric operands: " + left + " "
                    + operator.getSymbol() + " " + right);
        }
        return new ArithmeticExpression(operator, left, right);
    }

    private ScalarExpression bindBoolean(Expression expression) {
        ScalarExpression bound = bind(expression);
        if (bound.getType() != DataType.BOOLEAN) {
            throw new TypeMismatchException("Logical operand must be BOOLEAN, got " + bound.getType() + ": " + expression);
        }
        return bound;
    }

    private ScalarExpression bindColumn(Column column) {
        String qualifier = column.getTable() != null ? column.getTable().getName() : null;
        String name = column.getColumnName();
        int index = aggregateInput == null ? schema.indexOf(qualifier, name) : indexOfGroupKey(qualifier, name);
        if (index >= 0) {
            return ColumnReference.of(index, schema.getField(index));
        }
        if (qualifier == null && ("true".equalsIgnoreCase(name) || "false".equalsIgnoreCase(name))) {
            return Literal.of(Boolean.parseBoolean(name));
        }
        String reference = column.getFullyQualifiedName();
        if (aggregateInput != null && aggregateInput.indexOf(qualifier, name) >= 0) {
            throw new UnresolvedReferenceException(reference, "Column " + reference
                    + " must appear in GROUP BY or be used in an aggregate function");
        }
        throw new UnresolvedReferenceException(reference, "Unknown column " + reference + " in " + context);
    }

    private int indexOfGroupKey(String qualifier, String name) {
        int index = schema.indexOf(qualifier, name);
        return index < keyCount ? index : -1;
    }

    private ScalarExpression bindSigned(SignedExpression signed) {
        ScalarExpression operand = bind(signed.getExpression());
        if (!operand.getType().isNumeric()) {
            throw new TypeMismatchException("Sign applied to non-numeric " + operand);
        }
        if (signed.getSign() != '-') {
            return operand;
        }
        if (operand instanceof Literal) {
            Object value = ((Literal) operand).getValue();
            return value instanceof Long ? Literal.of(-((Long) value)) : Literal.of(-((Double) value));
        }
        return new ArithmeticExpression(ArithmeticOperator.SUBTRACT, Literal.of(0L), operand);
    }

    private ScalarExpression bindFunction(Function function) {
        AggregateFunction aggregate = AggregateFunction.fromName(function.getName());
        if (aggregate == null) {
            throw new UnresolvedReferenceException(function.getName(), "Unknown function " + function.getName());
        }
        if (aggregateInput == null) {
            throw new TypeMismatchException("Aggregate functions are not allowed in " + context + ": " + function);
        }
        AggregateCall call = forSchema(aggregateInput, context).bindAggregateCall(function);
        int position = aggregates.indexOf(call);
        if (position < 0) {
            throw new PlanningException("Aggregate " + call + " was not collected for " + context);
        }
        int index = keyCount + position;
        return ColumnReference.of(index, schema.getField(index));
    }

    private static ComparisonOperator comparisonOperator(Expression expression) {
        if (expression instanceof EqualsTo) return ComparisonOperator.EQUALS;
        if (expression instanceof NotEqualsTo) return ComparisonOperator.NOT_EQUALS;
        if (expression instanceof GreaterThan) return ComparisonOperator.GREATER_THAN;
        if (expression instanceof GreaterThanEquals) return ComparisonOperator.GREATER_THAN_EQUALS;
        if (expression instanceof MinorThan) return ComparisonOperator.LESS_THAN;
        if (expression instanceof MinorThanEquals) return ComparisonOperator.LESS_THAN_EQUALS;
        return null;
    }

    private static ArithmeticOperator arithmeticOperator(Expression expression) {
        if (expression instanceof Addition) return ArithmeticOperator.ADD;
        if (expression instanceof Subtraction) return ArithmeticOperator.SUBTRACT;
        if (expression instanceof Multiplication) return ArithmeticOperator.MULTIPLY;
        if (expression instanceof Division) return ArithmeticOperator.DIVIDE;
        return null;
    }
}
