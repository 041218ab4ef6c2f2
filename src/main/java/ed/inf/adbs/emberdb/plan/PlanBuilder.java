package ed.inf.adbs.emberdb.plan;

import ed.inf.adbs.emberdb.catalog.Catalog;
import ed.inf.adbs.emberdb.catalog.Field;
import ed.inf.adbs.emberdb.catalog.Schema;
import ed.inf.adbs.emberdb.exception.PlanningException;
import ed.inf.adbs.emberdb.exception.TypeMismatchException;
import ed.inf.adbs.emberdb.exception.UnresolvedReferenceException;
import ed.inf.adbs.emberdb.expression.AggregateCall;
import ed.inf.adbs.emberdb.expression.BooleanExpression;
import ed.inf.adbs.emberdb.expression.ColumnReference;
import ed.inf.adbs.emberdb.expression.ComparisonOperator;
import ed.inf.adbs.emberdb.expression.ScalarExpression;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.operators.relational.EqualsTo;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.AllColumns;
import net.sf.jsqlparser.statement.select.AllTableColumns;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.GroupByElement;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.Limit;
import net.sf.jsqlparser.statement.select.Offset;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.SelectItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * The PlanBuilder translates a parsed SELECT statement into a logical plan.
 * <p>
 * Tables are resolved first, in FROM order, into {@link ScanNode}s; the join tree is left-deep
 * in the same order. WHERE conjuncts are placed as low as the tables they reference allow:
 * single-table conjuncts sit directly above their scan, and equalities between a comma-joined
 * table and the tables before it become that join's condition. Conjuncts over a table on the
 * null-supplying side of an outer join stay above that join.
 * <p>
 * Above the join tree come, in order: GroupAggregate and HAVING filter, Project,
 * DISTINCT (a GroupAggregate without aggregates), Sort and Limit. ORDER BY keys are resolved
 * against the select list first; keys that only make sense over the projection input put the
 * Sort beneath the Project instead.
 * <p>
 * Building performs no I/O: the catalog is only asked for table schemas.
 */
public class PlanBuilder {

    private static final Logger logger = LoggerFactory.getLogger(PlanBuilder.class);

    private final Catalog catalog;

    public PlanBuilder(Catalog catalog) {
        this.catalog = catalog;
    }

    /**
     * @param statement A parsed statement.
     * @return The logical plan.
     * @throws PlanningException If the statement is not a plain SELECT, or cannot be planned.
     */
    public LogicalOperator build(Statement statement) {
        if (!(statement instanceof PlainSelect)) {
            throw new PlanningException("Only plain SELECT statements are supported: " + statement);
        }
        return build((PlainSelect) statement);
    }

    /**
     * @param select A parsed SELECT.
     * @return The logical plan.
     * @throws UnresolvedReferenceException On unknown tables, columns or functions.
     * @throws TypeMismatchException On ill-typed predicates, operands or clauses.
     */
    public LogicalOperator build(PlainSelect select) {
        checkSupported(select);

        List<TableReference> tables = resolveTables(select);
        LogicalOperator plan = buildJoinTree(select, tables);
        plan = buildSelectList(select, plan);
        plan = buildLimit(select, plan);

        if (logger.isDebugEnabled()) {
            logger.debug("Logical plan for [{}]:\n{}", select, PlanPrinter.print(plan));
        }
        return plan;
    }

    private static void checkSupported(PlainSelect select) {
        if (select.getFromItem() == null) {
            throw new PlanningException("SELECT without FROM is not supported: " + select);
        }
        if (select.getDistinct() != null && select.getDistinct().getOnSelectItems() != null
                && !select.getDistinct().getOnSelectItems().isEmpty()) {
            throw new PlanningException("DISTINCT ON is not supported: " + select);
        }
        if (select.getFetch() != null || select.getTop() != null) {
            throw new PlanningException("Use LIMIT and OFFSET instead of FETCH or TOP: " + select);
        }
    }

    // ---------------------------------------------------------------------------------
    // FROM and WHERE
    // ---------------------------------------------------------------------------------

    /**
     * A table of the FROM clause with the join that brought it in (null for the first table).
     */
    private static final class TableReference {
        final ScanNode scan;
        final Join join;
        final JoinType joinType;

        TableReference(ScanNode scan, Join join, JoinType joinType) {
            this.scan = scan;
            this.join = join;
            this.joinType = joinType;
        }

        boolean isCrossJoin() {
            return join != null && joinType == JoinType.INNER && !join.isNatural()
                    && (join.getUsingColumns() == null || join.getUsingColumns().isEmpty())
                    && onExpressions(join).isEmpty();
        }
    }

    private List<TableReference> resolveTables(PlainSelect select) {
        List<TableReference> tables = new ArrayList<>();
        tables.add(new TableReference(resolveTable(select.getFromItem()), null, null));
        if (select.getJoins() != null) {
            for (Join join : select.getJoins()) {
                tables.add(new TableReference(resolveTable(join.getRightItem()), join, joinType(join)));
            }
        }

        Set<String> referenceNames = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (TableReference table : tables) {
            String name = table.scan.getReferenceName();
            if (!referenceNames.add(name)) {
                throw new UnresolvedReferenceException(name, "Table name " + name
                        + " is specified more than once; use an alias");
            }
        }
        return tables;
    }

    private ScanNode resolveTable(FromItem item) {
        if (!(item instanceof Table)) {
            throw new PlanningException("Only base tables are supported in FROM: " + item);
        }
        Table table = (Table) item;
        String name = table.getName();
        if (!catalog.hasTable(name)) {
            throw new UnresolvedReferenceException(name, "Unknown table " + name);
        }
        String alias = table.getAlias() != null ? table.getAlias().getName() : null;
        return new ScanNode(name, alias, catalog.schemaOf(name));
    }

    private static JoinType joinType(Join join) {
        if (join.isFull()) {
            return JoinType.FULL;
        }
        if (join.isLeft()) {
            return JoinType.LEFT;
        }
        if (join.isRight()) {
            return JoinType.RIGHT;
        }
        return JoinType.INNER;
    }

    private static Collection<Expression> onExpressions(Join join) {
        Collection<Expression> on = join.getOnExpressions();
        return on == null ? Collections.emptyList() : on;
    }

    private LogicalOperator buildJoinTree(PlainSelect select, List<TableReference> tables) {
        int n = tables.size();

        // Position of the last join that pads each table with NULLs, -1 if none does
        int[] lastNullSupplier = new int[n];
        Arrays.fill(lastNullSupplier, -1);
        for (int j = 1; j < n; j++) {
            JoinType type = tables.get(j).joinType;
            if (type.preservesLeft()) {
                lastNullSupplier[j] = j;
            }
            if (type.preservesRight()) {
                for (int i = 0; i < j; i++) {
                    lastNullSupplier[i] = j;
                }
            }
        }

        List<List<Expression>> scanConjuncts = emptyLists(n);
        List<List<Expression>> joinConjuncts = emptyLists(n);
        List<List<Expression>> levelConjuncts = emptyLists(n);
        List<Expression> topConjuncts = new ArrayList<>();

        for (Expression conjunct : ConditionSplitter.split(select.getWhere())) {
            if (AggregateExtractor.containsAggregate(conjunct)) {
                throw new TypeMismatchException("Aggregate functions are not allowed in WHERE: " + conjunct);
            }
            Set<Integer> referenced = referencedTables(conjunct, tables);
            if (referenced == null) {
                topConjuncts.add(conjunct);
                continue;
            }
            int level = 0;
            for (int t : referenced) {
                level = Math.max(level, Math.max(t, lastNullSupplier[t]));
            }
            int only = referenced.iterator().next();
            if (referenced.size() == 1 && lastNullSupplier[only] < 0) {
                scanConjuncts.get(only).add(conjunct);
            } else if (referenced.size() == 2 && referenced.contains(level)
                    && tables.get(level).isCrossJoin() && isColumnEquality(conjunct)) {
                joinConjuncts.get(level).add(conjunct);
            } else {
                levelConjuncts.get(level).add(conjunct);
            }
        }

        LogicalOperator plan = withFilter(tables.get(0).scan, scanConjuncts.get(0));
        for (int j = 1; j < n; j++) {
            TableReference table = tables.get(j);
            LogicalOperator right = withFilter(table.scan, scanConjuncts.get(j));
            plan = buildJoin(plan, right, table, joinConjuncts.get(j));
            plan = withFilter(plan, levelConjuncts.get(j));
        }
        return withFilter(plan, topConjuncts);
    }

    private static List<List<Expression>> emptyLists(int n) {
        List<List<Expression>> lists = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            lists.add(new ArrayList<>());
        }
        return lists;
    }

    private static boolean isColumnEquality(Expression conjunct) {
        return conjunct instanceof EqualsTo
                && ((EqualsTo) conjunct).getLeftExpression() instanceof Column
                && ((EqualsTo) conjunct).getRightExpression() instanceof Column;
    }

    /**
     * @return The positions of the tables the expression reads, or null if that cannot be
     * decided (no columns, or a column that is unknown or ambiguous at this stage).
     */
    private static Set<Integer> referencedTables(Expression expression, List<TableReference> tables) {
        ColumnExtractor extractor = new ColumnExtractor();
        expression.accept(extractor);
        Set<Integer> referenced = new TreeSet<>();
        for (Column column : extractor.getColumns()) {
            String qualifier = column.getTable() != null ? column.getTable().getName() : null;
            int owner = -1;
            for (int i = 0; i < tables.size(); i++) {
                ScanNode scan = tables.get(i).scan;
                if (qualifier != null && !qualifier.equalsIgnoreCase(scan.getReferenceName())) {
                    continue;
                }
                if (scan.getSchema().indexOf(qualifier, column.getColumnName()) >= 0) {
                    if (owner >= 0) {
                        return null;
                    }
                    owner = i;
                }
            }
            if (owner < 0) {
                return null;
            }
            referenced.add(owner);
        }
        return referenced.isEmpty() ? null : referenced;
    }

    private static LogicalOperator withFilter(LogicalOperator node, List<Expression> conjuncts) {
        if (conjuncts.isEmpty()) {
            return node;
        }
        ExpressionBinder binder = ExpressionBinder.forSchema(node.getSchema(), "WHERE");
        List<ScalarExpression> bound = new ArrayList<>();
        for (Expression conjunct : conjuncts) {
            bound.add(binder.bindPredicate(conjunct));
        }
        return new FilterNode(BooleanExpression.conjunction(bound), node);
    }

    private static LogicalOperator buildJoin(LogicalOperator left, LogicalOperator right, TableReference table,
                                             List<Expression> crossConjuncts) {
        Join join = table.join;
        Schema leftSchema = left.getSchema();
        Schema rightSchema = right.getSchema();

        if (join.isNatural() || (join.getUsingColumns() != null && !join.getUsingColumns().isEmpty())) {
            List<String> using = new ArrayList<>();
            if (join.isNatural()) {
                using.addAll(commonColumnNames(leftSchema, rightSchema));
            } else {
                for (Column column : join.getUsingColumns()) {
                    using.add(column.getColumnName());
                }
            }
            ScalarExpression condition = usingCondition(leftSchema, rightSchema, using);
            logger.debug("Joining {} USING {}", table.scan.getReferenceName(), using);
            return new JoinNode(table.joinType, condition, left, right, using);
        }

        ExpressionBinder binder = ExpressionBinder.forSchema(leftSchema.concat(rightSchema), "ON");
        List<ScalarExpression> bound = new ArrayList<>();
        Collection<Expression> conditions = table.isCrossJoin() ? crossConjuncts : onExpressions(join);
        for (Expression condition : conditions) {
            if (AggregateExtractor.containsAggregate(condition)) {
                throw new TypeMismatchException("Aggregate functions are not allowed in ON: " + condition);
            }
            bound.add(binder.bindPredicate(condition));
        }
        if (table.isCrossJoin() && !bound.isEmpty()) {
            logger.debug("Rewrote cross join with {} into an inner join on {}", table.scan.getReferenceName(), bound);
        }
        return new JoinNode(table.joinType, BooleanExpression.conjunction(bound), left, right);
    }

    private static List<String> commonColumnNames(Schema left, Schema right) {
        Set<String> common = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        List<String> names = new ArrayList<>();
        for (Field field : left.getFields()) {
            if (right.indexOf(null, field.getName()) >= 0 && common.add(field.getName())) {
                names.add(field.getName());
            }
        }
        return names;
    }

    private static ScalarExpression usingCondition(Schema left, Schema right, List<String> using) {
        if (using.isEmpty()) {
            return null;
        }
        List<Integer> leftIndices = SchemaDerivations.usingIndices(left, using);
        List<Integer> rightIndices = SchemaDerivations.usingIndices(right, using);
        List<ScalarExpression> equalities = new ArrayList<>();
        for (int k = 0; k < using.size(); k++) {
            int l = leftIndices.get(k);
            int r = rightIndices.get(k);
            if (left.getField(l).getType() != right.getField(r).getType()) {
                throw new TypeMismatchException("USING column " + using.get(k) + " is "
                        + left.getField(l).getType() + " on the left but " + right.getField(r).getType()
                        + " on the right");
            }
            equalities.add(ExpressionBinder.compare(ComparisonOperator.EQUALS,
                    ColumnReference.of(l, left.getField(l)),
                    ColumnReference.of(left.size() + r, right.getField(r))));
        }
        return BooleanExpression.conjunction(equalities);
    }

    // ---------------------------------------------------------------------------------
    // GROUP BY, HAVING, select list, DISTINCT and ORDER BY
    // ---------------------------------------------------------------------------------

    private LogicalOperator buildSelectList(PlainSelect select, LogicalOperator plan) {
        List<SelectItem<?>> items = select.getSelectItems();
        List<OrderByElement> orderBy = select.getOrderByElements() == null
                ? Collections.emptyList() : select.getOrderByElements();
        boolean distinct = select.getDistinct() != null;

        List<Expression> groupExpressions = groupExpressions(select.getGroupBy());
        boolean aggregated = !groupExpressions.isEmpty() || select.getHaving() != null;
        for (SelectItem<?> item : items) {
            aggregated |= AggregateExtractor.containsAggregate(item.getExpression());
        }
        for (OrderByElement element : orderBy) {
            aggregated |= AggregateExtractor.containsAggregate(element.getExpression());
        }

        Schema preAggregation = plan.getSchema();
        ExpressionBinder inputBinder;
        if (aggregated) {
            GroupAggregateNode aggregate = buildAggregate(select, groupExpressions, orderBy, plan);
            plan = aggregate;
            if (select.getHaving() != null) {
                plan = new FilterNode(ExpressionBinder.forAggregate(aggregate, "HAVING")
                        .bindPredicate(select.getHaving()), aggregate);
            }
            inputBinder = ExpressionBinder.forAggregate(aggregate, "SELECT");
        } else {
            inputBinder = ExpressionBinder.forSchema(plan.getSchema(), "SELECT");
        }

        // One entry per output column; sources are null for columns expanded from a wildcard
        List<ScalarExpression> expressions = new ArrayList<>();
        List<String> names = new ArrayList<>();
        List<Expression> sources = new ArrayList<>();
        for (SelectItem<?> item : items) {
            Expression expression = item.getExpression();
            if (expression instanceof AllTableColumns) {
                String qualifier = ((AllTableColumns) expression).getTable().getName();
                List<Integer> indices = preAggregation.indicesOf(qualifier);
                if (indices.isEmpty()) {
                    throw new UnresolvedReferenceException(qualifier + ".*", "Unknown table " + qualifier + " in SELECT");
                }
                expandWildcard(indices, preAggregation, aggregated, inputBinder, expressions, names, sources);
            } else if (expression instanceof AllColumns) {
                List<Integer> indices = new ArrayList<>();
                for (int i = 0; i < preAggregation.size(); i++) {
                    indices.add(i);
                }
                expandWildcard(indices, preAggregation, aggregated, inputBinder, expressions, names, sources);
            } else {
                ScalarExpression bound = inputBinder.bind(expression);
                expressions.add(bound);
                names.add(item.getAlias() != null ? item.getAlias().getName() : defaultName(bound, expression));
                sources.add(expression);
            }
        }

        LogicalOperator projectInput = plan;
        ProjectNode project = new ProjectNode(expressions, names, projectInput);
        if (orderBy.isEmpty()) {
            return distinct ? distinctOf(project) : project;
        }

        List<SortKey> keys;
        try {
            keys = bindOutputSortKeys(orderBy, project.getSchema(), sources);
        } catch (UnresolvedReferenceException | TypeMismatchException e) {
            if (distinct) {
                throw e;
            }
            logger.debug("ORDER BY does not resolve against the select list ({}), sorting before projection",
                    e.getMessage());
            List<SortKey> inputKeys = bindInputSortKeys(orderBy, inputBinder, expressions, names, sources);
            return new ProjectNode(expressions, names, new SortNode(inputKeys, projectInput));
        }
        return new SortNode(keys, distinct ? distinctOf(project) : project);
    }

    private static List<Expression> groupExpressions(GroupByElement groupBy) {
        List<Expression> expressions = new ArrayList<>();
        if (groupBy != null && groupBy.getGroupByExpressionList() != null) {
            for (Object expression : groupBy.getGroupByExpressionList()) {
                expressions.add((Expression) expression);
            }
        }
        return expressions;
    }

    private static GroupAggregateNode buildAggregate(PlainSelect select, List<Expression> groupExpressions,
                                                     List<OrderByElement> orderBy, LogicalOperator input) {
        ExpressionBinder keyBinder = ExpressionBinder.forSchema(input.getSchema(), "GROUP BY");
        List<ColumnReference> keys = new ArrayList<>();
        for (Expression expression : groupExpressions) {
            if (!(expression instanceof Column)) {
                throw new TypeMismatchException("GROUP BY keys must be column references: " + expression);
            }
            ScalarExpression key = keyBinder.bind(expression);
            if (!(key instanceof ColumnReference)) {
                throw new TypeMismatchException("GROUP BY keys must be column references: " + expression);
            }
            if (!keys.contains(key)) {
                keys.add((ColumnReference) key);
            }
        }

        List<Expression> withAggregates = new ArrayList<>();
        for (SelectItem<?> item : select.getSelectItems()) {
            withAggregates.add(item.getExpression());
        }
        withAggregates.add(select.getHaving());
        for (OrderByElement element : orderBy) {
            withAggregates.add(element.getExpression());
        }

        ExpressionBinder argumentBinder = ExpressionBinder.forSchema(input.getSchema(), "aggregate argument");
        List<AggregateCall> calls = new ArrayList<>();
        for (Expression expression : withAggregates) {
            for (Function function : AggregateExtractor.extract(expression)) {
                AggregateCall call = argumentBinder.bindAggregateCall(function);
                if (!calls.contains(call)) {
                    calls.add(call);
                }
            }
        }
        return new GroupAggregateNode(keys, calls, input);
    }

    private static void expandWildcard(List<Integer> indices, Schema source, boolean aggregated,
                                       ExpressionBinder binder, List<ScalarExpression> expressions,
                                       List<String> names, List<Expression> sources) {
        for (int index : indices) {
            Field field = source.getField(index);
            if (aggregated) {
                Column column = field.getQualifier() != null
                        ? new Column(new Table(field.getQualifier()), field.getName())
                        : new Column(field.getName());
                expressions.add(binder.bind(column));
            } else {
                expressions.add(ColumnReference.of(index, field));
            }
            names.add(field.getName());
            sources.add(null);
        }
    }

    private static String defaultName(ScalarExpression bound, Expression expression) {
        if (bound instanceof ColumnReference) {
            return ((ColumnReference) bound).getName();
        }
        return expression.toString();
    }

    private static GroupAggregateNode distinctOf(LogicalOperator input) {
        List<ColumnReference> keys = new ArrayList<>();
        Schema schema = input.getSchema();
        for (int i = 0; i < schema.size(); i++) {
            keys.add(ColumnReference.of(i, schema.getField(i)));
        }
        return new GroupAggregateNode(keys, Collections.emptyList(), input);
    }

    private static List<SortKey> bindOutputSortKeys(List<OrderByElement> orderBy, Schema output,
                                                    List<Expression> sources) {
        ExpressionBinder binder = ExpressionBinder.forSchema(output, "ORDER BY");
        List<SortKey> keys = new ArrayList<>();
        for (OrderByElement element : orderBy) {
            Expression expression = element.getExpression();
            ScalarExpression bound;
            int position = selectListPosition(expression, output.size(), sources);
            if (position >= 0) {
                bound = ColumnReference.of(position, output.getField(position));
            } else {
                bound = binder.bind(expression);
            }
            keys.add(sortKey(bound, element));
        }
        return keys;
    }

    private static List<SortKey> bindInputSortKeys(List<OrderByElement> orderBy, ExpressionBinder binder,
                                                   List<ScalarExpression> expressions, List<String> names,
                                                   List<Expression> sources) {
        List<SortKey> keys = new ArrayList<>();
        for (OrderByElement element : orderBy) {
            Expression expression = element.getExpression();
            int position = selectListPosition(expression, expressions.size(), sources);
            ScalarExpression bound;
            if (position >= 0) {
                bound = expressions.get(position);
            } else {
                try {
                    bound = binder.bind(expression);
                } catch (UnresolvedReferenceException e) {
                    int alias = aliasPosition(expression, names);
                    if (alias < 0) {
                        throw e;
                    }
                    bound = expressions.get(alias);
                }
            }
            keys.add(sortKey(bound, element));
        }
        return keys;
    }

    /**
     * Matches an ORDER BY expression to a select-list column, either by ordinal
     * ({@code ORDER BY 2}) or by being written exactly as a select-list expression.
     * @return The zero-based output position, or -1.
     */
    private static int selectListPosition(Expression expression, int width, List<Expression> sources) {
        if (expression instanceof LongValue) {
            long ordinal = ((LongValue) expression).getValue();
            if (ordinal < 1 || ordinal > width) {
                throw new UnresolvedReferenceException(expression.toString(),
                        "ORDER BY position " + ordinal + " is not in the select list");
            }
            return (int) ordinal - 1;
        }
        String text = expression.toString();
        for (int i = 0; i < sources.size(); i++) {
            if (sources.get(i) != null && sources.get(i).toString().equalsIgnoreCase(text)) {
                return i;
            }
        }
        return -1;
    }

    private static int aliasPosition(Expression expression, List<String> names) {
        if (!(expression instanceof Column)) {
            return -1;
        }
        Table table = ((Column) expression).getTable();
        if (table != null && table.getName() != null) {
            return -1;
        }
        String name = ((Column) expression).getColumnName();
        for (int i = 0; i < names.size(); i++) {
            if (names.get(i).equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }

    private static SortKey sortKey(ScalarExpression bound, OrderByElement element) {
        if (!bound.getType().isOrderable()) {
            throw new TypeMismatchException("Cannot ORDER BY " + bound + " of type " + bound.getType());
        }
        boolean ascending = element.isAsc();
        OrderByElement.NullOrdering nullOrdering = element.getNullOrdering();
        boolean nullsFirst = nullOrdering == null ? !ascending : nullOrdering == OrderByElement.NullOrdering.NULLS_FIRST;
        return new SortKey(bound, ascending, nullsFirst);
    }

    // ---------------------------------------------------------------------------------
    // LIMIT and OFFSET
    // ---------------------------------------------------------------------------------

    private static LogicalOperator buildLimit(PlainSelect select, LogicalOperator plan) {
        Limit limit = select.getLimit();
        Offset offset = select.getOffset();
        Long count = null;
        long skip = 0;
        if (limit != null) {
            if (limit.getRowCount() != null) {
                count = nonNegativeLiteral(limit.getRowCount(), "LIMIT");
            }
            if (limit.getOffset() != null) {
                skip = nonNegativeLiteral(limit.getOffset(), "OFFSET");
            }
        }
        if (offset != null && offset.getOffset() != null) {
            skip = nonNegativeLiteral(offset.getOffset(), "OFFSET");
        }
        if (count == null && skip == 0) {
            return plan;
        }
        return new LimitNode(count == null ? Long.MAX_VALUE : count, skip, plan);
    }

    private static long nonNegativeLiteral(Expression expression, String clause) {
        if (!(expression instanceof LongValue) || ((LongValue) expression).getValue() < 0) {
            throw new TypeMismatchException(clause + " must be a non-negative integer literal, got " + expression);
        }
        return ((LongValue) expression).getValue();
    }
}
