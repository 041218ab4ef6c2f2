package ed.inf.adbs.emberdb;

import ed.inf.adbs.emberdb.catalog.Catalog;
import ed.inf.adbs.emberdb.catalog.CsvCatalog;
import ed.inf.adbs.emberdb.exception.PlanningException;
import ed.inf.adbs.emberdb.operator.PhysicalOperator;
import ed.inf.adbs.emberdb.optimizer.RuleBasedOptimizer;
import ed.inf.adbs.emberdb.optimizer.RuleSet;
import ed.inf.adbs.emberdb.plan.LogicalOperator;
import ed.inf.adbs.emberdb.plan.PlanBuilder;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Facade running SQL text through the whole pipeline: parse with JSqlParser, build the
 * logical plan, lower it with the rule-based optimizer and execute it.
 */
public class EmberDB {

    private static final Logger logger = LoggerFactory.getLogger(EmberDB.class);

    private final Catalog catalog;
    private final EngineOptions options;
    private final PlanBuilder planBuilder;
    private final RuleBasedOptimizer optimizer;
    private final QueryExecutor executor;

    public EmberDB(Catalog catalog) {
        this(catalog, EngineOptions.load());
    }

    public EmberDB(Catalog catalog, EngineOptions options) {
        this(catalog, options, RuleSet.defaults(catalog, options));
    }

    public EmberDB(Catalog catalog, EngineOptions options, RuleSet ruleSet) {
        this.catalog = catalog;
        this.options = options;
        this.planBuilder = new PlanBuilder(catalog);
        this.optimizer = new RuleBasedOptimizer(ruleSet);
        this.executor = new QueryExecutor(optimizer);
    }

    /**
     * Opens a database directory laid out for {@link CsvCatalog}.
     */
    public static EmberDB open(Path databaseDirectory) throws IOException {
        return new EmberDB(CsvCatalog.load(databaseDirectory));
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public EngineOptions getOptions() {
        return options;
    }

    /**
     * @throws PlanningException If the text does not parse or the query cannot be planned.
     */
    public LogicalOperator plan(String sql) {
        Statement statement;
        try {
            statement = CCJSqlParserUtil.parse(sql);
        } catch (JSQLParserException e) {
            throw new PlanningException("Could not parse query: " + sql, e);
        }
        logger.debug("Parsed statement: {}", statement);
        return planBuilder.build(statement);
    }

    public PhysicalOperator compile(String sql) {
        return optimizer.optimize(plan(sql));
    }

    /**
     * @return The physical plan the query would run, rendered by {@link PhysicalOperator#explain()}.
     */
    public String explain(String sql) {
        return compile(sql).explain();
    }

    /**
     * @return A lazy stream of the result rows; close it to stop early.
     */
    public ResultStream query(String sql) {
        return executor.execute(compile(sql));
    }

    /**
     * Runs a query to completion.
     */
    public List<Tuple> queryAll(String sql) {
        try (ResultStream rows = query(sql)) {
            return rows.toList();
        }
    }
}
