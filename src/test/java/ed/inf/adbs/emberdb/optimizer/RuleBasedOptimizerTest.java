package ed.inf.adbs.emberdb.optimizer;

import static org.junit.Assert.*;

import java.util.Collections;
import java.util.List;

import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import org.junit.Before;
import org.junit.Test;

import ed.inf.adbs.emberdb.EngineOptions;
import ed.inf.adbs.emberdb.TestFixtures;
import ed.inf.adbs.emberdb.Tuple;
import ed.inf.adbs.emberdb.catalog.DataType;
import ed.inf.adbs.emberdb.catalog.Field;
import ed.inf.adbs.emberdb.catalog.InMemoryCatalog;
import ed.inf.adbs.emberdb.catalog.Schema;
import ed.inf.adbs.emberdb.exception.PlanningException;
import ed.inf.adbs.emberdb.exception.UnsupportedAggregateException;
import ed.inf.adbs.emberdb.exception.UnsupportedJoinException;
import ed.inf.adbs.emberdb.expression.ColumnReference;
import ed.inf.adbs.emberdb.operator.HashJoin;
import ed.inf.adbs.emberdb.operator.LimitExec;
import ed.inf.adbs.emberdb.operator.PhysicalOperator;
import ed.inf.adbs.emberdb.operator.PhysicalOperatorType;
import ed.inf.adbs.emberdb.operator.SortExec;
import ed.inf.adbs.emberdb.optimizer.rule.ScanToTableScanRule;
import ed.inf.adbs.emberdb.plan.GroupAggregateNode;
import ed.inf.adbs.emberdb.plan.JoinNode;
import ed.inf.adbs.emberdb.plan.JoinType;
import ed.inf.adbs.emberdb.plan.LimitNode;
import ed.inf.adbs.emberdb.plan.LogicalOperator;
import ed.inf.adbs.emberdb.plan.LogicalOperatorType;
import ed.inf.adbs.emberdb.plan.PlanBuilder;
import ed.inf.adbs.emberdb.plan.ScanNode;

public class RuleBasedOptimizerTest {

    private InMemoryCatalog catalog;
    private PlanBuilder builder;
    private RuleBasedOptimizer optimizer;

    @Before
    public void setUp() {
        catalog = TestFixtures.catalog();
        builder = new PlanBuilder(catalog);
        optimizer = new RuleBasedOptimizer(catalog, EngineOptions.defaults());
    }

    private LogicalOperator plan(String sql) throws JSQLParserException {
        return builder.build(CCJSqlParserUtil.parse(sql));
    }

    private static void assertIsomorphic(LogicalOperator logical, PhysicalOperator physical) {
        assertEquals(logical.getType(), physical.getType().getImplementedType());
        assertEquals("Schemas must agree at " + logical.describe(), logical.getSchema(), physical.getSchema());
        assertEquals(logical.getChildren().size(), physical.getChildren().size());
        for (int i = 0; i < logical.getChildren().size(); i++) {
            assertIsomorphic(logical.getChild(i), physical.getChild(i));
        }
    }

    @Test
    public void testLoweringIsDeterministic() throws JSQLParserException {
        String sql = "SELECT S.name, COUNT(*) FROM Student S, Enrolled E, Course C "
                + "WHERE S.sid = E.sid AND E.cid = C.cid AND E.grade > 60 GROUP BY S.name ORDER BY S.name LIMIT 3";
        LogicalOperator logical = plan(sql);

        String first = optimizer.optimize(logical).explain();
        String second = optimizer.optimize(logical).explain();
        String third = new RuleBasedOptimizer(catalog, EngineOptions.defaults()).optimize(plan(sql)).explain();

        assertEquals(first, second);
        assertEquals("Planning the same query twice gives the same plan", first, third);
    }

    @Test
    public void testPhysicalPlanMirrorsLogicalPlan() throws JSQLParserException {
        String[] queries = {
                "SELECT * FROM Student",
                "SELECT DISTINCT age FROM Student WHERE gpa > 3.0 ORDER BY age",
                "SELECT * FROM Student LEFT JOIN Enrolled USING (sid) WHERE Enrolled.grade IS NULL",
                "SELECT title, MAX(grade) FROM Enrolled NATURAL JOIN Course GROUP BY title LIMIT 1 OFFSET 1",
                "SELECT name FROM Student ORDER BY gpa DESC"
        };
        for (String sql : queries) {
            LogicalOperator logical = plan(sql);
            assertIsomorphic(logical, optimizer.optimize(logical));
        }
    }

    @Test
    public void testLogicalPlanIsNotModified() throws JSQLParserException {
        LogicalOperator logical = plan("SELECT * FROM Student S, Enrolled E WHERE S.sid = E.sid");
        String before = logical.toString() + logical.getSchema();

        optimizer.optimize(logical);
        assertEquals(before, logical.toString() + logical.getSchema());
    }

    @Test
    public void testSmallerInputIsBuilt() throws JSQLParserException {
        PhysicalOperator physical = optimizer.optimize(plan("SELECT * FROM Student S JOIN Course C ON S.sid = C.cid"));
        HashJoin join = (HashJoin) physical.getChild(0);

        assertEquals("Course has fewer rows than Student", HashJoin.BuildSide.RIGHT, join.getBuildSide());
        assertEquals(5L, join.getEstimatedRowCount());
    }

    @Test
    public void testNonEquiJoinIsUnsupported() throws JSQLParserException {
        LogicalOperator logical = plan("SELECT * FROM Student S JOIN Enrolled E ON S.sid < E.sid");
        try {
            optimizer.optimize(logical);
            fail("No rule implements a non-equi join");
        } catch (UnsupportedJoinException e) {
            assertEquals(LogicalOperatorType.JOIN, e.getFailedNode().getType());
        }
    }

    @Test(expected = UnsupportedJoinException.class)
    public void testCartesianProductIsUnsupported() throws JSQLParserException {
        optimizer.optimize(plan("SELECT * FROM Student, Course"));
    }

    @Test
    public void testGroupingOnBinaryIsUnsupported() {
        Schema blobs = Schema.of(new Field(null, "payload", DataType.BINARY));
        catalog.addTable("Blob", blobs, Collections.singletonList(Tuple.of((Object) new byte[]{1})));
        ScanNode scan = new ScanNode("Blob", null, catalog.schemaOf("Blob"));
        GroupAggregateNode aggregate = new GroupAggregateNode(
                Collections.singletonList(ColumnReference.of(0, scan.getSchema().getField(0))),
                Collections.emptyList(), scan);

        try {
            optimizer.optimize(aggregate);
            fail("BINARY keys cannot be hashed");
        } catch (UnsupportedAggregateException e) {
            assertSame(aggregate, e.getFailedNode());
        }
    }

    @Test(expected = PlanningException.class)
    public void testSharedSubtreeIsRejected() {
        ScanNode scan = new ScanNode("Course", null, catalog.schemaOf("Course"));
        optimizer.optimize(new JoinNode(JoinType.INNER, null, scan, scan));
    }

    @Test
    public void testLargeSortSpills() throws JSQLParserException {
        RuleBasedOptimizer spilling = new RuleBasedOptimizer(catalog,
                EngineOptions.defaults().withSortSpillThreshold(4).withSortRunSize(2));

        SortExec large = (SortExec) spilling.optimize(plan("SELECT * FROM Student ORDER BY age"));
        assertEquals(SortExec.SortMode.EXTERNAL, large.getMode());

        SortExec small = (SortExec) spilling.optimize(plan("SELECT * FROM Course ORDER BY cid"));
        assertEquals(SortExec.SortMode.IN_MEMORY, small.getMode());
    }

    @Test
    public void testPrependedRuleTakesPrecedence() throws JSQLParserException {
        Rule skipLimit = new Rule() {
            @Override
            public String getName() {
                return "LimitWithoutOffset";
            }

            @Override
            public LogicalOperatorType getTarget() {
                return LogicalOperatorType.LIMIT;
            }

            @Override
            public boolean matches(LogicalOperator node, List<PhysicalOperator> loweredChildren) {
                return ((LimitNode) node).getOffset() > 0;
            }

            @Override
            public PhysicalOperator apply(LogicalOperator node, List<PhysicalOperator> loweredChildren) {
                return new LimitExec(((LimitNode) node).getCount(), 0, loweredChildren.get(0));
            }
        };
        RuleSet rules = RuleSet.defaults(catalog, EngineOptions.defaults()).toBuilder().prepend(skipLimit).build();
        assertSame(skipLimit, rules.rulesFor(LogicalOperatorType.LIMIT).get(0));

        PhysicalOperator physical = new RuleBasedOptimizer(rules).optimize(plan("SELECT sid FROM Student LIMIT 2 OFFSET 3"));
        assertEquals("LimitExec(2) rows=2", physical.explain().split("\n")[0]);

        PhysicalOperator plain = new RuleBasedOptimizer(rules).optimize(plan("SELECT sid FROM Student LIMIT 2"));
        assertEquals(PhysicalOperatorType.LIMIT, plain.getType());
    }

    @Test(expected = PlanningException.class)
    public void testRuleProducingWrongOperatorIsCaught() throws JSQLParserException {
        Rule broken = new Rule() {
            @Override
            public String getName() {
                return "Broken";
            }

            @Override
            public LogicalOperatorType getTarget() {
                return LogicalOperatorType.PROJECT;
            }

            @Override
            public boolean matches(LogicalOperator node, List<PhysicalOperator> loweredChildren) {
                return true;
            }

            @Override
            public PhysicalOperator apply(LogicalOperator node, List<PhysicalOperator> loweredChildren) {
                return new LimitExec(1, 0, loweredChildren.get(0));
            }
        };
        RuleSet rules = RuleSet.defaults(catalog, EngineOptions.defaults()).toBuilder().prepend(broken).build();
        new RuleBasedOptimizer(rules).optimize(plan("SELECT sid FROM Student"));
    }

    @Test
    public void testMissingRuleIsReported() throws JSQLParserException {
        RuleSet scansOnly = RuleSet.builder().add(new ScanToTableScanRule(catalog)).build();
        try {
            new RuleBasedOptimizer(scansOnly).optimize(plan("SELECT * FROM Course"));
            fail("Project has no rule");
        } catch (PlanningException e) {
            assertTrue(e.getMessage().startsWith("No rule matches"));
        }
    }
}
