package ed.inf.adbs.emberdb.operator;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import ed.inf.adbs.emberdb.TestFixtures;
import ed.inf.adbs.emberdb.Tuple;
import ed.inf.adbs.emberdb.catalog.DataType;
import ed.inf.adbs.emberdb.catalog.Field;
import ed.inf.adbs.emberdb.catalog.InMemoryCatalog;
import ed.inf.adbs.emberdb.catalog.Schema;
import ed.inf.adbs.emberdb.expression.ArithmeticExpression;
import ed.inf.adbs.emberdb.expression.ArithmeticOperator;
import ed.inf.adbs.emberdb.expression.ColumnReference;
import ed.inf.adbs.emberdb.expression.Literal;
import ed.inf.adbs.emberdb.expression.ScalarExpression;

public class ProjectExecTest {

    private InMemoryCatalog catalog;

    @Before
    public void setUp() {
        catalog = TestFixtures.catalog();
    }

    private TableScan studentScan() {
        return new TableScan(catalog, "Student", "Student", catalog.schemaOf("Student"), 5);
    }

    @Test
    public void testProjectAllColumnsReturnsChildRowsUnchanged() {
        TableScan scan = studentScan();
        List<ScalarExpression> expressions = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (int i = 0; i < scan.getSchema().size(); i++) {
            Field field = scan.getSchema().getField(i);
            expressions.add(ColumnReference.of(i, field));
            names.add(field.getName());
        }
        ProjectExec project = new ProjectExec(expressions, names, scan);

        assertEquals("Schema should pass through", scan.getSchema(), project.getSchema());
        List<Tuple> expected = TestFixtures.drain(studentScan());
        assertEquals(expected, TestFixtures.drain(project));
    }

    @Test
    public void testProjectComputedColumns() {
        TableScan scan = studentScan();
        Schema input = scan.getSchema();
        ScalarExpression name = ColumnReference.of(1, input.getField(1));
        ScalarExpression nextAge = new ArithmeticExpression(ArithmeticOperator.ADD,
                ColumnReference.of(2, input.getField(2)), Literal.of(1));
        ProjectExec project = new ProjectExec(Arrays.asList(name, nextAge), Arrays.asList("name", "older"), scan);

        assertEquals(new Field("Student", "name", DataType.STRING), project.getSchema().getField(0));
        assertEquals(new Field(null, "older", DataType.INTEGER), project.getSchema().getField(1));

        List<Tuple> rows = TestFixtures.drain(project);
        assertEquals(5, rows.size());
        assertEquals(Tuple.of("Ada", 36L), rows.get(0));
        assertEquals("NULL propagates through arithmetic", Tuple.of("Di", null), rows.get(3));
    }

    @Test
    public void testProjectMayRepeatAndReorderColumns() {
        TableScan scan = studentScan();
        Schema input = scan.getSchema();
        ColumnReference sid = ColumnReference.of(0, input.getField(0));
        ColumnReference name = ColumnReference.of(1, input.getField(1));
        ProjectExec project = new ProjectExec(Arrays.<ScalarExpression>asList(name, sid, sid),
                Arrays.asList("name", "sid", "sid"), scan);

        Tuple first = TestFixtures.drain(project).get(0);
        assertEquals(Tuple.of("Ada", 1L, 1L), first);
    }
}
