package ed.inf.adbs.emberdb;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import ed.inf.adbs.emberdb.catalog.DataType;
import ed.inf.adbs.emberdb.catalog.Field;
import ed.inf.adbs.emberdb.catalog.InMemoryCatalog;
import ed.inf.adbs.emberdb.catalog.Schema;
import ed.inf.adbs.emberdb.operator.PhysicalOperator;

/**
 * Shared tables and helpers for the tests.
 * <pre>
 * Student(sid, name:string, age, gpa:double)   5 rows
 * Enrolled(sid, cid, grade)                    5 rows
 * Course(cid, title:string)                    3 rows
 * </pre>
 */
public final class TestFixtures {

    public static final Schema STUDENT = Schema.of(
            new Field(null, "sid", DataType.INTEGER),
            new Field(null, "name", DataType.STRING),
            new Field(null, "age", DataType.INTEGER),
            new Field(null, "gpa", DataType.DOUBLE));

    public static final Schema ENROLLED = Schema.of(
            new Field(null, "sid", DataType.INTEGER),
            new Field(null, "cid", DataType.INTEGER),
            new Field(null, "grade", DataType.INTEGER));

    public static final Schema COURSE = Schema.of(
            new Field(null, "cid", DataType.INTEGER),
            new Field(null, "title", DataType.STRING));

    private TestFixtures() {
    }

    public static InMemoryCatalog catalog() {
        return new InMemoryCatalog()
                .addTable("Student", STUDENT, Arrays.asList(
                        Tuple.of(1L, "Ada", 35L, 3.9),
                        Tuple.of(2L, "Bob", 22L, 3.1),
                        Tuple.of(3L, "Cy", 41L, null),
                        Tuple.of(4L, "Di", null, 2.5),
                        Tuple.of(5L, "Ed", 22L, 3.1)))
                .addTable("Enrolled", ENROLLED, Arrays.asList(
                        Tuple.of(1L, 101L, 80L),
                        Tuple.of(1L, 102L, 70L),
                        Tuple.of(2L, 101L, 65L),
                        Tuple.of(3L, 103L, 90L),
                        Tuple.of(6L, 101L, 50L)))
                .addTable("Course", COURSE, Arrays.asList(
                        Tuple.of(101L, "DB"),
                        Tuple.of(102L, "OS"),
                        Tuple.of(104L, "AI")));
    }

    /**
     * Opens the operator, pulls every row and closes it.
     */
    public static List<Tuple> drain(PhysicalOperator operator) {
        List<Tuple> rows = new ArrayList<>();
        operator.open();
        try {
            Tuple tuple;
            while ((tuple = operator.next()) != null) {
                rows.add(tuple);
            }
        } finally {
            operator.close();
        }
        return rows;
    }

    /**
     * @return The integer table {@code Numbers(n)} holding 1..count.
     */
    public static List<Tuple> numbers(int count) {
        List<Tuple> rows = new ArrayList<>();
        for (long i = 1; i <= count; i++) {
            rows.add(Tuple.of(i));
        }
        return rows;
    }
}
