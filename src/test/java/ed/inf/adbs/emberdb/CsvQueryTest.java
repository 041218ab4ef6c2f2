package ed.inf.adbs.emberdb;

import static org.junit.Assert.*;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

/**
 * Runs whole queries against a database directory on disk and compares the printed rows.
 *
 * Student: A B C D (student ID, name code, age, GPA*10)
 * Enrolled: I J K (student ID, course ID, grade)
 */
public class CsvQueryTest {

    private static final String TEST_DB_DIR = "src/test/resources/csvquerydb";
    private static final String SCHEMA_FILE = TEST_DB_DIR + "/schema.txt";
    private static final String STATS_FILE = TEST_DB_DIR + "/stats.txt";
    private static final String DATA_DIR = TEST_DB_DIR + "/data";

    private EmberDB db;

    @Before
    public void setUp() throws IOException {
        Files.createDirectories(Paths.get(DATA_DIR));

        try (BufferedWriter writer = new BufferedWriter(new FileWriter(SCHEMA_FILE))) {
            writer.write("Student A B C D\n");
            writer.write("Enrolled I J K\n");
        }
        try (BufferedWriter writer = new BufferedWriter(new FileWriter(STATS_FILE))) {
            writer.write("Student 6\n");
            writer.write("Enrolled 5\n");
        }
        try (BufferedWriter writer = new BufferedWriter(new FileWriter(DATA_DIR + "/Student.csv"))) {
            writer.write("1, 25, 85, 30\n");
            writer.write("2, 30, 22, 40\n");
            writer.write("3, 35, 19, 20\n");
            writer.write("4, 40, 21, 40\n");
            writer.write("5, 45, 65, 30\n");
            writer.write("6, 50, 32, 10\n");
        }
        try (BufferedWriter writer = new BufferedWriter(new FileWriter(DATA_DIR + "/Enrolled.csv"))) {
            writer.write("1, 101, 75\n");
            writer.write("1, 102, 82\n");
            writer.write("2, 101, 92\n");
            writer.write("3, 102, 68\n");
            writer.write("4, 103, 88\n");
        }

        db = EmberDB.open(Paths.get(TEST_DB_DIR));
    }

    @After
    public void tearDown() throws IOException {
        Files.deleteIfExists(Paths.get(DATA_DIR + "/Student.csv"));
        Files.deleteIfExists(Paths.get(DATA_DIR + "/Enrolled.csv"));
        Files.deleteIfExists(Paths.get(SCHEMA_FILE));
        Files.deleteIfExists(Paths.get(STATS_FILE));
        Files.deleteIfExists(Paths.get(DATA_DIR));
        Files.deleteIfExists(Paths.get(TEST_DB_DIR));
    }

    private String run(String sql) {
        StringBuilder output = new StringBuilder();
        List<Tuple> rows = db.queryAll(sql);
        for (Tuple row : rows) {
            output.append(row).append('\n');
        }
        return output.toString();
    }

    @Test
    public void testSelectWithWhere() {
        String expectedOutput =
                "2, 30, 40\n" +
                "4, 40, 40\n";

        assertEquals(expectedOutput, run("SELECT Student.A, Student.B, Student.D FROM Student WHERE Student.D > 30"));
    }

    @Test
    public void testJoinWithOrderBy() {
        String expectedOutput =
                "3, 68\n" +
                "1, 75\n" +
                "1, 82\n" +
                "4, 88\n" +
                "2, 92\n";

        assertEquals(expectedOutput, run("SELECT Student.A, Enrolled.K FROM Student, Enrolled "
                + "WHERE Student.A = Enrolled.I ORDER BY Enrolled.K"));
    }

    @Test
    public void testGroupBySum() {
        String expectedOutput =
                "30, 150\n" +
                "40, 43\n" +
                "20, 19\n" +
                "10, 32\n";

        assertEquals(expectedOutput, run("SELECT Student.D, SUM(Student.C) FROM Student GROUP BY Student.D"));
    }

    @Test
    public void testDistinct() {
        String expectedOutput =
                "101\n" +
                "102\n" +
                "103\n";

        assertEquals(expectedOutput, run("SELECT DISTINCT Enrolled.J FROM Enrolled ORDER BY Enrolled.J"));
    }

    @Test
    public void testEmptyResult() {
        assertEquals("", run("SELECT * FROM Student WHERE Student.A > 100"));
    }

    @Test
    public void testExplainUsesStatistics() {
        String plan = db.explain("SELECT * FROM Student, Enrolled WHERE Student.A = Enrolled.I");

        assertTrue(plan, plan.contains("build=RIGHT"));
        assertTrue(plan, plan.contains("TableScan(Student) rows=6"));
    }
}
