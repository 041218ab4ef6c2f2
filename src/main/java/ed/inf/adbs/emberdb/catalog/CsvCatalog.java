package ed.inf.adbs.emberdb.catalog;

import ed.inf.adbs.emberdb.Constants;
import ed.inf.adbs.emberdb.Tuple;
import ed.inf.adbs.emberdb.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * A catalog over a database directory on disk.
 * The directory holds:
 * 1. {@code schema.txt}, one table per line: the table name followed by its columns,
 *    each written {@code name} (INTEGER) or {@code name:type}
 * 2. {@code data/<Table>.csv}, one comma-separated row per line, empty fields being NULL
 * 3. optionally {@code stats.txt}, one {@code <Table> <rowCount>} pair per line
 * Tables without statistics report an unknown row estimate.
 */
public class CsvCatalog implements Catalog {

    private static final Logger logger = LoggerFactory.getLogger(CsvCatalog.class);

    private final Map<String, Path> tableLocations = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final Map<String, Schema> tableSchemata = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final Map<String, Long> rowCounts = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    private CsvCatalog() {
    }

    /**
     * Loads schema, location and statistics information from a database directory.
     * @param dbDirectory The directory containing the schema file and the data directory.
     * @return The loaded catalog.
     * @throws IOException If the schema file cannot be read or is malformed.
     */
    public static CsvCatalog load(Path dbDirectory) throws IOException {
        CsvCatalog catalog = new CsvCatalog();
        catalog.loadSchemata(dbDirectory);
        catalog.loadStatistics(dbDirectory.resolve(Constants.STATS_FILE_NAME));
        catalog.checkDataFiles(dbDirectory.resolve(Constants.DATA_DIRECTORY_NAME));
        logger.debug("Loaded catalog from {} with tables {}", dbDirectory, catalog.tableSchemata.keySet());
        return catalog;
    }

    private void loadSchemata(Path dbDirectory) throws IOException {
        Path schemaPath = dbDirectory.resolve(Constants.SCHEMA_FILE_NAME);
        Path dataPath = dbDirectory.resolve(Constants.DATA_DIRECTORY_NAME);
        try (BufferedReader schemaReader = Files.newBufferedReader(schemaPath)) {
            String line;
            while ((line = schemaReader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }
                String[] parts = line.split(Constants.SPLITTER_REGEX);
                String tableName = parts[0];

                List<Field> fields = new ArrayList<>();
                for (int i = 1; i < parts.length; i++) {
                    fields.add(parseColumn(tableName, parts[i]));
                }
                if (fields.isEmpty()) {
                    throw new IOException("Table " + tableName + " declares no columns in " + schemaPath);
                }

                tableSchemata.put(tableName, new Schema(fields));
                tableLocations.put(tableName, dataPath.resolve(tableName + Constants.DATA_FILE_EXTENSION));
            }
        }
    }

    private static Field parseColumn(String tableName, String declaration) throws IOException {
        int separator = declaration.indexOf(Constants.TYPE_SEPARATOR);
        if (separator < 0) {
            return new Field(tableName, declaration, DataType.INTEGER);
        }
        try {
            return new Field(tableName, declaration.substring(0, separator),
                    DataType.fromName(declaration.substring(separator + 1)));
        } catch (IllegalArgumentException e) {
            throw new IOException("Bad column declaration " + declaration + " in table " + tableName, e);
        }
    }

    private void loadStatistics(Path statsPath) throws IOException {
        if (!Files.exists(statsPath)) {
            return;
        }
        try (BufferedReader reader = Files.newBufferedReader(statsPath)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String[] parts = line.trim().split(Constants.SPLITTER_REGEX);
                if (parts.length != 2) {
                    continue;
                }
                if (!tableSchemata.containsKey(parts[0])) {
                    logger.warn("Statistics given for unknown table {}", parts[0]);
                    continue;
                }
                try {
                    rowCounts.put(parts[0], Long.parseLong(parts[1]));
                } catch (NumberFormatException e) {
                    logger.warn("Ignoring malformed row count for table {}: {}", parts[0], parts[1]);
                }
            }
        }
    }

    private void checkDataFiles(Path dataPath) throws IOException {
        if (!Files.isDirectory(dataPath)) {
            return;
        }
        try (Stream<Path> files = Files.list(dataPath)) {
            files.forEach(file -> {
                String fileName = file.getFileName().toString();
                if (fileName.endsWith(Constants.DATA_FILE_EXTENSION)) {
                    String tableName = fileName.substring(0, fileName.length() - Constants.DATA_FILE_EXTENSION.length());
                    if (!tableSchemata.containsKey(tableName)) {
                        logger.warn("Found data file {} but no schema definition", fileName);
                    }
                }
            });
        }
    }

    @Override
    public boolean hasTable(String tableName) {
        return tableSchemata.containsKey(tableName);
    }

    @Override
    public Schema schemaOf(String tableName) {
        Schema schema = tableSchemata.get(tableName);
        if (schema == null) {
            throw new IllegalArgumentException("Unknown table " + tableName);
        }
        return schema;
    }

    @Override
    public long estimatedRowCount(String tableName) {
        schemaOf(tableName);
        return rowCounts.getOrDefault(tableName, Constants.UNKNOWN_ROW_COUNT);
    }

    @Override
    public RowCursor openCursor(String tableName) {
        return new CsvCursor(tableName, tableLocations.get(tableName), schemaOf(tableName));
    }

    /**
     * Reads one CSV file line by line, parsing each field by its declared type.
     */
    private static final class CsvCursor implements RowCursor {

        private final String tableName;
        private final Path tablePath;
        private final Schema schema;
        private BufferedReader reader;
        private long lineNumber;

        CsvCursor(String tableName, Path tablePath, Schema schema) {
            this.tableName = tableName;
            this.tablePath = tablePath;
            this.schema = schema;
        }

        @Override
        public void open() throws IOException {
            if (reader != null) {
                throw new IllegalStateException("Cursor over " + tableName + " is already open");
            }
            reader = Files.newBufferedReader(tablePath);
        }

        @Override
        public Tuple next() throws IOException {
            if (reader == null) {
                return null;
            }
            String line = reader.readLine();
            while (line != null && line.trim().isEmpty()) {
                lineNumber++;
                line = reader.readLine();
            }
            if (line == null) { // END OF FILE
                close();
                return null;
            }
            lineNumber++;

            String[] values = line.split(",", -1);
            if (values.length != schema.size()) {
                throw new IOException("Row " + lineNumber + " of " + tableName + " has " + values.length
                        + " fields, expected " + schema.size());
            }
            List<Object> attributes = new ArrayList<>(values.length);
            for (int i = 0; i < values.length; i++) {
                try {
                    attributes.add(Values.parse(values[i].trim(), schema.getField(i).getType()));
                } catch (NumberFormatException e) {
                    throw new IOException("Row " + lineNumber + " of " + tableName + ": bad value for "
                            + schema.getField(i).getName() + ": " + values[i].trim(), e);
                }
            }
            return new Tuple(attributes);
        }

        @Override
        public void close() throws IOException {
            if (reader != null) {
                BufferedReader toClose = reader;
                reader = null;
                toClose.close();
            }
        }
    }
}
