package ed.inf.adbs.emberdb;

/**
 * Defines global constants used throughout EmberDB.
 * This class contains the default values of every tunable option as well as
 * file names and string literals shared by the catalog and the planner.
 * @see EngineOptions for how the defaults can be overridden.
 */
public class Constants {

    /** Row estimate reported when the catalog has no statistics for a table */
    public static final long UNKNOWN_ROW_COUNT = -1L;

    /** Sorts whose input is estimated above this many rows run in external mode */
    public static final long DEFAULT_SORT_SPILL_THRESHOLD = 100_000L;

    /** Number of rows held in memory per sorted run in external mode */
    public static final int DEFAULT_SORT_RUN_SIZE = 10_000;

    /** Classpath resource holding option overrides */
    public static final String OPTIONS_RESOURCE = "emberdb.properties";

    /** Prefix for option keys given as system properties */
    public static final String SYSTEM_PROPERTY_PREFIX = "emberdb.";

    public static final String OPTION_SORT_SPILL_THRESHOLD = "sort.spillThreshold";
    public static final String OPTION_SORT_RUN_SIZE = "sort.runSize";
    public static final String OPTION_SORT_SPILL_DIRECTORY = "sort.spillDirectory";

    /** Standard filename for table schema definitions */
    public static final String SCHEMA_FILE_NAME = "schema.txt";

    /** Optional file with per-table row counts */
    public static final String STATS_FILE_NAME = "stats.txt";

    /** Directory name where table data files are stored */
    public static final String DATA_DIRECTORY_NAME = "data";

    /** Extension of table data files */
    public static final String DATA_FILE_EXTENSION = ".csv";

    /** Regular expression used for splitting schema file entries */
    public static final String SPLITTER_REGEX = "\\s+";

    /** Separator between a column name and its type in the schema file */
    public static final String TYPE_SEPARATOR = ":";

    /** Fraction of input rows a filter is assumed to keep */
    public static final double FILTER_SELECTIVITY = 0.5;
}
