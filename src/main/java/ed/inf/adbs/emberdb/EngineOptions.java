package ed.inf.adbs.emberdb;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Tunable options of the planner and the execution engine.
 * Values start from the defaults in {@link Constants}, are overridden by the classpath
 * resource {@value Constants#OPTIONS_RESOURCE} and finally by {@code emberdb.*} system properties.
 * Instances are immutable; the {@code with*} methods return modified copies.
 */
public final class EngineOptions {

    private static final Logger logger = LoggerFactory.getLogger(EngineOptions.class);

    private final long sortSpillThreshold;
    private final int sortRunSize;
    private final Path spillDirectory;

    private EngineOptions(long sortSpillThreshold, int sortRunSize, Path spillDirectory) {
        if (sortSpillThreshold < 0) {
            throw new IllegalArgumentException("Sort spill threshold must not be negative: " + sortSpillThreshold);
        }
        if (sortRunSize <= 0) {
            throw new IllegalArgumentException("Sort run size must be positive: " + sortRunSize);
        }
        this.sortSpillThreshold = sortSpillThreshold;
        this.sortRunSize = sortRunSize;
        this.spillDirectory = spillDirectory;
    }

    /**
     * @return Options holding only the built-in defaults, ignoring any overrides.
     */
    public static EngineOptions defaults() {
        return new EngineOptions(Constants.DEFAULT_SORT_SPILL_THRESHOLD, Constants.DEFAULT_SORT_RUN_SIZE,
                Paths.get(System.getProperty("java.io.tmpdir")));
    }

    /**
     * Loads options from the classpath resource and system properties on top of the defaults.
     * @return The effective options.
     */
    public static EngineOptions load() {
        Properties properties = new Properties();
        try (InputStream in = EngineOptions.class.getClassLoader().getResourceAsStream(Constants.OPTIONS_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            logger.warn("Could not read {}, using defaults: {}", Constants.OPTIONS_RESOURCE, e.getMessage());
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(Constants.SYSTEM_PROPERTY_PREFIX)) {
                properties.setProperty(key.substring(Constants.SYSTEM_PROPERTY_PREFIX.length()),
                        System.getProperty(key));
            }
        }
        return fromProperties(properties);
    }

    /**
     * Builds options from explicit properties, unspecified keys keep their defaults.
     * @param properties Keys without the {@code emberdb.} prefix.
     * @return The resulting options.
     */
    public static EngineOptions fromProperties(Properties properties) {
        EngineOptions defaults = defaults();
        long threshold = parseLong(properties, Constants.OPTION_SORT_SPILL_THRESHOLD, defaults.sortSpillThreshold);
        long runSize = parseLong(properties, Constants.OPTION_SORT_RUN_SIZE, defaults.sortRunSize);
        if (runSize > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Option " + Constants.OPTION_SORT_RUN_SIZE + " is too large: " + runSize);
        }
        String directory = properties.getProperty(Constants.OPTION_SORT_SPILL_DIRECTORY);
        Path spillDirectory = directory == null || directory.trim().isEmpty()
                ? defaults.spillDirectory : Paths.get(directory.trim());
        EngineOptions options = new EngineOptions(threshold, (int) runSize, spillDirectory);
        logger.debug("Engine options: {}", options);
        return options;
    }

    private static long parseLong(Properties properties, String key, long fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option " + key + " is not a number: " + value, e);
        }
    }

    public EngineOptions withSortSpillThreshold(long threshold) {
        return new EngineOptions(threshold, sortRunSize, spillDirectory);
    }

    public EngineOptions withSortRunSize(int runSize) {
        return new EngineOptions(sortSpillThreshold, runSize, spillDirectory);
    }

    public EngineOptions withSpillDirectory(Path directory) {
        return new EngineOptions(sortSpillThreshold, sortRunSize, directory);
    }

    public long getSortSpillThreshold() {
        return sortSpillThreshold;
    }

    public int getSortRunSize() {
        return sortRunSize;
    }

    public Path getSpillDirectory() {
        return spillDirectory;
    }

    @Override
    public String toString() {
        return "EngineOptions{sortSpillThreshold=" + sortSpillThreshold
                + ", sortRunSize=" + sortRunSize
                + ", spillDirectory=" + spillDirectory + "}";
    }
}
