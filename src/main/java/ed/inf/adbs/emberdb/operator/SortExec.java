package ed.inf.adbs.emberdb.operator;

import ed.inf.adbs.emberdb.Tuple;
import ed.inf.adbs.emberdb.TupleComparator;
import ed.inf.adbs.emberdb.plan.SortKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Stable sort of the child rows.
 * <p>
 * Open drains the child. In {@link SortMode#IN_MEMORY} mode all rows are buffered and sorted.
 * In {@link SortMode#EXTERNAL} mode rows are buffered {@code runSize} at a time; each full buffer
 * is sorted and written to a run file, and next merges the runs. Equal rows from different runs
 * come out in run order, so the merge stays stable. Run files are deleted on close.
 */
public class SortExec extends PhysicalOperator {

    private static final Logger logger = LoggerFactory.getLogger(SortExec.class);

    public enum SortMode {
        IN_MEMORY,
        EXTERNAL
    }

    private final List<SortKey> sortKeys;
    private final SortMode mode;
    private final int runSize;
    private final Path spillDirectory;
    private final Comparator<Tuple> comparator;

    private List<Tuple> buffer;
    private Iterator<Tuple> bufferIterator;
    private final List<Path> runFiles = new ArrayList<>();
    private final List<RunReader> readers = new ArrayList<>();
    private PriorityQueue<RunReader> merge;

    public SortExec(List<SortKey> sortKeys, SortMode mode, int runSize, Path spillDirectory, PhysicalOperator child) {
        super(child.getSchema(), Collections.singletonList(child), child.getEstimatedRowCount());
        if (runSize <= 0) {
            throw new IllegalArgumentException("Run size must be positive: " + runSize);
        }
        this.sortKeys = sortKeys;
        this.mode = mode;
        this.runSize = runSize;
        this.spillDirectory = spillDirectory;
        this.comparator = new TupleComparator(sortKeys);
    }

    public SortMode getMode() {
        return mode;
    }

    /**
     * @return The number of runs written to disk by the current execution.
     */
    public int getSpilledRunCount() {
        return runFiles.size();
    }

    @Override
    public PhysicalOperatorType getType() {
        return PhysicalOperatorType.SORT;
    }

    @Override
    protected String describeParameters() {
        return mode + ", " + sortKeys;
    }

    @Override
    protected void doOpen() throws IOException {
        buffer = new ArrayList<>();
        Tuple tuple;
        while ((tuple = getChild(0).next()) != null) {
            buffer.add(tuple);
            if (mode == SortMode.EXTERNAL && buffer.size() >= runSize) {
                spill();
            }
        }
        if (runFiles.isEmpty()) {
            buffer.sort(comparator);
            bufferIterator = buffer.iterator();
            return;
        }
        if (!buffer.isEmpty()) {
            spill();
        }
        buffer = null;
        merge = new PriorityQueue<>(Comparator.<RunReader, Tuple>comparing(r -> r.current, comparator)
                .thenComparingInt(r -> r.run));
        for (int run = 0; run < runFiles.size(); run++) {
            RunReader reader = new RunReader(run, runFiles.get(run));
            readers.add(reader);
            if (reader.advance()) {
                merge.add(reader);
            }
        }
        logger.debug("SortExec merging {} runs", runFiles.size());
    }

    private void spill() throws IOException {
        buffer.sort(comparator);
        Path file = spillDirectory != null
                ? Files.createTempFile(spillDirectory, "emberdb-sort-", ".run")
                : Files.createTempFile("emberdb-sort-", ".run");
        runFiles.add(file);
        try (ObjectOutputStream out = new ObjectOutputStream(new BufferedOutputStream(Files.newOutputStream(file)))) {
            out.writeInt(buffer.size());
            for (Tuple row : buffer) {
                out.writeObject(row.getValues().toArray());
                out.reset();
            }
        }
        logger.debug("SortExec spilled run {} with {} rows to {}", runFiles.size() - 1, buffer.size(), file);
        buffer.clear();
    }

    @Override
    protected Tuple doNext() throws IOException {
        if (bufferIterator != null) {
            return bufferIterator.hasNext() ? bufferIterator.next() : null;
        }
        RunReader head = merge.poll();
        if (head == null) {
            return null;
        }
        Tuple tuple = head.current;
        if (head.advance()) {
            merge.add(head);
        }
        return tuple;
    }

    @Override
    protected void doClose() throws IOException {
        buffer = null;
        bufferIterator = null;
        merge = null;
        IOException failure = null;
        for (RunReader reader : readers) {
            try {
                reader.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        readers.clear();
        for (Path file : runFiles) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        runFiles.clear();
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * @return true while rows or run files are held.
     */
    public boolean hasBufferedState() {
        return buffer != null || merge != null || !runFiles.isEmpty();
    }

    /**
     * Sequential reader over one sorted run file.
     */
    static final class RunReader {
        final int run;
        private final ObjectInputStream in;
        private int remaining;
        Tuple current;

        RunReader(int run, Path file) throws IOException {
            this.run = run;
            ObjectInputStream stream = new ObjectInputStream(new BufferedInputStream(Files.newInputStream(file)));
            try {
                this.remaining = stream.readInt();
            } catch (IOException e) {
                try {
                    stream.close();
                } catch (IOException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
                throw new IOException("Corrupt sort run " + run, e);
            }
            this.in = stream;
        }

        boolean advance() throws IOException {
            if (remaining == 0) {
                current = null;
                return false;
            }
            try {
                current = new Tuple(Arrays.asList((Object[]) in.readObject()));
            } catch (ClassNotFoundException e) {
                throw new IOException("Corrupt sort run " + run, e);
            }
            remaining--;
            return true;
        }

        void close() throws IOException {
            in.close();
        }
    }
}
