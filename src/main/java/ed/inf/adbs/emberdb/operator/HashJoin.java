package ed.inf.adbs.emberdb.operator;

import ed.inf.adbs.emberdb.Tuple;
import ed.inf.adbs.emberdb.Values;
import ed.inf.adbs.emberdb.catalog.DataType;
import ed.inf.adbs.emberdb.catalog.Schema;
import ed.inf.adbs.emberdb.plan.JoinType;
import ed.inf.adbs.emberdb.plan.SchemaDerivations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Equi-join by hashing one input.
 * <p>
 * Open drains the build side into a table keyed by its join columns. Next streams the probe
 * side, emitting one combined row per matching build row. A key containing NULL never matches.
 * For outer joins, unmatched probe rows of a preserved probe side are padded with NULLs as they
 * are read, and unmatched build rows of a preserved build side are emitted after the probe side
 * is exhausted.
 * <p>
 * Output rows are the left columns followed by the right columns, whichever side was built.
 * USING columns are kept once, on the left, holding the first non-NULL of the two values.
 */
public class HashJoin extends PhysicalOperator {

    private static final Logger logger = LoggerFactory.getLogger(HashJoin.class);

    /**
     * The input materialized into the hash table.
     */
    public enum BuildSide {
        LEFT,
        RIGHT
    }

    private final JoinType joinType;
    private final int[] leftKeys;
    private final int[] rightKeys;
    private final boolean[] widenKeys;
    private final BuildSide buildSide;
    private final int leftWidth;
    private final int rightWidth;
    private final int[] usingLeft;
    private final int[] usingRight;
    private final int[] keptRight;

    private Map<List<Object>, List<Integer>> table;
    private List<Tuple> buildRows;
    private BitSet matched;

    private Tuple probeRow;
    private List<Integer> probeMatches;
    private int probeMatchIndex;
    private boolean probeExhausted;
    private int unmatchedBuildIndex;

    /**
     * @param leftKeys Key positions in the left input, paired with {@code rightKeys}.
     * @param rightKeys Key positions in the right input.
     * @param usingColumns USING column names, empty for an ON join.
     */
    public HashJoin(JoinType joinType, int[] leftKeys, int[] rightKeys, BuildSide buildSide,
                    PhysicalOperator left, PhysicalOperator right, List<String> usingColumns) {
        super(SchemaDerivations.join(left.getSchema(), right.getSchema(), usingColumns), Arrays.asList(left, right),
                RowEstimates.join(left.getEstimatedRowCount(), right.getEstimatedRowCount()));
        if (leftKeys.length == 0 || leftKeys.length != rightKeys.length) {
            throw new IllegalArgumentException("HashJoin needs matching, non-empty key lists");
        }
        this.joinType = joinType;
        this.leftKeys = leftKeys.clone();
        this.rightKeys = rightKeys.clone();
        this.buildSide = buildSide;

        Schema leftSchema = left.getSchema();
        Schema rightSchema = right.getSchema();
        this.leftWidth = leftSchema.size();
        this.rightWidth = rightSchema.size();

        // Mixed INTEGER/DOUBLE key pairs hash as DOUBLE so that 1 matches 1.0
        this.widenKeys = new boolean[leftKeys.length];
        for (int k = 0; k < leftKeys.length; k++) {
            DataType l = leftSchema.getField(leftKeys[k]).getType();
            DataType r = rightSchema.getField(rightKeys[k]).getType();
            widenKeys[k] = l != r;
        }

        List<Integer> usingLeftIndices = SchemaDerivations.usingIndices(leftSchema, usingColumns);
        List<Integer> usingRightIndices = SchemaDerivations.usingIndices(rightSchema, usingColumns);
        this.usingLeft = toArray(usingLeftIndices);
        this.usingRight = toArray(usingRightIndices);
        Set<Integer> dropped = new HashSet<>(usingRightIndices);
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < rightWidth; i++) {
            if (!dropped.contains(i)) {
                kept.add(i);
            }
        }
        this.keptRight = toArray(kept);
    }

    private static int[] toArray(List<Integer> values) {
        int[] array = new int[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return array;
    }

    public JoinType getJoinType() {
        return joinType;
    }

    public BuildSide getBuildSide() {
        return buildSide;
    }

    public PhysicalOperator getBuildChild() {
        return getChild(buildSide == BuildSide.LEFT ? 0 : 1);
    }

    public PhysicalOperator getProbeChild() {
        return getChild(buildSide == BuildSide.LEFT ? 1 : 0);
    }

    @Override
    public PhysicalOperatorType getType() {
        return PhysicalOperatorType.HASH_JOIN;
    }

    @Override
    protected String describeParameters() {
        return joinType + ", build=" + buildSide + ", leftKeys=" + Arrays.toString(leftKeys)
                + ", rightKeys=" + Arrays.toString(rightKeys) + (usingLeft.length > 0 ? ", using" : "");
    }

    private boolean buildPreserved() {
        return buildSide == BuildSide.LEFT ? joinType.preservesLeft() : joinType.preservesRight();
    }

    private boolean probePreserved() {
        return buildSide == BuildSide.LEFT ? joinType.preservesRight() : joinType.preservesLeft();
    }

    @Override
    protected void doOpen() {
        int[] buildKeys = buildSide == BuildSide.LEFT ? leftKeys : rightKeys;
        table = new HashMap<>();
        buildRows = new ArrayList<>();
        matched = new BitSet();
        Tuple tuple;
        while ((tuple = getBuildChild().next()) != null) {
            int index = buildRows.size();
            buildRows.add(tuple);
            List<Object> key = key(tuple, buildKeys);
            if (key != null) {
                table.computeIfAbsent(key, k -> new ArrayList<>()).add(index);
            }
        }
        logger.debug("HashJoin built {} rows into {} keys from the {} side", buildRows.size(), table.size(), buildSide);
    }

    /**
     * @return The normalised key of a row, or null if a key column is NULL.
     */
    private List<Object> key(Tuple tuple, int[] positions) {
        Object[] key = new Object[positions.length];
        for (int k = 0; k < positions.length; k++) {
            Object value = tuple.getAttribute(positions[k]);
            if (value == null) {
                return null;
            }
            key[k] = Values.hashKey(value, widenKeys[k]);
        }
        return Arrays.asList(key);
    }

    @Override
    protected Tuple doNext() {
        int[] probeKeys = buildSide == BuildSide.LEFT ? rightKeys : leftKeys;
        while (!probeExhausted) {
            if (probeMatches != null && probeMatchIndex < probeMatches.size()) {
                Tuple buildRow = buildRows.get(probeMatches.get(probeMatchIndex++));
                return combine(buildRow, probeRow);
            }
            probeRow = getProbeChild().next();
            probeMatches = null;
            probeMatchIndex = 0;
            if (probeRow == null) {
                probeExhausted = true;
                break;
            }
            List<Object> key = key(probeRow, probeKeys);
            List<Integer> matches = key == null ? null : table.get(key);
            if (matches == null) {
                if (probePreserved()) {
                    return combine(null, probeRow);
                }
                continue;
            }
            for (int index : matches) {
                matched.set(index);
            }
            probeMatches = matches;
        }

        if (buildPreserved()) {
            while (unmatchedBuildIndex < buildRows.size()) {
                int index = unmatchedBuildIndex++;
                if (!matched.get(index)) {
                    return combine(buildRows.get(index), null);
                }
            }
        }
        return null;
    }

    private Tuple combine(Tuple buildRow, Tuple probeRow) {
        Tuple left = buildSide == BuildSide.LEFT ? buildRow : probeRow;
        Tuple right = buildSide == BuildSide.LEFT ? probeRow : buildRow;
        List<Object> values = new ArrayList<>(leftWidth + keptRight.length);
        for (int i = 0; i < leftWidth; i++) {
            values.add(left == null ? null : left.getAttribute(i));
        }
        for (int k = 0; k < usingLeft.length; k++) {
            if (values.get(usingLeft[k]) == null && right != null) {
                values.set(usingLeft[k], right.getAttribute(usingRight[k]));
            }
        }
        for (int i : keptRight) {
            values.add(right == null ? null : right.getAttribute(i));
        }
        return new Tuple(values);
    }

    @Override
    protected void doClose() {
        table = null;
        buildRows = null;
        matched = null;
        probeRow = null;
        probeMatches = null;
    }

    /**
     * @return true while the build side is held in memory.
     */
    public boolean hasBufferedState() {
        return table != null || buildRows != null;
    }
}
