package ed.inf.adbs.emberdb.operator;

import ed.inf.adbs.emberdb.Constants;

/**
 * Output row estimates of the physical operators, derived from their inputs' estimates.
 * An unknown estimate ({@link Constants#UNKNOWN_ROW_COUNT}) propagates upwards.
 */
public final class RowEstimates {

    private RowEstimates() {
    }

    public static boolean isKnown(long estimate) {
        return estimate >= 0;
    }

    public static long filter(long child) {
        if (!isKnown(child)) {
            return Constants.UNKNOWN_ROW_COUNT;
        }
        return (long) Math.ceil(child * Constants.FILTER_SELECTIVITY);
    }

    public static long aggregate(long child, boolean grouped) {
        if (!grouped) {
            return 1;
        }
        return child;
    }

    public static long join(long left, long right) {
        if (!isKnown(left) || !isKnown(right)) {
            return Constants.UNKNOWN_ROW_COUNT;
        }
        return Math.max(left, right);
    }

    public static long limit(long child, long count) {
        if (!isKnown(child)) {
            return count;
        }
        return Math.min(child, count);
    }
}
