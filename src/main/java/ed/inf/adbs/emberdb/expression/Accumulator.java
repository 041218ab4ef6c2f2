package ed.inf.adbs.emberdb.expression;

import ed.inf.adbs.emberdb.Values;
import ed.inf.adbs.emberdb.catalog.DataType;

import java.util.HashSet;
import java.util.Set;

/**
 * Running state of one aggregate for one group.
 * NULL inputs are ignored, except by COUNT(*) which is fed a non-null marker per row.
 */
public abstract class Accumulator {

    /**
     * Folds one input value into the state.
     * @param value The evaluated argument, may be null.
     */
    public abstract void add(Object value);

    /**
     * @return The aggregate value, null where SQL says so.
     */
    public abstract Object result();

    /**
     * Creates an empty accumulator for an aggregate call.
     * @param call The aggregate.
     * @return A fresh accumulator.
     */
    public static Accumulator create(AggregateCall call) {
        Accumulator accumulator;
        switch (call.getFunction()) {
            case COUNT:
                accumulator = new Count();
                break;
            case SUM:
                accumulator = call.getType() == DataType.INTEGER ? new LongSum() : new DoubleSum();
                break;
            case AVG:
                accumulator = new Average();
                break;
            case MIN:
                accumulator = new Extreme(false);
                break;
            case MAX:
                accumulator = new Extreme(true);
                break;
            default:
                throw new AssertionError(call.getFunction());
        }
        return call.isDistinct() ? new Distinct(accumulator, call.getArgument().getType()) : accumulator;
    }

    private static final class Count extends Accumulator {
        private long count;

        @Override
        public void add(Object value) {
            if (value != null) {
                count++;
            }
        }

        @Override
        public Object result() {
            return count;
        }
    }

    private static final class LongSum extends Accumulator {
        private long sum;
        private boolean seen;

        @Override
        public void add(Object value) {
            if (value != null) {
                sum = Math.addExact(sum, ((Number) value).longValue());
                seen = true;
            }
        }

        @Override
        public Object result() {
            return seen ? sum : null;
        }
    }

    private static final class DoubleSum extends Accumulator {
        private double sum;
        private boolean seen;

        @Override
        public void add(Object value) {
            if (value != null) {
                sum += ((Number) value).doubleValue();
                seen = true;
            }
        }

        @Override
        public Object result() {
            return seen ? sum : null;
        }
    }

    private static final class Average extends Accumulator {
        private double sum;
        private long count;

        @Override
        public void add(Object value) {
            if (value != null) {
                sum += ((Number) value).doubleValue();
                count++;
            }
        }

        @Override
        public Object result() {
            return count == 0 ? null : sum / count;
        }
    }

    private static final class Extreme extends Accumulator {
        private final boolean max;
        private Object current;

        Extreme(boolean max) {
            this.max = max;
        }

        @Override
        public void add(Object value) {
            if (value == null) {
                return;
            }
            if (current == null) {
                current = value;
                return;
            }
            int cmp = Values.compare(value, current);
            if (max ? cmp > 0 : cmp < 0) {
                current = value;
            }
        }

        @Override
        public Object result() {
            return current;
        }
    }

    // Feeds each distinct non-null value to the wrapped accumulator once.
    private static final class Distinct extends Accumulator {
        private final Accumulator delegate;
        private final boolean widen;
        private final Set<Object> seen = new HashSet<>();

        Distinct(Accumulator delegate, DataType argumentType) {
            this.delegate = delegate;
            this.widen = argumentType == DataType.DOUBLE;
        }

        @Override
        public void add(Object value) {
            if (value != null && seen.add(Values.hashKey(value, widen))) {
                delegate.add(value);
            }
        }

        @Override
        public Object result() {
            return delegate.result();
        }
    }
}
