package ed.inf.adbs.emberdb;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The Tuple class represents a row of data.
 * A tuple consists of an ordered list of attribute values, where SQL NULL is {@code null}.
 * The tuple attributes are immutable after creation.
 * The tuple itself is unaware of the schema despite maintaining order.
 */
public final class Tuple {

    // Attribute values in a row
    private final List<Object> attributes;

    /**
     * Construct a tuple consisting a list of ordered attributes.
     * @param attributes The attribute values, copied defensively.
     */
    public Tuple(List<?> attributes) {
        this.attributes = Collections.unmodifiableList(new ArrayList<>(attributes));
    }

    /**
     * Convenience factory for literal rows, mainly used by tests and in-memory tables.
     * @param values The attribute values in order.
     * @return A new tuple.
     */
    public static Tuple of(Object... values) {
        return new Tuple(Arrays.asList(values));
    }

    /**
     * Get the list of attributes.
     * @return An unmodifiable ordered list of attribute values.
     */
    public List<Object> getValues() {
        return attributes;
    }

    /**
     * Get a single attribute.
     * @param i The zero-based index of the attribute to retrieve.
     * @return The value of the attribute, or null for SQL NULL.
     */
    public Object getAttribute(int i) {
        return attributes.get(i);
    }

    public int size() {
        return attributes.size();
    }

    /**
     * Converts the tuple to a comma-separated string.
     * @return A string representation of the row of attributes.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < attributes.size(); i++) {
            sb.append(Values.format(attributes.get(i)));
            if (i < attributes.size() - 1) {
                sb.append(", ");
            }
        }
        return sb.toString();
    }

    /**
     * Two tuples are equal if they have the same number of attributes
     * and each attribute at the same position has the same value.
     * Binary attributes are compared by content.
     * @param o The object to compare with.
     * @return true if given object is a tuple with identical attributes in the same order.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Tuple other = (Tuple) o;

        if (attributes.size() != other.attributes.size()) {
            return false;
        }

        for (int i = 0; i < attributes.size(); i++) {
            if (!Objects.deepEquals(attributes.get(i), other.attributes.get(i))) {
                return false;
            }
        }

        return true;
    }

    /**
     * Return a hash code for this tuple, consistent with {@link #equals(Object)}.
     * @return A hash code value for this tuple.
     */
    @Override
    public int hashCode() {
        return Arrays.deepHashCode(attributes.toArray());
    }
}
