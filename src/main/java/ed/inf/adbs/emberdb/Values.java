package ed.inf.adbs.emberdb;

import ed.inf.adbs.emberdb.catalog.DataType;

/**
 * Static helpers for comparing, converting and printing attribute values.
 * Values are Long, Double, String, Boolean or byte[]; SQL NULL is {@code null}
 * and is never passed to {@link #compare(Object, Object)}.
 */
public final class Values {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Values() {
    }

    /**
     * Compares two non-null values of compatible types.
     * Mixed INTEGER/DOUBLE operands are compared numerically.
     * @param left The left value.
     * @param right The right value.
     * @return A negative, zero or positive integer as the left value is less than, equal to or greater than the right.
     * @throws IllegalArgumentException If the values are not comparable.
     */
    public static int compare(Object left, Object right) {
        if (left instanceof Long && right instanceof Long) {
            return Long.compare((Long) left, (Long) right);
        }
        if (left instanceof Number && right instanceof Number) {
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
        }
        if (left instanceof String && right instanceof String) {
            return ((String) left).compareTo((String) right);
        }
        if (left instanceof Boolean && right instanceof Boolean) {
            return Boolean.compare((Boolean) left, (Boolean) right);
        }
        throw new IllegalArgumentException("Cannot compare " + describe(left) + " with " + describe(right));
    }

    /**
     * Equality used by comparisons and join keys: numeric values compare by value
     * across INTEGER and DOUBLE, binary values by content.
     */
    public static boolean equal(Object left, Object right) {
        if (left instanceof byte[] && right instanceof byte[]) {
            return java.util.Arrays.equals((byte[]) left, (byte[]) right);
        }
        return compare(left, right) == 0;
    }

    /**
     * Normalises a hash key component so that equal numeric values of different
     * types hash alike.
     * @param value The value, may be null.
     * @param widen Whether the key position mixes INTEGER and DOUBLE columns.
     * @return The value to put in a hash key.
     */
    public static Object hashKey(Object value, boolean widen) {
        if (widen && value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return value;
    }

    /**
     * Parses the textual form of a value, as stored in CSV files.
     * @param text The text, an empty string means NULL.
     * @param type The declared column type.
     * @return The parsed value.
     */
    public static Object parse(String text, DataType type) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        switch (type) {
            case INTEGER:
                return Long.parseLong(text);
            case DOUBLE:
                return Double.parseDouble(text);
            case BOOLEAN:
                return Boolean.parseBoolean(text);
            case BINARY:
                return parseHex(text);
            case STRING:
            default:
                return text;
        }
    }

    /**
     * Renders a value for display and for the tuple string form.
     */
    public static String format(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof byte[]) {
            byte[] bytes = (byte[]) value;
            StringBuilder sb = new StringBuilder("0x");
            for (byte b : bytes) {
                sb.append(HEX[(b >> 4) & 0xF]).append(HEX[b & 0xF]);
            }
            return sb.toString();
        }
        return value.toString();
    }

    private static byte[] parseHex(String text) {
        String digits = text.startsWith("0x") || text.startsWith("0X") ? text.substring(2) : text;
        if (digits.length() % 2 != 0) {
            throw new NumberFormatException("Odd number of hex digits in " + text);
        }
        byte[] bytes = new byte[digits.length() / 2];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = (byte) Integer.parseInt(digits.substring(2 * i, 2 * i + 2), 16);
        }
        return bytes;
    }

    private static String describe(Object value) {
        return value == null ? "NULL" : value.getClass().getSimpleName() + "(" + format(value) + ")";
    }
}
