package ed.inf.adbs.emberdb.catalog;

import java.util.Locale;

/**
 * Scalar column types supported by EmberDB, with the Java class carrying their values.
 * BINARY values are opaque byte arrays: they can be stored, projected and tested for
 * equality, but they are neither hashable nor orderable.
 */
public enum DataType {

    INTEGER(Long.class, true, true),

    DOUBLE(Double.class, true, true),

    STRING(String.class, true, true),

    BOOLEAN(Boolean.class, true, true),

    BINARY(byte[].class, false, false);

    private final Class<?> javaType;
    private final boolean hashable;
    private final boolean orderable;

    DataType(Class<?> javaType, boolean hashable, boolean orderable) {
        this.javaType = javaType;
        this.hashable = hashable;
        this.orderable = orderable;
    }

    public Class<?> getJavaType() {
        return javaType;
    }

    /**
     * @return true if values of this type can serve as hash table keys.
     */
    public boolean isHashable() {
        return hashable;
    }

    /**
     * @return true if values of this type have a total order usable for sorting and MIN/MAX.
     */
    public boolean isOrderable() {
        return orderable;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == DOUBLE;
    }

    /**
     * Two types are comparable when they are equal or both numeric.
     * @param other The other operand type.
     * @return true if a comparison between the two types is well typed.
     */
    public boolean isComparableWith(DataType other) {
        return this == other || (this.isNumeric() && other.isNumeric());
    }

    /**
     * Parses a type name as written in a schema file.
     * @param name The type name, case-insensitive.
     * @return The matching type.
     * @throws IllegalArgumentException If the name is not a known type.
     */
    public static DataType fromName(String name) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "int":
            case "integer":
            case "long":
            case "bigint":
                return INTEGER;
            case "double":
            case "float":
            case "real":
                return DOUBLE;
            case "string":
            case "varchar":
            case "text":
                return STRING;
            case "bool":
            case "boolean":
                return BOOLEAN;
            case "binary":
            case "bytes":
            case "blob":
                return BINARY;
            default:
                throw new IllegalArgumentException("Unknown column type: " + name);
        }
    }
}
