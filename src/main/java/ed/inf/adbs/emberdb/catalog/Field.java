package ed.inf.adbs.emberdb.catalog;

import java.util.Objects;

/**
 * A single column of a {@link Schema}: the qualifier of the relation it came from
 * (table name or alias, null for computed columns), its name and its type.
 */
public final class Field {

    private final String qualifier;
    private final String name;
    private final DataType type;

    public Field(String qualifier, String name, DataType type) {
        this.qualifier = qualifier;
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getQualifier() {
        return qualifier;
    }

    public String getName() {
        return name;
    }

    public DataType getType() {
        return type;
    }

    /**
     * @param newQualifier The qualifier to use instead.
     * @return A copy of this field under another qualifier.
     */
    public Field withQualifier(String newQualifier) {
        return new Field(newQualifier, name, type);
    }

    /**
     * Checks whether a (possibly unqualified) column reference denotes this field.
     * Names compare case-insensitively.
     * @param refQualifier The qualifier written in the query, or null.
     * @param refName The column name written in the query.
     * @return true if the reference matches.
     */
    public boolean matches(String refQualifier, String refName) {
        if (!name.equalsIgnoreCase(refName)) {
            return false;
        }
        return refQualifier == null || (qualifier != null && qualifier.equalsIgnoreCase(refQualifier));
    }

    /**
     * @return The qualified display name, e.g. {@code Student.sid}.
     */
    public String getQualifiedName() {
        return qualifier == null ? name : qualifier + "." + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Field field = (Field) o;
        return Objects.equals(qualifier, field.qualifier) && name.equals(field.name) && type == field.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(qualifier, name, type);
    }

    @Override
    public String toString() {
        return getQualifiedName() + ":" + type.name();
    }
}
