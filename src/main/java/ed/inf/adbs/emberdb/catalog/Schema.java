package ed.inf.adbs.emberdb.catalog;

import ed.inf.adbs.emberdb.exception.UnresolvedReferenceException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered, immutable sequence of fields describing the rows an operator produces.
 * Columns are identified by position; names need not be unique, so resolving an
 * unqualified name that matches several fields is reported as ambiguous.
 */
public final class Schema {

    private final List<Field> fields;

    public Schema(List<Field> fields) {
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public static Schema of(Field... fields) {
        List<Field> list = new ArrayList<>();
        Collections.addAll(list, fields);
        return new Schema(list);
    }

    public List<Field> getFields() {
        return fields;
    }

    public Field getField(int index) {
        return fields.get(index);
    }

    public int size() {
        return fields.size();
    }

    /**
     * Resolves a column reference to its position.
     * @param qualifier The table name or alias, or null for an unqualified reference.
     * @param name The column name.
     * @return The zero-based index, or -1 if no field matches.
     * @throws UnresolvedReferenceException If several fields match.
     */
    public int indexOf(String qualifier, String name) {
        int found = -1;
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).matches(qualifier, name)) {
                if (found >= 0) {
                    String ref = qualifier == null ? name : qualifier + "." + name;
                    throw new UnresolvedReferenceException(ref, "Column reference " + ref + " is ambiguous in " + this);
                }
                found = i;
            }
        }
        return found;
    }

    /**
     * @param qualifier A table name or alias.
     * @return The positions of the fields carrying the qualifier, in order.
     */
    public List<Integer> indicesOf(String qualifier) {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < fields.size(); i++) {
            String q = fields.get(i).getQualifier();
            if (q != null && q.equalsIgnoreCase(qualifier)) {
                indices.add(i);
            }
        }
        return indices;
    }

    /**
     * @return The schema of a row made of this schema's columns followed by the other's.
     */
    public Schema concat(Schema other) {
        List<Field> combined = new ArrayList<>(fields);
        combined.addAll(other.fields);
        return new Schema(combined);
    }

    /**
     * @return A copy of this schema with every field under the given qualifier.
     */
    public Schema withQualifier(String qualifier) {
        List<Field> renamed = new ArrayList<>();
        for (Field field : fields) {
            renamed.add(field.withQualifier(qualifier));
        }
        return new Schema(renamed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return fields.equals(((Schema) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
