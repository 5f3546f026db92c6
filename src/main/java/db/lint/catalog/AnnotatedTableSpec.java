package db.lint.catalog;

import java.util.Arrays;
import java.util.List;

/**
 * TableSpec after a successful consistency check, with the position of each
 * primary key column inside {@code columns} already resolved.
 * primaryKeyIndices is empty when the table declares no primary key.
 */
public record AnnotatedTableSpec(TableSpec spec, int[] primaryKeyIndices) {
    public AnnotatedTableSpec {
        primaryKeyIndices = primaryKeyIndices == null ? new int[0] : primaryKeyIndices.clone();
    }

    public String name() { return spec.name(); }
    public List<ColumnSpec> columns() { return spec.columns(); }
    public boolean hasPrimaryKey() { return primaryKeyIndices.length > 0; }

    @Override
    public int[] primaryKeyIndices() { return primaryKeyIndices.clone(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnnotatedTableSpec other)) return false;
        return spec.equals(other.spec) && Arrays.equals(primaryKeyIndices, other.primaryKeyIndices);
    }

    @Override
    public int hashCode() {
        return 31 * spec.hashCode() + Arrays.hashCode(primaryKeyIndices);
    }

    @Override
    public String toString() {
        return "AnnotatedTableSpec[" + spec.name() + ", pk=" + Arrays.toString(primaryKeyIndices) + "]";
    }
}
