package db.lint.catalog;

import java.util.List;

/**
 * Ordered, non-empty tuple of column names: a single column or a composite key.
 * Equality is positional, so ('a', 'b') and ('b', 'a') differ.
 */
public record Column(List<String> names) {
    public Column {
        if (names == null || names.isEmpty()) {
            throw new IllegalArgumentException("Composite columns must be at least one column long");
        }
        names = List.copyOf(names);
    }

    public static Column of(String... names) {
        return new Column(List.of(names));
    }

    public int size() { return names.size(); }

    public String get(int i) { return names.get(i); }

    @Override
    public String toString() {
        if (names.size() == 1) return "'" + names.get(0) + "'";
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append('\'').append(names.get(i)).append('\'');
        }
        return sb.append(')').toString();
    }
}
