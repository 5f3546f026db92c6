package db.lint.catalog;

import java.util.List;

// Immutable, ordered set of table declarations for one run.
public record Schema(List<TableSpec> tables) {
    public Schema {
        tables = tables == null ? List.of() : List.copyOf(tables);
    }

    public static Schema of(TableSpec... tables) {
        return new Schema(List.of(tables));
    }
}
