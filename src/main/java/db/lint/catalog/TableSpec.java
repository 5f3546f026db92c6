package db.lint.catalog;

import java.util.List;

import com.google.gson.annotations.SerializedName;

/**
 * Declared shape of one table. primaryKey is null when the table has none.
 * The name doubles as the data file name the row source opens.
 */
public record TableSpec(
    String name,
    @SerializedName("primary_key") Column primaryKey,
    @SerializedName("unique_columns") List<Column> uniqueColumns,
    @SerializedName("foreign_keys") List<ForeignKeyMapping> foreignKeys,
    List<ColumnSpec> columns
) {
    public TableSpec {
        uniqueColumns = uniqueColumns == null ? List.of() : List.copyOf(uniqueColumns);
        foreignKeys = foreignKeys == null ? List.of() : List.copyOf(foreignKeys);
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public TableSpec(String name, Column primaryKey, List<ColumnSpec> columns) {
        this(name, primaryKey, List.of(), List.of(), columns);
    }

    public boolean hasPrimaryKey() { return primaryKey != null; }
}
