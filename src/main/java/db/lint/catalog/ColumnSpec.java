package db.lint.catalog;

import com.google.gson.annotations.SerializedName;

// One physical column of a table.
public record ColumnSpec(
    String name,
    DataType type,
    @SerializedName("not_null") boolean notNull
) {
    public static ColumnSpec of(String name, DataType type) {
        return new ColumnSpec(name, type, false);
    }
}
