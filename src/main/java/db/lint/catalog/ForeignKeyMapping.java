package db.lint.catalog;

import com.google.gson.annotations.SerializedName;

// localColumn (possibly composite) must match the primary key of foreignTable.
public record ForeignKeyMapping(
    @SerializedName("local_column") Column localColumn,
    @SerializedName("foreign_table") String foreignTable,
    @SerializedName("foreign_column") Column foreignColumn
) {}
