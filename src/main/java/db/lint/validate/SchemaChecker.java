package db.lint.validate;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.lint.catalog.AnnotatedTableSpec;
import db.lint.catalog.Column;
import db.lint.catalog.ColumnSpec;
import db.lint.catalog.DataType;
import db.lint.catalog.ForeignKeyMapping;
import db.lint.catalog.Schema;
import db.lint.catalog.TableSpec;
import db.lint.error.SchemaException;
import db.lint.error.SchemaException.Kind;

/**
 * Proves a schema is well formed before any data is read. Checks run in a fixed
 * order and the first violation is thrown as a {@link SchemaException}:
 * <ol>
 *   <li>table names are non-empty and unique</li>
 *   <li>per table, column names are non-empty and unique and types are usable</li>
 *   <li>primary key names resolve (their positions are recorded)</li>
 *   <li>unique column names resolve</li>
 *   <li>foreign keys: arity, target table, target primary key, name resolution, types</li>
 * </ol>
 * Foreign keys may reference tables declared later in the schema.
 */
public class SchemaChecker {
    private static final Logger log = LoggerFactory.getLogger(SchemaChecker.class);

    /** Returns the annotated tables keyed by name, in schema order. */
    public Map<String, AnnotatedTableSpec> check(Schema schema) {
        Map<String, TableSpec> byName = checkTableNames(schema.tables());

        Map<String, AnnotatedTableSpec> annotated = new LinkedHashMap<>();
        for (TableSpec table : schema.tables()) {
            checkColumns(table);
            int[] pk = resolvePrimaryKey(table);
            checkUniqueColumns(table);
            for (ForeignKeyMapping fk : table.foreignKeys()) {
                checkForeignKey(table, fk, byName);
            }
            annotated.put(table.name(), new AnnotatedTableSpec(table, pk));
        }
        log.debug("Schema consistent: {} table(s)", annotated.size());
        return Collections.unmodifiableMap(annotated);
    }

    private Map<String, TableSpec> checkTableNames(List<TableSpec> tables) {
        Map<String, TableSpec> byName = new LinkedHashMap<>();
        for (TableSpec table : tables) {
            if (table.name() == null || table.name().isEmpty()) {
                throw new SchemaException(Kind.INVALID_TABLE_NAME, "Invalid table name: ''");
            }
            if (byName.putIfAbsent(table.name(), table) != null) {
                throw new SchemaException(Kind.DUPLICATE_TABLE, "Table name exists: '" + table.name() + "'");
            }
        }
        return byName;
    }

    private void checkColumns(TableSpec table) {
        Set<String> seen = new HashSet<>();
        for (ColumnSpec column : table.columns()) {
            if (column.name() == null || column.name().isEmpty()) {
                throw new SchemaException(Kind.INVALID_COLUMN_NAME,
                    "Invalid column name: '" + table.name() + "'.''");
            }
            if (!seen.add(column.name())) {
                throw new SchemaException(Kind.DUPLICATE_COLUMN,
                    "Column name exists: '" + table.name() + "'.'" + column.name() + "'");
            }
            if (column.type() == null) {
                throw new SchemaException(Kind.INVALID_TYPE,
                    "Missing type for column '" + table.name() + "'.'" + column.name() + "'");
            }
            if (column.type().kind() == DataType.Kind.DATE) {
                column.type().formatter();
            }
        }
    }

    private int[] resolvePrimaryKey(TableSpec table) {
        if (!table.hasPrimaryKey()) return new int[0];
        Column pk = table.primaryKey();
        int[] indices = new int[pk.size()];
        for (int i = 0; i < pk.size(); i++) {
            OptionalInt idx = indexOf(table.columns(), pk.get(i));
            if (idx.isEmpty()) {
                throw new SchemaException(Kind.UNRESOLVED_PRIMARY_KEY_COLUMN,
                    "Primary key " + pk + " of table '" + table.name() + "' names unknown column '" + pk.get(i) + "'");
            }
            indices[i] = idx.getAsInt();
        }
        return indices;
    }

    private void checkUniqueColumns(TableSpec table) {
        for (Column unique : table.uniqueColumns()) {
            for (String name : unique.names()) {
                if (indexOf(table.columns(), name).isEmpty()) {
                    throw new SchemaException(Kind.UNRESOLVED_UNIQUE_COLUMN,
                        "Unique column " + unique + " of table '" + table.name() + "' names unknown column '" + name + "'");
                }
            }
        }
    }

    private void checkForeignKey(TableSpec table, ForeignKeyMapping fk, Map<String, TableSpec> byName) {
        Column local = fk.localColumn();
        Column foreign = fk.foreignColumn();
        if (local == null || foreign == null || fk.foreignTable() == null) {
            throw new SchemaException(Kind.MALFORMED_SCHEMA,
                "Incomplete foreign key in table '" + table.name() + "': " + fk);
        }
        String prefix = "Foreign key '" + table.name() + "'." + local + " -> '" + fk.foreignTable() + "'." + foreign + ": ";

        if (local.size() != foreign.size()) {
            throw new SchemaException(Kind.FOREIGN_KEY_ARITY_MISMATCH,
                prefix + "local column has " + local.size() + " name(s), foreign column has " + foreign.size());
        }
        TableSpec target = byName.get(fk.foreignTable());
        if (target == null) {
            throw new SchemaException(Kind.UNRESOLVED_FOREIGN_TABLE,
                prefix + "table '" + fk.foreignTable() + "' is missing from the schema");
        }
        if (!target.hasPrimaryKey()) {
            throw new SchemaException(Kind.FOREIGN_TABLE_WITHOUT_PRIMARY_KEY,
                prefix + "table '" + target.name() + "' has no primary key");
        }
        if (!foreign.equals(target.primaryKey())) {
            throw new SchemaException(Kind.FOREIGN_COLUMN_NOT_PRIMARY_KEY,
                prefix + "foreign column must be the primary key " + target.primaryKey() + " of '" + target.name() + "'");
        }
        int[] localIdx = resolveAll(table, local, Kind.UNRESOLVED_LOCAL_COLUMN, prefix);
        int[] foreignIdx = resolveAll(target, foreign, Kind.UNRESOLVED_FOREIGN_COLUMN, prefix);
        for (int i = 0; i < localIdx.length; i++) {
            ColumnSpec l = table.columns().get(localIdx[i]);
            ColumnSpec f = target.columns().get(foreignIdx[i]);
            if (!l.type().equals(f.type())) {
                throw new SchemaException(Kind.FOREIGN_KEY_TYPE_MISMATCH,
                    prefix + "column '" + l.name() + "' is " + l.type() + " but '" + target.name() + "'.'"
                        + f.name() + "' is " + f.type());
            }
        }
    }

    private int[] resolveAll(TableSpec table, Column column, Kind kind, String prefix) {
        int[] out = new int[column.size()];
        for (int i = 0; i < column.size(); i++) {
            OptionalInt idx = indexOf(table.columns(), column.get(i));
            if (idx.isEmpty()) {
                throw new SchemaException(kind,
                    prefix + "column '" + column.get(i) + "' is missing from table '" + table.name() + "'");
            }
            out[i] = idx.getAsInt();
        }
        return out;
    }

    static OptionalInt indexOf(List<ColumnSpec> columns, String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (name.equals(columns.get(i).name())) return OptionalInt.of(i);
        }
        return OptionalInt.empty();
    }
}
