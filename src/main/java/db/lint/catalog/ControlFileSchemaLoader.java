package db.lint.catalog;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.lint.error.SchemaException;
import db.lint.source.FileSystemRowSource;
import db.lint.source.RowSource;
import db.lint.validate.DataValidator;
import db.lint.validate.SchemaChecker;

/**
 * Reads a schema from the flat control file {@value #CONTROL_FILE}, one row per column:
 * <pre>
 * table,column,not_null,unique,primary_key,type,references_table,references_column
 * </pre>
 * The control file is validated against {@link #META_SCHEMA} with the regular checker and
 * validator before it is interpreted. Primary key flags are collected in row order into
 * the table's (possibly composite) primary key and imply not-null. Tables keep the order
 * in which they first appear.
 */
public class ControlFileSchemaLoader {
    private static final Logger log = LoggerFactory.getLogger(ControlFileSchemaLoader.class);

    public static final String CONTROL_FILE = "schema.csv";

    // Column positions are fixed: the header is validated positionally against META_SCHEMA.
    private static final int TABLE = 0;
    private static final int COLUMN = 1;
    private static final int NOT_NULL = 2;
    private static final int UNIQUE = 3;
    private static final int PRIMARY_KEY = 4;
    private static final int TYPE = 5;
    private static final int REFERENCES_TABLE = 6;
    private static final int REFERENCES_COLUMN = 7;

    public static final Schema META_SCHEMA = Schema.of(new TableSpec(
        CONTROL_FILE,
        null,
        List.of(
            new ColumnSpec("table", DataType.STRING, true),
            new ColumnSpec("column", DataType.STRING, true),
            new ColumnSpec("not_null", DataType.BOOL, true),
            new ColumnSpec("unique", DataType.BOOL, true),
            new ColumnSpec("primary_key", DataType.BOOL, true),
            new ColumnSpec("type", DataType.STRING, true),
            new ColumnSpec("references_table", DataType.STRING, false),
            new ColumnSpec("references_column", DataType.STRING, false)
        )
    ));

    private final SchemaChecker checker = new SchemaChecker();
    private final DataValidator validator = new DataValidator();

    public Schema load(Path directory) {
        return load(new FileSystemRowSource(directory));
    }

    public Schema load(RowSource source) {
        validator.validate(checker.check(META_SCHEMA), source);

        Map<String, TableBuilder> tables = new LinkedHashMap<>();
        source.withTable(CONTROL_FILE, rows -> {
            int line = 1;
            List<String> row;
            while ((row = rows.next()) != null) {
                line++;
                String tableName = row.get(TABLE);
                TableBuilder table = tables.computeIfAbsent(tableName, TableBuilder::new);
                table.add(row, line);
            }
        });

        List<TableSpec> specs = new ArrayList<>();
        for (TableBuilder b : tables.values()) specs.add(b.build());
        log.debug("Control file declared {} table(s)", specs.size());
        return new Schema(specs);
    }

    private static final class TableBuilder {
        private final String name;
        private final List<ColumnSpec> columns = new ArrayList<>();
        private final List<String> primaryKey = new ArrayList<>();
        private final List<Column> unique = new ArrayList<>();
        private final List<ForeignKeyMapping> foreignKeys = new ArrayList<>();

        TableBuilder(String name) { this.name = name; }

        void add(List<String> row, int line) {
            String column = row.get(COLUMN);
            DataType type;
            try {
                type = DataType.parse(row.get(TYPE));
            } catch (SchemaException e) {
                throw new SchemaException(e.kind(),
                    "Error parsing column type on line " + line + ": " + e.getMessage(), e);
            }
            boolean isPrimaryKey = Boolean.parseBoolean(row.get(PRIMARY_KEY));
            boolean notNull = isPrimaryKey || Boolean.parseBoolean(row.get(NOT_NULL));
            columns.add(new ColumnSpec(column, type, notNull));

            if (isPrimaryKey) primaryKey.add(column);
            if (Boolean.parseBoolean(row.get(UNIQUE))) unique.add(Column.of(column));

            String refTable = row.get(REFERENCES_TABLE);
            String refColumn = row.get(REFERENCES_COLUMN);
            if (refTable.isEmpty() != refColumn.isEmpty()) {
                throw new SchemaException(SchemaException.Kind.MALFORMED_SCHEMA,
                    "Line " + line + ": references_table and references_column must be set together");
            }
            if (!refTable.isEmpty()) {
                foreignKeys.add(new ForeignKeyMapping(Column.of(column), refTable, Column.of(refColumn)));
            }
        }

        TableSpec build() {
            Column pk = primaryKey.isEmpty() ? null : new Column(primaryKey);
            return new TableSpec(name, pk, unique, foreignKeys, columns);
        }
    }
}
