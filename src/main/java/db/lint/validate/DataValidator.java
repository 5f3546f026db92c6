package db.lint.validate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.lint.catalog.AnnotatedTableSpec;
import db.lint.catalog.ColumnSpec;
import db.lint.error.DataException;
import db.lint.error.DataException.Kind;
import db.lint.source.RowSource;
import db.lint.source.Rows;

/**
 * Streams every table of a checked schema through its row pipeline:
 * cell count, cell types, not-null, primary key uniqueness.
 * Tables are visited in schema order and the first violation aborts the whole pass.
 *
 * Every cell goes through its type's validator, so an empty cell is only accepted by
 * string columns; the not-null check then rejects it where the column demands a value.
 *
 * Not enforced: uniqueness of non primary key unique columns, existence of foreign key
 * values in the referenced table, and null-freedom of individual primary key columns
 * beyond what their own not-null flag demands.
 */
public class DataValidator {
    private static final Logger log = LoggerFactory.getLogger(DataValidator.class);

    public void validate(Map<String, AnnotatedTableSpec> tables, RowSource source) {
        for (AnnotatedTableSpec table : tables.values()) {
            source.withTable(table.name(), rows -> validateTable(table, rows));
        }
    }

    void validateTable(AnnotatedTableSpec table, Rows rows) {
        log.debug("Validating table '{}'", table.name());
        checkHeader(table, rows.header());

        CompositeKeySet keys = new CompositeKeySet();
        List<RowCheck> pipeline = buildPipeline(table, keys);
        int rowNumber = 1; // header
        List<String> row;
        while ((row = rows.next()) != null) {
            rowNumber++;
            for (RowCheck check : pipeline) check.check(row, rowNumber);
        }
        log.debug("Table '{}' valid: {} data row(s), {} distinct primary key(s)",
            table.name(), rowNumber - 1, keys.size());
    }

    private void checkHeader(AnnotatedTableSpec table, List<String> header) {
        List<ColumnSpec> columns = table.columns();
        if (header.size() != columns.size()) {
            throw new DataException(Kind.HEADER_ARITY_MISMATCH, table.name(), 1,
                "'" + table.name() + "' header: wanted " + columns.size() + " columns, found " + header.size());
        }
        for (int i = 0; i < columns.size(); i++) {
            if (!columns.get(i).name().equals(header.get(i))) {
                throw new DataException(Kind.HEADER_MISMATCH, table.name(), 1,
                    "'" + table.name() + "' header column " + (i + 1) + ": wanted '" + columns.get(i).name()
                        + "', found '" + header.get(i) + "'");
            }
        }
    }

    // Built once per table, before the first row is read.
    private List<RowCheck> buildPipeline(AnnotatedTableSpec table, CompositeKeySet keys) {
        String name = table.name();
        List<ColumnSpec> columns = table.columns();
        List<RowCheck> pipeline = new ArrayList<>();

        pipeline.add((row, rowNumber) -> {
            if (row.size() != columns.size()) {
                throw new DataException(Kind.ROW_ARITY_MISMATCH, name, rowNumber,
                    "'" + name + "' row " + rowNumber + ": wanted " + columns.size() + " columns, found " + row.size());
            }
        });

        ValueValidator[] validators = new ValueValidator[columns.size()];
        for (int i = 0; i < validators.length; i++) validators[i] = ValueValidators.forType(columns.get(i).type());
        pipeline.add((row, rowNumber) -> {
            for (int i = 0; i < validators.length; i++) {
                try {
                    validators[i].validate(row.get(i));
                } catch (IllegalArgumentException e) {
                    throw new DataException(Kind.TYPE_MISMATCH, name, rowNumber,
                        cellPrefix(name, columns.get(i), rowNumber) + e.getMessage());
                }
            }
        });

        List<Integer> notNull = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) if (columns.get(i).notNull()) notNull.add(i);
        if (!notNull.isEmpty()) {
            pipeline.add((row, rowNumber) -> {
                for (int i : notNull) {
                    if (row.get(i).isEmpty()) {
                        throw new DataException(Kind.NULL_VIOLATION, name, rowNumber,
                            cellPrefix(name, columns.get(i), rowNumber) + "Found null value in not-null column");
                    }
                }
            });
        }

        if (table.hasPrimaryKey()) {
            int[] pk = table.primaryKeyIndices();
            pipeline.add((row, rowNumber) -> {
                List<String> tuple = new ArrayList<>(pk.length);
                for (int idx : pk) tuple.add(row.get(idx));
                if (keys.exists(tuple)) {
                    throw new DataException(Kind.DUPLICATE_KEY, name, rowNumber,
                        "'" + name + "' row " + rowNumber + ": duplicate primary key " + table.spec().primaryKey()
                            + " value " + renderTuple(tuple));
                }
                keys.insert(tuple);
            });
        }
        return pipeline;
    }

    private static String cellPrefix(String table, ColumnSpec column, int rowNumber) {
        return "'" + table + "'.'" + column.name() + "' row " + rowNumber + ": ";
    }

    static String renderTuple(List<String> tuple) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < tuple.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append('"').append(tuple.get(i).replace("\\", "\\\\").replace("\"", "\\\"")).append('"');
        }
        return sb.append(')').toString();
    }
}
