package db.lint.error;

/**
 * A table's header or one of its rows violates the schema.
 * Row numbers are 1-based counting the header line, so the first data row is 2.
 * Header-level failures carry row 1.
 */
public class DataException extends LintException {
    public enum Kind {
        HEADER_ARITY_MISMATCH,
        HEADER_MISMATCH,
        ROW_ARITY_MISMATCH,
        TYPE_MISMATCH,
        NULL_VIOLATION,
        DUPLICATE_KEY
    }

    private final Kind kind;
    private final String table;
    private final int row;

    public DataException(Kind kind, String table, int row, String message) {
        super(message);
        this.kind = kind;
        this.table = table;
        this.row = row;
    }

    public Kind kind() { return kind; }
    public String table() { return table; }
    public int row() { return row; }
}
