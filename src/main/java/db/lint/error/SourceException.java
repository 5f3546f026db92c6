package db.lint.error;

/**
 * The row source could not locate, open or read a table.
 */
public class SourceException extends LintException {
    public enum Kind {
        ILLEGAL_TABLE_NAME,
        TABLE_NOT_FOUND,
        MISSING_HEADER,
        READ_FAILED
    }

    private final Kind kind;
    private final String table;

    public SourceException(Kind kind, String table, String message) {
        super(message);
        this.kind = kind;
        this.table = table;
    }

    public SourceException(Kind kind, String table, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.table = table;
    }

    public Kind kind() { return kind; }
    public String table() { return table; }
}
