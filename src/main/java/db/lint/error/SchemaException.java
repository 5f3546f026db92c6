package db.lint.error;

/**
 * Structural problem in the schema itself, found without reading any data.
 */
public class SchemaException extends LintException {
    public enum Kind {
        MALFORMED_SCHEMA,
        INVALID_TYPE,
        INVALID_TABLE_NAME,
        INVALID_COLUMN_NAME,
        DUPLICATE_TABLE,
        DUPLICATE_COLUMN,
        UNRESOLVED_PRIMARY_KEY_COLUMN,
        UNRESOLVED_UNIQUE_COLUMN,
        FOREIGN_KEY_ARITY_MISMATCH,
        UNRESOLVED_FOREIGN_TABLE,
        FOREIGN_TABLE_WITHOUT_PRIMARY_KEY,
        FOREIGN_COLUMN_NOT_PRIMARY_KEY,
        UNRESOLVED_LOCAL_COLUMN,
        UNRESOLVED_FOREIGN_COLUMN,
        FOREIGN_KEY_TYPE_MISMATCH
    }

    private final Kind kind;

    public SchemaException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SchemaException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() { return kind; }
}
