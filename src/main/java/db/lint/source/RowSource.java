package db.lint.source;

/**
 * Supplies the contents of a table by name. The rows handed to the body are only valid
 * inside the call; the underlying resource is released when withTable returns or throws.
 */
public interface RowSource {
    void withTable(String table, TableBody body);

    @FunctionalInterface
    interface TableBody { void accept(Rows rows); }
}
