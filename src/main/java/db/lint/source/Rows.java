package db.lint.source;

import java.util.List;

/**
 * Single-pass, forward-only view of one table: the header line followed by data rows.
 */
public interface Rows {
    List<String> header();
    List<String> next(); // returns next row or null when exhausted; read failures throw
}
