package db.lint.validate;

import java.util.List;

/**
 * One stage of a table's row pipeline. Throws DataException on the first violation.
 */
@FunctionalInterface
interface RowCheck {
    void check(List<String> row, int rowNumber);
}
