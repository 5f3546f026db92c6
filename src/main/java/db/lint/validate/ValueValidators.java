package db.lint.validate;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

import db.lint.catalog.DataType;

/**
 * Validators for the closed set of column data types.
 */
public final class ValueValidators {
    private ValueValidators() {}

    // ASCII digits only; Long.parseLong alone would also accept other Unicode digits.
    private static final Pattern INT_LITERAL = Pattern.compile("[+-]?[0-9]+");

    public static final ValueValidator INT = raw -> {
        if (!INT_LITERAL.matcher(raw).matches()) throw illegal(DataType.INT, raw);
        try {
            Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw illegal(DataType.INT, raw);
        }
    };

    public static final ValueValidator BOOL = raw -> {
        if (!raw.equals("true") && !raw.equals("false")) throw illegal(DataType.BOOL, raw);
    };

    public static final ValueValidator STRING = raw -> {};

    public static ValueValidator forType(DataType type) {
        return switch (type.kind()) {
            case INT -> INT;
            case BOOL -> BOOL;
            case STRING -> STRING;
            case DATE -> date(type);
        };
    }

    private static ValueValidator date(DataType type) {
        DateTimeFormatter formatter = type.formatter();
        return raw -> {
            try {
                formatter.parse(raw);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException(
                    "Value '" + raw + "' does not match date format '" + type.format() + "'");
            }
        };
    }

    private static IllegalArgumentException illegal(DataType type, String raw) {
        return new IllegalArgumentException("Illegal value for type '" + type + "': '" + raw + "'");
    }
}
