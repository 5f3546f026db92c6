package db.lint.catalog;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;

import db.lint.error.SchemaException;

/**
 * Supported cell data types. DATE carries the pattern its cells are parsed with;
 * for every other kind {@code format} is null.
 */
public record DataType(Kind kind, String format) {
    public enum Kind {
        INT,
        BOOL,
        STRING,
        DATE;
    }

    public static final DataType INT = new DataType(Kind.INT, null);
    public static final DataType BOOL = new DataType(Kind.BOOL, null);
    public static final DataType STRING = new DataType(Kind.STRING, null);

    private static final String DATE_PREFIX = "date(";

    public DataType {
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        if (kind == Kind.DATE && format == null) throw new IllegalArgumentException("date type requires a format");
        if (kind != Kind.DATE) format = null;
    }

    public static DataType date(String format) {
        return new DataType(Kind.DATE, format);
    }

    /**
     * Decode the textual form used by schema documents: int, bool, string or date(pattern).
     */
    public static DataType parse(String text) {
        if (text == null) throw new SchemaException(SchemaException.Kind.INVALID_TYPE, "Missing column type");
        switch (text) {
            case "int": return INT;
            case "bool": return BOOL;
            case "string": return STRING;
            default:
                if (text.startsWith(DATE_PREFIX) && text.endsWith(")") && text.length() > DATE_PREFIX.length()) {
                    DataType dt = date(text.substring(DATE_PREFIX.length(), text.length() - 1));
                    dt.formatter(); // reject patterns that cannot compile
                    return dt;
                }
                throw new SchemaException(SchemaException.Kind.INVALID_TYPE, "Couldn't match type: '" + text + "'");
        }
    }

    /**
     * Compiled pattern for a DATE type. Resolution is strict, so out-of-range values such
     * as 2023-02-30 are rejected; the era defaults to AD so year-of-era patterns (yyyy)
     * resolve without a G field.
     */
    public DateTimeFormatter formatter() {
        if (kind != Kind.DATE) throw new IllegalStateException("Not a date type: " + this);
        try {
            return new DateTimeFormatterBuilder()
                .appendPattern(format)
                .parseDefaulting(ChronoField.ERA, 1)
                .toFormatter()
                .withResolverStyle(ResolverStyle.STRICT);
        } catch (IllegalArgumentException e) {
            throw new SchemaException(SchemaException.Kind.INVALID_TYPE,
                "Invalid date format '" + format + "': " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return switch (kind) {
            case INT -> "int";
            case BOOL -> "bool";
            case STRING -> "string";
            case DATE -> DATE_PREFIX + format + ")";
        };
    }
}
