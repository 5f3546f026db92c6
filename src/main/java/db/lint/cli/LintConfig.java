package db.lint.cli;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line settings.
 *   csv-schema-lint [--schema schema.json] [--verbose] data-dir
 * Without --schema the schema is read from the control file data-dir/schema.csv.
 */
public record LintConfig(Path dataDir, Path schemaFile, boolean verbose) {
    public static final String USAGE = "usage: csv-schema-lint [--schema <schema.json>] [--verbose] <data-dir>";

    public static LintConfig parse(String[] args) {
        Path dataDir = null;
        Path schemaFile = null;
        boolean verbose = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--schema" -> {
                    if (i + 1 >= args.length) throw new IllegalArgumentException("--schema requires a file argument");
                    schemaFile = Paths.get(args[++i]);
                }
                case "--verbose", "-v" -> verbose = true;
                default -> {
                    if (arg.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + arg);
                    if (dataDir != null) throw new IllegalArgumentException("Unexpected argument: " + arg);
                    dataDir = Paths.get(arg);
                }
            }
        }
        if (dataDir == null) throw new IllegalArgumentException("Missing data directory");
        return new LintConfig(dataDir, schemaFile, verbose);
    }

    public boolean usesControlFile() { return schemaFile == null; }
}
