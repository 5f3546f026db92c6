package db.lint;

import java.io.PrintStream;

import db.lint.cli.LintCommand;
import db.lint.cli.LintConfig;
import db.lint.error.LintException;

public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_VIOLATION = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.err));
    }

    // Prints nothing on success and exactly one line on failure.
    static int run(String[] args, PrintStream err) {
        LintConfig config;
        try {
            config = LintConfig.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.println(LintConfig.USAGE);
            return EXIT_USAGE;
        }
        if (config.verbose()) {
            // must happen before the first logger is created
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        }
        try {
            new LintCommand().run(config);
            return EXIT_OK;
        } catch (LintException e) {
            err.println("error: " + e.getMessage());
            return EXIT_VIOLATION;
        }
    }
}
