package db.lint.error;

/**
 * Root of every failure the linter reports. A run stops at the first one thrown;
 * its message is the single diagnostic shown to the user.
 */
public abstract class LintException extends RuntimeException {
    protected LintException(String message) {
        super(message);
    }

    protected LintException(String message, Throwable cause) {
        super(message, cause);
    }
}
