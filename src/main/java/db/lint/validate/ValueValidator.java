package db.lint.validate;

/**
 * Pure per-cell type check. Implementations hold no mutable state.
 */
@FunctionalInterface
public interface ValueValidator {
    // throws IllegalArgumentException describing the rejected value
    void validate(String raw);
}
