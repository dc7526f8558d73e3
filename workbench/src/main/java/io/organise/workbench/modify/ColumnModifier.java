package io.organise.workbench.modify;

/**
 * A rule that rewrites the value of one column, optionally checking it first.
 * Implementations must be free of side effects and must accept an empty value.
 */
public interface ColumnModifier {

    /**
     * Replacement for the column's current value.
     *
     * @param value   the current raw cell value, never null
     * @param context the whole row before any modifier ran
     */
    String modify(String value, RowContext context);

    /**
     * Advisory pre-check. A {@code false} result is counted and reported, but {@link #modify} still
     * runs and its result is still written.
     */
    default boolean validate(String value, RowContext context) {
        return true;
    }

    /**
     * Whether the row carries the columns this modifier reads. When it does not, the modifier is
     * skipped for the row: the target keeps its value and nothing is counted or reported.
     * Empty cells in columns that do exist are the modifier's own business.
     */
    default boolean appliesTo(RowContext context) {
        return true;
    }

    /** Human readable label for diagnostics and statistics output. */
    String description();
}
