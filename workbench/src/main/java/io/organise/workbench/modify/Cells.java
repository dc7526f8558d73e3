package io.organise.workbench.modify;

/**
 * Cell value conventions shared by modifiers and the items aggregator.
 */
public final class Cells {
    /** Spreadsheet error marker exported in place of a formula result. Means "no data". */
    public static final String PLACEHOLDER = "#VALUE!";

    private Cells() {}

    /** Trimmed value, or empty when the cell holds the placeholder (any case). */
    public static String normalize(String value) {
        if (value == null) return "";
        String trimmed = value.trim();
        return trimmed.equalsIgnoreCase(PLACEHOLDER) ? "" : trimmed;
    }

    public static boolean isAbsent(String value) {
        return normalize(value).isEmpty();
    }

    /** Everything before the last underscore; the whole value when there is none. */
    public static String beforeLastUnderscore(String value) {
        int i = value.lastIndexOf('_');
        return i < 0 ? value : value.substring(0, i);
    }
}
