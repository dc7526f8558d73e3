package io.organise.workbench.report;

/**
 * One rejected pre-check.
 *
 * @param modifier description of the modifier whose validation failed
 * @param column   target column of that modifier
 * @param rowIndex 0-based data row index
 * @param rawValue the cell value as read, before any modification
 */
public record ValidationFailure(String modifier, String column, long rowIndex, String rawValue) {

    /** 1-based row number as a spreadsheet user would count data rows. */
    public long rowNumber() { return rowIndex + 1; }
}
