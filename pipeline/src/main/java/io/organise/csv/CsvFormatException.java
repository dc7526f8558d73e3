package io.organise.csv;

import java.io.IOException;

/**
 * Signals a table whose shape cannot be processed: a missing or duplicated header, or a data row
 * whose field count disagrees with the header. Always fatal for the run that hit it.
 */
public class CsvFormatException extends IOException {
    private final long rowIndex;

    public CsvFormatException(String message) {
        this(message, -1);
    }

    public CsvFormatException(String message, long rowIndex) {
        super(message);
        this.rowIndex = rowIndex;
    }

    /** 0-based data row index (header excluded), or -1 when the error is not tied to a row. */
    public long rowIndex() { return rowIndex; }
}
