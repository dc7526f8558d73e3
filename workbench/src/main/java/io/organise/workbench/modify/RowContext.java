package io.organise.workbench.modify;

import io.organise.csv.CsvHeader;
import io.organise.csv.CsvRow;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view of one row as it was before any modifier touched it. Built fresh for every row
 * and discarded when the row is done, so modifiers see the same inputs whatever order they run in.
 */
public final class RowContext {
    private final CsvHeader header;
    private final List<String> values;
    private final long rowIndex;

    private RowContext(CsvHeader header, List<String> values, long rowIndex) {
        this.header = header;
        this.values = values;
        this.rowIndex = rowIndex;
    }

    public static RowContext snapshot(CsvRow row, long rowIndex) {
        Objects.requireNonNull(row, "row");
        return new RowContext(row.header(), row.values(), rowIndex);
    }

    /** 0-based data row index; the header row is not counted. */
    public long rowIndex() { return rowIndex; }

    public boolean has(String column) { return header.contains(column); }

    /** Raw value, or empty when the row has no such column. */
    public Optional<String> get(String column) {
        return header.indexOf(column).stream().mapToObj(values::get).findFirst();
    }

    /** Normalized value (see {@link Cells#normalize}); empty for a missing column. */
    public String getOrEmpty(String column) {
        return get(column).map(Cells::normalize).orElse("");
    }

    /** First column, in argument order, whose normalized value is non-empty. */
    public Optional<String> firstNonEmpty(String... columns) {
        for (String column : columns) {
            String value = getOrEmpty(column);
            if (!value.isEmpty()) return Optional.of(value);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "RowContext{row=" + rowIndex + ", values=" + values + '}';
    }
}
