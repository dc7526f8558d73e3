package io.organise.csv;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One data record of a table. Values are positional against the shared {@link CsvHeader}.
 * Not thread-safe: a row is owned by whichever step is currently processing it.
 */
public final class CsvRow {
    private final CsvHeader header;
    private final String[] values;

    public CsvRow(CsvHeader header, List<String> values) {
        this(header, values.toArray(new String[0]));
    }

    CsvRow(CsvHeader header, String[] values) {
        this.header = Objects.requireNonNull(header, "header");
        if (values.length != header.size()) {
            throw new IllegalArgumentException("Expected " + header.size() + " values, got " + values.length);
        }
        this.values = values;
    }

    public static CsvRow of(CsvHeader header, String... values) {
        return new CsvRow(header, values.clone());
    }

    public CsvHeader header() { return header; }
    public int size() { return values.length; }
    public String get(int i) { return values[i]; }

    public Optional<String> get(String column) {
        return header.indexOf(column).stream().mapToObj(i -> values[i]).findFirst();
    }

    public void set(int i, String value) {
        values[i] = Objects.requireNonNull(value, "value");
    }

    /** Defensive copy of the current values, in header order. */
    public List<String> values() { return List.of(values); }

    @Override
    public boolean equals(Object o) {
        return o instanceof CsvRow that && header.equals(that.header) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() { return 31 * header.hashCode() + Arrays.hashCode(values); }

    @Override
    public String toString() { return Arrays.toString(values); }
}
