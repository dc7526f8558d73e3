package io.organise.csv;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Column names of a table, fixed for the duration of one pass. Names are unique.
 */
public final class CsvHeader {
    private final List<String> names;
    private final Map<String, Integer> index;

    private CsvHeader(List<String> names, Map<String, Integer> index) {
        this.names = names;
        this.index = index;
    }

    public static CsvHeader of(String... names) {
        try {
            return of(List.of(names));
        } catch (CsvFormatException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    public static CsvHeader of(List<String> names) throws CsvFormatException {
        if (names.isEmpty()) throw new CsvFormatException("Header row has no columns");
        Map<String, Integer> index = new HashMap<>(names.size() * 2);
        for (int i = 0; i < names.size(); i++) {
            Integer prev = index.putIfAbsent(names.get(i), i);
            if (prev != null) {
                throw new CsvFormatException("Duplicate column '" + names.get(i) + "' in header (positions " + prev + " and " + i + ")");
            }
        }
        return new CsvHeader(List.copyOf(names), Map.copyOf(index));
    }

    public int size() { return names.size(); }
    public List<String> names() { return names; }
    public String name(int i) { return names.get(i); }
    public boolean contains(String column) { return index.containsKey(column); }

    public OptionalInt indexOf(String column) {
        Integer i = index.get(column);
        return i == null ? OptionalInt.empty() : OptionalInt.of(i);
    }

    /** Index of a column the caller cannot work without. */
    public int require(String column, String hint) throws CsvFormatException {
        Integer i = index.get(column);
        if (i == null) {
            throw new CsvFormatException("Column '" + column + "' not found in CSV" + Optional.ofNullable(hint).map(h -> ". " + h).orElse(""));
        }
        return i;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CsvHeader that && names.equals(that.names);
    }

    @Override
    public int hashCode() { return names.hashCode(); }

    @Override
    public String toString() { return "CsvHeader" + names; }
}
