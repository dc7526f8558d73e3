package io.organise.workbench.modify;

/**
 * Escapes semicolons in {@code field_description} (the ingest tool splits multi-valued fields on
 * {@code ;}) and wraps the result in literal double quotes.
 */
public class FieldDescriptionEscaper implements ColumnModifier {
    public static final String NAME = "field-description";

    @Override
    public String modify(String value, RowContext context) {
        return wrapInQuotes(escapeSemicolons(value));
    }

    @Override
    public String description() {
        return "Escapes unescaped semicolons in field_description";
    }

    static String escapeSemicolons(String value) {
        if (value.indexOf(';') < 0) return value;
        StringBuilder out = new StringBuilder(value.length() + 8);
        char previous = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == ';' && previous != '\\') out.append('\\');
            out.append(c);
            previous = c;
        }
        return out.toString();
    }

    static String wrapInQuotes(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) return value;
        return '"' + value + '"';
    }
}
