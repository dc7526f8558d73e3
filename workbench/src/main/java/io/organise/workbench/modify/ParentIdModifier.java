package io.organise.workbench.modify;

/**
 * Derives {@code parent_id} from {@code accessIdentifier} by dropping the last underscore segment:
 * {@code 2024_19_01_001 -> 2024_19_01}. An empty or placeholder identifier clears the target;
 * that is treated as absent data, not as a validation failure. Rows without an
 * {@code accessIdentifier} column are left alone.
 */
public class ParentIdModifier implements ColumnModifier {
    public static final String NAME = "parent-id";

    @Override
    public String modify(String value, RowContext context) {
        String accessIdentifier = context.getOrEmpty(Columns.ACCESS_IDENTIFIER);
        if (accessIdentifier.isEmpty()) return "";
        return Cells.beforeLastUnderscore(accessIdentifier);
    }

    @Override
    public boolean appliesTo(RowContext context) {
        return context.has(Columns.ACCESS_IDENTIFIER);
    }

    @Override
    public String description() {
        return "Extracts parent_id from accessIdentifier by removing the last underscore segment";
    }
}
