package io.organise.workbench.modify;

/**
 * Normalizes {@code accessIdentifier} and flags values that are not item-level:
 * empty identifiers and container identifiers ending in {@code _00} or {@code _000}.
 */
public class AccessIdentifierValidator implements ColumnModifier {
    public static final String NAME = "access-identifier";

    @Override
    public String modify(String value, RowContext context) {
        return Cells.normalize(value);
    }

    @Override
    public boolean validate(String value, RowContext context) {
        String clean = Cells.normalize(value);
        if (clean.isEmpty()) return false;
        return !(clean.endsWith("_00") || clean.endsWith("_000"));
    }

    @Override
    public String description() {
        return "Validates accessIdentifier for item-level suitability";
    }
}
