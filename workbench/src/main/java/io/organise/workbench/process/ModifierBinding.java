package io.organise.workbench.process;

import io.organise.workbench.modify.ColumnModifier;

import java.util.Objects;

/**
 * A named modifier and the column it owns.
 */
public record ModifierBinding(String name, String column, ColumnModifier modifier) {
    public ModifierBinding {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(modifier, "modifier");
    }
}
