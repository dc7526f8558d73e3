package io.organise.workbench.modify;

import java.util.Objects;

/**
 * Populates {@code field_model} from the row's file extension using configured mappings.
 */
public class FieldModelModifier implements ColumnModifier {
    public static final String NAME = "field-model";

    private final FieldModelMappings mappings;

    public FieldModelModifier(FieldModelMappings mappings) {
        this.mappings = Objects.requireNonNull(mappings, "mappings");
    }

    @Override
    public String modify(String value, RowContext context) {
        String extension = context.firstNonEmpty(Columns.FILE_EXTENSION, Columns.FILE_EXTENSION_LEGACY).orElse("");
        return mappings.modelFor(extension);
    }

    @Override
    public boolean appliesTo(RowContext context) {
        return context.has(Columns.FILE_EXTENSION) || context.has(Columns.FILE_EXTENSION_LEGACY);
    }

    @Override
    public String description() {
        return "Populates field_model based on configured file extension mappings";
    }
}
