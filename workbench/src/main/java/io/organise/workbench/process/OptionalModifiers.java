package io.organise.workbench.process;

import io.organise.workbench.modify.AccessIdentifierValidator;
import io.organise.workbench.modify.Columns;
import io.organise.workbench.modify.FieldDescriptionEscaper;
import io.organise.workbench.modify.FieldModelMappings;
import io.organise.workbench.modify.FieldModelModifier;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Modifiers that are registered only on request. They run after the built-ins, in the order of
 * {@link #NAMES}.
 */
public final class OptionalModifiers {
    public static final List<String> NAMES =
            List.of(AccessIdentifierValidator.NAME, FieldDescriptionEscaper.NAME, FieldModelModifier.NAME);

    @FunctionalInterface
    public interface MappingsLoader {
        FieldModelMappings load() throws IOException;
    }

    private OptionalModifiers() {}

    /**
     * Registers each requested optional modifier. Mappings are loaded only when the field-model
     * modifier is requested.
     *
     * @throws IllegalArgumentException for a name that is not an optional modifier
     */
    public static ModifierRegistry enable(ModifierRegistry registry, Collection<String> names, MappingsLoader mappings) throws IOException {
        Set<String> requested = Set.copyOf(names);
        for (String name : requested) {
            if (!NAMES.contains(name)) {
                throw new IllegalArgumentException("Unknown optional modifier '" + name + "'; optional modifiers: " + String.join(", ", NAMES));
            }
        }
        if (requested.contains(AccessIdentifierValidator.NAME)) {
            registry.register(AccessIdentifierValidator.NAME, Columns.ACCESS_IDENTIFIER, new AccessIdentifierValidator());
        }
        if (requested.contains(FieldDescriptionEscaper.NAME)) {
            registry.register(FieldDescriptionEscaper.NAME, Columns.FIELD_DESCRIPTION, new FieldDescriptionEscaper());
        }
        if (requested.contains(FieldModelModifier.NAME)) {
            registry.register(FieldModelModifier.NAME, Columns.FIELD_MODEL, new FieldModelModifier(mappings.load()));
        }
        return registry;
    }
}
