package io.organise.workbench.process;

import io.organise.workbench.modify.ColumnModifier;
import io.organise.workbench.modify.Columns;
import io.organise.workbench.modify.FilePathModifier;
import io.organise.workbench.modify.ParentIdModifier;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Every modifier known to a run, keyed by name, in registration order. A column is owned by at
 * most one modifier.
 */
public class ModifierRegistry {
    private final Map<String, ModifierBinding> byName = new LinkedHashMap<>();
    private final Map<String, String> ownerByColumn = new LinkedHashMap<>();

    /** Registry holding the built-in modifiers: parent-id, then file-extension. */
    public static ModifierRegistry defaults() {
        return new ModifierRegistry()
                .register(ParentIdModifier.NAME, Columns.PARENT_ID, new ParentIdModifier())
                .register(FilePathModifier.NAME, Columns.FILE, new FilePathModifier());
    }

    public ModifierRegistry register(String name, String column, ColumnModifier modifier) {
        ModifierBinding binding = new ModifierBinding(name, column, modifier);
        if (byName.containsKey(name)) {
            throw new IllegalArgumentException("Modifier '" + name + "' is already registered");
        }
        String owner = ownerByColumn.get(column);
        if (owner != null) {
            throw new IllegalArgumentException("Column '" + column + "' is already owned by modifier '" + owner + "'");
        }
        byName.put(name, binding);
        ownerByColumn.put(column, name);
        return this;
    }

    public List<String> names() { return List.copyOf(byName.keySet()); }

    public boolean contains(String name) { return byName.containsKey(name); }

    public ActiveModifiers all() {
        return new ActiveModifiers(new ArrayList<>(byName.values()));
    }

    /**
     * Active subset for a run. A non-empty {@code onlyRun} keeps only the modifiers it names;
     * {@code ignoreRun} then removes names, so a modifier in both sets is excluded.
     *
     * @throws IllegalArgumentException when either set names an unregistered modifier
     */
    public ActiveModifiers select(Collection<String> onlyRun, Collection<String> ignoreRun) {
        Set<String> only = Set.copyOf(onlyRun);
        Set<String> ignore = Set.copyOf(ignoreRun);
        requireKnown(only, "only-run");
        requireKnown(ignore, "ignore-run");
        List<ModifierBinding> active = new ArrayList<>();
        for (ModifierBinding binding : byName.values()) {
            if (!only.isEmpty() && !only.contains(binding.name())) continue;
            if (ignore.contains(binding.name())) continue;
            active.add(binding);
        }
        return new ActiveModifiers(active);
    }

    private void requireKnown(Set<String> names, String option) {
        for (String name : names) {
            if (!byName.containsKey(name)) {
                throw new IllegalArgumentException("Unknown modifier '" + name + "' in " + option
                        + "; known modifiers: " + String.join(", ", byName.keySet()));
            }
        }
    }
}
