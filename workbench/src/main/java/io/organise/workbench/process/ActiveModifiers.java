package io.organise.workbench.process;

import java.util.Iterator;
import java.util.List;

/**
 * The modifiers applied in one run, in registration order. Fixed before the first row is read.
 */
public final class ActiveModifiers implements Iterable<ModifierBinding> {
    private final List<ModifierBinding> bindings;

    ActiveModifiers(List<ModifierBinding> bindings) {
        this.bindings = List.copyOf(bindings);
    }

    public static ActiveModifiers of(ModifierBinding... bindings) {
        return new ActiveModifiers(List.of(bindings));
    }

    public List<ModifierBinding> bindings() { return bindings; }

    public List<String> names() {
        return bindings.stream().map(ModifierBinding::name).toList();
    }

    public boolean isEmpty() { return bindings.isEmpty(); }
    public int size() { return bindings.size(); }

    @Override
    public Iterator<ModifierBinding> iterator() { return bindings.iterator(); }

    @Override
    public String toString() { return "ActiveModifiers" + names(); }
}
