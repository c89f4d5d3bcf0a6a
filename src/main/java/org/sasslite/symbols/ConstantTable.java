package org.sasslite.symbols;

import org.eclipse.collections.api.factory.Maps;
import org.eclipse.collections.api.map.MutableMap;

import java.util.Optional;
import java.util.Set;

/**
 * Constants defined so far in a compilation, by name without the leading
 * {@code !}. Values are already evaluated strings.
 *
 * Each compilation unit owns its table; imports exchange tables through
 * {@link #copy()} and {@link #putAll(ConstantTable)} rather than sharing one.
 */
public final class ConstantTable {

    private final MutableMap<String, String> values;

    private ConstantTable(MutableMap<String, String> values) {
        this.values = values;
    }

    /**
     * @return a table holding only the built-in {@code important} constant
     */
    public static ConstantTable withDefaults() {
        MutableMap<String, String> values = Maps.mutable.empty();
        values.put("important", "!important");
        return new ConstantTable(values);
    }

    public static ConstantTable empty() {
        return new ConstantTable(Maps.mutable.empty());
    }

    public Optional<String> lookup(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean isDefined(String name) {
        return values.containsKey(name);
    }

    /** Defines or overwrites a constant ({@code !name = value}). */
    public void set(String name, String value) {
        values.put(name, value);
    }

    /** Defines a constant unless it already has a value ({@code !name ||= value}). */
    public void setIfAbsent(String name, String value) {
        values.getIfAbsentPut(name, value);
    }

    /**
     * Copies every constant of {@code other} into this table, overwriting
     * existing names.
     */
    public void putAll(ConstantTable other) {
        values.putAll(other.values);
    }

    public ConstantTable copy() {
        MutableMap<String, String> copied = Maps.mutable.empty();
        copied.putAll(values);
        return new ConstantTable(copied);
    }

    public Set<String> names() {
        return Set.copyOf(values.keySet());
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
