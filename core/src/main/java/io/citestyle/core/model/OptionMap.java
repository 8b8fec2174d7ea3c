package io.citestyle.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * String-keyed option mapping with explicit write policies. {@link #set} replaces any existing
 * value so the most recent write is the one observed; {@link #setIfAbsent} and
 * {@link #appendAll} never shadow a value that is already present.
 *
 * <p>
 * Mutable while a style is being assembled; {@link #snapshot()} produces the read-only copy
 * that is stored in a {@link CompiledStyle}.
 */
public final class OptionMap {

    private final Map<String, String> values;
    private final boolean readOnly;

    public OptionMap() {
        this(new LinkedHashMap<>(), false);
    }

    private OptionMap(Map<String, String> values, boolean readOnly) {
        this.values = values;
        this.readOnly = readOnly;
    }

    /** Creates a mutable mapping pre-populated with the given entries, in iteration order. */
    public static OptionMap of(Map<String, String> entries) {
        OptionMap map = new OptionMap();
        entries.forEach(map::set);
        return map;
    }

    /** Sets {@code key} to {@code value}, replacing any earlier value. */
    public OptionMap set(String key, String value) {
        checkWritable();
        values.remove(key);
        values.put(key, value);
        return this;
    }

    /**
     * Sets {@code key} only if it has no value yet.
     *
     * @return {@code true} if the value was stored
     */
    public boolean setIfAbsent(String key, String value) {
        checkWritable();
        if (values.containsKey(key)) {
            return false;
        }
        values.put(key, value);
        return true;
    }

    /**
     * Appends entries behind the existing ones. Keys already present keep their value, and within
     * {@code entries} the first occurrence of a key wins.
     */
    public OptionMap appendAll(Map<String, String> entries) {
        entries.forEach(this::setIfAbsent);
        return this;
    }

    /** Returns the value for {@code key}, or {@code null} if unset. */
    public String get(String key) {
        return values.get(key);
    }

    public Optional<String> find(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Read-only view of the entries, in insertion order. */
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /** Returns a read-only copy detached from this mapping. */
    public OptionMap snapshot() {
        return new OptionMap(new LinkedHashMap<>(values), true);
    }

    /** Returns a mutable copy detached from this mapping. */
    public OptionMap copy() {
        return new OptionMap(new LinkedHashMap<>(values), false);
    }

    private void checkWritable() {
        if (readOnly) {
            throw new UnsupportedOperationException("option map is read-only");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OptionMap that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "OptionMap" + values;
    }
}
