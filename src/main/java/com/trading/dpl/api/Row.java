package com.trading.dpl.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.EqualsAndHashCode;

/**
 * One time-step of named field values, input or output.
 *
 * <p>
 * Immutable. Field order is insertion order; it is the order reported by the
 * {@code _args} and {@code _args_names} script variables.
 */
@EqualsAndHashCode
public final class Row {
    public static final Row EMPTY = new Row(Map.of());

    private final Map<String, Value> fields;

    private Row(Map<String, Value> fields) {
        this.fields = fields;
    }

    public static Row of(Map<String, Value> fields) {
        return fields.isEmpty() ? EMPTY : new Row(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    public static Row of(String name, Value value) {
        return builder().put(name, value).build();
    }

    public static Row of(String n1, Value v1, String n2, Value v2) {
        return builder().put(n1, v1).put(n2, v2).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns the field value, or Java {@code null} when the field is absent. */
    public Value get(String name) {
        return fields.get(name);
    }

    /** Returns the field value, or {@link Value#NULL} when absent. */
    public Value getOrNull(String name) {
        Value v = fields.get(name);
        return v == null ? Value.NULL : v;
    }

    public boolean contains(String name) {
        return fields.containsKey(name);
    }

    public List<String> names() {
        return new ArrayList<>(fields.keySet());
    }

    public List<Value> values() {
        return new ArrayList<>(fields.values());
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public Map<String, Value> asMap() {
        return fields;
    }

    @Override
    public String toString() {
        return fields.toString();
    }

    public static final class Builder {
        private final Map<String, Value> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String name, Value value) {
            fields.put(name, value == null ? Value.NULL : value);
            return this;
        }

        public Builder put(String name, double value) {
            return put(name, Value.of(value));
        }

        public Builder put(String name, String value) {
            return put(name, Value.of(value));
        }

        public Row build() {
            return Row.of(fields);
        }
    }
}
