package com.trading.dpl.engine;

import com.trading.dpl.api.Value;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Variable scope of one row evaluation.
 *
 * Mutated by assignments while a row is evaluated. Instances are recycled by
 * the {@link ContextPool}; {@link #reset()} is called before every reuse.
 * Not thread-safe.
 */
public final class ExecutionContext {
    private final Map<String, Value> variables = new HashMap<>();

    /** Returns the bound value, or Java {@code null} when unbound. */
    public Value get(String name) {
        return variables.get(name);
    }

    public void set(String name, Value value) {
        variables.put(name, value);
    }

    public boolean contains(String name) {
        return variables.containsKey(name);
    }

    public int size() {
        return variables.size();
    }

    public void reset() {
        variables.clear();
    }

    /** Copy of every binding, used for closure capture and scope restore. */
    public Map<String, Value> snapshot() {
        return new LinkedHashMap<>(variables);
    }

    /** Replaces all bindings with {@code snapshot}. */
    public void restore(Map<String, Value> snapshot) {
        variables.clear();
        variables.putAll(snapshot);
    }
}
