package com.slidebind.template.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Name to value mapping one token is resolved against.
 *
 * Environments are immutable. A child frame created with {@link #with} shadows
 * its parent; the parent is never touched, so evaluation cannot leak state
 * between shapes.
 */
public final class Environment {

    public final Environment parent;
    private final Map<String, Value> vars;
    private final Map<String, Value> folded;

    public Environment(Map<String, Value> initial) {
        this(null, initial);
    }

    private Environment(Environment parent, Map<String, Value> initial) {
        this.parent = parent;
        Map<String, Value> exact = new LinkedHashMap<>();
        Map<String, Value> lower = new LinkedHashMap<>();
        if (initial != null) {
            for (Map.Entry<String, Value> e : initial.entrySet()) {
                if (e.getKey() == null) continue;
                Value v = (e.getValue() == null) ? Value.nil() : e.getValue();
                exact.put(e.getKey(), v);
                lower.putIfAbsent(Value.fold(e.getKey()), v);
            }
        }
        this.vars = Collections.unmodifiableMap(exact);
        this.folded = Collections.unmodifiableMap(lower);
    }

    public static Environment empty() {
        return new Environment(null, null);
    }

    /** New frame holding {@code frame} on top of this one. */
    public Environment with(Map<String, Value> frame) {
        return new Environment(this, frame);
    }

    public Environment with(String name, Value value) {
        Map<String, Value> m = new LinkedHashMap<>();
        m.put(name, value);
        return with(m);
    }

    /**
     * Exact match through the whole frame chain first, then a case-insensitive
     * match through the chain. Returns null when the name is not bound.
     */
    public Value lookup(String name) {
        if (name == null) return null;
        for (Environment env = this; env != null; env = env.parent) {
            Value v = env.vars.get(name);
            if (v != null) return v;
        }
        String key = Value.fold(name);
        for (Environment env = this; env != null; env = env.parent) {
            Value v = env.folded.get(key);
            if (v != null) return v;
        }
        return null;
    }

    public boolean exists(String name) {
        return lookup(name) != null;
    }

    /** Snapshot of every visible binding, inner frames winning. */
    public Map<String, Value> snapshot() {
        Map<String, Value> out = new LinkedHashMap<>();
        if (parent != null) out.putAll(parent.snapshot());
        out.putAll(vars);
        return out;
    }
}
