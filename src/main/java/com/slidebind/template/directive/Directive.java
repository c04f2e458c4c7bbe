package com.slidebind.template.directive;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * One {@code #name: value, key: value, ...} line from a slide's notes.
 */
public final class Directive {

    /** Spreads a collection over copies of the slide. */
    public static final String FOREACH = "foreach";
    /** Shows or hides named shapes on a condition. */
    public static final String IF = "if";

    private final String name;
    private final String value;
    private final Map<String, String> parameters;

    public Directive(String name, String value, Map<String, String> parameters) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("directive name is empty");
        this.name = name;
        this.value = (value == null) ? "" : value;
        this.parameters = (parameters == null)
                ? Collections.<String, String>emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public String getName() { return name; }
    public String getValue() { return value; }
    public Map<String, String> getParameters() { return parameters; }

    public boolean is(String directiveName) {
        return name.equalsIgnoreCase(directiveName);
    }

    /** Parameter by case-insensitive key, or null. */
    public String parameter(String key) {
        if (key == null) return null;
        String v = parameters.get(key);
        if (v != null) return v;
        String folded = key.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> e : parameters.entrySet()) {
            if (e.getKey().toLowerCase(Locale.ROOT).equals(folded)) return e.getValue();
        }
        return null;
    }

    @Override
    public String toString() {
        return "#" + name + ": " + value + (parameters.isEmpty() ? "" : " " + parameters);
    }
}
