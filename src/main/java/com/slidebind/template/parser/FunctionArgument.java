package com.slidebind.template.parser;

/**
 * One argument of a {@code ppt.Fn(...)} call: positional or {@code name: value}.
 */
public final class FunctionArgument {
    private final String name;
    private final String raw;
    private final String value;
    private final boolean quoted;

    public FunctionArgument(String name, String raw, String value, boolean quoted) {
        this.name = name;
        this.raw = raw;
        this.value = value;
        this.quoted = quoted;
    }

    public static FunctionArgument positional(String value) {
        return new FunctionArgument(null, value, value, false);
    }

    /** Keyword name, or null for positional arguments. */
    public String getName() { return name; }
    /** Trimmed source text of the value, quotes included. */
    public String getRaw() { return raw; }
    /** Value with quotes removed and escapes resolved. */
    public String getValue() { return value; }
    public boolean isQuoted() { return quoted; }
    public boolean isKeyword() { return name != null; }

    @Override
    public String toString() {
        return (name == null) ? raw : name + ": " + raw;
    }
}
