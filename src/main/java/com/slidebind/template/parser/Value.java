package com.slidebind.template.parser;

import java.util.List;
import java.util.Locale;

import com.slidebind.template.TemplateException;

/**
 * Capability-tagged value held by an {@link Environment}.
 *
 * The type decides how a value may be accessed: read as text, walked by
 * property name, indexed, or dispatched as a function.
 */
public class Value {
    public enum Type { SCALAR, PROPERTIES, INDEXABLE, FUNCTION, NULL }

    /** Named, case-insensitive member access. */
    public interface PropertySource {
        /** Member value, or null when absent. Lookup ignores case. */
        Value property(String name);

        List<String> names();
    }

    /** Countable, bounds-checked positional access. */
    public interface IndexSource {
        int count();

        /** Element at {@code index}; callers check bounds first. */
        Value item(int index);
    }

    private static final Value NIL = new Value(Type.NULL, null);

    public final Type type;
    public final Object value;

    public Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value scalar(Object o) { return (o == null) ? NIL : new Value(Type.SCALAR, o); }
    public static Value string(String s) { return scalar(s); }
    public static Value properties(PropertySource p) { return new Value(Type.PROPERTIES, p); }
    public static Value indexable(IndexSource s) { return new Value(Type.INDEXABLE, s); }
    /** A function value names the registry entry it dispatches to. */
    public static Value func(String qualifiedName) { return new Value(Type.FUNCTION, qualifiedName); }
    public static Value nil() { return NIL; }

    public Type getType() { return type; }

    public boolean isNull() { return type == Type.NULL; }

    public Object asScalar() {
        if (type != Type.SCALAR) throw new TemplateValueException("Expected scalar, got " + type);
        return value;
    }

    public PropertySource asProperties() {
        if (type != Type.PROPERTIES) throw new TemplateValueException("Expected object, got " + type);
        return (PropertySource) value;
    }

    public IndexSource asIndexable() {
        if (type != Type.INDEXABLE) throw new TemplateValueException("Expected collection, got " + type);
        return (IndexSource) value;
    }

    public String asFunc() {
        if (type != Type.FUNCTION) throw new TemplateValueException("Expected function, got " + type);
        return (String) value;
    }

    /** Walks one member by name; null when this value carries no such member. */
    public Value property(String name) {
        if (type != Type.PROPERTIES || name == null) return null;
        return asProperties().property(name);
    }

    /** Plain text rendering used when no format applies. */
    public String toDisplayString() {
        switch (type) {
            case SCALAR:
                return String.valueOf(value);
            case FUNCTION:
                return asFunc();
            case INDEXABLE: {
                IndexSource src = asIndexable();
                StringBuilder sb = new StringBuilder();
                for (int i = 0; i < src.count(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(src.item(i).toDisplayString());
                }
                return sb.toString();
            }
            case PROPERTIES: {
                PropertySource p = asProperties();
                List<String> names = p.names();
                if (names.isEmpty()) return "";
                StringBuilder sb = new StringBuilder("{");
                for (int i = 0; i < names.size(); i++) {
                    if (i > 0) sb.append(", ");
                    Value v = p.property(names.get(i));
                    sb.append(names.get(i)).append('=').append(v == null ? "" : v.toDisplayString());
                }
                return sb.append('}').toString();
            }
            default:
                return "";
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case SCALAR:
                return (value instanceof CharSequence) ? '"' + value.toString() + '"' : String.valueOf(value);
            case FUNCTION:
                return "func(" + value + ")";
            case INDEXABLE:
                return "indexable(" + asIndexable().count() + ")";
            case PROPERTIES:
                return "object" + asProperties().names();
            default:
                return "null";
        }
    }

    static String fold(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    /** Thrown when a value is accessed through the wrong capability. */
    public static class TemplateValueException extends TemplateException {
        public TemplateValueException(String message) {
            super(message);
        }
    }
}
