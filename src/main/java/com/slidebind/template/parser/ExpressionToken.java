package com.slidebind.template.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parsed form of one {@code ${...}} occurrence. Immutable; parsed once per occurrence.
 */
public class ExpressionToken {

    public interface TokenInterface {
        <R> R accept(Visitor<R> visitor);

        /** Source text of the expression (without delimiters and format). */
        String source();
    }

    public interface Visitor<R> {
        R visitPlainVariable(PlainVariable token);
        R visitPropertyPath(PropertyPath token);
        R visitArrayIndexAccess(ArrayIndexAccess token);
        R visitFunctionCall(FunctionCall token);
    }

    private ExpressionToken() {}

    // -------------------------
    // Variants
    // -------------------------

    public static final class PlainVariable implements TokenInterface {
        public final String name;

        public PlainVariable(String name) {
            this.name = name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPlainVariable(this);
        }

        @Override
        public String source() { return name; }
    }

    public static final class PropertyPath implements TokenInterface {
        public final List<String> segments;

        public PropertyPath(List<String> segments) {
            this.segments = Collections.unmodifiableList(segments);
        }

        public String root() { return segments.get(0); }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPropertyPath(this);
        }

        @Override
        public String source() { return String.join(".", segments); }
    }

    public static final class ArrayIndexAccess implements TokenInterface {
        /** Dotted path of the collection, e.g. {@code Items} or {@code Order.Lines}. */
        public final String arrayName;
        /** Segments leading to the collection; the first is the variable name. */
        public final List<String> arrayPath;
        public final int index;
        /** Segments after {@code ]}, empty when the element itself is referenced. */
        public final List<String> propertyPath;

        public ArrayIndexAccess(String arrayName, int index, List<String> propertyPath) {
            this(Collections.singletonList(arrayName), index, propertyPath);
        }

        public ArrayIndexAccess(List<String> arrayPath, int index, List<String> propertyPath) {
            this.arrayPath = Collections.unmodifiableList(new ArrayList<>(arrayPath));
            this.arrayName = String.join(".", arrayPath);
            this.index = index;
            this.propertyPath = Collections.unmodifiableList(propertyPath);
        }

        public String root() { return arrayPath.get(0); }

        public ArrayReference toReference(boolean inFunction) {
            String path = propertyPath.isEmpty() ? "" : "." + String.join(".", propertyPath);
            return new ArrayReference(arrayName, index, path, source(), inFunction);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitArrayIndexAccess(this);
        }

        @Override
        public String source() {
            StringBuilder sb = new StringBuilder(arrayName).append('[').append(index).append(']');
            for (String p : propertyPath) sb.append('.').append(p);
            return sb.toString();
        }
    }

    public static final class FunctionCall implements TokenInterface {
        public final String namespace;
        public final String name;
        /** Argument text between the parentheses, untouched. */
        public final String rawArgs;

        public FunctionCall(String namespace, String name, String rawArgs) {
            this.namespace = namespace;
            this.name = name;
            this.rawArgs = rawArgs;
        }

        public String qualifiedName() { return namespace + "." + name; }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }

        @Override
        public String source() { return qualifiedName() + "(" + rawArgs + ")"; }
    }
}
