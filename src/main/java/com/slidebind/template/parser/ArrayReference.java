package com.slidebind.template.parser;

import java.util.Objects;

/**
 * A {@code Name[index]} occurrence, used for overflow analysis and pagination shifting.
 */
public final class ArrayReference {
    private final String arrayName;
    private final int index;
    private final String propertyPath;
    private final String pattern;
    private final boolean inFunction;

    public ArrayReference(String arrayName, int index, String propertyPath, String pattern, boolean inFunction) {
        this.arrayName = Objects.requireNonNull(arrayName, "arrayName");
        this.index = index;
        this.propertyPath = (propertyPath == null) ? "" : propertyPath;
        this.pattern = (pattern == null) ? "" : pattern;
        this.inFunction = inFunction;
    }

    public String getArrayName() { return arrayName; }
    public int getIndex() { return index; }
    /** Property path including the leading dot, or empty. */
    public String getPropertyPath() { return propertyPath; }
    public String getPattern() { return pattern; }
    public boolean isInFunction() { return inFunction; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayReference)) return false;
        ArrayReference that = (ArrayReference) o;
        return index == that.index
                && inFunction == that.inFunction
                && arrayName.equals(that.arrayName)
                && propertyPath.equals(that.propertyPath)
                && pattern.equals(that.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(arrayName, index, propertyPath, pattern, inFunction);
    }

    @Override
    public String toString() {
        return arrayName + "[" + index + "]" + propertyPath;
    }
}
