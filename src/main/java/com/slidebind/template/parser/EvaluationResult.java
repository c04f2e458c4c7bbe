package com.slidebind.template.parser;

/**
 * Outcome of resolving one token. Only {@link Kind#VALUE} and {@link Kind#TEXT}
 * carry displayable content; the other kinds are signals.
 */
public final class EvaluationResult {

    public enum Kind {
        /** Resolved to a value; rendered through the format suffix. */
        VALUE,
        /** A function produced literal text. */
        TEXT,
        /** An indexed access past the end of its collection. */
        OUT_OF_RANGE,
        /** Nothing bound under the referenced name or path. */
        UNRESOLVED,
        /** A function replaced the owning shape. */
        REPLACED
    }

    private static final EvaluationResult UNRESOLVED = new EvaluationResult(Kind.UNRESOLVED, null, null, null);
    private static final EvaluationResult REPLACED = new EvaluationResult(Kind.REPLACED, null, null, null);

    private final Kind kind;
    private final Value value;
    private final String text;
    private final ArrayReference reference;

    private EvaluationResult(Kind kind, Value value, String text, ArrayReference reference) {
        this.kind = kind;
        this.value = value;
        this.text = text;
        this.reference = reference;
    }

    public static EvaluationResult value(Value v) {
        return new EvaluationResult(Kind.VALUE, (v == null) ? Value.nil() : v, null, null);
    }

    public static EvaluationResult text(String s) {
        return new EvaluationResult(Kind.TEXT, null, (s == null) ? "" : s, null);
    }

    public static EvaluationResult outOfRange(ArrayReference ref) {
        return new EvaluationResult(Kind.OUT_OF_RANGE, null, null, ref);
    }

    public static EvaluationResult unresolved() { return UNRESOLVED; }
    public static EvaluationResult replaced() { return REPLACED; }

    public Kind getKind() { return kind; }
    public Value getValue() { return value; }
    public String getText() { return text; }
    /** The offending reference for {@link Kind#OUT_OF_RANGE}, else null. */
    public ArrayReference getReference() { return reference; }

    public boolean isOutOfRange() { return kind == Kind.OUT_OF_RANGE; }
    public boolean isResolved() { return kind == Kind.VALUE || kind == Kind.TEXT; }

    @Override
    public String toString() {
        switch (kind) {
            case VALUE: return "VALUE(" + value + ")";
            case TEXT: return "TEXT(" + text + ")";
            case OUT_OF_RANGE: return "OUT_OF_RANGE(" + reference + ")";
            default: return kind.name();
        }
    }
}
