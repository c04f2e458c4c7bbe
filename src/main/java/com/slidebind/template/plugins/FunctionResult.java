package com.slidebind.template.plugins;

import com.slidebind.template.parser.ArrayReference;
import com.slidebind.template.parser.EvaluationResult;

/** What a template function produced. */
public final class FunctionResult {

    private static final FunctionResult REPLACED = new FunctionResult(null, null, true);

    private final String text;
    private final ArrayReference outOfRange;
    private final boolean replaced;

    private FunctionResult(String text, ArrayReference outOfRange, boolean replaced) {
        this.text = text;
        this.outOfRange = outOfRange;
        this.replaced = replaced;
    }

    /** Text substituted for the call. */
    public static FunctionResult text(String s) {
        return new FunctionResult((s == null) ? "" : s, null, false);
    }

    /** The call referenced a collection item that does not exist; the shape is suppressed. */
    public static FunctionResult outOfRange(ArrayReference ref) {
        return new FunctionResult(null, ref, false);
    }

    /** The function swapped the shape for another element. */
    public static FunctionResult replaced() { return REPLACED; }

    public String getText() { return text; }
    public ArrayReference getOutOfRange() { return outOfRange; }
    public boolean isOutOfRange() { return outOfRange != null; }
    public boolean isReplaced() { return replaced; }

    EvaluationResult toEvaluation() {
        if (replaced) return EvaluationResult.replaced();
        if (outOfRange != null) return EvaluationResult.outOfRange(outOfRange);
        return EvaluationResult.text(text);
    }

    @Override
    public String toString() {
        if (replaced) return "REPLACED";
        if (outOfRange != null) return "OUT_OF_RANGE(" + outOfRange + ")";
        return "TEXT(" + text + ")";
    }
}
