package com.slidebind.template;

import java.util.List;

import com.slidebind.debug.Debug;
import com.slidebind.template.deck.DeckShape;
import com.slidebind.template.deck.DeckSlide;
import com.slidebind.template.directive.Directive;
import com.slidebind.template.layout.VisibilityResolver;
import com.slidebind.template.parser.Environment;
import com.slidebind.template.parser.EvaluationResult;
import com.slidebind.template.parser.ExpressionEvaluator;
import com.slidebind.template.parser.Value;

/**
 * Applies {@code #if} directives: shapes named by {@code target} are shown when
 * the condition holds and hidden otherwise; shapes named by
 * {@code visibleWhenFalse} get the opposite. Shapes the visibility resolver is
 * holding suppressed are left to it.
 */
final class ConditionDirectives {

    private static final String TAG = "slidebind.directive";

    private ConditionDirectives() {}

    /** @return the number of shapes whose hidden flag changed */
    static int apply(DeckSlide slide, List<Directive> directives, Environment env,
                     ExpressionEvaluator evaluator, VisibilityResolver visibility) {
        int changed = 0;
        for (Directive d : directives) {
            if (!d.is(Directive.IF)) continue;
            String target = d.parameter("target");
            if (target == null || target.isEmpty()) {
                Debug.get().w(TAG, "#if without target on slide " + slide.getIndex() + ": " + d.getValue());
                continue;
            }
            boolean holds = test(d.getValue(), env, evaluator);
            Debug.get().d(TAG, "#if " + d.getValue() + " -> " + holds + " on slide " + slide.getIndex());

            int found = 0;
            for (DeckShape shape : slide.getShapes()) {
                if (target.equals(shape.getName())) {
                    found++;
                    if (show(shape, holds, visibility)) changed++;
                }
            }
            if (found == 0) Debug.get().w(TAG, "Target shape '" + target + "' not found on slide " + slide.getIndex());

            String otherwise = d.parameter("visibleWhenFalse");
            if (otherwise == null || otherwise.isEmpty()) continue;
            for (DeckShape shape : slide.getShapes()) {
                if (otherwise.equals(shape.getName()) && show(shape, !holds, visibility)) changed++;
            }
        }
        return changed;
    }

    /**
     * Evaluates a condition: an expression body, optionally wrapped in
     * {@code ${...}} and optionally negated with a leading {@code !}.
     */
    static boolean test(String condition, Environment env, ExpressionEvaluator evaluator) {
        String c = (condition == null) ? "" : condition.trim();
        if (c.startsWith("${") && c.endsWith("}")) c = c.substring(2, c.length() - 1).trim();
        boolean negate = false;
        while (c.startsWith("!")) {
            negate = !negate;
            c = c.substring(1).trim();
        }
        if (c.isEmpty()) return negate;
        if (c.equalsIgnoreCase("true")) return !negate;
        if (c.equalsIgnoreCase("false")) return negate;

        EvaluationResult r = evaluator.evaluate(c, env);
        boolean truthy = r.getKind() == EvaluationResult.Kind.VALUE && isTruthy(r.getValue());
        return truthy != negate;
    }

    static boolean isTruthy(Value v) {
        if (v == null) return false;
        switch (v.type) {
            case NULL:
                return false;
            case INDEXABLE:
                return v.asIndexable().count() > 0;
            case SCALAR: {
                Object o = v.asScalar();
                if (o instanceof Boolean) return (Boolean) o;
                if (o instanceof Number) return ((Number) o).doubleValue() != 0d;
                String s = String.valueOf(o).trim();
                return !s.isEmpty() && !s.equalsIgnoreCase("false") && !s.equals("0");
            }
            default:
                return true;
        }
    }

    private static boolean show(DeckShape shape, boolean visible, VisibilityResolver visibility) {
        if (visibility.recordOf(shape) != null) return false;
        if (shape.isHidden() == !visible) return false;
        shape.setHidden(!visible);
        Debug.get().i(TAG, (visible ? "Shown" : "Hidden") + " shape '" + shape.getName() + "' by #if");
        return true;
    }
}
