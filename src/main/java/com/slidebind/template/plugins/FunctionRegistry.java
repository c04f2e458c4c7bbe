package com.slidebind.template.plugins;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.slidebind.debug.Debug;
import com.slidebind.template.ProcessingContext;
import com.slidebind.template.parser.EvaluationResult;
import com.slidebind.template.parser.ExpressionParser;
import com.slidebind.template.parser.ExpressionToken.FunctionCall;
import com.slidebind.template.parser.FunctionArgument;
import com.slidebind.template.parser.ArgumentParser;
import com.slidebind.template.parser.Value;

/**
 * Template functions by case-insensitive name.
 *
 * A function that throws never fails the shape: the call is replaced by
 * {@code [Error in function '<Name>': <message>]}.
 */
public class FunctionRegistry {

    private static final String TAG = "slidebind.fn";

    private final Map<String, String> names = new LinkedHashMap<>();
    private final Map<String, TemplateFunction> functions = new LinkedHashMap<>();

    /**
     * Registers {@code fn} under {@code name} (without namespace), replacing any
     * function of the same name. A null function registers a name with no
     * implementation.
     */
    public void register(String name, TemplateFunction fn) {
        if (name == null || name.trim().isEmpty()) throw new IllegalArgumentException("Function name is empty");
        String n = strip(name.trim());
        String key = n.toLowerCase(Locale.ROOT);
        names.put(key, n);
        functions.put(key, fn);
    }

    public boolean contains(String name) {
        return name != null && names.containsKey(strip(name).toLowerCase(Locale.ROOT));
    }

    public TemplateFunction get(String name) {
        return (name == null) ? null : functions.get(strip(name).toLowerCase(Locale.ROOT));
    }

    /** Registered names as first written, without namespace. */
    public List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(names.values()));
    }

    /** Function values for the environment, keyed {@code ppt.<Name>}. */
    public Map<String, Value> asValues() {
        Map<String, Value> out = new LinkedHashMap<>();
        for (String n : names.values()) {
            String qualified = ExpressionParser.FUNCTION_NAMESPACE + "." + n;
            out.put(qualified, Value.func(qualified));
        }
        return out;
    }

    public EvaluationResult execute(ProcessingContext ctx, String qualifiedName, FunctionCall call) {
        String key = strip(qualifiedName).toLowerCase(Locale.ROOT);
        String name = names.getOrDefault(key, call.name);
        if (!names.containsKey(key)) {
            return EvaluationResult.text("[Error: Function '" + name + "' not found]");
        }

        TemplateFunction fn = functions.get(key);
        if (fn == null) {
            Debug.get().w(TAG, "Function '" + name + "' has no implementation");
            return EvaluationResult.text("[Error: Function '" + name + "' has no implementation]");
        }

        try {
            List<FunctionArgument> args = ArgumentParser.parse(call.rawArgs);
            Value bound = boundValue(ctx, args);
            Debug.get().d(TAG, "Calling " + call.qualifiedName() + " with " + args);
            FunctionResult r = fn.execute(ctx, bound, args);
            return (r == null) ? EvaluationResult.text("") : r.toEvaluation();
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "Function '" + name + "' failed", e);
            return EvaluationResult.text("[Error in function '" + name + "': " + e.getMessage() + "]");
        }
    }

    private static Value boundValue(ProcessingContext ctx, List<FunctionArgument> args) {
        for (FunctionArgument a : args) {
            if (a.isKeyword()) continue;
            EvaluationResult r = ctx.resolveArgument(a);
            return (r.getKind() == EvaluationResult.Kind.VALUE) ? r.getValue() : Value.nil();
        }
        return Value.nil();
    }

    private static String strip(String name) {
        String prefix = ExpressionParser.FUNCTION_NAMESPACE + ".";
        return name.regionMatches(true, 0, prefix, 0, prefix.length()) ? name.substring(prefix.length()) : name;
    }
}
