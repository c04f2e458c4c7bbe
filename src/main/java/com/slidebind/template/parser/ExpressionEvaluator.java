package com.slidebind.template.parser;

import java.util.List;
import java.util.Locale;

import com.slidebind.debug.Debug;
import com.slidebind.template.parser.ExpressionToken.ArrayIndexAccess;
import com.slidebind.template.parser.ExpressionToken.FunctionCall;
import com.slidebind.template.parser.ExpressionToken.PlainVariable;
import com.slidebind.template.parser.ExpressionToken.PropertyPath;
import com.slidebind.template.parser.ExpressionToken.TokenInterface;

/**
 * Resolves parsed tokens against an {@link Environment}.
 *
 * Order: host {@link VariableResolver}, exact name, case-insensitive property walk,
 * bounds-checked indexed access, function dispatch. Nothing here throws to the
 * caller; failures come back as {@link EvaluationResult} kinds.
 */
public class ExpressionEvaluator implements ExpressionToken.Visitor<EvaluationResult> {

    private static final String TAG = "slidebind.eval";

    private final ValueFormatter formatter;
    private final UnresolvedPolicy policy;
    private final FunctionDispatcher dispatcher;
    private VariableResolver resolver;

    private Environment env = Environment.empty();

    public ExpressionEvaluator() {
        this(Locale.US, UnresolvedPolicy.EMPTY, null);
    }

    public ExpressionEvaluator(Locale locale, UnresolvedPolicy policy, FunctionDispatcher dispatcher) {
        this.formatter = new ValueFormatter(locale);
        this.policy = (policy == null) ? UnresolvedPolicy.EMPTY : policy;
        this.dispatcher = dispatcher;
    }

    public void setVariableResolver(VariableResolver resolver) {
        this.resolver = resolver;
    }

    public VariableResolver getVariableResolver() { return resolver; }
    public UnresolvedPolicy getPolicy() { return policy; }
    public ValueFormatter getFormatter() { return formatter; }

    /** Parses and resolves one expression body (no delimiters, no format suffix). */
    public EvaluationResult evaluate(String expressionText, Environment environment) {
        TokenInterface token;
        try {
            token = new ExpressionParser(expressionText).parse();
        } catch (ExpressionSyntaxException e) {
            Debug.get().d(TAG, "Not an expression: '" + expressionText + "' " + e.getMessage());
            return EvaluationResult.unresolved();
        }
        return resolve(token, environment);
    }

    public EvaluationResult resolve(TokenInterface token, Environment environment) {
        Environment saved = this.env;
        this.env = (environment == null) ? Environment.empty() : environment;
        try {
            return token.accept(this);
        } catch (RuntimeException e) {
            Debug.get().w(TAG, "Evaluation of '" + token.source() + "' failed: " + e.getMessage(), e);
            return EvaluationResult.unresolved();
        } finally {
            this.env = saved;
        }
    }

    /**
     * Resolves a function argument. Quoted arguments are literal text; unquoted
     * arguments that parse as a path are resolved, the rest are literal text.
     */
    public EvaluationResult resolveArgument(FunctionArgument arg, Environment environment) {
        if (arg == null) return EvaluationResult.unresolved();
        if (arg.isQuoted()) return EvaluationResult.value(Value.string(arg.getValue()));

        TokenInterface token;
        try {
            token = new ExpressionParser(arg.getValue()).parse();
        } catch (ExpressionSyntaxException e) {
            return EvaluationResult.value(Value.string(arg.getValue()));
        }
        if (token instanceof FunctionCall) return EvaluationResult.value(Value.string(arg.getValue()));
        return resolve(token, environment);
    }

    /** Text that replaces {@code span} for {@code result}. */
    public String render(TokenSpan span, EvaluationResult result) {
        switch (result.getKind()) {
            case VALUE:
                return formatter.format(result.getValue(), span.getFormat());
            case TEXT:
                return result.getText();
            case UNRESOLVED:
                return (policy == UnresolvedPolicy.LITERAL) ? span.getRaw() : "";
            default:
                return "";
        }
    }

    // -------------------------
    // Visitor
    // -------------------------

    @Override
    public EvaluationResult visitPlainVariable(PlainVariable token) {
        Value hooked = fromHook(token.source());
        if (hooked != null) return EvaluationResult.value(hooked);

        Value v = env.lookup(token.name);
        return (v == null) ? EvaluationResult.unresolved() : EvaluationResult.value(v);
    }

    @Override
    public EvaluationResult visitPropertyPath(PropertyPath token) {
        Value hooked = fromHook(token.source());
        if (hooked != null) return EvaluationResult.value(hooked);

        // a host may bind the dotted name itself
        Value whole = env.lookup(token.source());
        if (whole != null) return EvaluationResult.value(whole);

        Value root = env.lookup(token.root());
        if (root == null) return EvaluationResult.unresolved();
        Value v = walk(root, token.segments.subList(1, token.segments.size()));
        return (v == null) ? EvaluationResult.unresolved() : EvaluationResult.value(v);
    }

    @Override
    public EvaluationResult visitArrayIndexAccess(ArrayIndexAccess token) {
        Value hooked = fromHook(token.source());
        if (hooked != null) return EvaluationResult.value(hooked);

        Value arr = env.lookup(token.arrayName);
        if (arr == null && token.arrayPath.size() > 1) {
            Value root = env.lookup(token.root());
            arr = (root == null) ? null : walk(root, token.arrayPath.subList(1, token.arrayPath.size()));
        }
        if (arr == null || arr.type != Value.Type.INDEXABLE) return EvaluationResult.unresolved();

        Value.IndexSource src = arr.asIndexable();
        if (token.index < 0 || token.index >= src.count()) {
            return EvaluationResult.outOfRange(token.toReference(false));
        }
        Value v = walk(src.item(token.index), token.propertyPath);
        return (v == null) ? EvaluationResult.unresolved() : EvaluationResult.value(v);
    }

    @Override
    public EvaluationResult visitFunctionCall(FunctionCall token) {
        Value f = env.lookup(token.qualifiedName());
        if (f == null || f.type != Value.Type.FUNCTION) {
            return EvaluationResult.text("[Error: Function '" + token.name + "' not found]");
        }
        if (dispatcher == null) return EvaluationResult.unresolved();
        EvaluationResult r = dispatcher.dispatch(f.asFunc(), token, env);
        return (r == null) ? EvaluationResult.text("") : r;
    }

    // -------------------------
    // Helpers
    // -------------------------

    private Value fromHook(String expression) {
        if (resolver == null) return null;
        try {
            return resolver.resolve(expression, env);
        } catch (RuntimeException e) {
            Debug.get().w(TAG, "Variable resolver failed on '" + expression + "': " + e.getMessage(), e);
            return null;
        }
    }

    private static Value walk(Value start, List<String> segments) {
        Value cur = start;
        for (String seg : segments) {
            if (cur == null) return null;
            cur = cur.property(seg);
        }
        return cur;
    }
}
