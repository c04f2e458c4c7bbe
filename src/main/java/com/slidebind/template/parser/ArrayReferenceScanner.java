package com.slidebind.template.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.slidebind.debug.Debug;
import com.slidebind.template.parser.ExpressionToken.ArrayIndexAccess;
import com.slidebind.template.parser.ExpressionToken.FunctionCall;
import com.slidebind.template.parser.ExpressionToken.TokenInterface;

/**
 * Finds {@code Name[index]} references in template text and shifts them when a
 * template slide is cloned for pagination.
 */
public final class ArrayReferenceScanner {

    private static final String TAG = "slidebind.page";

    /** Largest index pagination arithmetic may produce or consume. */
    public static final int MAX_INDEX = 1000;

    private ArrayReferenceScanner() {}

    /**
     * References inside {@code ${...}} tokens, including unquoted arguments of
     * function calls, in text order.
     */
    public static List<ArrayReference> scan(String text) {
        List<ArrayReference> out = new ArrayList<>();
        for (TokenSpan span : TokenExtractor.extract(text)) {
            if (span.isLiteral()) continue;
            TokenInterface token = span.getToken();
            if (token instanceof ArrayIndexAccess) {
                out.add(((ArrayIndexAccess) token).toReference(false));
            } else if (token instanceof FunctionCall) {
                for (FunctionArgument arg : ArgumentParser.parse(((FunctionCall) token).rawArgs)) {
                    if (arg.isQuoted()) continue;
                    ArrayReference ref = argumentReference(arg.getValue());
                    if (ref != null) out.add(ref);
                }
            }
        }
        return out;
    }

    /** Largest referenced index per array name (names as first written). */
    public static Map<String, Integer> maxIndexes(List<ArrayReference> refs) {
        Map<String, Integer> byFolded = new LinkedHashMap<>();
        Map<String, String> names = new LinkedHashMap<>();
        for (ArrayReference r : refs) {
            String key = r.getArrayName().toLowerCase(Locale.ROOT);
            names.putIfAbsent(key, r.getArrayName());
            byFolded.merge(key, r.getIndex(), Math::max);
        }
        Map<String, Integer> out = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> e : byFolded.entrySet()) {
            out.put(names.get(e.getKey()), e.getValue());
        }
        return out;
    }

    /**
     * Adds {@code offset} to every {@code arrayName[i]} in {@code text}, matched
     * case-insensitively on a name boundary. A reference whose old or new index
     * falls outside {@code [0, MAX_INDEX]} is left untouched.
     */
    public static String shift(String text, String arrayName, int offset) {
        if (text == null || arrayName == null || arrayName.isEmpty() || offset == 0) return text;

        StringBuilder sb = new StringBuilder(text.length() + 8);
        int n = text.length();
        int i = 0;
        while (i < n) {
            int refEnd = matchReference(text, i, arrayName);
            if (refEnd < 0) {
                sb.append(text.charAt(i++));
                continue;
            }
            int open = i + arrayName.length();
            String digits = text.substring(open + 1, refEnd - 1);
            long oldIndex = Long.parseLong(digits);
            long newIndex = oldIndex + offset;
            if (oldIndex > MAX_INDEX || newIndex < 0 || newIndex > MAX_INDEX) {
                Debug.get().w(TAG, "Index shift " + arrayName + "[" + digits + "] by " + offset
                        + " leaves [0, " + MAX_INDEX + "]; reference kept.");
                sb.append(text, i, refEnd);
            } else {
                sb.append(text, i, open + 1).append(newIndex).append(']');
            }
            i = refEnd;
        }
        return sb.toString();
    }

    private static ArrayReference argumentReference(String value) {
        try {
            TokenInterface t = new ExpressionParser(value).parse();
            return (t instanceof ArrayIndexAccess) ? ((ArrayIndexAccess) t).toReference(true) : null;
        } catch (ExpressionSyntaxException e) {
            return null;
        }
    }

    /** End offset (past {@code ]}) of a reference starting at {@code at}, or -1. */
    private static int matchReference(String text, int at, String name) {
        if (!text.regionMatches(true, at, name, 0, name.length())) return -1;
        if (at > 0) {
            char prev = text.charAt(at - 1);
            if (Character.isLetterOrDigit(prev) || prev == '_' || prev == '.') return -1;
        }
        int j = at + name.length();
        if (j >= text.length() || text.charAt(j) != '[') return -1;
        int k = j + 1;
        while (k < text.length() && Character.isDigit(text.charAt(k))) k++;
        if (k == j + 1 || k >= text.length() || text.charAt(k) != ']') return -1;
        if (k - (j + 1) > 9) return -1;
        return k + 1;
    }
}
