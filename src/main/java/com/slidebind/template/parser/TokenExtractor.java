package com.slidebind.template.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.slidebind.debug.Debug;
import com.slidebind.template.parser.ExpressionToken.TokenInterface;

/**
 * Finds {@code ${...}} tokens in reconstructed paragraph text.
 *
 * The scanner is a small state machine: outside a token it looks for {@code ${};
 * inside it tracks quoted strings (with backslash escapes) so a {@code }} inside a
 * quoted argument does not close the token. A {@code ${} that is never closed, or
 * that is interrupted by another {@code ${} (even inside an open quote), stays
 * literal and scanning resumes after it.
 *
 * Never throws; malformed bodies come back as literal spans.
 */
public final class TokenExtractor {

    private static final String TAG = "slidebind.eval";
    private static final String OPEN = "${";

    private TokenExtractor() {}

    public static boolean containsToken(String text) {
        return text != null && text.contains(OPEN);
    }

    public static List<TokenSpan> extract(String text) {
        if (!containsToken(text)) return Collections.emptyList();

        List<TokenSpan> out = new ArrayList<>();
        int from = 0;
        while (from < text.length()) {
            int start = text.indexOf(OPEN, from);
            if (start < 0) break;

            int close = findClose(text, start + OPEN.length());
            if (close == -1) {
                from = start + OPEN.length();
                continue;
            }
            if (close < -1) {
                // interrupted by another "${" at -(close + 2)
                from = -(close + 2);
                continue;
            }

            String raw = text.substring(start, close + 1);
            String inner = text.substring(start + OPEN.length(), close);
            out.add(parseSpan(start, close + 1, raw, inner));
            from = close + 1;
        }
        return out;
    }

    /** Parses one body; a malformed body yields a literal span. */
    public static TokenSpan parseSpan(int start, int end, String raw, String inner) {
        String expression = inner;
        String format = null;
        int sep = ExpressionParser.formatSeparator(inner);
        if (sep >= 0) {
            expression = inner.substring(0, sep);
            format = inner.substring(sep + 1).trim();
            if (format.isEmpty()) format = null;
        }

        try {
            TokenInterface token = new ExpressionParser(expression).parse();
            return new TokenSpan(start, end, raw, token, format);
        } catch (ExpressionSyntaxException e) {
            Debug.get().d(TAG, "Leaving malformed token literal: " + raw + " (" + e.getMessage() + ")");
            return new TokenSpan(start, end, raw, null, null);
        }
    }

    /**
     * Returns the index of the closing brace, -1 if the text ends first, or
     * {@code -(i + 2)} if another {@code ${} starts at i before the token closes.
     */
    private static int findClose(String text, int from) {
        char quote = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '$' && i + 1 < text.length() && text.charAt(i + 1) == '{') {
                return -(i + 2);
            }
            if (quote != 0) {
                if (c == '\\') i++;
                else if (c == quote) quote = 0;
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '}') {
                return i;
            }
        }
        return -1;
    }
}
