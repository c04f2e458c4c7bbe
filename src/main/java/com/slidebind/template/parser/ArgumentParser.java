package com.slidebind.template.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Splits the raw argument text of a function call.
 *
 * Commas separate arguments only outside quotes, parentheses and brackets.
 * Each argument is trimmed; a quoted argument is unquoted and unescaped.
 * {@code name: value} becomes a keyword argument unless the colon starts a path
 * ({@code C:\...} or {@code C:/...}).
 */
public final class ArgumentParser {

    private ArgumentParser() {}

    public static List<FunctionArgument> parse(String rawArgs) {
        if (rawArgs == null || rawArgs.trim().isEmpty()) return Collections.emptyList();

        List<FunctionArgument> out = new ArrayList<>();
        for (String part : split(rawArgs)) {
            out.add(toArgument(part.trim()));
        }
        return out;
    }

    /** Finds a keyword argument by case-insensitive name. */
    public static FunctionArgument keyword(List<FunctionArgument> args, String name) {
        if (args == null) return null;
        String wanted = name.toLowerCase(Locale.ROOT);
        for (FunctionArgument a : args) {
            if (a.isKeyword() && a.getName().toLowerCase(Locale.ROOT).equals(wanted)) return a;
        }
        return null;
    }

    static List<String> split(String raw) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (quote != 0) {
                if (c == '\\') i++;
                else if (c == quote) quote = 0;
                continue;
            }
            switch (c) {
                case '"': case '\'': quote = c; break;
                case '(': case '[': depth++; break;
                case ')': case ']': if (depth > 0) depth--; break;
                case ',':
                    if (depth == 0) {
                        parts.add(raw.substring(start, i));
                        start = i + 1;
                    }
                    break;
                default: break;
            }
        }
        parts.add(raw.substring(start));
        return parts;
    }

    private static FunctionArgument toArgument(String text) {
        String name = null;
        String valueText = text;

        int colon = keywordColon(text);
        if (colon > 0) {
            name = text.substring(0, colon).trim();
            valueText = text.substring(colon + 1).trim();
        }

        boolean quoted = isQuoted(valueText);
        String value = quoted ? unescape(valueText.substring(1, valueText.length() - 1)) : valueText;
        return new FunctionArgument(name, valueText, value, quoted);
    }

    private static int keywordColon(String text) {
        int i = 0;
        while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) i++;
        if (i == 0 || !Character.isLetter(text.charAt(0))) return -1;
        int colon = i;
        while (colon < text.length() && Character.isWhitespace(text.charAt(colon))) colon++;
        if (colon >= text.length() || text.charAt(colon) != ':') return -1;
        if (colon + 1 < text.length()) {
            char next = text.charAt(colon + 1);
            if (next == '/' || next == '\\') return -1;
        }
        return colon;
    }

    private static boolean isQuoted(String s) {
        if (s.length() < 2) return false;
        char first = s.charAt(0);
        return (first == '"' || first == '\'') && s.charAt(s.length() - 1) == first;
    }

    static String unescape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                char n = s.charAt(++i);
                switch (n) {
                    case 'n': sb.append('\n'); break;
                    case 'r': sb.append('\r'); break;
                    case 't': sb.append('\t'); break;
                    default: sb.append(n);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
