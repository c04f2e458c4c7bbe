package com.slidebind.template.directive;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.slidebind.debug.Debug;

/**
 * Reads directives from slide notes, one per line:
 *
 * <pre>
 * #foreach: Items
 * #foreach: Order.Lines, itemName: Lines
 * #if: ShowTotals, target: Totals, visibleWhenFalse: "No totals"
 * </pre>
 *
 * Parameters are {@code key: value} pairs separated by commas outside double
 * quotes. Quoted values are unquoted and unescaped. Other note text is ignored.
 */
public final class DirectiveParser {

    private static final String TAG = "slidebind.directive";

    private static final Pattern LINE = Pattern.compile("#(\\w+(?:-\\w+)?)\\s*:([^,\\r\\n]+)(?:,([^\\r\\n]*))?");

    private DirectiveParser() {}

    public static List<Directive> parse(String notes) {
        List<Directive> out = new ArrayList<>();
        if (notes == null || notes.isEmpty()) return out;

        Matcher m = LINE.matcher(notes);
        while (m.find()) {
            Map<String, String> params = new LinkedHashMap<>();
            if (m.group(3) != null) parseParameters(m.group(3), params);
            Directive d = new Directive(m.group(1).trim(), unquote(m.group(2).trim()), params);
            Debug.get().d(TAG, "Found " + d);
            out.add(d);
        }
        return out;
    }

    private static void parseParameters(String text, Map<String, String> into) {
        for (String part : split(text)) {
            String pair = part.trim();
            if (pair.isEmpty()) continue;
            int colon = pair.indexOf(':');
            if (colon <= 0) {
                Debug.get().w(TAG, "Invalid directive parameter: " + pair);
                continue;
            }
            into.put(pair.substring(0, colon).trim(), unquote(pair.substring(colon + 1).trim()));
        }
    }

    /** Splits on commas outside double quotes. */
    static List<String> split(String text) {
        List<String> out = new ArrayList<>();
        boolean quoted = false;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' && (i == 0 || text.charAt(i - 1) != '\\')) quoted = !quoted;
            else if (c == ',' && !quoted) {
                out.add(text.substring(start, i));
                start = i + 1;
            }
        }
        if (start < text.length()) out.add(text.substring(start));
        return out;
    }

    static String unquote(String v) {
        if (v.length() < 2 || !v.startsWith("\"") || !v.endsWith("\"")) return v;
        StringBuilder sb = new StringBuilder(v.length());
        for (int i = 1; i < v.length() - 1; i++) {
            char c = v.charAt(i);
            if (c == '\\' && i + 1 < v.length() - 1) {
                char n = v.charAt(++i);
                switch (n) {
                    case 'n': sb.append('\n'); break;
                    case 'r': sb.append('\r'); break;
                    default: sb.append(n); break;
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
