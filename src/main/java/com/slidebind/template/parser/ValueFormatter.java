package com.slidebind.template.parser;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.text.NumberFormat;
import java.text.SimpleDateFormat;
import java.time.DateTimeException;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Calendar;
import java.util.Date;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.slidebind.debug.Debug;

/**
 * Renders values for substitution, applying an optional {@code :format} suffix.
 *
 * Numbers accept the standard specifiers N, F, C, P, D and X with an optional
 * precision ({@code N2}, {@code D5}), or any {@link DecimalFormat} pattern.
 * Temporals use {@link DateTimeFormatter} patterns and legacy dates use
 * {@link SimpleDateFormat} patterns. A format that fails to apply falls back to
 * the plain rendering.
 */
public final class ValueFormatter {

    private static final String TAG = "slidebind.eval";
    private static final Pattern STANDARD = Pattern.compile("([NnFfCcPpDdXx])(\\d{0,2})");

    private final Locale locale;

    public ValueFormatter(Locale locale) {
        this.locale = (locale == null) ? Locale.US : locale;
    }

    public Locale getLocale() { return locale; }

    public String format(Value v, String format) {
        if (v == null || v.isNull()) return "";
        if (v.type != Value.Type.SCALAR) return v.toDisplayString();

        Object o = v.value;
        if (format == null || format.trim().isEmpty()) return plain(o);

        String f = format.trim();
        try {
            if (o instanceof Number) return formatNumber((Number) o, f);
            if (o instanceof TemporalAccessor) return DateTimeFormatter.ofPattern(f, locale).format((TemporalAccessor) o);
            if (o instanceof Date) return new SimpleDateFormat(f, locale).format((Date) o);
            if (o instanceof Calendar) return new SimpleDateFormat(f, locale).format(((Calendar) o).getTime());
        } catch (IllegalArgumentException | DateTimeException e) {
            Debug.get().w(TAG, "Format '" + f + "' does not apply to " + o + ": " + e.getMessage());
        }
        return plain(o);
    }

    /** Default stringification: integral doubles drop their fraction. */
    public static String plain(Object o) {
        if (o == null) return "";
        if (o instanceof Double || o instanceof Float) {
            double d = ((Number) o).doubleValue();
            if (!Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (o instanceof BigDecimal) return ((BigDecimal) o).toPlainString();
        return String.valueOf(o);
    }

    private String formatNumber(Number n, String f) {
        Matcher m = STANDARD.matcher(f);
        if (!m.matches()) {
            return new DecimalFormat(f, DecimalFormatSymbols.getInstance(locale)).format(n);
        }

        char spec = Character.toUpperCase(m.group(1).charAt(0));
        Integer precision = m.group(2).isEmpty() ? null : Integer.valueOf(m.group(2));

        switch (spec) {
            case 'N': return fixed(NumberFormat.getNumberInstance(locale), n, precision, 2, true);
            case 'F': return fixed(NumberFormat.getNumberInstance(locale), n, precision, 2, false);
            case 'C': return fixed(NumberFormat.getCurrencyInstance(locale), n, precision, 2, true);
            case 'P': return fixed(NumberFormat.getPercentInstance(locale), n, precision, 2, true);
            case 'D': {
                BigInteger i = integral(n, f);
                String digits = i.abs().toString();
                int width = (precision == null) ? 0 : precision;
                StringBuilder sb = new StringBuilder();
                if (i.signum() < 0) sb.append('-');
                for (int k = digits.length(); k < width; k++) sb.append('0');
                return sb.append(digits).toString();
            }
            case 'X': {
                BigInteger i = integral(n, f);
                if (i.signum() < 0) throw new IllegalArgumentException("hex format needs a non-negative value");
                String hex = i.toString(16);
                if (Character.isUpperCase(m.group(1).charAt(0))) hex = hex.toUpperCase(Locale.ROOT);
                int width = (precision == null) ? 0 : precision;
                StringBuilder sb = new StringBuilder();
                for (int k = hex.length(); k < width; k++) sb.append('0');
                return sb.append(hex).toString();
            }
            default:
                return plain(n);
        }
    }

    private static String fixed(NumberFormat nf, Number n, Integer precision, int def, boolean grouping) {
        int digits = (precision == null) ? def : precision;
        nf.setMinimumFractionDigits(digits);
        nf.setMaximumFractionDigits(digits);
        nf.setGroupingUsed(grouping);
        return nf.format(n);
    }

    private static BigInteger integral(Number n, String f) {
        if (n instanceof BigInteger) return (BigInteger) n;
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return BigInteger.valueOf(n.longValue());
        }
        BigDecimal d = (n instanceof BigDecimal) ? (BigDecimal) n : BigDecimal.valueOf(n.doubleValue());
        try {
            return d.toBigIntegerExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("'" + f + "' needs an integral value", e);
        }
    }
}
