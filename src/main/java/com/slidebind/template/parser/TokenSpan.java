package com.slidebind.template.parser;

import com.slidebind.template.parser.ExpressionToken.TokenInterface;

/**
 * One {@code ${...}} occurrence with its absolute position in the scanned text.
 * A span whose token is null failed to parse and must be left as literal text.
 */
public final class TokenSpan {
    private final int start;
    private final int end;
    private final String raw;
    private final TokenInterface token;
    private final String format;

    public TokenSpan(int start, int end, String raw, TokenInterface token, String format) {
        this.start = start;
        this.end = end;
        this.raw = raw;
        this.token = token;
        this.format = format;
    }

    /** Inclusive start offset of {@code $}. */
    public int getStart() { return start; }
    /** Exclusive end offset, just past {@code }}. */
    public int getEnd() { return end; }
    public String getRaw() { return raw; }
    public TokenInterface getToken() { return token; }
    /** Text after the top-level colon, or null. */
    public String getFormat() { return format; }
    public boolean isLiteral() { return token == null; }

    @Override
    public String toString() {
        return "TokenSpan[" + start + "," + end + ") " + raw;
    }
}
