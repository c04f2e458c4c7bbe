package com.slidebind.template.parser;

import com.slidebind.template.TemplateException;

/**
 * Raised by the lexer and parser on malformed expression text.
 * Never escapes {@link TokenExtractor}: a malformed token is kept as literal text.
 */
public class ExpressionSyntaxException extends TemplateException {

    private final int position;

    public ExpressionSyntaxException(int position, String message) {
        super("[col " + position + "] " + message);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
