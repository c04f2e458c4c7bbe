package com.slidebind.template.parser;

public class Token {
    final TokenType type;
    public final String lexeme;
    final Object literal;
    /** Offset of the first character inside the lexed source. */
    public final int start;
    /** Offset one past the last character. */
    public final int end;

    Token(TokenType type, String lexeme, Object literal, int start, int end) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.start = start;
        this.end = end;
    }

    public TokenType getType() { return type; }

    @Override
    public String toString() {
        return type + " '" + lexeme + "'";
    }
}
