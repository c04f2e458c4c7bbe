package com.slidebind.template.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for the text between {@code ${} and {@code }}.
 *
 * Identifiers accept any Unicode letter so data keys such as {@code 제목} work.
 * Numbers are unsigned; a leading '-' is lexed as MINUS so the parser can reject
 * negative indices explicitly.
 */
public class ExpressionLexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    public ExpressionLexer(String source) {
        this.source = (source == null) ? "" : source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, current, current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case '.': addToken(TokenType.DOT); break;
            case '-': addToken(TokenType.MINUS); break;
            case ' ': case '\r': case '\t': case '\n': case '\u00A0':
                break;
            case '"':
            case '\'':
                string(c);
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw error("Unexpected character: " + c);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.IDENTIFIER, source.substring(start, current));
    }

    private void number() {
        while (isDigit(peek())) advance();
        boolean fractional = false;
        if (peek() == '.' && isDigit(peekNext())) {
            fractional = true;
            advance();
            while (isDigit(peek())) advance();
        }
        String text = source.substring(start, current);
        if (fractional) {
            addToken(TokenType.NUMBER, Double.parseDouble(text));
        } else {
            try {
                addToken(TokenType.NUMBER, Long.parseLong(text));
            } catch (NumberFormatException e) {
                throw error("Number out of range: " + text);
            }
        }
    }

    private void string(char quote) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                char n = advance();
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
        if (isAtEnd()) throw error("Unterminated string");
        advance();
        addToken(TokenType.STRING, sb.toString());
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) { return c == '_' || Character.isLetter(c); }
    private boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, start, current));
    }

    private ExpressionSyntaxException error(String msg) {
        return new ExpressionSyntaxException(start, msg);
    }
}
