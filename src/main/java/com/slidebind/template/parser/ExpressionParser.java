package com.slidebind.template.parser;

import java.util.ArrayList;
import java.util.List;

import com.slidebind.template.parser.ExpressionToken.ArrayIndexAccess;
import com.slidebind.template.parser.ExpressionToken.FunctionCall;
import com.slidebind.template.parser.ExpressionToken.PlainVariable;
import com.slidebind.template.parser.ExpressionToken.PropertyPath;
import com.slidebind.template.parser.ExpressionToken.TokenInterface;

/**
 * Recursive-descent parser for one expression body.
 *
 * <pre>
 * expr := call | path
 * call := 'ppt' '.' IDENT '(' rawArgs ')'
 * path := IDENT ( '.' IDENT )* ( '[' INT ']' ( '.' IDENT )* )?
 * </pre>
 *
 * Call arguments are not lexed here: they may hold file paths or other text the
 * expression lexer rejects, so the raw text between the parentheses is kept and
 * split later by {@link ArgumentParser}.
 */
public class ExpressionParser {

    /** Reserved namespace for template functions. */
    public static final String FUNCTION_NAMESPACE = "ppt";

    private final String source;
    private List<Token> tokens;
    private int current = 0;

    public ExpressionParser(String source) {
        this.source = (source == null) ? "" : source.trim();
    }

    public TokenInterface parse() {
        if (source.isEmpty()) throw new ExpressionSyntaxException(0, "Empty expression.");

        FunctionCall call = tryFunctionCall();
        if (call != null) return call;

        tokens = new ExpressionLexer(source).tokenize();
        current = 0;
        TokenInterface out = path();
        if (!isAtEnd()) throw error(peek(), "Unexpected '" + peek().lexeme + "' after expression.");
        return out;
    }

    /**
     * Index of the colon that starts a {@code :format} suffix, or -1.
     * Only a colon outside quotes, parentheses and brackets counts.
     */
    public static int formatSeparator(String inner) {
        if (inner == null) return -1;
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (quote != 0) {
                if (c == '\\') i++;
                else if (c == quote) quote = 0;
                continue;
            }
            switch (c) {
                case '"': case '\'': quote = c; break;
                case '(': case '[': depth++; break;
                case ')': case ']': if (depth > 0) depth--; break;
                case ':': if (depth == 0) return i; break;
                default: break;
            }
        }
        return -1;
    }

    // -------------------------
    // Function call (raw scan)
    // -------------------------

    private FunctionCall tryFunctionCall() {
        String prefix = FUNCTION_NAMESPACE + ".";
        if (!source.startsWith(prefix)) return null;

        int i = prefix.length();
        int nameStart = i;
        while (i < source.length() && (Character.isLetterOrDigit(source.charAt(i)) || source.charAt(i) == '_')) i++;
        if (i == nameStart) return null;
        String name = source.substring(nameStart, i);

        while (i < source.length() && Character.isWhitespace(source.charAt(i))) i++;
        if (i >= source.length() || source.charAt(i) != '(') return null;

        int open = i;
        int close = matchingParen(open);
        if (close < 0) throw new ExpressionSyntaxException(open, "Unterminated argument list.");
        if (!source.substring(close + 1).trim().isEmpty()) {
            throw new ExpressionSyntaxException(close + 1, "Unexpected text after function call.");
        }
        return new FunctionCall(FUNCTION_NAMESPACE, name, source.substring(open + 1, close));
    }

    private int matchingParen(int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < source.length(); i++) {
            char c = source.charAt(i);
            if (quote != 0) {
                if (c == '\\') i++;
                else if (c == quote) quote = 0;
                continue;
            }
            if (c == '"' || c == '\'') quote = c;
            else if (c == '(') depth++;
            else if (c == ')' && --depth == 0) return i;
        }
        return -1;
    }

    // -------------------------
    // Paths
    // -------------------------

    private TokenInterface path() {
        Token first = consume(TokenType.IDENTIFIER, "Expect variable name.");
        if (check(TokenType.LEFT_PAREN)) {
            throw error(peek(), "Function calls are only allowed under '" + FUNCTION_NAMESPACE + ".'.");
        }

        List<String> head = new ArrayList<>();
        head.add(first.lexeme);
        while (check(TokenType.DOT)) {
            advance();
            head.add(consume(TokenType.IDENTIFIER, "Expect property name after '.'.").lexeme);
        }

        if (!match(TokenType.LEFT_BRACKET)) {
            return (head.size() == 1) ? new PlainVariable(first.lexeme) : new PropertyPath(head);
        }

        if (check(TokenType.MINUS)) throw error(peek(), "Negative index.");
        Token number = consume(TokenType.NUMBER, "Expect index.");
        if (!(number.literal instanceof Long) || (Long) number.literal > Integer.MAX_VALUE) {
            throw error(number, "Index must be a non-negative integer.");
        }
        int index = ((Long) number.literal).intValue();
        consume(TokenType.RIGHT_BRACKET, "Expect ']' after index.");

        List<String> rest = new ArrayList<>();
        while (match(TokenType.DOT)) {
            rest.add(consume(TokenType.IDENTIFIER, "Expect property name after '.'.").lexeme);
        }
        if (check(TokenType.LEFT_BRACKET)) throw error(peek(), "Only one index per expression.");
        return new ArrayIndexAccess(head, index, rest);
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ExpressionSyntaxException error(Token token, String message) {
        return new ExpressionSyntaxException(token.start, message);
    }
}
