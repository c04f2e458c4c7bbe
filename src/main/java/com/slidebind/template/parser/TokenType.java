package com.slidebind.template.parser;

public enum TokenType {
    IDENTIFIER, NUMBER, STRING,
    DOT, COMMA, COLON,
    LEFT_PAREN, RIGHT_PAREN,
    LEFT_BRACKET, RIGHT_BRACKET,
    MINUS,
    EOF
}
