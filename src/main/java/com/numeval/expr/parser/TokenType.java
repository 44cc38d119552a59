package com.numeval.expr.parser;

public enum TokenType {
    // Single-character tokens
    LEFT_PAREN, RIGHT_PAREN, COMMA,
    PLUS, MINUS, STAR, SLASH, PERCENT, CARET,

    // One or two character tokens
    BANG, BANG_EQUAL,
    EQUAL_EQUAL,
    GREATER, GREATER_EQUAL,
    LESS, LESS_EQUAL,
    AND_AND, OR_OR,

    // Literals
    IDENTIFIER, NUMBER,

    EOF
}
