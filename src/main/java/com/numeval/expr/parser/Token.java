package com.numeval.expr.parser;

public class Token {
    final TokenType type;
    public final String lexeme;
    final Object literal;
    public final int column;

    Token(TokenType type, String lexeme, Object literal, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.column = column;
    }

    public TokenType type() { return type; }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' @" + column;
    }
}
