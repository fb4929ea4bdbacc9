package org.zplot.parser;

public enum TokenKind {
    NUMBER,
    IDENTIFIER,
    OPERATOR,
    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA;

    public boolean isValue() {
        return this == NUMBER || this == IDENTIFIER;
    }
}
