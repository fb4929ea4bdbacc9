package org.zplot.parser;

/**
 * A lexeme of the input.
 *
 * @param kind     lexical class, decided without consulting the symbol tables
 * @param text     the matched characters
 * @param position zero-based index of the first character in the original, unstripped input
 */
public record Token(TokenKind kind, String text, int position) {

    public boolean is(TokenKind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return kind + "'" + text + "'@" + position;
    }
}
