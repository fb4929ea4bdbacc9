package org.zplot.parser;

import java.util.ArrayList;
import java.util.List;

import org.zplot.ExpressionLexException;
import org.zplot.symbols.Symbols;

/**
 * Splits an expression into tokens.
 * <p>
 * All whitespace is removed before scanning, so {@code "si n(z)"} reads as {@code "sin(z)"}.
 * At each position the scanner takes an identifier ({@code [A-Za-z_][A-Za-z0-9_]*}), a number
 * ({@code \d+\.?\d*}, no sign and no exponent), one of {@code + - * / ^}, a parenthesis or a
 * comma. Anything else is rejected.
 */
public final class Tokenizer {

    private Tokenizer() {}

    public static List<Token> tokenize(String input) {
        if (input == null) {
            throw ExpressionLexException.emptyInput("");
        }

        // compact[i] came from input.charAt(origin[i])
        StringBuilder compact = new StringBuilder(input.length());
        int[] origin = new int[input.length()];
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (!Character.isWhitespace(c)) {
                origin[compact.length()] = i;
                compact.append(c);
            }
        }
        if (compact.length() == 0) {
            throw ExpressionLexException.emptyInput(input);
        }

        List<Token> tokens = new ArrayList<>();
        int length = compact.length();
        int pos = 0;
        while (pos < length) {
            char c = compact.charAt(pos);
            int start = pos;
            TokenKind kind;
            if (isIdentifierStart(c)) {
                pos++;
                while (pos < length && isIdentifierPart(compact.charAt(pos))) {
                    pos++;
                }
                kind = TokenKind.IDENTIFIER;
            } else if (isDigit(c)) {
                pos = skipDigits(compact, pos);
                if (pos < length && compact.charAt(pos) == '.') {
                    pos = skipDigits(compact, pos + 1);
                }
                kind = TokenKind.NUMBER;
            } else if (Symbols.isOperator(c)) {
                pos++;
                kind = TokenKind.OPERATOR;
            } else if (c == '(') {
                pos++;
                kind = TokenKind.LEFT_PAREN;
            } else if (c == ')') {
                pos++;
                kind = TokenKind.RIGHT_PAREN;
            } else if (c == ',') {
                pos++;
                kind = TokenKind.COMMA;
            } else {
                throw ExpressionLexException.invalidCharacter(input, origin[start]);
            }
            tokens.add(new Token(kind, compact.substring(start, pos), origin[start]));
        }
        return tokens;
    }

    private static int skipDigits(CharSequence s, int pos) {
        while (pos < s.length() && isDigit(s.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
