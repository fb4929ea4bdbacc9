package org.zplot;

public class ExpressionSyntaxException extends ExpressionParseException {

    public enum Reason {
        UNEXPECTED_TOKEN,
        OPERATOR_AFTER_OPERATOR,
        UNKNOWN_IDENTIFIER,
        LITERAL_OUT_OF_RANGE,
        MISMATCHED_PARENTHESES,
        MISSING_OPERAND,
        INVALID_UNARY_MINUS,
        NOT_ENOUGH_ARGUMENTS,
        ARGUMENT_COUNT,
        MISPLACED_COMMA,
        NESTING_TOO_DEEP,
        INVALID_STRUCTURE
    }

    private final Reason reason;
    private final String token;

    public ExpressionSyntaxException(Reason reason, String message, String token, String expression, int position) {
        super("Syntax error: " + message, expression, position);
        this.reason = reason;
        this.token = token;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * The text of the offending token, or {@code null} when the error is not tied to a single token.
     */
    public String getToken() {
        return token;
    }
}
