package org.zplot;

public class ExpressionLexException extends ExpressionParseException {

    public enum Reason {
        EMPTY_INPUT,
        INVALID_CHARACTER
    }

    private final Reason reason;

    public ExpressionLexException(Reason reason, String message, String expression, int position) {
        super(message, expression, position);
        this.reason = reason;
    }

    public static ExpressionLexException emptyInput(String expression) {
        return new ExpressionLexException(Reason.EMPTY_INPUT, "Function cannot be empty", expression, -1);
    }

    public static ExpressionLexException invalidCharacter(String expression, int position) {
        return new ExpressionLexException(Reason.INVALID_CHARACTER,
                "Invalid character '" + expression.charAt(position) + "' at position " + position,
                expression, position);
    }

    public Reason getReason() {
        return reason;
    }
}
