package org.zplot;

/**
 * Raised when a source string is rejected before any code is generated for it.
 * <p>
 * {@link #getPosition()} is the zero-based index into the original input of the character or
 * token that caused the rejection, or {@code -1} when the failure concerns the expression as a whole.
 */
public class ExpressionParseException extends ZPlotException {

    private final String expression;
    private final int position;

    public ExpressionParseException(String message, String expression, int position) {
        super(message);
        this.expression = expression;
        this.position = position;
    }

    public String getExpression() {
        return expression;
    }

    public int getPosition() {
        return position;
    }
}
