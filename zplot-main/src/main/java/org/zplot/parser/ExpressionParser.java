package org.zplot.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.zplot.ExpressionSyntaxException;
import org.zplot.ExpressionSyntaxException.Reason;
import org.zplot.parser.ast.BinaryOperationNode;
import org.zplot.parser.ast.ConstantNode;
import org.zplot.parser.ast.ExpressionNode;
import org.zplot.parser.ast.FunctionCallNode;
import org.zplot.parser.ast.UnaryMinusNode;
import org.zplot.parser.ast.VariableNode;
import org.zplot.symbols.MathFunction;
import org.zplot.symbols.NamedConstant;
import org.zplot.symbols.Operator;
import org.zplot.symbols.Symbols;

/**
 * Shunting-yard parser producing an {@link ExpressionNode} tree.
 * <p>
 * Two stacks are kept: finished nodes and pending markers (operators, unary minus, function
 * names, left parentheses). A function marker is reduced when the parenthesis following it
 * closes, taking as many finished nodes as the function's arity. In permissive mode the
 * argument count between the parentheses is not checked, so a surplus argument stays on the
 * node stack and is picked up by whatever consumes operands next, e.g. {@code pow(sin(1,2))}
 * reads as {@code pow(1, sin(2))}. Strict mode rejects that.
 * <p>
 * Trees deeper than {@link #MAX_DEPTH} are rejected, as the code generators walk them recursively.
 * <p>
 * Instances hold no per-parse state and may be shared.
 */
public final class ExpressionParser {

    /** Deepest tree accepted, counting a leaf as depth 1. */
    public static final int MAX_DEPTH = 256;

    private enum MarkerKind {
        OPERATOR,
        UNARY_MINUS,
        FUNCTION,
        LEFT_PAREN
    }

    private static final class Marker {
        final MarkerKind kind;
        final Token token;
        final Operator operator;
        final MathFunction function;
        final boolean call;
        int commas;

        Marker(MarkerKind kind, Token token, Operator operator, MathFunction function, boolean call) {
            this.kind = kind;
            this.token = token;
            this.operator = operator;
            this.function = function;
            this.call = call;
        }
    }

    /** A finished node and the depth of the tree below it. */
    private record Operand(ExpressionNode node, int depth) {}

    private final boolean strictArity;

    public ExpressionParser() {
        this(false);
    }

    public ExpressionParser(boolean strictArity) {
        this.strictArity = strictArity;
    }

    public ExpressionNode parse(String expression) {
        return parse(Tokenizer.tokenize(expression), expression);
    }

    /**
     * @param tokens     output of {@link Tokenizer#tokenize(String)}
     * @param expression the source the tokens came from, used in error reports
     */
    public ExpressionNode parse(List<Token> tokens, String expression) {
        Parse parse = new Parse(expression);
        Token last = null;
        for (Token token : tokens) {
            parse.accept(token, last);
            last = token;
        }
        return parse.finish();
    }

    private final class Parse {

        private final String expression;
        private final List<Operand> output = new ArrayList<>();
        private final Deque<Marker> markers = new ArrayDeque<>();

        Parse(String expression) {
            this.expression = expression;
        }

        void accept(Token token, Token last) {
            if (token.kind().isValue() && last != null && last.kind().isValue()) {
                throw error(Reason.UNEXPECTED_TOKEN,
                        "Unexpected token '" + token.text() + "' after '" + last.text() + "'", token);
            }
            boolean unaryMinus = token.is(TokenKind.OPERATOR) && "-".equals(token.text()) && startsOperand(last);
            if (token.is(TokenKind.OPERATOR) && !unaryMinus && last != null && last.is(TokenKind.OPERATOR)) {
                throw error(Reason.OPERATOR_AFTER_OPERATOR,
                        "Operator '" + token.text() + "' cannot follow operator '" + last.text() + "'", token);
            }

            switch (token.kind()) {
                case NUMBER:
                    output.add(new Operand(new ConstantNode(parseLiteral(token)), 1));
                    break;
                case IDENTIFIER:
                    identifier(token);
                    break;
                case OPERATOR:
                    if (unaryMinus) {
                        markers.push(new Marker(MarkerKind.UNARY_MINUS, token, null, null, false));
                    } else {
                        binaryOperator(token);
                    }
                    break;
                case LEFT_PAREN:
                    boolean call = last != null && last.is(TokenKind.IDENTIFIER)
                            && !markers.isEmpty() && markers.peek().kind == MarkerKind.FUNCTION;
                    markers.push(new Marker(MarkerKind.LEFT_PAREN, token, null, null, call));
                    break;
                case RIGHT_PAREN:
                    rightParen(token, last);
                    break;
                case COMMA:
                    comma(token);
                    break;
                default:
                    throw new IllegalStateException("Unhandled token kind " + token.kind());
            }
        }

        ExpressionNode finish() {
            while (!markers.isEmpty()) {
                Marker marker = markers.pop();
                if (marker.kind == MarkerKind.LEFT_PAREN) {
                    throw error(Reason.MISMATCHED_PARENTHESES, "Mismatched parentheses", marker.token);
                }
                reduce(marker);
            }
            if (output.size() != 1) {
                throw new ExpressionSyntaxException(Reason.INVALID_STRUCTURE,
                        "Invalid expression structure", null, expression, -1);
            }
            return output.get(0).node();
        }

        private boolean startsOperand(Token last) {
            return last == null
                    || last.is(TokenKind.OPERATOR)
                    || last.is(TokenKind.LEFT_PAREN)
                    || last.is(TokenKind.COMMA);
        }

        private double parseLiteral(Token token) {
            double value = Double.parseDouble(token.text());
            if (Double.isInfinite(value)) {
                throw error(Reason.LITERAL_OUT_OF_RANGE, "Numeric literal '" + token.text() + "' is out of range", token);
            }
            return value;
        }

        private void identifier(Token token) {
            String name = token.text();
            MathFunction function = Symbols.findFunction(name).orElse(null);
            if (function != null) {
                markers.push(new Marker(MarkerKind.FUNCTION, token, null, function, false));
                return;
            }
            NamedConstant constant = Symbols.findConstant(name).orElse(null);
            if (constant != null) {
                output.add(new Operand(VariableNode.of(constant), 1));
            } else if (Symbols.isFreeVariable(name)) {
                output.add(new Operand(VariableNode.freeVariable(), 1));
            } else {
                throw error(Reason.UNKNOWN_IDENTIFIER, "Unknown identifier '" + name + "'", token);
            }
        }

        private void binaryOperator(Token token) {
            Operator incoming = Symbols.getOperator(token.text());
            while (!markers.isEmpty()) {
                Marker top = markers.peek();
                if (top.kind == MarkerKind.LEFT_PAREN || top.kind == MarkerKind.FUNCTION) {
                    break;
                }
                // unary minus binds tighter than any binary operator
                if (top.kind == MarkerKind.UNARY_MINUS || incoming.yieldsTo(top.operator)) {
                    reduce(markers.pop());
                } else {
                    break;
                }
            }
            markers.push(new Marker(MarkerKind.OPERATOR, token, incoming, null, false));
        }

        private void rightParen(Token token, Token last) {
            while (!markers.isEmpty() && markers.peek().kind != MarkerKind.LEFT_PAREN) {
                reduce(markers.pop());
            }
            if (markers.isEmpty()) {
                throw error(Reason.MISMATCHED_PARENTHESES, "Mismatched parentheses", token);
            }
            Marker paren = markers.pop();
            if (!markers.isEmpty() && markers.peek().kind == MarkerKind.FUNCTION) {
                Marker function = markers.pop();
                if (strictArity && paren.call) {
                    int supplied = last != null && last.is(TokenKind.LEFT_PAREN) ? 0 : paren.commas + 1;
                    if (supplied != function.function.arity()) {
                        throw error(Reason.ARGUMENT_COUNT, "Function '" + function.function.functionName()
                                + "' expects " + function.function.arity() + " argument(s) but got " + supplied,
                                function.token);
                    }
                }
                reduce(function);
            }
        }

        private void comma(Token token) {
            reducePending();
            if (!strictArity) {
                return;
            }
            Marker paren = markers.peek();
            if (paren == null || !paren.call) {
                throw error(Reason.MISPLACED_COMMA, "Comma outside of a function call", token);
            }
            paren.commas++;
        }

        /** Reduces operators and unary minus markers down to the nearest parenthesis or function marker. */
        private void reducePending() {
            while (!markers.isEmpty()
                    && (markers.peek().kind == MarkerKind.OPERATOR || markers.peek().kind == MarkerKind.UNARY_MINUS)) {
                reduce(markers.pop());
            }
        }

        private void reduce(Marker marker) {
            switch (marker.kind) {
                case UNARY_MINUS: {
                    if (output.isEmpty()) {
                        throw error(Reason.INVALID_UNARY_MINUS, "Invalid unary minus", marker.token);
                    }
                    Operand operand = output.remove(output.size() - 1);
                    push(new UnaryMinusNode(operand.node()), operand.depth() + 1, marker);
                    break;
                }
                case FUNCTION: {
                    MathFunction function = marker.function;
                    if (output.size() < function.arity()) {
                        throw error(Reason.NOT_ENOUGH_ARGUMENTS,
                                "Not enough arguments for function '" + function.functionName() + "'", marker.token);
                    }
                    List<Operand> tail = output.subList(output.size() - function.arity(), output.size());
                    List<ExpressionNode> args = new ArrayList<>(tail.size());
                    int depth = 0;
                    for (Operand arg : tail) {
                        args.add(arg.node());
                        depth = Math.max(depth, arg.depth());
                    }
                    tail.clear();
                    push(new FunctionCallNode(function, args), depth + 1, marker);
                    break;
                }
                case OPERATOR: {
                    if (output.size() < 2) {
                        throw error(Reason.MISSING_OPERAND,
                                "Missing operand for operator '" + marker.token.text() + "'", marker.token);
                    }
                    Operand right = output.remove(output.size() - 1);
                    Operand left = output.remove(output.size() - 1);
                    push(new BinaryOperationNode(marker.operator, left.node(), right.node()),
                            Math.max(left.depth(), right.depth()) + 1, marker);
                    break;
                }
                default:
                    throw error(Reason.MISMATCHED_PARENTHESES, "Mismatched parentheses", marker.token);
            }
        }

        private void push(ExpressionNode node, int depth, Marker marker) {
            if (depth > MAX_DEPTH) {
                throw error(Reason.NESTING_TOO_DEEP,
                        "Expression is nested deeper than " + MAX_DEPTH + " levels", marker.token);
            }
            output.add(new Operand(node, depth));
        }

        private ExpressionSyntaxException error(Reason reason, String message, Token token) {
            return new ExpressionSyntaxException(reason, message, token.text(), expression, token.position());
        }
    }
}
