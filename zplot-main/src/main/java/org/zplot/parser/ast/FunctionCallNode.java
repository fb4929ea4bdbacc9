package org.zplot.parser.ast;

import java.util.List;
import java.util.Objects;

import org.zplot.parser.ast.visitor.ExpressionVisitor;
import org.zplot.symbols.MathFunction;

/**
 * Call of a {@link MathFunction}. The argument list always has exactly {@code function.arity()} entries.
 */
public record FunctionCallNode(MathFunction function, List<ExpressionNode> arguments) implements ExpressionNode {

    public FunctionCallNode {
        Objects.requireNonNull(function, "function");
        arguments = List.copyOf(arguments);
        if (arguments.size() != function.arity()) {
            throw new IllegalArgumentException(function.functionName() + " takes " + function.arity()
                    + " argument(s), got " + arguments.size());
        }
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
