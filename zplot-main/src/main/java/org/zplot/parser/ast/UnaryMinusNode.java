package org.zplot.parser.ast;

import java.util.Objects;

import org.zplot.parser.ast.visitor.ExpressionVisitor;

public record UnaryMinusNode(ExpressionNode operand) implements ExpressionNode {

    public UnaryMinusNode {
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
