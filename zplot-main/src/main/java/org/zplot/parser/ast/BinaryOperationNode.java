package org.zplot.parser.ast;

import java.util.Objects;

import org.zplot.parser.ast.visitor.ExpressionVisitor;
import org.zplot.symbols.Operator;

public record BinaryOperationNode(Operator operator, ExpressionNode left, ExpressionNode right) implements ExpressionNode {

    public BinaryOperationNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
