package org.zplot.parser.ast;

import org.zplot.parser.ast.visitor.ExpressionVisitor;

/**
 * A real numeric literal.
 */
public record ConstantNode(double value) implements ExpressionNode {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
