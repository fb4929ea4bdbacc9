package org.zplot.parser.ast;

import org.zplot.parser.ast.visitor.ExpressionVisitor;

/**
 * Node of a parsed expression. Trees are immutable and every child is a complete node.
 */
public sealed interface ExpressionNode
        permits ConstantNode, VariableNode, BinaryOperationNode, FunctionCallNode, UnaryMinusNode {

    <R> R accept(ExpressionVisitor<R> visitor);
}
