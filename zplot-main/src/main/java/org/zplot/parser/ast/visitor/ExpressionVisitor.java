package org.zplot.parser.ast.visitor;

import org.zplot.parser.ast.BinaryOperationNode;
import org.zplot.parser.ast.ConstantNode;
import org.zplot.parser.ast.FunctionCallNode;
import org.zplot.parser.ast.UnaryMinusNode;
import org.zplot.parser.ast.VariableNode;

public interface ExpressionVisitor<R> {

    R visit(ConstantNode n);

    R visit(VariableNode n);

    R visit(BinaryOperationNode n);

    R visit(FunctionCallNode n);

    R visit(UnaryMinusNode n);
}
