package org.zplot.codegen;

import java.util.List;

import org.zplot.ComplexEvaluator;
import org.zplot.math.Complex;
import org.zplot.parser.ast.BinaryOperationNode;
import org.zplot.parser.ast.ConstantNode;
import org.zplot.parser.ast.ExpressionNode;
import org.zplot.parser.ast.FunctionCallNode;
import org.zplot.parser.ast.UnaryMinusNode;
import org.zplot.parser.ast.VariableNode;
import org.zplot.parser.ast.visitor.ExpressionVisitor;
import org.zplot.symbols.MathFunction;
import org.zplot.symbols.Operator;

/**
 * Turns an expression tree into a chain of {@link ComplexEvaluator} closures, built once per
 * compilation. Each node applies the same {@link Complex} routine that its shader counterpart calls.
 */
public final class EvaluatorCodeGenerator implements ExpressionVisitor<ComplexEvaluator> {

    public static final EvaluatorCodeGenerator INSTANCE = new EvaluatorCodeGenerator();

    private EvaluatorCodeGenerator() {}

    public ComplexEvaluator generate(ExpressionNode root) {
        return root.accept(this);
    }

    @Override
    public ComplexEvaluator visit(ConstantNode n) {
        Complex value = Complex.real(n.value());
        return z -> value;
    }

    @Override
    public ComplexEvaluator visit(VariableNode n) {
        if (n.isFreeVariable()) {
            return ComplexEvaluator.IDENTITY;
        }
        Complex value = n.constant().value();
        return z -> value;
    }

    @Override
    public ComplexEvaluator visit(BinaryOperationNode n) {
        Operator operator = n.operator();
        ComplexEvaluator left = n.left().accept(this);
        ComplexEvaluator right = n.right().accept(this);
        return z -> operator.apply(left.evaluate(z), right.evaluate(z));
    }

    @Override
    public ComplexEvaluator visit(FunctionCallNode n) {
        MathFunction function = n.function();
        List<ExpressionNode> arguments = n.arguments();
        ComplexEvaluator[] args = new ComplexEvaluator[arguments.size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = arguments.get(i).accept(this);
        }
        return z -> {
            Complex[] values = new Complex[args.length];
            for (int i = 0; i < args.length; i++) {
                values[i] = args[i].evaluate(z);
            }
            return function.apply(values);
        };
    }

    @Override
    public ComplexEvaluator visit(UnaryMinusNode n) {
        ComplexEvaluator operand = n.operand().accept(this);
        return z -> operand.evaluate(z).negate();
    }
}
