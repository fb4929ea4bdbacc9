package org.zplot;

import java.util.Objects;

import org.zplot.math.Complex;
import org.zplot.parser.ast.ExpressionNode;

/**
 * Result of one successful compilation. The shader source and the evaluator are both derived
 * from {@link #ast()}, so they always describe the same function.
 */
public record CompiledExpression(String source, ExpressionNode ast, String shaderSource, ComplexEvaluator evaluator) {

    public CompiledExpression {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(ast, "ast");
        Objects.requireNonNull(shaderSource, "shaderSource");
        Objects.requireNonNull(evaluator, "evaluator");
    }

    public Complex evaluate(Complex z) {
        return evaluator.evaluate(z);
    }
}
