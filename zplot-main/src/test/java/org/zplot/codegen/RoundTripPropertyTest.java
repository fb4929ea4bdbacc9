package org.zplot.codegen;

import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.DoubleRange;
import org.assertj.core.data.Offset;
import org.zplot.CompiledExpression;
import org.zplot.ExpressionArbitraries;
import org.zplot.ExpressionCompiler;
import org.zplot.math.Complex;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * The generated shader source, executed routine by routine on the host, must compute the same
 * value as the evaluator built from the same tree.
 */
class RoundTripPropertyTest {

    private final ExpressionCompiler compiler = new ExpressionCompiler();

    @Provide
    Arbitrary<String> expressions() {
        return ExpressionArbitraries.expressions();
    }

    @Property(tries = 500)
    void shaderCallGraphAgreesWithEvaluator(@ForAll("expressions") String expression,
                                            @ForAll @DoubleRange(min = -3, max = 3) double re,
                                            @ForAll @DoubleRange(min = -3, max = 3) double im) {
        CompiledExpression compiled = compiler.compile(expression);
        Complex z = Complex.of(re, im);

        Complex host = compiled.evaluate(z);
        Complex shader = GlslExpressionInterpreter.run(compiled.shaderSource(), z);

        assertComponent(expression, host.re(), shader.re());
        assertComponent(expression, host.im(), shader.im());
    }

    private static void assertComponent(String expression, double host, double shader) {
        if (Double.isNaN(host) || Double.isNaN(shader)) {
            assertThat(Double.isNaN(shader)).as(expression).isEqualTo(Double.isNaN(host));
        } else if (Double.isInfinite(host) || Double.isInfinite(shader)) {
            assertThat(shader).as(expression).isEqualTo(host);
        } else {
            assertThat(shader).as(expression).isCloseTo(host, Offset.offset(1e-9 * Math.max(1, Math.abs(host))));
        }
    }
}
