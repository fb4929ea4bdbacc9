package org.zplot.benchmark;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.*;
import org.zplot.CompilerSettings;
import org.zplot.ComplexExpression;
import org.zplot.math.Complex;

/**
 * Host evaluation of a compiled expression at varying points, the path taken by the
 * point inspector on every cursor move.
 */
@BenchmarkMode({Mode.AverageTime, Mode.Throughput})
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Fork(value = 2, jvmArgsAppend = {
        "-Dorg.slf4j.simpleLogger.defaultLogLevel=warn"
})
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 5, time = 2)
public class WarmEvaluationBenchmark {

    @State(Scope.Thread)
    public static class PolynomialState {

        ComplexExpression expression;
        Complex z;

        @Setup(Level.Trial)
        public void compile() {
            expression = new ComplexExpression(CompilerSettings.defaults());
            expression.compile("z^3 - 2*z + 1");
        }

        @Setup(Level.Iteration)
        public void movePoint() {
            z = randomPoint();
        }
    }

    @State(Scope.Thread)
    public static class TranscendentalState {

        ComplexExpression expression;
        Complex z;

        @Setup(Level.Trial)
        public void compile() {
            expression = new ComplexExpression(CompilerSettings.defaults());
            expression.compile("sin(1/z)*exp(z) + log(z)");
        }

        @Setup(Level.Iteration)
        public void movePoint() {
            z = randomPoint();
        }
    }

    static Complex randomPoint() {
        ThreadLocalRandom rng = ThreadLocalRandom.current();
        return Complex.of(rng.nextDouble(-2, 2), rng.nextDouble(-2, 2));
    }

    @Benchmark
    public Complex evalPolynomial(PolynomialState state) {
        return state.expression.evaluate(state.z);
    }

    @Benchmark
    public Complex evalTranscendental(TranscendentalState state) {
        return state.expression.evaluate(state.z);
    }

    @Benchmark
    public Complex evalTranscendentalNearInfinity(TranscendentalState state) {
        return state.expression.evaluateNearInfinity(state.z);
    }
}
