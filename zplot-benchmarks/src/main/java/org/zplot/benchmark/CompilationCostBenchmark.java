package org.zplot.benchmark;

import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.*;
import org.zplot.CompiledExpression;
import org.zplot.CompilerSettings;
import org.zplot.ExpressionCompiler;

/**
 * Measures a full compile: tokenize, parse and both code generators. This is what every
 * keystroke in the expression field costs.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2, jvmArgsAppend = {
        "-Dorg.slf4j.simpleLogger.defaultLogLevel=warn"
})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class CompilationCostBenchmark {

    @State(Scope.Thread)
    public static class CompilerState {

        ExpressionCompiler compiler;

        @Param({"false", "true"})
        boolean strictArity;

        @Setup(Level.Trial)
        public void init() {
            compiler = new ExpressionCompiler(CompilerSettings.builder().strictArity(strictArity).build());
        }
    }

    @Benchmark
    public CompiledExpression compileIdentity(CompilerState state) {
        return state.compiler.compile("z");
    }

    @Benchmark
    public CompiledExpression compileRational(CompilerState state) {
        return state.compiler.compile("(z^2 - 1)*(z - 2 - i)^2/(z^2 + 2 + 2*i)");
    }

    @Benchmark
    public CompiledExpression compileNestedCalls(CompilerState state) {
        return state.compiler.compile("sin(exp(1/z)) + pow(cosh(z), -2) - log(sqrt(z*pi))");
    }
}
