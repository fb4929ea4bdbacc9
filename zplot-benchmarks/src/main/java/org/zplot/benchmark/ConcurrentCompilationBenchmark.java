package org.zplot.benchmark;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.openjdk.jmh.annotations.*;
import org.zplot.CompilerSettings;
import org.zplot.ComplexExpression;
import org.zplot.math.Complex;

/**
 * One thread recompiles a shared {@link ComplexExpression} while the other evaluates it.
 * Gives a contention baseline for the edit-while-rendering pattern.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2, jvmArgsAppend = {
        "-Dorg.slf4j.simpleLogger.defaultLogLevel=warn"
})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Threads(2)
public class ConcurrentCompilationBenchmark {

    @State(Scope.Benchmark)
    public static class SharedState {

        final String[] expressions = {
                "z^2 + 1",
                "sin(z)/z"
        };

        ComplexExpression expression;

        @Setup(Level.Trial)
        public void init() {
            expression = new ComplexExpression(CompilerSettings.defaults());
        }
    }

    @State(Scope.Thread)
    public static class ThreadState {

        private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);
        int threadIndex;
        int edits;

        @Setup(Level.Trial)
        public void init() {
            threadIndex = THREAD_COUNTER.getAndIncrement() % 2;
        }
    }

    @Benchmark
    public Object compileWhileEvaluating(SharedState shared, ThreadState local) {
        if (local.threadIndex == 0) {
            return shared.expression.compile(shared.expressions[local.edits++ % shared.expressions.length]);
        }
        return shared.expression.evaluate(Complex.of(0.5, 0.25));
    }
}
