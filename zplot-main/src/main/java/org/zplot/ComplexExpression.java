package org.zplot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zplot.math.Complex;
import org.zplot.symbols.Symbols;

/**
 * The current plotted expression.
 * <p>
 * Holds one {@link CompiledExpression}, seeded from {@link CompilerSettings#defaultExpression()}.
 * {@link #compile(String)} either replaces it as a whole or throws and leaves it in place, so a
 * reader never sees shader source and an evaluator built from different sources, and a rejected
 * edit never leaves the plot without a function.
 * <p>
 * Reads are lock free; compilations are serialised.
 */
public final class ComplexExpression {

    private static final Logger log = LoggerFactory.getLogger(ComplexExpression.class);

    private final ExpressionCompiler compiler;
    private volatile CompiledExpression current;

    public ComplexExpression() {
        this(CompilerSettings.fromSystemProperties());
    }

    public ComplexExpression(CompilerSettings settings) {
        this.compiler = new ExpressionCompiler(settings);
        this.current = seed(settings.defaultExpression());
    }

    private CompiledExpression seed(String defaultExpression) {
        try {
            return compiler.compile(defaultExpression);
        } catch (ExpressionParseException e) {
            log.warn("Default expression '{}' is invalid, falling back to '{}': {}",
                    defaultExpression, Symbols.FREE_VARIABLE, e.getMessage());
            return compiler.compile(Symbols.FREE_VARIABLE);
        }
    }

    /**
     * Compiles {@code source} and makes it current.
     *
     * @return the new state
     * @throws ExpressionParseException if the source is rejected; the previous state stays current
     */
    public synchronized CompiledExpression compile(String source) {
        CompiledExpression next;
        try {
            next = compiler.compile(source);
        } catch (ExpressionParseException e) {
            log.debug("Rejected expression '{}', keeping '{}': {}", source, current.source(), e.getMessage());
            throw e;
        }
        current = next;
        log.debug("Compiled expression '{}'", source);
        return next;
    }

    public CompiledExpression current() {
        return current;
    }

    public String source() {
        return current.source();
    }

    public Complex evaluate(Complex z) {
        return current.evaluate(z);
    }

    public Complex evaluate(double re, double im) {
        return evaluate(Complex.of(re, im));
    }

    /**
     * Evaluates {@code f(1/w)}, the value plotted at {@code w} in the neighbourhood of infinity.
     */
    public Complex evaluateNearInfinity(Complex w) {
        return evaluate(w.inv());
    }

    public String shaderFunctionSource() {
        return current.shaderSource();
    }
}
