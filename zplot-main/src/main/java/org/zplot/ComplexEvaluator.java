package org.zplot;

import org.zplot.math.Complex;

/**
 * Host-side evaluation of a compiled expression. Implementations are pure: no side effects,
 * equal inputs give equal outputs, safe to call from any thread.
 */
@FunctionalInterface
public interface ComplexEvaluator {

    Complex evaluate(Complex z);

    ComplexEvaluator IDENTITY = z -> z;
}
