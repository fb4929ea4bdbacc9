package org.zplot;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;

/**
 * Generators of well-formed source strings over the whole grammar.
 */
public final class ExpressionArbitraries {

    private ExpressionArbitraries() {}

    public static Arbitrary<String> expressions() {
        return expression(3);
    }

    /**
     * Valid expressions made invalid by a lexical or syntactic defect.
     */
    public static Arbitrary<String> invalidExpressions() {
        return Combinators.combine(expressions(), Arbitraries.integers().between(0, 4))
                .as((expression, defect) -> {
                    switch (defect) {
                        case 0: return expression + "+";
                        case 1: return "(" + expression;
                        case 2: return expression + " $";
                        case 3: return expression + " w";
                        default: return expression + ")";
                    }
                });
    }

    private static Arbitrary<String> expression(int depth) {
        Arbitrary<String> leaves = Arbitraries.of("z", "z", "i", "pi", "e", "2", "0.5", "1.5", "3.25");
        if (depth == 0) {
            return leaves;
        }
        Arbitrary<String> sub = expression(depth - 1);
        Arbitrary<String> binary = Combinators.combine(sub, Arbitraries.of("+", "-", "*", "/", "^"), sub)
                .as((left, op, right) -> "(" + left + op + right + ")");
        Arbitrary<String> negated = sub.map(operand -> "-" + operand);
        Arbitrary<String> unaryCall = Combinators.combine(
                        Arbitraries.of("sin", "cos", "sinh", "cosh", "exp", "log", "sqrt"), sub)
                .as((name, arg) -> name + "(" + arg + ")");
        Arbitrary<String> pow = Combinators.combine(sub, sub).as((base, exponent) -> "pow(" + base + ", " + exponent + ")");
        return Arbitraries.oneOf(leaves, binary, negated, unaryCall, pow);
    }
}
