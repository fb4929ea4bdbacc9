package org.zplot.symbols;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only lookup of the names an expression may use. Built once, shared by every compilation.
 */
public final class Symbols {

    /** The only free variable an expression may reference. */
    public static final String FREE_VARIABLE = "z";

    /** Name of the generated shader function, agreed with the fragment shader template. */
    public static final String SHADER_FUNCTION = "F_Z";

    private static final Map<Character, Operator> OPERATORS = Arrays.stream(Operator.values())
            .collect(Collectors.toUnmodifiableMap(Operator::symbol, Function.identity()));

    private static final Map<String, MathFunction> FUNCTIONS = Arrays.stream(MathFunction.values())
            .collect(Collectors.toUnmodifiableMap(MathFunction::functionName, Function.identity()));

    private static final Map<String, NamedConstant> CONSTANTS = Arrays.stream(NamedConstant.values())
            .collect(Collectors.toUnmodifiableMap(NamedConstant::constantName, Function.identity()));

    private Symbols() {}

    public static Operator getOperator(String operatorText) {
        Operator operator = operatorText.length() == 1 ? OPERATORS.get(operatorText.charAt(0)) : null;
        if (operator == null) {
            throw new IllegalArgumentException("Unknown binary operator: " + operatorText);
        }
        return operator;
    }

    public static boolean isOperator(char c) {
        return OPERATORS.containsKey(c);
    }

    public static Optional<MathFunction> findFunction(String name) {
        return Optional.ofNullable(FUNCTIONS.get(name));
    }

    public static Optional<NamedConstant> findConstant(String name) {
        return Optional.ofNullable(CONSTANTS.get(name));
    }

    public static boolean isFreeVariable(String name) {
        return FREE_VARIABLE.equals(name);
    }
}
