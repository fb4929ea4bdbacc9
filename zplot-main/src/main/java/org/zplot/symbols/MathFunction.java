package org.zplot.symbols;

import org.zplot.math.Complex;

/**
 * Named functions callable from an expression, e.g. {@code sin(z)} or {@code pow(z, 3)}.
 */
public enum MathFunction {

    SIN("sin", 1, "c_sin", args -> args[0].sin()),
    COS("cos", 1, "c_cos", args -> args[0].cos()),
    SINH("sinh", 1, "c_sinh", args -> args[0].sinh()),
    COSH("cosh", 1, "c_cosh", args -> args[0].cosh()),
    EXP("exp", 1, "c_exp", args -> args[0].exp()),
    LOG("log", 1, "c_log", args -> args[0].log()),
    SQRT("sqrt", 1, "c_sqrt", args -> args[0].sqrt()),
    POW("pow", 2, "c_pow", args -> args[0].pow(args[1]));

    @FunctionalInterface
    public interface Routine {
        Complex apply(Complex[] args);
    }

    private final String functionName;
    private final int arity;
    private final String shaderRoutine;
    private final Routine routine;

    MathFunction(String functionName, int arity, String shaderRoutine, Routine routine) {
        this.functionName = functionName;
        this.arity = arity;
        this.shaderRoutine = shaderRoutine;
        this.routine = routine;
    }

    public String functionName() {
        return functionName;
    }

    public int arity() {
        return arity;
    }

    public String shaderRoutine() {
        return shaderRoutine;
    }

    /**
     * @param args exactly {@link #arity()} values
     */
    public Complex apply(Complex[] args) {
        if (args.length != arity) {
            throw new IllegalArgumentException(functionName + " expects " + arity + " argument(s), got " + args.length);
        }
        return routine.apply(args);
    }
}
