package org.zplot.symbols;

import java.util.function.BinaryOperator;

import org.zplot.math.Complex;

/**
 * Binary operators. Higher precedence binds tighter.
 */
public enum Operator {

    ADD('+', 2, Associativity.LEFT, "c_add", Complex::add),
    SUBTRACT('-', 2, Associativity.LEFT, "c_sub", Complex::sub),
    MULTIPLY('*', 3, Associativity.LEFT, "c_mul", Complex::mul),
    DIVIDE('/', 3, Associativity.LEFT, "c_div", Complex::div),
    POWER('^', 4, Associativity.RIGHT, "c_pow", Complex::pow);

    private final char symbol;
    private final int precedence;
    private final Associativity associativity;
    private final String shaderRoutine;
    private final BinaryOperator<Complex> routine;

    Operator(char symbol, int precedence, Associativity associativity, String shaderRoutine,
             BinaryOperator<Complex> routine) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.associativity = associativity;
        this.shaderRoutine = shaderRoutine;
        this.routine = routine;
    }

    public char symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public Associativity associativity() {
        return associativity;
    }

    public String shaderRoutine() {
        return shaderRoutine;
    }

    public Complex apply(Complex left, Complex right) {
        return routine.apply(left, right);
    }

    /**
     * Whether an operator already on the stack has to be reduced before this one is pushed.
     */
    public boolean yieldsTo(Operator top) {
        if (associativity == Associativity.LEFT) {
            return precedence <= top.precedence;
        }
        return precedence < top.precedence;
    }
}
