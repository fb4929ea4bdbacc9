package org.zplot.symbols;

import org.zplot.math.Complex;

public enum NamedConstant {

    PI("pi", Complex.real(Math.PI), "vec2(" + Math.PI + ", 0.0)"),
    E("e", Complex.real(Math.E), "vec2(" + Math.E + ", 0.0)"),
    I("i", Complex.I, "vec2(0.0, 1.0)");

    private final String constantName;
    private final Complex value;
    private final String shaderLiteral;

    NamedConstant(String constantName, Complex value, String shaderLiteral) {
        this.constantName = constantName;
        this.value = value;
        this.shaderLiteral = shaderLiteral;
    }

    public String constantName() {
        return constantName;
    }

    public Complex value() {
        return value;
    }

    public String shaderLiteral() {
        return shaderLiteral;
    }
}
