package org.zplot.codegen;

import java.math.BigDecimal;
import java.math.MathContext;

public final class ShaderLiterals {

    /** Lowest precision that still round-trips the literals users type. */
    public static final int MIN_PRECISION = 15;

    private ShaderLiterals() {}

    /**
     * Formats a finite real as a GLSL float literal rounded to {@code precision} significant digits,
     * e.g. {@code 2.0}, {@code 0.100000000000000}, {@code 1.00000000000000E+20}.
     */
    public static String real(double value, int precision) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("No GLSL literal for " + value);
        }
        String text = new BigDecimal(value).round(new MathContext(precision)).toString();
        if (text.indexOf('.') < 0 && text.indexOf('E') < 0) {
            text += ".0";
        }
        return text;
    }

    public static String vec2(String re, String im) {
        return "vec2(" + re + ", " + im + ")";
    }
}
