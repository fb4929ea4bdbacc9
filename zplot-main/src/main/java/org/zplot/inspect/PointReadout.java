package org.zplot.inspect;

import java.util.Locale;
import java.util.Optional;

import org.zplot.ComplexExpression;
import org.zplot.math.Complex;

/**
 * What the info panel shows for the point under the cursor.
 *
 * @param z     the point of the plane, already mapped back from the infinity neighbourhood if needed
 * @param value {@code f(z)}
 */
public record PointReadout(Complex z, Complex value) {

    /** Squared radius of the disc drawn in the infinity neighbourhood plot. */
    public static final double INFINITY_DISC_RADIUS2 = 1.0 / 64;

    private static final int DIGITS = 4;

    public static PointReadout at(ComplexExpression expression, Complex z) {
        return new PointReadout(z, expression.evaluate(z));
    }

    /**
     * Readout for {@code w} in the infinity neighbourhood plot, where {@code w} stands for {@code 1/w}.
     * Empty outside the plotted disc.
     */
    public static Optional<PointReadout> nearInfinity(ComplexExpression expression, Complex w) {
        if (w.mag2() > INFINITY_DISC_RADIUS2) {
            return Optional.empty();
        }
        return Optional.of(new PointReadout(w.inv(), expression.evaluateNearInfinity(w)));
    }

    public String formattedPoint() {
        return format(z);
    }

    public String formattedValue() {
        return format(value);
    }

    public String formattedMagnitude() {
        return String.format(Locale.ROOT, "%." + DIGITS + "e", value.mag());
    }

    public String formattedArgument() {
        return String.format(Locale.ROOT, "%." + DIGITS + "f π rad", value.arg() / Math.PI);
    }

    static String format(Complex c) {
        char sign = c.im() < 0 ? '-' : '+';
        return String.format(Locale.ROOT, "%." + DIGITS + "f %c %." + DIGITS + "fi", c.re(), sign, Math.abs(c.im()));
    }
}
