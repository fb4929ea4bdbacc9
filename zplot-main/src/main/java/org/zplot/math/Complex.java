package org.zplot.math;

/**
 * Immutable complex number. Every operation returns a new value.
 * <p>
 * Nothing here throws for singular inputs: division by zero and inversion of zero yield
 * {@link #INFINITY}, and {@code 0^p} is zero for every exponent. The same formulas are
 * implemented by the companion GLSL library ({@code complex.glsl}), so a value evaluated
 * on the host agrees with the rendered pixel up to floating point rounding.
 */
public record Complex(double re, double im) {

    public static final Complex ZERO = new Complex(0, 0);
    public static final Complex ONE = new Complex(1, 0);
    public static final Complex MINUS_ONE = new Complex(-1, 0);
    public static final Complex I = new Complex(0, 1);
    public static final Complex HALF = new Complex(0.5, 0);

    /** Sentinel for singular results, both components positive infinity. */
    public static final Complex INFINITY = new Complex(Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY);

    public static Complex of(double re, double im) {
        return new Complex(re, im);
    }

    public static Complex real(double re) {
        return new Complex(re, 0);
    }

    public Complex add(Complex other) {
        return new Complex(re + other.re, im + other.im);
    }

    public Complex sub(Complex other) {
        return new Complex(re - other.re, im - other.im);
    }

    public Complex mul(Complex other) {
        return new Complex(re * other.re - im * other.im, re * other.im + im * other.re);
    }

    public Complex inv() {
        double d = mag2();
        if (d == 0) {
            return INFINITY;
        }
        return new Complex(re / d, -im / d);
    }

    public Complex div(Complex other) {
        return mul(other.inv());
    }

    /**
     * Principal value of {@code this^p} via the polar form. A zero base returns zero
     * without looking at the exponent.
     */
    public Complex pow(Complex p) {
        if (re == 0 && im == 0) {
            return ZERO;
        }
        double r = mag();
        double theta = arg();
        double logR = Math.log(r);

        double newMag = Math.pow(r, p.re) * Math.exp(-p.im * theta);
        double newAngle = p.re * theta + p.im * logR;
        return new Complex(newMag * Math.cos(newAngle), newMag * Math.sin(newAngle));
    }

    public Complex exp() {
        double eRe = Math.exp(re);
        return new Complex(eRe * Math.cos(im), eRe * Math.sin(im));
    }

    /** Principal branch: imaginary part in (-pi, pi]. */
    public Complex log() {
        return new Complex(Math.log(mag()), arg());
    }

    public Complex sqrt() {
        return pow(HALF);
    }

    public Complex sin() {
        return new Complex(Math.sin(re) * Math.cosh(im), Math.cos(re) * Math.sinh(im));
    }

    public Complex cos() {
        return new Complex(Math.cos(re) * Math.cosh(im), -Math.sin(re) * Math.sinh(im));
    }

    public Complex sinh() {
        return new Complex(Math.sinh(re) * Math.cos(im), Math.cosh(re) * Math.sin(im));
    }

    public Complex cosh() {
        return new Complex(Math.cosh(re) * Math.cos(im), Math.sinh(re) * Math.sin(im));
    }

    /**
     * Negation as multiplication by {@code (-1, 0)}, matching what the shader backend emits.
     * Differs from {@code (-re, -im)} only for non-finite components.
     */
    public Complex negate() {
        return MINUS_ONE.mul(this);
    }

    public double mag() {
        return Math.sqrt(mag2());
    }

    public double mag2() {
        return re * re + im * im;
    }

    public double arg() {
        return Math.atan2(im, re);
    }

    public boolean isFinite() {
        return Double.isFinite(re) && Double.isFinite(im);
    }

    @Override
    public String toString() {
        return "(" + re + ", " + im + ")";
    }
}
