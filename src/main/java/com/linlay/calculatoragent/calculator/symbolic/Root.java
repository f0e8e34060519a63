package com.linlay.calculatoragent.calculator.symbolic;

import org.apache.commons.math3.complex.Complex;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * One solution of an equation: exact when it could be found symbolically, otherwise a numeric
 * approximation.
 */
public record Root(Expression exact, Complex approximate) {

    private static final MathContext DIGITS = new MathContext(10);
    private static final double IMAGINARY_TOLERANCE = 1e-9;

    static Root exact(Expression value) {
        return new Root(value, null);
    }

    static Root approximate(Complex value) {
        return new Root(null, value);
    }

    public boolean isExact() {
        return exact != null;
    }

    @Override
    public String toString() {
        if (exact != null) {
            return exact.toString();
        }
        String real = plain(approximate.getReal());
        if (Math.abs(approximate.getImaginary()) < IMAGINARY_TOLERANCE) {
            return real;
        }
        double imaginary = approximate.getImaginary();
        String sign = imaginary < 0 ? " - " : " + ";
        return real + sign + plain(Math.abs(imaginary)) + "*I";
    }

    private static String plain(double value) {
        if (Math.abs(value) < IMAGINARY_TOLERANCE) {
            return "0";
        }
        return new BigDecimal(value).round(DIGITS).stripTrailingZeros().toPlainString();
    }
}
