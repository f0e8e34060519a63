package com.linlay.calculatoragent.calculator.symbolic;

import org.apache.commons.math3.fraction.BigFraction;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An expression brought over a common denominator, both parts fully expanded.
 */
record RationalForm(Expression numerator, Expression denominator) {

    static RationalForm of(Expression expression) {
        Map<Atom, BigFraction> common = new LinkedHashMap<>();
        for (Monomial monomial : expression.termMap().keySet()) {
            for (Map.Entry<Atom, BigFraction> factor : monomial.exponents().entrySet()) {
                BigFraction exponent = factor.getValue();
                if (Rationals.signum(exponent) < 0) {
                    common.merge(factor.getKey(), exponent.negate(), (a, b) -> a.compareTo(b) >= 0 ? a : b);
                }
            }
        }
        if (common.isEmpty()) {
            return new RationalForm(Simplifier.expand(expression), Expression.ONE);
        }
        Expression denominator = Expression.ONE;
        for (Map.Entry<Atom, BigFraction> factor : common.entrySet()) {
            denominator = denominator.multiply(Expression.factor(factor.getKey(), factor.getValue()));
        }
        Expression numerator = expression.multiply(denominator);
        return new RationalForm(Simplifier.expand(numerator), Simplifier.expand(denominator));
    }

    boolean isPolynomial() {
        return denominator.equals(Expression.ONE);
    }
}
