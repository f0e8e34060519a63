package com.linlay.calculatoragent.calculator.symbolic;

import org.apache.commons.math3.fraction.BigFraction;

import java.util.Map;

/**
 * Limits by direct substitution, cancellation of common factors and L'Hopital's rule. Poles are
 * approached from the right.
 */
final class LimitEvaluator {

    private static final int MAX_LHOPITAL_STEPS = 8;
    private static final double SIDE_STEP = 1e-7;

    private LimitEvaluator() {
    }

    static LimitResult limit(Expression expression, Atom.Symbol symbol, LimitPoint point) {
        if (!expression.contains(symbol)) {
            return LimitResult.finite(expression);
        }
        if (point.infinitySign() < 0) {
            Expression mirrored = expression.substitute(symbol, Expression.symbol(symbol).negate());
            return limitAtInfinity(mirrored, symbol);
        }
        if (point.infinite()) {
            return limitAtInfinity(expression, symbol);
        }
        return limitAt(expression, symbol, point.value());
    }

    private static LimitResult limitAt(Expression expression, Atom.Symbol symbol, Expression at) {
        Expression direct = substitute(expression, symbol, at);
        if (direct != null) {
            return LimitResult.finite(Simplifier.simplify(direct));
        }
        Expression cancelled = substitute(Simplifier.simplify(expression), symbol, at);
        if (cancelled != null) {
            return LimitResult.finite(Simplifier.simplify(cancelled));
        }
        RationalForm form = RationalForm.of(expression);
        Expression numerator = form.numerator();
        Expression denominator = form.denominator();
        for (int step = 0; step < MAX_LHOPITAL_STEPS; step++) {
            Expression top = substitute(numerator, symbol, at);
            Expression bottom = substitute(denominator, symbol, at);
            if (top == null || bottom == null) {
                break;
            }
            if (!bottom.isZero()) {
                return LimitResult.finite(Simplifier.simplify(top.divide(bottom)));
            }
            if (!top.isZero()) {
                return LimitResult.infinity(rightHandSign(expression, symbol, at));
            }
            numerator = Differentiator.derivative(numerator, symbol);
            denominator = Differentiator.derivative(denominator, symbol);
        }
        throw new UnsupportedSymbolicOperationException("cannot determine the limit of " + expression);
    }

    private static LimitResult limitAtInfinity(Expression expression, Atom.Symbol symbol) {
        RationalForm form = RationalForm.of(expression);
        UnivariatePolynomial numerator = UnivariatePolynomial.from(form.numerator(), symbol);
        UnivariatePolynomial denominator = UnivariatePolynomial.from(form.denominator(), symbol);
        if (numerator != null && denominator != null) {
            if (numerator.isZero() || numerator.degree() < denominator.degree()) {
                return LimitResult.finite(Expression.ZERO);
            }
            BigFraction ratio = numerator.leading().divide(denominator.leading());
            if (numerator.degree() == denominator.degree()) {
                return LimitResult.finite(Expression.constant(ratio));
            }
            return LimitResult.infinity(Rationals.signum(ratio));
        }
        Expression reciprocal = Expression.symbol(symbol).pow(BigFraction.MINUS_ONE);
        return limitAt(expression.substitute(symbol, reciprocal), symbol, Expression.ZERO);
    }

    private static Expression substitute(Expression expression, Atom.Symbol symbol, Expression at) {
        try {
            return expression.substitute(symbol, at);
        } catch (UndefinedExpressionException e) {
            return null;
        }
    }

    private static int rightHandSign(Expression expression, Atom.Symbol symbol, Expression at) {
        double point = at.evaluate(Map.of());
        double near = expression.evaluate(Map.of(symbol.name(), point + SIDE_STEP * Math.max(1.0, Math.abs(point))));
        if (Double.isNaN(near) || near == 0) {
            throw new UnsupportedSymbolicOperationException("cannot determine the limit of " + expression);
        }
        return near > 0 ? 1 : -1;
    }
}
