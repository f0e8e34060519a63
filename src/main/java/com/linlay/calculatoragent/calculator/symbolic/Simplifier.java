package com.linlay.calculatoragent.calculator.symbolic;

import org.apache.commons.math3.fraction.BigFraction;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

final class Simplifier {

    private Simplifier() {
    }

    /**
     * Distributes every product and integer power of a sum.
     */
    static Expression expand(Expression expression) {
        Expression result = Expression.ZERO;
        for (Map.Entry<Monomial, BigFraction> entry : expression.termMap().entrySet()) {
            Expression term = Expression.constant(entry.getValue());
            for (Map.Entry<Atom, BigFraction> factor : entry.getKey().exponents().entrySet()) {
                term = term.multiply(expandFactor(factor.getKey(), factor.getValue()));
            }
            result = result.add(term);
        }
        return result;
    }

    private static Expression expandFactor(Atom atom, BigFraction exponent) {
        if (atom instanceof Atom.Group group) {
            return expand(group.base()).pow(exponent);
        }
        if (atom instanceof Atom.Function function) {
            return Expression.function(function.name(), expand(function.argument())).pow(exponent);
        }
        if (atom instanceof Atom.Power power) {
            return expand(power.base()).pow(expand(power.exponent())).pow(exponent);
        }
        return Expression.factor(atom, exponent);
    }

    /**
     * Canonical form with common polynomial factors of numerator and denominator cancelled.
     */
    static Expression simplify(Expression expression) {
        RationalForm form = RationalForm.of(expression);
        if (form.isPolynomial()) {
            return form.numerator();
        }
        Set<Atom.Symbol> symbols = new LinkedHashSet<>(form.numerator().freeSymbols());
        symbols.addAll(form.denominator().freeSymbols());
        if (symbols.size() != 1) {
            return expression;
        }
        Atom.Symbol symbol = symbols.iterator().next();
        UnivariatePolynomial numerator = UnivariatePolynomial.from(form.numerator(), symbol);
        UnivariatePolynomial denominator = UnivariatePolynomial.from(form.denominator(), symbol);
        if (numerator == null || denominator == null) {
            return expression;
        }
        UnivariatePolynomial gcd = numerator.gcd(denominator);
        numerator = numerator.divide(gcd)[0];
        denominator = denominator.divide(gcd)[0];
        numerator = numerator.scale(denominator.leading().reciprocal());
        denominator = denominator.monic();
        if (denominator.degree() == 0) {
            return numerator.toExpression(symbol);
        }
        return asQuotient(numerator.toExpression(symbol), denominator.toExpression(symbol));
    }

    /**
     * {@code numerator / denominator} with a multi-term numerator kept in parentheses.
     */
    static Expression asQuotient(Expression numerator, Expression denominator) {
        Expression top = numerator.termCount() > 1
                ? Expression.factor(new Atom.Group(numerator), BigFraction.ONE)
                : numerator;
        return top.multiply(denominator.pow(BigFraction.MINUS_ONE));
    }
}
