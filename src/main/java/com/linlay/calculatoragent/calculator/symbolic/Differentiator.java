package com.linlay.calculatoragent.calculator.symbolic;

import org.apache.commons.math3.fraction.BigFraction;

import java.util.Map;

final class Differentiator {

    private Differentiator() {
    }

    static Expression derivative(Expression expression, Atom.Symbol symbol) {
        Expression result = Expression.ZERO;
        for (Map.Entry<Monomial, BigFraction> entry : expression.termMap().entrySet()) {
            if (!entry.getKey().contains(symbol)) {
                continue;
            }
            result = result.add(derivative(entry.getKey(), symbol).multiply(entry.getValue()));
        }
        return result;
    }

    /**
     * Product rule over the factors of a monomial.
     */
    private static Expression derivative(Monomial monomial, Atom.Symbol symbol) {
        Expression result = Expression.ZERO;
        for (Map.Entry<Atom, BigFraction> factor : monomial.exponents().entrySet()) {
            Atom atom = factor.getKey();
            if (!atom.contains(symbol)) {
                continue;
            }
            Expression others = Expression.fromTerm(new Term(BigFraction.ONE, monomial.without(atom)));
            result = result.add(others.multiply(powerDerivative(atom, factor.getValue(), symbol)));
        }
        return result;
    }

    private static Expression powerDerivative(Atom atom, BigFraction exponent, Atom.Symbol symbol) {
        Expression outer = Expression.factor(atom, exponent.subtract(BigFraction.ONE)).multiply(exponent);
        return outer.multiply(atomDerivative(atom, symbol));
    }

    private static Expression atomDerivative(Atom atom, Atom.Symbol symbol) {
        if (atom instanceof Atom.Symbol) {
            return Expression.ONE;
        }
        if (atom instanceof Atom.Group group) {
            return derivative(group.base(), symbol);
        }
        if (atom instanceof Atom.Function function) {
            Expression argument = function.argument();
            Expression inner = derivative(argument, symbol);
            Expression outer = switch (function.name()) {
                case "sin" -> Expression.function("cos", argument);
                case "cos" -> Expression.function("sin", argument).negate();
                case "tan" -> Expression.function("tan", argument).pow(new BigFraction(2)).add(Expression.ONE);
                case "exp" -> Expression.function("exp", argument);
                case "log" -> argument.pow(BigFraction.MINUS_ONE);
                default -> throw new UnsupportedSymbolicOperationException("cannot differentiate " + function.name());
            };
            return outer.multiply(inner);
        }
        if (atom instanceof Atom.Power power) {
            // d(b^e) = b^e * (e' * log(b) + e * b' / b)
            Expression base = power.base();
            Expression exponent = power.exponent();
            Expression logPart = derivative(exponent, symbol).multiply(Expression.function("log", base));
            Expression basePart = exponent.multiply(derivative(base, symbol)).divide(base);
            return Expression.atom(power).multiply(logPart.add(basePart));
        }
        return Expression.ZERO;
    }
}
