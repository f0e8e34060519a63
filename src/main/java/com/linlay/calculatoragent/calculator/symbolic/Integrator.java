package com.linlay.calculatoragent.calculator.symbolic;

import org.apache.commons.math3.fraction.BigFraction;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Indefinite integration by table lookup: power rule, elementary functions of a linear argument and
 * integration by parts for polynomial times sin/cos/exp. No constant of integration is added.
 */
final class Integrator {

    private static final int MAX_PARTS_DEPTH = 12;

    private Integrator() {
    }

    static Optional<Expression> integrate(Expression expression, Atom.Symbol symbol) {
        try {
            return Optional.of(integrateSum(Simplifier.expand(expression), symbol, 0));
        } catch (NotIntegrableException e) {
            return Optional.empty();
        }
    }

    private static Expression integrateSum(Expression expression, Atom.Symbol symbol, int depth) {
        Expression result = Expression.ZERO;
        for (Map.Entry<Monomial, BigFraction> entry : expression.termMap().entrySet()) {
            result = result.add(integrateTerm(entry.getKey(), symbol, depth).multiply(entry.getValue()));
        }
        return result;
    }

    private static Expression integrateTerm(Monomial monomial, Atom.Symbol symbol, int depth) {
        Expression constantPart = Expression.ONE;
        Monomial dependent = Monomial.ONE;
        for (Map.Entry<Atom, BigFraction> factor : monomial.exponents().entrySet()) {
            if (factor.getKey().contains(symbol)) {
                dependent = dependent.multiply(Monomial.of(factor.getKey(), factor.getValue()).monomial()).monomial();
            } else {
                constantPart = constantPart.multiply(Expression.factor(factor.getKey(), factor.getValue()));
            }
        }
        return constantPart.multiply(integrateDependent(dependent, symbol, depth));
    }

    private static Expression integrateDependent(Monomial dependent, Atom.Symbol symbol, int depth) {
        Expression variable = Expression.symbol(symbol);
        if (dependent.isOne()) {
            return variable;
        }
        BigFraction power = dependent.exponentOf(symbol);
        Monomial rest = dependent.without(symbol);

        if (rest.isOne()) {
            if (power.equals(BigFraction.MINUS_ONE)) {
                return Expression.function("log", variable);
            }
            BigFraction next = power.add(BigFraction.ONE);
            return variable.pow(next).multiply(next.reciprocal());
        }
        if (rest.exponents().size() != 1) {
            throw new NotIntegrableException();
        }
        Map.Entry<Atom, BigFraction> only = rest.exponents().entrySet().iterator().next();
        Atom atom = only.getKey();
        BigFraction exponent = only.getValue();

        if (Rationals.isZero(power)) {
            return integrateSingle(atom, exponent, symbol);
        }
        if (Rationals.isInteger(power) && Rationals.signum(power) > 0 && exponent.equals(BigFraction.ONE)
                && atom instanceof Atom.Function function && isPeriodicOrExp(function.name())
                && depth < MAX_PARTS_DEPTH) {
            // x^n f(u) = x^n F(u) - n * integral(x^(n-1) F(u))
            Expression antiderivative = integrateSingle(atom, exponent, symbol);
            Expression polynomial = variable.pow(power);
            Expression reduced = antiderivative.multiply(variable.pow(power.subtract(BigFraction.ONE))).multiply(power);
            return polynomial.multiply(antiderivative).subtract(integrateSum(reduced, symbol, depth + 1));
        }
        throw new NotIntegrableException();
    }

    private static boolean isPeriodicOrExp(String name) {
        return name.equals("sin") || name.equals("cos") || name.equals("exp");
    }

    private static Expression integrateSingle(Atom atom, BigFraction exponent, Atom.Symbol symbol) {
        if (atom instanceof Atom.Group group) {
            Expression slope = linearSlope(group.base(), symbol);
            if (exponent.equals(BigFraction.MINUS_ONE)) {
                return Expression.function("log", group.base()).divide(slope);
            }
            BigFraction next = exponent.add(BigFraction.ONE);
            return group.base().pow(next).multiply(next.reciprocal()).divide(slope);
        }
        if (atom instanceof Atom.Function function && exponent.equals(BigFraction.ONE)) {
            Expression argument = function.argument();
            Expression slope = linearSlope(argument, symbol);
            Expression antiderivative = switch (function.name()) {
                case "sin" -> Expression.function("cos", argument).negate();
                case "cos" -> Expression.function("sin", argument);
                case "exp" -> Expression.function("exp", argument);
                case "tan" -> Expression.function("log", Expression.function("cos", argument)).negate();
                case "log" -> argument.multiply(Expression.function("log", argument)).subtract(argument);
                default -> throw new NotIntegrableException();
            };
            return antiderivative.divide(slope);
        }
        if (atom instanceof Atom.Power power && exponent.equals(BigFraction.ONE) && !power.base().contains(symbol)) {
            Expression slope = linearSlope(power.exponent(), symbol);
            return Expression.atom(power).divide(slope.multiply(Expression.function("log", power.base())));
        }
        throw new NotIntegrableException();
    }

    /**
     * The coefficient a of {@code a*x + b}; anything that is not linear in the symbol fails.
     */
    private static Expression linearSlope(Expression argument, Atom.Symbol symbol) {
        TreeMap<Integer, Expression> coefficients = UnivariatePolynomial.coefficientsIn(argument, symbol);
        if (coefficients == null || coefficients.isEmpty() || coefficients.lastKey() != 1) {
            throw new NotIntegrableException();
        }
        return coefficients.get(1);
    }

    private static final class NotIntegrableException extends RuntimeException {
        NotIntegrableException() {
            super(null, null, false, false);
        }
    }
}
