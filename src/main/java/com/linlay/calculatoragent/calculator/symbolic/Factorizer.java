package com.linlay.calculatoragent.calculator.symbolic;

import org.apache.commons.math3.fraction.BigFraction;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Factors over the rationals: numeric content, common monomial factors and linear factors with
 * rational roots. What remains is kept as one parenthesized factor.
 */
final class Factorizer {

    private Factorizer() {
    }

    static Expression factor(Expression expression) {
        RationalForm form = RationalForm.of(expression);
        Expression numerator = factorPolynomial(form.numerator());
        if (form.isPolynomial()) {
            return numerator;
        }
        return numerator.multiply(factorPolynomial(form.denominator()).pow(BigFraction.MINUS_ONE));
    }

    private static Expression factorPolynomial(Expression polynomial) {
        if (polynomial.termCount() <= 1) {
            return polynomial;
        }
        List<Term> terms = polynomial.terms();
        BigInteger numerators = BigInteger.ZERO;
        BigInteger denominators = BigInteger.ONE;
        for (Term term : terms) {
            numerators = numerators.gcd(term.coefficient().getNumerator());
            denominators = Rationals.lcm(denominators, term.coefficient().getDenominator());
        }
        BigFraction content = new BigFraction(numerators, denominators);
        if (Rationals.signum(terms.get(0).coefficient()) < 0) {
            content = content.negate();
        }

        Map<Atom, BigFraction> common = new LinkedHashMap<>();
        terms.get(0).monomial().exponents().forEach((atom, exponent) -> {
            if (Rationals.signum(exponent) > 0) {
                common.put(atom, exponent);
            }
        });
        for (Term term : terms) {
            common.replaceAll((atom, exponent) -> {
                BigFraction other = term.monomial().exponentOf(atom);
                return other.compareTo(exponent) < 0 ? other : exponent;
            });
            common.values().removeIf(exponent -> Rationals.signum(exponent) <= 0);
        }

        Expression outside = Expression.constant(content);
        Expression commonFactor = Expression.ONE;
        for (Map.Entry<Atom, BigFraction> entry : common.entrySet()) {
            commonFactor = commonFactor.multiply(Expression.factor(entry.getKey(), entry.getValue()));
        }
        outside = outside.multiply(commonFactor);
        Expression rest = polynomial.divide(outside);

        Set<Atom.Symbol> symbols = rest.freeSymbols();
        if (symbols.size() == 1) {
            Atom.Symbol symbol = symbols.iterator().next();
            UnivariatePolynomial univariate = UnivariatePolynomial.from(rest, symbol);
            if (univariate != null) {
                return outside.multiply(factorUnivariate(univariate, symbol));
            }
        }
        return outside.multiply(group(rest));
    }

    private static Expression factorUnivariate(UnivariatePolynomial polynomial, Atom.Symbol symbol) {
        Expression result = Expression.ONE;
        UnivariatePolynomial remaining = polynomial;
        for (BigFraction root : polynomial.rationalRoots()) {
            UnivariatePolynomial linear = UnivariatePolynomial.of(
                    new BigFraction(root.getNumerator().negate()), new BigFraction(root.getDenominator()));
            while (remaining.degree() > 0 && Rationals.isZero(remaining.evaluate(root))) {
                remaining = remaining.divide(linear)[0];
                result = result.multiply(group(linear.toExpression(symbol)));
            }
        }
        if (remaining.degree() <= 0) {
            return result.multiply(Expression.constant(remaining.coefficient(0)));
        }
        return result.multiply(group(remaining.toExpression(symbol)));
    }

    private static Expression group(Expression expression) {
        if (expression.termCount() <= 1) {
            return expression;
        }
        return Expression.factor(new Atom.Group(expression), BigFraction.ONE);
    }
}
