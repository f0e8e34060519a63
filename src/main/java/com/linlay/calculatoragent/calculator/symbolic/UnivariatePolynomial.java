package com.linlay.calculatoragent.calculator.symbolic;

import org.apache.commons.math3.fraction.BigFraction;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Polynomial in one symbol with rational coefficients; index i holds the coefficient of x^i.
 */
final class UnivariatePolynomial {

    private final List<BigFraction> coefficients;

    UnivariatePolynomial(List<BigFraction> coefficients) {
        List<BigFraction> trimmed = new ArrayList<>(coefficients);
        while (!trimmed.isEmpty() && Rationals.isZero(trimmed.get(trimmed.size() - 1))) {
            trimmed.remove(trimmed.size() - 1);
        }
        this.coefficients = Collections.unmodifiableList(trimmed);
    }

    /**
     * Coefficients of {@code expression} by power of {@code symbol}, or {@code null} when some term
     * has a non-integer or negative power of the symbol or hides it inside another atom.
     */
    static TreeMap<Integer, Expression> coefficientsIn(Expression expression, Atom.Symbol symbol) {
        TreeMap<Integer, Expression> byPower = new TreeMap<>();
        for (Map.Entry<Monomial, BigFraction> entry : expression.termMap().entrySet()) {
            Monomial monomial = entry.getKey();
            BigFraction exponent = monomial.exponentOf(symbol);
            if (!Rationals.isInteger(exponent) || Rationals.signum(exponent) < 0
                    || exponent.getNumerator().bitLength() > 31) {
                return null;
            }
            Monomial rest = monomial.without(symbol);
            if (rest.contains(symbol)) {
                return null;
            }
            Expression coefficient = Expression.fromTerm(new Term(entry.getValue(), rest));
            byPower.merge(exponent.getNumerator().intValue(), coefficient, Expression::add);
        }
        byPower.values().removeIf(Expression::isZero);
        return byPower;
    }

    /**
     * The polynomial form of {@code expression}, or {@code null} when it is not a polynomial in
     * {@code symbol} with rational coefficients.
     */
    static UnivariatePolynomial from(Expression expression, Atom.Symbol symbol) {
        TreeMap<Integer, Expression> byPower = coefficientsIn(expression, symbol);
        if (byPower == null) {
            return null;
        }
        int degree = byPower.isEmpty() ? -1 : byPower.lastKey();
        List<BigFraction> values = new ArrayList<>(Collections.nCopies(degree + 1, BigFraction.ZERO));
        for (Map.Entry<Integer, Expression> entry : byPower.entrySet()) {
            BigFraction value = entry.getValue().constantValue();
            if (value == null) {
                return null;
            }
            values.set(entry.getKey(), value);
        }
        return new UnivariatePolynomial(values);
    }

    static UnivariatePolynomial of(BigFraction... ascending) {
        return new UnivariatePolynomial(List.of(ascending));
    }

    int degree() {
        return coefficients.size() - 1;
    }

    boolean isZero() {
        return coefficients.isEmpty();
    }

    BigFraction coefficient(int power) {
        return power < coefficients.size() ? coefficients.get(power) : BigFraction.ZERO;
    }

    BigFraction leading() {
        return isZero() ? BigFraction.ZERO : coefficients.get(coefficients.size() - 1);
    }

    List<BigFraction> coefficients() {
        return coefficients;
    }

    UnivariatePolynomial scale(BigFraction factor) {
        List<BigFraction> scaled = new ArrayList<>();
        for (BigFraction c : coefficients) {
            scaled.add(c.multiply(factor));
        }
        return new UnivariatePolynomial(scaled);
    }

    UnivariatePolynomial subtract(UnivariatePolynomial other) {
        int size = Math.max(coefficients.size(), other.coefficients.size());
        List<BigFraction> result = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            result.add(coefficient(i).subtract(other.coefficient(i)));
        }
        return new UnivariatePolynomial(result);
    }

    UnivariatePolynomial multiply(UnivariatePolynomial other) {
        if (isZero() || other.isZero()) {
            return new UnivariatePolynomial(List.of());
        }
        List<BigFraction> result = new ArrayList<>(Collections.nCopies(degree() + other.degree() + 1, BigFraction.ZERO));
        for (int i = 0; i < coefficients.size(); i++) {
            for (int j = 0; j < other.coefficients.size(); j++) {
                result.set(i + j, result.get(i + j).add(coefficients.get(i).multiply(other.coefficients.get(j))));
            }
        }
        return new UnivariatePolynomial(result);
    }

    /**
     * Quotient and remainder of polynomial long division.
     */
    UnivariatePolynomial[] divide(UnivariatePolynomial divisor) {
        if (divisor.isZero()) {
            throw new UndefinedExpressionException("division by zero polynomial");
        }
        List<BigFraction> remainder = new ArrayList<>(coefficients);
        int quotientSize = Math.max(0, degree() - divisor.degree() + 1);
        List<BigFraction> quotient = new ArrayList<>(Collections.nCopies(quotientSize, BigFraction.ZERO));
        for (int shift = degree() - divisor.degree(); shift >= 0; shift--) {
            BigFraction factor = remainder.get(shift + divisor.degree()).divide(divisor.leading());
            quotient.set(shift, factor);
            for (int i = 0; i <= divisor.degree(); i++) {
                remainder.set(shift + i, remainder.get(shift + i).subtract(divisor.coefficient(i).multiply(factor)));
            }
        }
        return new UnivariatePolynomial[]{new UnivariatePolynomial(quotient), new UnivariatePolynomial(remainder)};
    }

    UnivariatePolynomial monic() {
        return isZero() ? this : scale(leading().reciprocal());
    }

    UnivariatePolynomial gcd(UnivariatePolynomial other) {
        UnivariatePolynomial a = this;
        UnivariatePolynomial b = other;
        while (!b.isZero()) {
            UnivariatePolynomial r = a.divide(b)[1];
            a = b;
            b = r;
        }
        return a.monic();
    }

    BigFraction evaluate(BigFraction at) {
        BigFraction result = BigFraction.ZERO;
        for (int i = coefficients.size() - 1; i >= 0; i--) {
            result = result.multiply(at).add(coefficients.get(i));
        }
        return result;
    }

    /**
     * Scales to integer coefficients with gcd 1 and a positive leading coefficient. Returns the
     * factor this polynomial was multiplied by.
     */
    BigFraction primitiveScale() {
        BigInteger denominators = BigInteger.ONE;
        for (BigFraction c : coefficients) {
            denominators = Rationals.lcm(denominators, c.getDenominator());
        }
        BigInteger content = BigInteger.ZERO;
        for (BigFraction c : coefficients) {
            content = content.gcd(c.multiply(denominators).getNumerator());
        }
        if (content.signum() == 0) {
            return BigFraction.ONE;
        }
        BigFraction scale = new BigFraction(denominators, content);
        return Rationals.signum(leading()) < 0 ? scale.negate() : scale;
    }

    /**
     * Distinct rational roots, found by testing p/q for p dividing the constant term and q dividing
     * the leading coefficient of the primitive form.
     */
    List<BigFraction> rationalRoots() {
        List<BigFraction> roots = new ArrayList<>();
        if (degree() < 1) {
            return roots;
        }
        UnivariatePolynomial primitive = scale(primitiveScale());
        int low = 0;
        while (Rationals.isZero(primitive.coefficient(low))) {
            low++;
        }
        if (low > 0) {
            roots.add(BigFraction.ZERO);
        }
        List<BigInteger> ps = Rationals.divisors(primitive.coefficient(low).getNumerator());
        List<BigInteger> qs = Rationals.divisors(primitive.leading().getNumerator());
        for (BigInteger p : ps) {
            for (BigInteger q : qs) {
                for (BigFraction candidate : new BigFraction[]{new BigFraction(p, q), new BigFraction(p.negate(), q)}) {
                    if (!roots.contains(candidate) && Rationals.isZero(primitive.evaluate(candidate))) {
                        roots.add(candidate);
                    }
                }
            }
        }
        roots.sort(BigFraction::compareTo);
        return roots;
    }

    UnivariatePolynomial derivative() {
        List<BigFraction> result = new ArrayList<>();
        for (int i = 1; i < coefficients.size(); i++) {
            result.add(coefficients.get(i).multiply(i));
        }
        return new UnivariatePolynomial(result);
    }

    Expression toExpression(Atom.Symbol symbol) {
        Expression result = Expression.ZERO;
        Expression variable = Expression.symbol(symbol);
        for (int i = 0; i < coefficients.size(); i++) {
            if (!Rationals.isZero(coefficients.get(i))) {
                result = result.add(variable.pow(new BigFraction(i)).multiply(coefficients.get(i)));
            }
        }
        return result;
    }

    double[] toDoubles() {
        double[] values = new double[coefficients.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = coefficients.get(i).doubleValue();
        }
        return values;
    }
}
