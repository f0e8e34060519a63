package com.linlay.calculatoragent.calculator.symbolic;

import org.apache.commons.math3.fraction.BigFraction;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Product of atoms raised to non-zero rational exponents. Immutable.
 */
final class Monomial {

    static final Monomial ONE = new Monomial(new TreeMap<>(Atom.ORDER));

    private final SortedMap<Atom, BigFraction> exponents;

    private Monomial(SortedMap<Atom, BigFraction> exponents) {
        this.exponents = Collections.unmodifiableSortedMap(exponents);
    }

    static Term of(Atom atom, BigFraction exponent) {
        Map<Atom, BigFraction> raw = new LinkedHashMap<>();
        raw.put(atom, exponent);
        return normalize(raw);
    }

    /**
     * Builds a monomial, folding integer powers of radicands and of the imaginary unit into the
     * returned coefficient.
     */
    static Term normalize(Map<Atom, BigFraction> raw) {
        BigFraction coefficient = BigFraction.ONE;
        TreeMap<Atom, BigFraction> result = new TreeMap<>(Atom.ORDER);
        Map<BigFraction, BigInteger> radicandsByExponent = new LinkedHashMap<>();

        for (Map.Entry<Atom, BigFraction> entry : raw.entrySet()) {
            Atom atom = entry.getKey();
            BigFraction exponent = entry.getValue();
            if (Rationals.isZero(exponent)) {
                continue;
            }
            if (atom instanceof Atom.Radicand radicand) {
                BigInteger whole = Rationals.floor(exponent);
                BigFraction fraction = exponent.subtract(new BigFraction(whole));
                coefficient = coefficient.multiply(Rationals.power(new BigFraction(radicand.value()), whole));
                if (!Rationals.isZero(fraction)) {
                    radicandsByExponent.merge(fraction, radicand.value(), BigInteger::multiply);
                }
                continue;
            }
            if (Atom.Constant.I.equals(atom) && Rationals.isInteger(exponent)) {
                int turn = exponent.getNumerator().mod(BigInteger.valueOf(4)).intValue();
                if (turn >= 2) {
                    coefficient = coefficient.negate();
                }
                if (turn % 2 == 1) {
                    result.put(atom, BigFraction.ONE);
                }
                continue;
            }
            result.merge(atom, exponent, BigFraction::add);
            if (Rationals.isZero(result.get(atom))) {
                result.remove(atom);
            }
        }

        for (Map.Entry<BigFraction, BigInteger> entry : radicandsByExponent.entrySet()) {
            BigFraction exponent = entry.getKey();
            int degree = exponent.getDenominator().intValueExact();
            BigInteger[] split = Rationals.extractPerfectPower(entry.getValue(), degree);
            coefficient = coefficient.multiply(Rationals.power(new BigFraction(split[0]), exponent.getNumerator()));
            if (!split[1].equals(BigInteger.ONE)) {
                result.merge(new Atom.Radicand(split[1]), exponent, BigFraction::add);
            }
        }
        return new Term(coefficient, new Monomial(result));
    }

    Term multiply(Monomial other) {
        if (other.isOne()) {
            return new Term(BigFraction.ONE, this);
        }
        if (isOne()) {
            return new Term(BigFraction.ONE, other);
        }
        Map<Atom, BigFraction> merged = new LinkedHashMap<>(exponents);
        other.exponents.forEach((atom, exponent) -> merged.merge(atom, exponent, BigFraction::add));
        return normalize(merged);
    }

    Term power(BigFraction exponent) {
        Map<Atom, BigFraction> scaled = new LinkedHashMap<>();
        exponents.forEach((atom, value) -> scaled.put(atom, value.multiply(exponent)));
        return normalize(scaled);
    }

    boolean isOne() {
        return exponents.isEmpty();
    }

    SortedMap<Atom, BigFraction> exponents() {
        return exponents;
    }

    BigFraction exponentOf(Atom atom) {
        return exponents.getOrDefault(atom, BigFraction.ZERO);
    }

    Monomial without(Atom atom) {
        TreeMap<Atom, BigFraction> copy = new TreeMap<>(exponents);
        copy.remove(atom);
        return new Monomial(copy);
    }

    boolean contains(Atom.Symbol symbol) {
        for (Atom atom : exponents.keySet()) {
            if (atom.contains(symbol)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Sum of the exponents of every atom that is not a plain number or named constant.
     */
    double degree() {
        double degree = 0;
        for (Map.Entry<Atom, BigFraction> entry : exponents.entrySet()) {
            if (entry.getKey() instanceof Atom.Radicand || entry.getKey() instanceof Atom.Constant) {
                continue;
            }
            degree += entry.getValue().doubleValue();
        }
        return degree;
    }

    String sortKey() {
        return ExpressionFormatter.formatMonomial(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Monomial other)) {
            return false;
        }
        return exponents.equals(other.exponents);
    }

    @Override
    public int hashCode() {
        return exponents.hashCode();
    }

    @Override
    public String toString() {
        return sortKey();
    }
}
