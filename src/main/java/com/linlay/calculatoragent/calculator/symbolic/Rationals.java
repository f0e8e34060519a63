package com.linlay.calculatoragent.calculator.symbolic;

import org.apache.commons.math3.fraction.BigFraction;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

final class Rationals {

    private static final BigInteger TRIAL_DIVISION_LIMIT = BigInteger.valueOf(100_000);
    private static final BigInteger DIVISOR_SEARCH_LIMIT = BigInteger.valueOf(1_000_000_000_000L);
    private static final int MAX_ROOT_DEGREE = 64;
    private static final int MAX_POWER_BITS = 4096;

    private Rationals() {
    }

    static BigFraction of(long value) {
        return new BigFraction(value);
    }

    static BigFraction of(BigInteger value) {
        return new BigFraction(value);
    }

    static BigFraction parseDecimal(String literal) {
        BigDecimal decimal = new BigDecimal(literal);
        if (decimal.scale() <= 0) {
            return new BigFraction(decimal.toBigIntegerExact());
        }
        return new BigFraction(decimal.unscaledValue(), BigInteger.TEN.pow(decimal.scale()));
    }

    static boolean isZero(BigFraction value) {
        return value.getNumerator().signum() == 0;
    }

    static int signum(BigFraction value) {
        return value.getNumerator().signum();
    }

    static boolean isInteger(BigFraction value) {
        return value.getDenominator().equals(BigInteger.ONE);
    }

    static BigInteger floor(BigFraction value) {
        BigInteger[] qr = value.getNumerator().divideAndRemainder(value.getDenominator());
        if (qr[1].signum() < 0) {
            return qr[0].subtract(BigInteger.ONE);
        }
        return qr[0];
    }

    static BigFraction power(BigFraction base, BigInteger exponent) {
        if (exponent.bitLength() > 31) {
            throw new UnsupportedSymbolicOperationException("exponent too large: " + exponent);
        }
        int e = exponent.intValue();
        if (e < 0 && isZero(base)) {
            throw new UndefinedExpressionException("division by zero");
        }
        // floor(log2) of the larger part times |e| is a lower bound on the bits of the result
        int baseBits = Math.max(base.getNumerator().abs().bitLength(), base.getDenominator().bitLength()) - 1;
        if ((long) Math.max(baseBits, 0) * Math.abs((long) e) > MAX_POWER_BITS) {
            throw new UnsupportedSymbolicOperationException(
                    "power too large: " + base + "^" + e + " exceeds " + MAX_POWER_BITS + " bits");
        }
        return base.pow(e);
    }

    /**
     * Splits {@code n} into {@code outer^degree * inner}, pulling out every perfect power whose prime
     * base can be found by bounded trial division.
     */
    static BigInteger[] extractPerfectPower(BigInteger n, int degree) {
        if (degree > MAX_ROOT_DEGREE) {
            return new BigInteger[]{BigInteger.ONE, n};
        }
        BigInteger outer = BigInteger.ONE;
        BigInteger inner = BigInteger.ONE;
        BigInteger rest = n;
        BigInteger p = BigInteger.TWO;
        while (p.compareTo(TRIAL_DIVISION_LIMIT) <= 0 && p.multiply(p).compareTo(rest) <= 0) {
            int count = 0;
            while (rest.mod(p).signum() == 0) {
                rest = rest.divide(p);
                count++;
            }
            if (count > 0) {
                outer = outer.multiply(p.pow(count / degree));
                inner = inner.multiply(p.pow(count % degree));
            }
            p = p.nextProbablePrime();
        }
        BigInteger root = integerRoot(rest, degree);
        if (root != null) {
            outer = outer.multiply(root);
        } else {
            inner = inner.multiply(rest);
        }
        return new BigInteger[]{outer, inner};
    }

    static BigInteger integerRoot(BigInteger n, int degree) {
        if (n.signum() < 0) {
            return null;
        }
        if (degree == 2) {
            BigInteger root = n.sqrt();
            return root.multiply(root).equals(n) ? root : null;
        }
        BigInteger low = BigInteger.ZERO;
        BigInteger high = BigInteger.ONE.shiftLeft(n.bitLength() / degree + 1);
        while (low.compareTo(high) <= 0) {
            BigInteger mid = low.add(high).shiftRight(1);
            int cmp = mid.pow(degree).compareTo(n);
            if (cmp == 0) {
                return mid;
            }
            if (cmp < 0) {
                low = mid.add(BigInteger.ONE);
            } else {
                high = mid.subtract(BigInteger.ONE);
            }
        }
        return null;
    }

    static BigInteger lcm(BigInteger a, BigInteger b) {
        if (a.signum() == 0 || b.signum() == 0) {
            return BigInteger.ZERO;
        }
        return a.divide(a.gcd(b)).multiply(b).abs();
    }

    /**
     * Positive divisors of {@code |n|}, or an empty list when n is too large to enumerate.
     */
    static List<BigInteger> divisors(BigInteger n) {
        BigInteger value = n.abs();
        if (value.signum() == 0 || value.compareTo(DIVISOR_SEARCH_LIMIT) > 0) {
            return List.of();
        }
        TreeSet<BigInteger> result = new TreeSet<>();
        BigInteger i = BigInteger.ONE;
        while (i.multiply(i).compareTo(value) <= 0) {
            if (value.mod(i).signum() == 0) {
                result.add(i);
                result.add(value.divide(i));
            }
            i = i.add(BigInteger.ONE);
        }
        return new ArrayList<>(result);
    }

    static String format(BigFraction value) {
        if (isInteger(value)) {
            return value.getNumerator().toString();
        }
        return value.getNumerator() + "/" + value.getDenominator();
    }
}
