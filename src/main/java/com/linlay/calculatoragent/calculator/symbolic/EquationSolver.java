package com.linlay.calculatoragent.calculator.symbolic;

import org.apache.commons.math3.analysis.solvers.LaguerreSolver;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fraction.BigFraction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Solves polynomial equations in one variable. Rational roots and quadratic factors are solved
 * exactly; irreducible factors of degree three and above fall back to Laguerre's method.
 */
final class EquationSolver {

    private static final BigFraction ONE_HALF = new BigFraction(1, 2);
    private static final double REAL_TOLERANCE = 1e-9;
    private static final int MAX_ROOT_EVALUATIONS = 100_000;

    private EquationSolver() {
    }

    static EquationSolution solve(Expression left, Expression right, Atom.Symbol symbol, int maxDegree) {
        Expression difference = left.subtract(right);
        if (!difference.contains(symbol)) {
            return difference.isZero() ? new EquationSolution.Identity() : new EquationSolution.Roots(List.of());
        }
        RationalForm form = RationalForm.of(difference);
        TreeMap<Integer, Expression> coefficients = UnivariatePolynomial.coefficientsIn(form.numerator(), symbol);
        if (coefficients == null) {
            throw new UnsupportedSymbolicOperationException(
                    "only polynomial equations in " + symbol.name() + " can be solved");
        }
        if (coefficients.isEmpty()) {
            return new EquationSolution.Identity();
        }
        if (coefficients.lastKey() > maxDegree) {
            throw new UnsupportedSymbolicOperationException("equation has degree " + coefficients.lastKey()
                    + ", at most " + maxDegree + " is supported");
        }
        UnivariatePolynomial polynomial = UnivariatePolynomial.from(form.numerator(), symbol);
        List<Root> candidates = polynomial != null ? solveRational(polynomial) : solveSymbolic(coefficients);

        List<Root> roots = new ArrayList<>();
        for (Root candidate : candidates) {
            if (candidate.isExact() && zeroesDenominator(form.denominator(), symbol, candidate.exact())) {
                continue;
            }
            if (!roots.contains(candidate)) {
                roots.add(candidate);
            }
        }
        return new EquationSolution.Roots(roots);
    }

    private static List<Root> solveRational(UnivariatePolynomial polynomial) {
        List<Root> roots = new ArrayList<>();
        UnivariatePolynomial remaining = polynomial;
        for (BigFraction root : polynomial.rationalRoots()) {
            roots.add(Root.exact(Expression.constant(root)));
            UnivariatePolynomial linear = UnivariatePolynomial.of(root.negate(), BigFraction.ONE);
            while (remaining.degree() > 0 && Rationals.isZero(remaining.evaluate(root))) {
                remaining = remaining.divide(linear)[0];
            }
        }
        if (remaining.degree() == 1) {
            roots.add(Root.exact(Expression.constant(remaining.coefficient(0).negate().divide(remaining.coefficient(1)))));
        } else if (remaining.degree() == 2) {
            roots.addAll(quadratic(
                    Expression.constant(remaining.coefficient(2)),
                    Expression.constant(remaining.coefficient(1)),
                    Expression.constant(remaining.coefficient(0))));
        } else if (remaining.degree() > 2) {
            roots.addAll(numericRoots(remaining));
        }
        roots.sort(Comparator.comparing(EquationSolver::numericValue, EquationSolver::compareComplex));
        return roots;
    }

    private static List<Root> numericRoots(UnivariatePolynomial polynomial) {
        Complex[] values;
        try {
            values = new LaguerreSolver().solveAllComplex(polynomial.toDoubles(), 0, MAX_ROOT_EVALUATIONS);
        } catch (MathIllegalStateException e) {
            throw new UnsupportedSymbolicOperationException(
                    "numeric root finding did not converge for a degree " + polynomial.degree() + " polynomial");
        }
        List<Root> roots = new ArrayList<>();
        for (Complex value : values) {
            roots.add(Root.approximate(value));
        }
        return roots;
    }

    private static List<Root> solveSymbolic(TreeMap<Integer, Expression> coefficients) {
        int degree = coefficients.lastKey();
        Expression c0 = coefficients.getOrDefault(0, Expression.ZERO);
        Expression c1 = coefficients.getOrDefault(1, Expression.ZERO);
        if (degree == 1) {
            return List.of(Root.exact(Simplifier.simplify(c0.negate().divide(c1))));
        }
        if (degree == 2) {
            return quadratic(coefficients.get(2), c1, c0);
        }
        throw new UnsupportedSymbolicOperationException(
                "cannot solve a degree " + degree + " equation with symbolic coefficients");
    }

    private static List<Root> quadratic(Expression a, Expression b, Expression c) {
        Expression discriminant = b.multiply(b).subtract(a.multiply(c).multiply(new BigFraction(4)));
        Expression twiceA = a.multiply(new BigFraction(2));
        if (discriminant.isZero()) {
            return List.of(Root.exact(b.negate().divide(twiceA)));
        }
        Expression root = discriminant.pow(ONE_HALF);
        return List.of(
                Root.exact(b.negate().subtract(root).divide(twiceA)),
                Root.exact(b.negate().add(root).divide(twiceA)));
    }

    private static boolean zeroesDenominator(Expression denominator, Atom.Symbol symbol, Expression value) {
        try {
            return denominator.substitute(symbol, value).isZero();
        } catch (UndefinedExpressionException e) {
            return true;
        }
    }

    /**
     * Numeric value of a root with real and imaginary parts split on the imaginary unit.
     */
    static Complex numericValue(Root root) {
        if (!root.isExact()) {
            return root.approximate();
        }
        double real = 0;
        double imaginary = 0;
        for (Map.Entry<Monomial, BigFraction> entry : root.exact().termMap().entrySet()) {
            Monomial monomial = entry.getKey();
            boolean imaginaryTerm = monomial.exponentOf(Atom.Constant.I).equals(BigFraction.ONE);
            Monomial rest = imaginaryTerm ? monomial.without(Atom.Constant.I) : monomial;
            double value;
            try {
                value = Expression.fromTerm(new Term(entry.getValue(), rest)).evaluate(Map.of());
            } catch (SymbolicException e) {
                return new Complex(Double.NaN, Double.NaN);
            }
            if (imaginaryTerm) {
                imaginary += value;
            } else {
                real += value;
            }
        }
        return new Complex(real, imaginary);
    }

    private static int compareComplex(Complex a, Complex b) {
        boolean aReal = Math.abs(a.getImaginary()) < REAL_TOLERANCE;
        boolean bReal = Math.abs(b.getImaginary()) < REAL_TOLERANCE;
        if (aReal != bReal) {
            return aReal ? -1 : 1;
        }
        int byReal = Double.compare(a.getReal(), b.getReal());
        return byReal != 0 ? byReal : Double.compare(a.getImaginary(), b.getImaginary());
    }
}
