package com.linlay.calculatoragent.calculator.symbolic;

import org.apache.commons.math3.fraction.BigFraction;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Renders expressions as text: highest degree first, {@code **} for powers and {@code sqrt(...)}
 * for square roots.
 */
final class ExpressionFormatter {

    private static final BigFraction ONE_HALF = new BigFraction(1, 2);

    private static final Comparator<Term> TERM_ORDER = Comparator
            .comparingDouble((Term term) -> -term.monomial().degree())
            .thenComparing(term -> term.monomial().isOne() ? 0 : 1)
            .thenComparing(term -> term.monomial().sortKey());

    private ExpressionFormatter() {
    }

    static List<Term> orderedTerms(Expression expression) {
        List<Term> ordered = new ArrayList<>();
        for (Map.Entry<Monomial, BigFraction> entry : expression.termMap().entrySet()) {
            ordered.add(new Term(entry.getValue(), entry.getKey()));
        }
        ordered.sort(TERM_ORDER);
        return ordered;
    }

    static String format(Expression expression) {
        if (expression.isZero()) {
            return "0";
        }
        StringBuilder out = new StringBuilder();
        boolean first = true;
        for (Term term : orderedTerms(expression)) {
            boolean negative = Rationals.signum(term.coefficient()) < 0;
            String body = formatMagnitude(term);
            if (first) {
                out.append(negative ? "-" : "").append(body);
                first = false;
            } else {
                out.append(negative ? " - " : " + ").append(body);
            }
        }
        return out.toString();
    }

    static String formatMonomial(Monomial monomial) {
        return formatMagnitude(new Term(BigFraction.ONE, monomial));
    }

    /**
     * Text for an expression used as the base or exponent of {@code **}, parenthesized unless it is
     * a bare atom or a non-negative integer.
     */
    static String asPowerOperand(Expression expression) {
        BigFraction constant = expression.constantValue();
        if (constant != null && Rationals.isInteger(constant) && Rationals.signum(constant) >= 0) {
            return Rationals.format(constant);
        }
        Atom atom = expression.singleAtom();
        if (atom != null && !(atom instanceof Atom.Power)) {
            return atom.text();
        }
        return "(" + expression + ")";
    }

    private static String formatMagnitude(Term term) {
        BigFraction magnitude = term.coefficient().abs();
        List<String> numerator = new ArrayList<>();
        List<String> denominator = new ArrayList<>();
        boolean hasPositiveFactor = term.monomial().exponents().values().stream()
                .anyMatch(exponent -> Rationals.signum(exponent) > 0);
        if (!magnitude.getNumerator().equals(BigInteger.ONE) || !hasPositiveFactor) {
            numerator.add(magnitude.getNumerator().toString());
        }
        if (!magnitude.getDenominator().equals(BigInteger.ONE)) {
            denominator.add(magnitude.getDenominator().toString());
        }
        for (Map.Entry<Atom, BigFraction> entry : term.monomial().exponents().entrySet()) {
            BigFraction exponent = entry.getValue();
            if (Rationals.signum(exponent) > 0) {
                numerator.add(factor(entry.getKey(), exponent));
            } else {
                denominator.add(factor(entry.getKey(), exponent.negate()));
            }
        }
        String top = numerator.isEmpty() ? "1" : String.join("*", numerator);
        if (denominator.isEmpty()) {
            return top;
        }
        String bottom = String.join("*", denominator);
        if (denominator.size() > 1) {
            bottom = "(" + bottom + ")";
        }
        return top + "/" + bottom;
    }

    private static String factor(Atom atom, BigFraction exponent) {
        if (exponent.equals(BigFraction.ONE)) {
            return atom.text();
        }
        if (exponent.equals(ONE_HALF)) {
            String inner = atom instanceof Atom.Group group ? group.base().toString() : atom.text();
            return "sqrt(" + inner + ")";
        }
        String base = atom instanceof Atom.Power ? "(" + atom.text() + ")" : atom.text();
        if (Rationals.isInteger(exponent)) {
            return base + "**" + Rationals.format(exponent);
        }
        return base + "**(" + Rationals.format(exponent) + ")";
    }
}
