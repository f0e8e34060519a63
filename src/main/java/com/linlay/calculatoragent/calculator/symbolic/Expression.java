package com.linlay.calculatoragent.calculator.symbolic;

import org.apache.commons.math3.fraction.BigFraction;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Symbolic expression in canonical form: a sum of terms, each a rational coefficient times a
 * {@link Monomial}. Like terms and like factors are combined on construction, so two expressions
 * that expand to the same sum compare equal. Immutable and thread-safe.
 */
public final class Expression {

    public static final Expression ZERO = new Expression(Map.of());
    public static final Expression ONE = constant(BigFraction.ONE);
    public static final Expression MINUS_ONE = constant(BigFraction.MINUS_ONE);

    private static final BigFraction ONE_HALF = new BigFraction(1, 2);
    private static final int MAX_EXPANSION_EXPONENT = 16;

    private final Map<Monomial, BigFraction> terms;
    private String text;

    private Expression(Map<Monomial, BigFraction> terms) {
        this.terms = Collections.unmodifiableMap(terms);
    }

    public static Expression constant(BigFraction value) {
        if (Rationals.isZero(value)) {
            return ZERO;
        }
        Map<Monomial, BigFraction> single = new LinkedHashMap<>();
        single.put(Monomial.ONE, value);
        return new Expression(single);
    }

    public static Expression constant(long value) {
        return constant(new BigFraction(value));
    }

    public static Expression symbol(Atom.Symbol symbol) {
        return atom(symbol);
    }

    static Expression atom(Atom atom) {
        return fromTerm(Monomial.of(atom, BigFraction.ONE));
    }

    /**
     * {@code atom^exponent} with grouped sums kept as a single factor.
     */
    static Expression factor(Atom atom, BigFraction exponent) {
        return fromTerm(Monomial.of(atom, exponent));
    }

    static Expression fromTerm(Term term) {
        return constant(term.coefficient()).multiplyMonomial(term.monomial());
    }

    public static Expression function(String name, Expression argument) {
        return switch (name) {
            case "sqrt" -> argument.pow(ONE_HALF);
            case "exp" -> exp(argument);
            case "log", "ln" -> log(argument);
            case "sin" -> sin(argument);
            case "cos" -> cos(argument);
            case "tan" -> tan(argument);
            default -> throw new UnsupportedSymbolicOperationException("unknown function " + name);
        };
    }

    private static Expression exp(Expression argument) {
        if (argument.isZero()) {
            return ONE;
        }
        if (argument.equals(ONE)) {
            return atom(Atom.Constant.E);
        }
        Atom inner = argument.singleAtom();
        if (inner instanceof Atom.Function function && function.name().equals("log")) {
            return function.argument();
        }
        return atom(new Atom.Function("exp", argument));
    }

    private static Expression log(Expression argument) {
        if (argument.isZero()) {
            throw new UndefinedExpressionException("log(0) is undefined");
        }
        if (argument.equals(ONE)) {
            return ZERO;
        }
        Atom inner = argument.singleAtom();
        if (Atom.Constant.E.equals(inner)) {
            return ONE;
        }
        if (inner instanceof Atom.Function function && function.name().equals("exp")) {
            return function.argument();
        }
        return atom(new Atom.Function("log", argument));
    }

    private static Expression sin(Expression argument) {
        BigFraction piMultiple = argument.piMultiple();
        if (argument.isZero() || (piMultiple != null && Rationals.isInteger(piMultiple))) {
            return ZERO;
        }
        if (argument.hasNegativeLeadingSign()) {
            return sin(argument.negate()).negate();
        }
        return atom(new Atom.Function("sin", argument));
    }

    private static Expression cos(Expression argument) {
        if (argument.isZero()) {
            return ONE;
        }
        BigFraction piMultiple = argument.piMultiple();
        if (piMultiple != null && Rationals.isInteger(piMultiple)) {
            return piMultiple.getNumerator().testBit(0) ? MINUS_ONE : ONE;
        }
        if (argument.hasNegativeLeadingSign()) {
            return cos(argument.negate());
        }
        return atom(new Atom.Function("cos", argument));
    }

    private static Expression tan(Expression argument) {
        BigFraction piMultiple = argument.piMultiple();
        if (argument.isZero() || (piMultiple != null && Rationals.isInteger(piMultiple))) {
            return ZERO;
        }
        if (argument.hasNegativeLeadingSign()) {
            return tan(argument.negate()).negate();
        }
        return atom(new Atom.Function("tan", argument));
    }

    public Expression add(Expression other) {
        if (other.isZero()) {
            return this;
        }
        if (isZero()) {
            return other;
        }
        Map<Monomial, BigFraction> sum = new LinkedHashMap<>(terms);
        other.terms.forEach((monomial, coefficient) -> accumulate(sum, monomial, coefficient));
        return new Expression(sum);
    }

    public Expression subtract(Expression other) {
        return add(other.negate());
    }

    public Expression negate() {
        return multiply(BigFraction.MINUS_ONE);
    }

    public Expression multiply(BigFraction factor) {
        if (Rationals.isZero(factor)) {
            return ZERO;
        }
        Map<Monomial, BigFraction> scaled = new LinkedHashMap<>();
        terms.forEach((monomial, coefficient) -> scaled.put(monomial, coefficient.multiply(factor)));
        return new Expression(scaled);
    }

    public Expression multiply(Expression other) {
        if (isZero() || other.isZero()) {
            return ZERO;
        }
        Map<Monomial, BigFraction> product = new LinkedHashMap<>();
        for (Map.Entry<Monomial, BigFraction> left : terms.entrySet()) {
            for (Map.Entry<Monomial, BigFraction> right : other.terms.entrySet()) {
                Term merged = left.getKey().multiply(right.getKey());
                BigFraction coefficient = left.getValue().multiply(right.getValue()).multiply(merged.coefficient());
                accumulate(product, merged.monomial(), coefficient);
            }
        }
        return new Expression(product);
    }

    public Expression divide(Expression other) {
        if (other.isZero()) {
            throw new UndefinedExpressionException("division by zero");
        }
        return multiply(other.pow(BigFraction.MINUS_ONE));
    }

    public Expression pow(BigFraction exponent) {
        if (Rationals.isZero(exponent)) {
            return ONE;
        }
        if (isZero()) {
            if (Rationals.signum(exponent) < 0) {
                throw new UndefinedExpressionException("division by zero");
            }
            return ZERO;
        }
        if (exponent.equals(BigFraction.ONE)) {
            return this;
        }
        if (terms.size() == 1) {
            Map.Entry<Monomial, BigFraction> single = terms.entrySet().iterator().next();
            Monomial monomial = single.getKey();
            if (!Rationals.isInteger(exponent) && monomial.exponents().containsKey(Atom.Constant.I)) {
                return atom(new Atom.Power(this, constant(exponent)));
            }
            return constantPower(single.getValue(), exponent).multiply(fromTerm(monomial.power(exponent)));
        }
        if (Rationals.isInteger(exponent) && Rationals.signum(exponent) > 0
                && exponent.getNumerator().compareTo(BigInteger.valueOf(MAX_EXPANSION_EXPONENT)) <= 0) {
            int n = exponent.getNumerator().intValue();
            Expression result = ONE;
            Expression base = this;
            while (n > 0) {
                if ((n & 1) == 1) {
                    result = result.multiply(base);
                }
                n >>= 1;
                if (n > 0) {
                    base = base.multiply(base);
                }
            }
            return result;
        }
        return fromTerm(Monomial.of(new Atom.Group(this), exponent));
    }

    public Expression pow(Expression exponent) {
        BigFraction rational = exponent.constantValue();
        if (rational != null) {
            return pow(rational);
        }
        if (Atom.Constant.E.equals(singleAtom())) {
            return exp(exponent);
        }
        return atom(new Atom.Power(this, exponent));
    }

    private static Expression constantPower(BigFraction base, BigFraction exponent) {
        if (Rationals.isInteger(exponent)) {
            return constant(Rationals.power(base, exponent.getNumerator()));
        }
        if (base.equals(BigFraction.ONE)) {
            return ONE;
        }
        if (Rationals.signum(base) < 0) {
            if (exponent.getDenominator().equals(BigInteger.TWO)) {
                Expression unit = fromTerm(Monomial.of(Atom.Constant.I, new BigFraction(exponent.getNumerator())));
                return unit.multiply(constantPower(base.negate(), exponent));
            }
            return atom(new Atom.Power(constant(base), constant(exponent)));
        }
        Map<Atom, BigFraction> radicals = new LinkedHashMap<>();
        if (!base.getNumerator().equals(BigInteger.ONE)) {
            radicals.put(new Atom.Radicand(base.getNumerator()), exponent);
        }
        if (!base.getDenominator().equals(BigInteger.ONE)) {
            radicals.put(new Atom.Radicand(base.getDenominator()), exponent.negate());
        }
        return fromTerm(Monomial.normalize(radicals));
    }

    private Expression multiplyMonomial(Monomial monomial) {
        if (monomial.isOne() || isZero()) {
            return this;
        }
        Map<Monomial, BigFraction> product = new LinkedHashMap<>();
        terms.forEach((own, coefficient) -> {
            Term merged = own.multiply(monomial);
            accumulate(product, merged.monomial(), coefficient.multiply(merged.coefficient()));
        });
        return new Expression(product);
    }

    private static void accumulate(Map<Monomial, BigFraction> target, Monomial monomial, BigFraction coefficient) {
        BigFraction merged = target.containsKey(monomial) ? target.get(monomial).add(coefficient) : coefficient;
        if (Rationals.isZero(merged)) {
            target.remove(monomial);
        } else {
            target.put(monomial, merged);
        }
    }

    public boolean isZero() {
        return terms.isEmpty();
    }

    public boolean isConstant() {
        return constantValue() != null;
    }

    /**
     * The rational value of this expression, or {@code null} when it is not a plain rational.
     */
    public BigFraction constantValue() {
        if (terms.isEmpty()) {
            return BigFraction.ZERO;
        }
        if (terms.size() == 1 && terms.containsKey(Monomial.ONE)) {
            return terms.get(Monomial.ONE);
        }
        return null;
    }

    int termCount() {
        return terms.size();
    }

    List<Term> terms() {
        return ExpressionFormatter.orderedTerms(this);
    }

    Map<Monomial, BigFraction> termMap() {
        return terms;
    }

    /**
     * The atom this expression consists of when it is exactly {@code 1 * atom^1}.
     */
    Atom singleAtom() {
        if (terms.size() != 1) {
            return null;
        }
        Map.Entry<Monomial, BigFraction> single = terms.entrySet().iterator().next();
        if (!single.getValue().equals(BigFraction.ONE) || single.getKey().exponents().size() != 1) {
            return null;
        }
        Map.Entry<Atom, BigFraction> factor = single.getKey().exponents().entrySet().iterator().next();
        return factor.getValue().equals(BigFraction.ONE) ? factor.getKey() : null;
    }

    private BigFraction piMultiple() {
        if (terms.size() != 1) {
            return null;
        }
        Map.Entry<Monomial, BigFraction> single = terms.entrySet().iterator().next();
        Map<Atom, BigFraction> exponents = single.getKey().exponents();
        if (exponents.size() == 1 && BigFraction.ONE.equals(exponents.get(Atom.Constant.PI))) {
            return single.getValue();
        }
        return null;
    }

    boolean hasNegativeLeadingSign() {
        if (terms.isEmpty()) {
            return false;
        }
        return Rationals.signum(terms().get(0).coefficient()) < 0;
    }

    public boolean contains(Atom.Symbol symbol) {
        for (Monomial monomial : terms.keySet()) {
            if (monomial.contains(symbol)) {
                return true;
            }
        }
        return false;
    }

    public Set<Atom.Symbol> freeSymbols() {
        Set<Atom.Symbol> symbols = new LinkedHashSet<>();
        collectSymbols(symbols);
        return symbols;
    }

    private void collectSymbols(Set<Atom.Symbol> symbols) {
        for (Monomial monomial : terms.keySet()) {
            for (Atom atom : monomial.exponents().keySet()) {
                if (atom instanceof Atom.Symbol symbol) {
                    symbols.add(symbol);
                } else if (atom instanceof Atom.Function function) {
                    function.argument().collectSymbols(symbols);
                } else if (atom instanceof Atom.Group group) {
                    group.base().collectSymbols(symbols);
                } else if (atom instanceof Atom.Power power) {
                    power.base().collectSymbols(symbols);
                    power.exponent().collectSymbols(symbols);
                }
            }
        }
    }

    public Expression substitute(Atom.Symbol symbol, Expression value) {
        if (!contains(symbol)) {
            return this;
        }
        Expression result = ZERO;
        for (Map.Entry<Monomial, BigFraction> entry : terms.entrySet()) {
            Expression term = constant(entry.getValue());
            for (Map.Entry<Atom, BigFraction> factor : entry.getKey().exponents().entrySet()) {
                Atom atom = factor.getKey();
                if (!atom.contains(symbol)) {
                    term = term.multiply(fromTerm(Monomial.of(atom, factor.getValue())));
                    continue;
                }
                term = term.multiply(substituteAtom(atom, symbol, value).pow(factor.getValue()));
            }
            result = result.add(term);
        }
        return result;
    }

    private static Expression substituteAtom(Atom atom, Atom.Symbol symbol, Expression value) {
        if (atom instanceof Atom.Symbol) {
            return value;
        }
        if (atom instanceof Atom.Function function) {
            return function(function.name(), function.argument().substitute(symbol, value));
        }
        if (atom instanceof Atom.Group group) {
            return group.base().substitute(symbol, value);
        }
        if (atom instanceof Atom.Power power) {
            return power.base().substitute(symbol, value).pow(power.exponent().substitute(symbol, value));
        }
        return atom(atom);
    }

    /**
     * Numeric value with the given symbol bindings. Unbound symbols and the imaginary unit are
     * rejected.
     */
    public double evaluate(Map<String, Double> bindings) {
        double sum = 0;
        for (Map.Entry<Monomial, BigFraction> entry : terms.entrySet()) {
            double product = entry.getValue().doubleValue();
            for (Map.Entry<Atom, BigFraction> factor : entry.getKey().exponents().entrySet()) {
                product *= Math.pow(evaluateAtom(factor.getKey(), bindings), factor.getValue().doubleValue());
            }
            sum += product;
        }
        return sum;
    }

    private static double evaluateAtom(Atom atom, Map<String, Double> bindings) {
        if (atom instanceof Atom.Radicand radicand) {
            return radicand.value().doubleValue();
        }
        if (atom instanceof Atom.Constant constant) {
            return constant.numericValue();
        }
        if (atom instanceof Atom.Symbol symbol) {
            Double bound = bindings.get(symbol.name());
            if (bound == null) {
                throw new SymbolicException("no value bound for symbol " + symbol.name());
            }
            return bound;
        }
        if (atom instanceof Atom.Group group) {
            return group.base().evaluate(bindings);
        }
        if (atom instanceof Atom.Power power) {
            return Math.pow(power.base().evaluate(bindings), power.exponent().evaluate(bindings));
        }
        Atom.Function function = (Atom.Function) atom;
        double argument = function.argument().evaluate(bindings);
        return switch (function.name()) {
            case "sin" -> Math.sin(argument);
            case "cos" -> Math.cos(argument);
            case "tan" -> Math.tan(argument);
            case "exp" -> Math.exp(argument);
            case "log" -> Math.log(argument);
            default -> throw new UnsupportedSymbolicOperationException("cannot evaluate " + function.name());
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Expression other)) {
            return false;
        }
        return terms.equals(other.terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        if (text == null) {
            text = ExpressionFormatter.format(this);
        }
        return text;
    }
}
