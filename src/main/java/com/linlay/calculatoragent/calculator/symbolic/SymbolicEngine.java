package com.linlay.calculatoragent.calculator.symbolic;

import java.util.Locale;
import java.util.Optional;

/**
 * Entry point of the symbolic algebra engine. Every call parses its input with a fresh
 * {@link SymbolTable}, so instances are stateless and may be shared between threads.
 *
 * <p>Failures are reported as {@link SymbolicException}s: {@link ExpressionParseException} for
 * malformed input, {@link UndefinedExpressionException} for divisions by zero and
 * {@link UnsupportedSymbolicOperationException} for requests outside what the engine can do.
 */
public class SymbolicEngine {

    public static final int DEFAULT_MAX_POLYNOMIAL_DEGREE = 20;

    private final int maxNestingDepth;
    private final int maxPolynomialDegree;

    public SymbolicEngine() {
        this(ExpressionParser.DEFAULT_MAX_NESTING_DEPTH, DEFAULT_MAX_POLYNOMIAL_DEGREE);
    }

    /**
     * @param maxNestingDepth     deepest nesting of parentheses, signs and exponents accepted by the parser
     * @param maxPolynomialDegree highest degree of a polynomial equation that {@link #solve} attempts
     */
    public SymbolicEngine(int maxNestingDepth, int maxPolynomialDegree) {
        if (maxPolynomialDegree < 2) {
            throw new IllegalArgumentException("maxPolynomialDegree must be at least 2: " + maxPolynomialDegree);
        }
        this.maxNestingDepth = maxNestingDepth;
        this.maxPolynomialDegree = maxPolynomialDegree;
    }

    public Expression parse(String text) {
        return parser(new SymbolTable()).parse(text);
    }

    public Expression simplify(String expression) {
        return Simplifier.simplify(parse(expression));
    }

    public Expression expand(String expression) {
        return Simplifier.expand(parse(expression));
    }

    public Expression factor(String expression) {
        return Factorizer.factor(parse(expression));
    }

    public Expression derivative(String expression, String variable) {
        SymbolTable symbols = new SymbolTable();
        Expression parsed = parser(symbols).parse(expression);
        return Differentiator.derivative(parsed, symbols.symbol(variable));
    }

    /**
     * The antiderivative, or {@code Integral(expression, variable)} when no rule applies.
     */
    public String integrate(String expression, String variable) {
        SymbolTable symbols = new SymbolTable();
        Expression parsed = parser(symbols).parse(expression);
        Atom.Symbol symbol = symbols.symbol(variable);
        Optional<Expression> antiderivative = Integrator.integrate(parsed, symbol);
        return antiderivative.map(Expression::toString)
                .orElseGet(() -> "Integral(" + parsed + ", " + symbol.name() + ")");
    }

    public LimitResult limit(String expression, String variable, LimitPoint point) {
        SymbolTable symbols = new SymbolTable();
        ExpressionParser parser = parser(symbols);
        return LimitEvaluator.limit(parser.parse(expression), symbols.symbol(variable), point);
    }

    /**
     * Reads a limit point: {@code null} or blank means 0, {@code infinity} or {@code oo} means
     * positive infinity (with a leading minus, negative infinity), anything else is parsed as an expression.
     */
    public LimitPoint limitPoint(String approach) {
        if (approach == null || approach.isBlank()) {
            return LimitPoint.at(Expression.ZERO);
        }
        String normalized = approach.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "infinity", "+infinity", "oo", "+oo":
                return LimitPoint.POSITIVE_INFINITY;
            case "-infinity", "-oo":
                return LimitPoint.NEGATIVE_INFINITY;
            default:
                break;
        }
        return LimitPoint.at(parse(approach.trim()));
    }

    /**
     * Solves {@code left = right} for the variable; without an equals sign the right-hand side is
     * zero.
     */
    public EquationSolution solve(String equation, String variable) {
        SymbolTable symbols = new SymbolTable();
        ExpressionParser parser = parser(symbols);
        int equals = equation.indexOf('=');
        Expression left;
        Expression right;
        if (equals >= 0) {
            left = parser.parse(equation.substring(0, equals));
            right = parser.parse(equation.substring(equals + 1));
        } else {
            left = parser.parse(equation);
            right = Expression.ZERO;
        }
        return EquationSolver.solve(left, right, symbols.symbol(variable), maxPolynomialDegree);
    }

    private ExpressionParser parser(SymbolTable symbols) {
        return new ExpressionParser(symbols, maxNestingDepth);
    }
}
