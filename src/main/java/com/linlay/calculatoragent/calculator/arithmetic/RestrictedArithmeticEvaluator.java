package com.linlay.calculatoragent.calculator.arithmetic;

/**
 * Evaluates arithmetic over number literals only: {@code + - * /}, {@code **} or {@code ^} for
 * powers, unary signs and parentheses. There are no identifiers, so no name can ever be resolved.
 *
 * <pre>
 * expr   := term (('+' | '-') term)*
 * term   := unary (('*' | '/') unary)*
 * unary  := ('+' | '-') unary | power
 * power  := atom (('**' | '^') unary)?
 * atom   := number | '(' expr ')'
 * </pre>
 *
 * <p>Parentheses, signs and exponents may nest at most {@code maxNestingDepth} levels.
 */
public class RestrictedArithmeticEvaluator {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 200;

    private final int maxNestingDepth;

    public RestrictedArithmeticEvaluator() {
        this(DEFAULT_MAX_NESTING_DEPTH);
    }

    public RestrictedArithmeticEvaluator(int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * @throws ArithmeticParseException when the text is not a well-formed expression
     * @throws ArithmeticException      on division by zero or a non-finite result
     */
    public double evaluate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ArithmeticParseException("empty expression", 0);
        }
        Parser parser = new Parser(expression, maxNestingDepth);
        double value = parser.expression();
        parser.skipSpaces();
        if (!parser.atEnd()) {
            throw new ArithmeticParseException("unexpected '" + parser.current() + "'", parser.pos);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ArithmeticException("result is not a finite number");
        }
        return value;
    }

    private static final class Parser {
        private final String text;
        private final int maxDepth;
        private int pos;
        private int depth;

        private Parser(String text, int maxDepth) {
            this.text = text;
            this.maxDepth = maxDepth;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        char current() {
            return text.charAt(pos);
        }

        void skipSpaces() {
            while (!atEnd() && Character.isWhitespace(current())) {
                pos++;
            }
        }

        boolean accept(String token) {
            skipSpaces();
            if (text.startsWith(token, pos)) {
                pos += token.length();
                return true;
            }
            return false;
        }

        double expression() {
            double value = term();
            while (true) {
                if (accept("+")) {
                    value += term();
                } else if (accept("-")) {
                    value -= term();
                } else {
                    return value;
                }
            }
        }

        double term() {
            double value = unary();
            while (true) {
                if (accept("*")) {
                    value *= unary();
                } else if (accept("/")) {
                    double divisor = unary();
                    if (divisor == 0) {
                        throw new ArithmeticException("division by zero");
                    }
                    value /= divisor;
                } else {
                    return value;
                }
            }
        }

        double unary() {
            if (++depth > maxDepth) {
                throw new ArithmeticParseException("expression nested deeper than " + maxDepth + " levels", pos);
            }
            try {
                if (accept("-")) {
                    return -unary();
                }
                if (accept("+")) {
                    return unary();
                }
                return power();
            } finally {
                depth--;
            }
        }

        double power() {
            double base = atom();
            if (accept("**") || accept("^")) {
                double exponent = unary();
                if (base == 0 && exponent < 0) {
                    throw new ArithmeticException("division by zero");
                }
                return Math.pow(base, exponent);
            }
            return base;
        }

        double atom() {
            skipSpaces();
            if (accept("(")) {
                double value = expression();
                if (!accept(")")) {
                    throw new ArithmeticParseException("expected ')'", pos);
                }
                return value;
            }
            return number();
        }

        double number() {
            skipSpaces();
            int start = pos;
            boolean digits = false;
            while (!atEnd() && Character.isDigit(current())) {
                pos++;
                digits = true;
            }
            if (!atEnd() && current() == '.') {
                pos++;
                while (!atEnd() && Character.isDigit(current())) {
                    pos++;
                    digits = true;
                }
            }
            if (!digits) {
                pos = start;
                if (atEnd()) {
                    throw new ArithmeticParseException("unexpected end of expression", pos);
                }
                throw new ArithmeticParseException("unexpected '" + current() + "'", pos);
            }
            return Double.parseDouble(text.substring(start, pos));
        }
    }
}
