package com.linlay.calculatoragent.calculator.symbolic;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for symbolic input.
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/') unary | power)*      implicit product when no operator
 * unary      := ('+' | '-') unary | power
 * power      := primary (('^' | '**') unary)?           right associative
 * primary    := number | name | name '(' expression ')' | '(' expression ')'
 * </pre>
 *
 * <p>Input nested deeper than the configured depth is rejected as a parse error.
 */
public final class ExpressionParser {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 200;

    private static final Set<String> FUNCTIONS = Set.of("sin", "cos", "tan", "exp", "log", "ln", "sqrt");

    private final SymbolTable symbols;
    private final int maxNestingDepth;

    public ExpressionParser(SymbolTable symbols) {
        this(symbols, DEFAULT_MAX_NESTING_DEPTH);
    }

    public ExpressionParser(SymbolTable symbols, int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        this.symbols = symbols;
        this.maxNestingDepth = maxNestingDepth;
    }

    public Expression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ExpressionParseException("empty expression", text == null ? "" : text, 0);
        }
        Cursor cursor = new Cursor(text, tokenize(text));
        Expression result = cursor.expression();
        if (!cursor.atEnd()) {
            Token extra = cursor.peek();
            throw new ExpressionParseException("unexpected '" + extra.text + "'", text, extra.position);
        }
        return result;
    }

    private enum Kind {
        NUMBER, NAME, PLUS, MINUS, TIMES, DIVIDE, POWER, LPAREN, RPAREN
    }

    private record Token(Kind kind, String text, int position) {
    }

    private static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int start = i;
            if (Character.isDigit(c) || (c == '.' && i + 1 < text.length() && Character.isDigit(text.charAt(i + 1)))) {
                boolean dot = false;
                while (i < text.length() && (Character.isDigit(text.charAt(i)) || (text.charAt(i) == '.' && !dot))) {
                    dot |= text.charAt(i) == '.';
                    i++;
                }
                tokens.add(new Token(Kind.NUMBER, text.substring(start, i), start));
                continue;
            }
            if (Character.isLetter(c) || c == '_') {
                while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new Token(Kind.NAME, text.substring(start, i), start));
                continue;
            }
            Kind kind = switch (c) {
                case '+' -> Kind.PLUS;
                case '-' -> Kind.MINUS;
                case '/' -> Kind.DIVIDE;
                case '^' -> Kind.POWER;
                case '(' -> Kind.LPAREN;
                case ')' -> Kind.RPAREN;
                case '*' -> i + 1 < text.length() && text.charAt(i + 1) == '*' ? Kind.POWER : Kind.TIMES;
                default -> throw new ExpressionParseException("unexpected character '" + c + "'", text, i);
            };
            i += kind == Kind.POWER && c == '*' ? 2 : 1;
            tokens.add(new Token(kind, text.substring(start, i), start));
        }
        return tokens;
    }

    private final class Cursor {
        private final String source;
        private final List<Token> tokens;
        private int index;
        private int depth;

        private Cursor(String source, List<Token> tokens) {
            this.source = source;
            this.tokens = tokens;
        }

        boolean atEnd() {
            return index >= tokens.size();
        }

        Token peek() {
            return atEnd() ? null : tokens.get(index);
        }

        boolean accept(Kind kind) {
            if (!atEnd() && tokens.get(index).kind == kind) {
                index++;
                return true;
            }
            return false;
        }

        Expression expression() {
            Expression result = term();
            while (true) {
                if (accept(Kind.PLUS)) {
                    result = result.add(term());
                } else if (accept(Kind.MINUS)) {
                    result = result.subtract(term());
                } else {
                    return result;
                }
            }
        }

        Expression term() {
            Expression result = unary();
            while (true) {
                if (accept(Kind.TIMES)) {
                    result = result.multiply(unary());
                } else if (accept(Kind.DIVIDE)) {
                    result = result.divide(unary());
                } else if (startsOperand()) {
                    result = result.multiply(power());
                } else {
                    return result;
                }
            }
        }

        boolean startsOperand() {
            Token next = peek();
            return next != null && (next.kind == Kind.NUMBER || next.kind == Kind.NAME || next.kind == Kind.LPAREN);
        }

        Expression unary() {
            if (++depth > maxNestingDepth) {
                Token next = peek();
                throw new ExpressionParseException("expression nested deeper than " + maxNestingDepth + " levels",
                        source, next == null ? source.length() : next.position);
            }
            try {
                if (accept(Kind.MINUS)) {
                    return unary().negate();
                }
                if (accept(Kind.PLUS)) {
                    return unary();
                }
                return power();
            } finally {
                depth--;
            }
        }

        Expression power() {
            Expression base = primary();
            if (accept(Kind.POWER)) {
                return base.pow(unary());
            }
            return base;
        }

        Expression primary() {
            Token token = peek();
            if (token == null) {
                throw new ExpressionParseException("unexpected end of expression", source, source.length());
            }
            index++;
            switch (token.kind) {
                case NUMBER:
                    return Expression.constant(Rationals.parseDecimal(token.text));
                case LPAREN: {
                    Expression inner = expression();
                    expect(Kind.RPAREN, "')'");
                    return inner;
                }
                case NAME:
                    return name(token);
                default:
                    throw new ExpressionParseException("unexpected '" + token.text + "'", source, token.position);
            }
        }

        private Expression name(Token token) {
            String name = token.text;
            Token next = peek();
            boolean call = next != null && next.kind == Kind.LPAREN;
            if (FUNCTIONS.contains(name)) {
                if (!call) {
                    throw new ExpressionParseException("function " + name + " needs an argument", source, token.position);
                }
                index++;
                Expression argument = expression();
                expect(Kind.RPAREN, "')'");
                return Expression.function(name, argument);
            }
            if (call && name.length() > 1) {
                throw new ExpressionParseException("unknown function " + name, source, token.position);
            }
            return switch (name) {
                case "pi" -> Expression.atom(Atom.Constant.PI);
                case "E" -> Expression.atom(Atom.Constant.E);
                case "I" -> Expression.atom(Atom.Constant.I);
                default -> Expression.symbol(symbols.symbol(name));
            };
        }

        private void expect(Kind kind, String description) {
            if (!accept(kind)) {
                Token actual = peek();
                int position = actual == null ? source.length() : actual.position;
                throw new ExpressionParseException("expected " + description, source, position);
            }
        }
    }
}
