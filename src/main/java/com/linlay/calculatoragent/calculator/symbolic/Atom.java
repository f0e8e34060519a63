package com.linlay.calculatoragent.calculator.symbolic;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.Objects;

/**
 * Indivisible factor of a {@link Monomial}. Everything an expression is built from that is not a
 * rational coefficient or a sum of terms ends up as one of these.
 */
public sealed interface Atom permits
        Atom.Radicand,
        Atom.Constant,
        Atom.Symbol,
        Atom.Function,
        Atom.Power,
        Atom.Group {

    Comparator<Atom> ORDER = Comparator.comparingInt(Atom::rank).thenComparing(Atom::text);

    int rank();

    String text();

    boolean contains(Symbol symbol);

    /**
     * Positive integer raised to a fractional exponent, e.g. the 13 in sqrt(13).
     */
    record Radicand(BigInteger value) implements Atom {
        public Radicand {
            Objects.requireNonNull(value, "value");
            if (value.signum() <= 0) {
                throw new IllegalArgumentException("radicand must be positive: " + value);
            }
        }

        @Override
        public int rank() {
            return 0;
        }

        @Override
        public String text() {
            return value.toString();
        }

        @Override
        public boolean contains(Symbol symbol) {
            return false;
        }
    }

    record Constant(String name) implements Atom {
        public static final Constant PI = new Constant("pi");
        public static final Constant E = new Constant("E");
        public static final Constant I = new Constant("I");

        public Constant {
            Objects.requireNonNull(name, "name");
        }

        public double numericValue() {
            return switch (name) {
                case "pi" -> Math.PI;
                case "E" -> Math.E;
                default -> throw new UnsupportedSymbolicOperationException("no real value for constant " + name);
            };
        }

        @Override
        public int rank() {
            return 1;
        }

        @Override
        public String text() {
            return name;
        }

        @Override
        public boolean contains(Symbol symbol) {
            return false;
        }
    }

    record Symbol(String name) implements Atom {
        public Symbol {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("symbol name must not be blank");
            }
        }

        @Override
        public int rank() {
            return 2;
        }

        @Override
        public String text() {
            return name;
        }

        @Override
        public boolean contains(Symbol symbol) {
            return equals(symbol);
        }
    }

    record Function(String name, Expression argument) implements Atom {
        public Function {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(argument, "argument");
        }

        @Override
        public int rank() {
            return 3;
        }

        @Override
        public String text() {
            return name + "(" + argument + ")";
        }

        @Override
        public boolean contains(Symbol symbol) {
            return argument.contains(symbol);
        }
    }

    /**
     * base**exponent where the exponent is not a rational number.
     */
    record Power(Expression base, Expression exponent) implements Atom {
        public Power {
            Objects.requireNonNull(base, "base");
            Objects.requireNonNull(exponent, "exponent");
        }

        @Override
        public int rank() {
            return 4;
        }

        @Override
        public String text() {
            return ExpressionFormatter.asPowerOperand(base) + "**" + ExpressionFormatter.asPowerOperand(exponent);
        }

        @Override
        public boolean contains(Symbol symbol) {
            return base.contains(symbol) || exponent.contains(symbol);
        }
    }

    /**
     * A sum of several terms kept as one factor, used for denominators and fractional powers.
     */
    record Group(Expression base) implements Atom {
        public Group {
            Objects.requireNonNull(base, "base");
        }

        @Override
        public int rank() {
            return 5;
        }

        @Override
        public String text() {
            return "(" + base + ")";
        }

        @Override
        public boolean contains(Symbol symbol) {
            return base.contains(symbol);
        }
    }
}
