package com.linlay.calculatoragent.calculator.symbolic;

/**
 * Where a limit is taken: a finite value or a signed infinity.
 */
public record LimitPoint(Expression value, int infinitySign) {

    public static final LimitPoint POSITIVE_INFINITY = new LimitPoint(null, 1);
    public static final LimitPoint NEGATIVE_INFINITY = new LimitPoint(null, -1);

    public static LimitPoint at(Expression value) {
        return new LimitPoint(value, 0);
    }

    public boolean infinite() {
        return infinitySign != 0;
    }

    @Override
    public String toString() {
        if (infinitySign != 0) {
            return infinitySign > 0 ? "oo" : "-oo";
        }
        return value.toString();
    }
}
