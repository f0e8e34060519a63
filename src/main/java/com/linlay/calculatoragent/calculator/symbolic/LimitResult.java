package com.linlay.calculatoragent.calculator.symbolic;

/**
 * A finite limit value, or a signed infinity.
 */
public record LimitResult(Expression value, int infinitySign) {

    static LimitResult finite(Expression value) {
        return new LimitResult(value, 0);
    }

    static LimitResult infinity(int sign) {
        return new LimitResult(null, sign < 0 ? -1 : 1);
    }

    public boolean isInfinite() {
        return infinitySign != 0;
    }

    @Override
    public String toString() {
        if (infinitySign > 0) {
            return "oo";
        }
        if (infinitySign < 0) {
            return "-oo";
        }
        return value.toString();
    }
}
