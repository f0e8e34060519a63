package com.linlay.calculatoragent.calculator.arithmetic;

public class ArithmeticParseException extends IllegalArgumentException {

    private final int position;

    public ArithmeticParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int position() {
        return position;
    }
}
