package com.linlay.calculatoragent.calculator.symbolic;

public class ExpressionParseException extends SymbolicException {

    private final String source;
    private final int position;

    public ExpressionParseException(String message, String source, int position) {
        super(message);
        this.source = source;
        this.position = position;
    }

    public String source() {
        return source;
    }

    public int position() {
        return position;
    }
}
