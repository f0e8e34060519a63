package com.linlay.calculatoragent.calculator.symbolic;

public class SymbolicException extends RuntimeException {

    public SymbolicException(String message) {
        super(message);
    }

    public SymbolicException(String message, Throwable cause) {
        super(message, cause);
    }
}
