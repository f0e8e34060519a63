package com.linlay.calculatoragent.calculator.symbolic;

public class UnsupportedSymbolicOperationException extends SymbolicException {

    public UnsupportedSymbolicOperationException(String message) {
        super(message);
    }
}
