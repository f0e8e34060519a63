package com.linlay.calculatoragent.calculator.symbolic;

/**
 * Raised when a value is mathematically undefined, e.g. a division by zero or log(0)
 * produced while substituting a point into an expression.
 */
public class UndefinedExpressionException extends SymbolicException {

    public UndefinedExpressionException(String message) {
        super(message);
    }
}
