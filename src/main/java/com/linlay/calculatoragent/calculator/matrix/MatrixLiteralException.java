package com.linlay.calculatoragent.calculator.matrix;

public class MatrixLiteralException extends IllegalArgumentException {

    public MatrixLiteralException(String message) {
        super(message);
    }

    public MatrixLiteralException(String message, Throwable cause) {
        super(message, cause);
    }
}
