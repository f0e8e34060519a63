package com.linlay.calculatoragent.calculator;

public enum ErrorKind {
    /** A parameter the operation needs was not found in the request. */
    EXTRACTION_GAP,
    /** The operation is mathematically invalid for the given input. */
    DOMAIN_VIOLATION,
    /** The expression, equation or literal text could not be parsed. */
    PARSE_FAILURE,
    /** Anything else that went wrong while computing. */
    COMPUTATION_FAILURE
}
