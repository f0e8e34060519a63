package com.linlay.calculatoragent.calculator.handler;

import com.linlay.calculatoragent.calculator.ErrorKind;
import com.linlay.calculatoragent.calculator.OperationResult;
import com.linlay.calculatoragent.calculator.symbolic.ExpressionParseException;
import com.linlay.calculatoragent.calculator.symbolic.SymbolicEngine;
import com.linlay.calculatoragent.calculator.symbolic.SymbolicException;
import com.linlay.calculatoragent.calculator.symbolic.UndefinedExpressionException;

/**
 * Shared plumbing of the handlers backed by the {@link SymbolicEngine}.
 */
abstract class AbstractSymbolicHandler implements OperationHandler {

    protected final SymbolicEngine engine;

    protected AbstractSymbolicHandler(SymbolicEngine engine) {
        this.engine = engine;
    }

    protected static OperationResult.Failure parseFailure(ExpressionParseException e) {
        return new OperationResult.Failure(ErrorKind.PARSE_FAILURE, "Error parsing expression: " + e.getMessage());
    }

    /**
     * Maps an engine failure other than a parse error onto the error taxonomy.
     */
    protected static OperationResult.Failure engineFailure(String prefix, SymbolicException e) {
        ErrorKind kind = e instanceof UndefinedExpressionException
                ? ErrorKind.DOMAIN_VIOLATION
                : ErrorKind.COMPUTATION_FAILURE;
        return new OperationResult.Failure(kind, prefix + e.getMessage());
    }
}
