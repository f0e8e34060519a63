package com.linlay.calculatoragent.calculator.handler;

import com.linlay.calculatoragent.calculator.Category;
import com.linlay.calculatoragent.calculator.OperationResult;
import com.linlay.calculatoragent.calculator.ParameterSet;

/**
 * Computes the operations of one {@link Category}. Implementations never throw: every problem is
 * returned as an {@link OperationResult.Failure}.
 */
public interface OperationHandler {

    Category category();

    OperationResult handle(ParameterSet params);
}
