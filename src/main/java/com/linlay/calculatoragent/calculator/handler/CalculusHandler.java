package com.linlay.calculatoragent.calculator.handler;

import com.linlay.calculatoragent.calculator.Category;
import com.linlay.calculatoragent.calculator.ErrorKind;
import com.linlay.calculatoragent.calculator.OperationResult;
import com.linlay.calculatoragent.calculator.ParameterSet;
import com.linlay.calculatoragent.calculator.symbolic.ExpressionParseException;
import com.linlay.calculatoragent.calculator.symbolic.LimitPoint;
import com.linlay.calculatoragent.calculator.symbolic.SymbolicEngine;
import com.linlay.calculatoragent.calculator.symbolic.SymbolicException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Derivatives, antiderivatives and limits. Limits default to the point 0 and are taken from the
 * right.
 */
public class CalculusHandler extends AbstractSymbolicHandler {

    private static final Logger log = LoggerFactory.getLogger(CalculusHandler.class);

    public CalculusHandler(SymbolicEngine engine) {
        super(engine);
    }

    @Override
    public Category category() {
        return Category.CALCULUS;
    }

    @Override
    public OperationResult handle(ParameterSet params) {
        Optional<String> expression = params.text(ParameterSet.EXPRESSION).filter(text -> !text.isBlank());
        if (expression.isEmpty()) {
            return new OperationResult.Failure(ErrorKind.EXTRACTION_GAP, "No expression provided for calculus operation");
        }
        String variable = params.text(ParameterSet.VARIABLE, "x");
        String operation = params.text(ParameterSet.OPERATION, "").toLowerCase(Locale.ROOT);
        try {
            switch (operation) {
                case "derivative":
                    return new OperationResult.Text(engine.derivative(expression.get(), variable).toString());
                case "integrate":
                    return new OperationResult.Text(engine.integrate(expression.get(), variable));
                case "limit":
                    LimitPoint point = engine.limitPoint(params.text(ParameterSet.APPROACH).orElse(null));
                    return new OperationResult.Text(engine.limit(expression.get(), variable, point).toString());
                default:
                    return new OperationResult.Failure(ErrorKind.EXTRACTION_GAP, "Unknown calculus operation");
            }
        } catch (ExpressionParseException e) {
            return parseFailure(e);
        } catch (SymbolicException e) {
            log.warn("Calculus {} failed: {}", operation, e.getMessage());
            return engineFailure("Error performing calculus calculation: ", e);
        } catch (RuntimeException e) {
            log.warn("Calculus {} failed", operation, e);
            return new OperationResult.Failure(ErrorKind.COMPUTATION_FAILURE,
                    "Error performing calculus calculation: " + e.getMessage());
        }
    }
}
