package com.linlay.calculatoragent.calculator.handler;

import com.linlay.calculatoragent.calculator.Category;
import com.linlay.calculatoragent.calculator.ErrorKind;
import com.linlay.calculatoragent.calculator.OperationResult;
import com.linlay.calculatoragent.calculator.ParameterSet;
import com.linlay.calculatoragent.calculator.symbolic.Expression;
import com.linlay.calculatoragent.calculator.symbolic.ExpressionParseException;
import com.linlay.calculatoragent.calculator.symbolic.SymbolicEngine;
import com.linlay.calculatoragent.calculator.symbolic.SymbolicException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

public class AlgebraHandler extends AbstractSymbolicHandler {

    private static final Logger log = LoggerFactory.getLogger(AlgebraHandler.class);

    public AlgebraHandler(SymbolicEngine engine) {
        super(engine);
    }

    @Override
    public Category category() {
        return Category.ALGEBRA;
    }

    @Override
    public OperationResult handle(ParameterSet params) {
        Optional<String> expression = params.text(ParameterSet.EXPRESSION).filter(text -> !text.isBlank());
        if (expression.isEmpty()) {
            return new OperationResult.Failure(ErrorKind.EXTRACTION_GAP, "No expression provided for algebraic operation");
        }
        String operation = params.text(ParameterSet.OPERATION, "simplify").toLowerCase(Locale.ROOT);
        try {
            Expression result = switch (operation) {
                case "factor" -> engine.factor(expression.get());
                case "expand" -> engine.expand(expression.get());
                default -> engine.simplify(expression.get());
            };
            return new OperationResult.Text(result.toString());
        } catch (ExpressionParseException e) {
            return parseFailure(e);
        } catch (SymbolicException e) {
            log.warn("Algebra {} failed: {}", operation, e.getMessage());
            return engineFailure("Error performing algebra calculation: ", e);
        } catch (RuntimeException e) {
            log.warn("Algebra {} failed", operation, e);
            return new OperationResult.Failure(ErrorKind.COMPUTATION_FAILURE,
                    "Error performing algebra calculation: " + e.getMessage());
        }
    }
}
