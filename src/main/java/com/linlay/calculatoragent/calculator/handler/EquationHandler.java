package com.linlay.calculatoragent.calculator.handler;

import com.linlay.calculatoragent.calculator.Category;
import com.linlay.calculatoragent.calculator.ErrorKind;
import com.linlay.calculatoragent.calculator.OperationResult;
import com.linlay.calculatoragent.calculator.ParameterSet;
import com.linlay.calculatoragent.calculator.symbolic.EquationSolution;
import com.linlay.calculatoragent.calculator.symbolic.ExpressionParseException;
import com.linlay.calculatoragent.calculator.symbolic.Root;
import com.linlay.calculatoragent.calculator.symbolic.SymbolicEngine;
import com.linlay.calculatoragent.calculator.symbolic.SymbolicException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

public class EquationHandler extends AbstractSymbolicHandler {

    private static final Logger log = LoggerFactory.getLogger(EquationHandler.class);

    public EquationHandler(SymbolicEngine engine) {
        super(engine);
    }

    @Override
    public Category category() {
        return Category.EQUATION;
    }

    @Override
    public OperationResult handle(ParameterSet params) {
        Optional<String> equation = params.text(ParameterSet.EQUATION).filter(text -> !text.isBlank());
        if (equation.isEmpty()) {
            return new OperationResult.Failure(ErrorKind.EXTRACTION_GAP, "No equation provided to solve");
        }
        String variable = params.text(ParameterSet.VARIABLE, "x");
        String normalized = normalize(equation.get());
        try {
            EquationSolution solution = engine.solve(normalized, variable);
            if (solution instanceof EquationSolution.Identity) {
                return new OperationResult.Report(
                        "The equation " + normalized + " holds for every value of " + variable);
            }
            List<Root> roots = ((EquationSolution.Roots) solution).roots();
            if (roots.isEmpty()) {
                return new OperationResult.Report("No solution found for the equation " + normalized);
            }
            if (roots.size() == 1) {
                return new OperationResult.Text(variable + " = " + roots.get(0));
            }
            return new OperationResult.Text(variable + " = " + roots.stream()
                    .map(Root::toString)
                    .collect(Collectors.joining(", ", "[", "]")));
        } catch (ExpressionParseException e) {
            return new OperationResult.Failure(ErrorKind.PARSE_FAILURE, "Error solving equation: " + e.getMessage());
        } catch (SymbolicException e) {
            log.warn("Solving '{}' failed: {}", normalized, e.getMessage());
            return engineFailure("Error solving equation: ", e);
        } catch (RuntimeException e) {
            log.warn("Solving '{}' failed", normalized, e);
            return new OperationResult.Failure(ErrorKind.COMPUTATION_FAILURE, "Error solving equation: " + e.getMessage());
        }
    }

    private static String normalize(String equation) {
        int equals = equation.indexOf('=');
        if (equals < 0) {
            return equation.trim();
        }
        return equation.substring(0, equals).trim() + " = " + equation.substring(equals + 1).trim();
    }
}
