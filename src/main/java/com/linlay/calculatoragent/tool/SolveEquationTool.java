package com.linlay.calculatoragent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.calculatoragent.calculator.CalculatorEngine;
import com.linlay.calculatoragent.calculator.Category;
import com.linlay.calculatoragent.calculator.ParameterSet;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class SolveEquationTool extends AbstractCalculatorTool {

    public SolveEquationTool(CalculatorEngine engine) {
        super(engine);
    }

    @Override
    public String name() {
        return "solve_equation";
    }

    @Override
    public String description() {
        return "Solves a polynomial equation in one variable. Without '=' the expression is set to zero.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return objectSchema(Map.of(
                "equation", stringProperty("Equation such as 'x^2 - 5x + 6 = 0'"),
                "variable", stringProperty("Variable to solve for, default x")
        ), List.of("equation"));
    }

    @Override
    public JsonNode invoke(Map<String, Object> args) {
        String variable = readString(args, "variable");
        ParameterSet params = ParameterSet.builder()
                .put(ParameterSet.OPERATION, "solve")
                .put(ParameterSet.EQUATION, readString(args, "equation"))
                .put(ParameterSet.VARIABLE, variable == null ? "x" : variable)
                .build();
        return run(Category.EQUATION, params);
    }
}
