package com.linlay.calculatoragent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.calculatoragent.calculator.CalculatorEngine;
import com.linlay.calculatoragent.calculator.Category;
import com.linlay.calculatoragent.calculator.ParameterSet;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class CalculusTool extends AbstractCalculatorTool {

    public CalculusTool(CalculatorEngine engine) {
        super(engine);
    }

    @Override
    public String name() {
        return "calculus";
    }

    @Override
    public String description() {
        return "Derivative, indefinite integral or limit of an expression.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return objectSchema(Map.of(
                "operation", enumProperty("Calculus operation", List.of("derivative", "integrate", "limit")),
                "expression", stringProperty("Expression such as 'x^2 * sin(x)'"),
                "variable", stringProperty("Variable, default x"),
                "approach", stringProperty("Limit point: a number, 'infinity' or '-infinity'; default 0")
        ), List.of("operation", "expression"));
    }

    @Override
    public JsonNode invoke(Map<String, Object> args) {
        String variable = readString(args, "variable");
        ParameterSet params = ParameterSet.builder()
                .put(ParameterSet.OPERATION, readOperation(args, "derivative"))
                .put(ParameterSet.EXPRESSION, readString(args, "expression"))
                .put(ParameterSet.VARIABLE, variable == null ? "x" : variable)
                .put(ParameterSet.APPROACH, readString(args, "approach"))
                .build();
        return run(Category.CALCULUS, params);
    }
}
