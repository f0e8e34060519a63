package com.linlay.calculatoragent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.calculatoragent.calculator.CalculatorEngine;
import com.linlay.calculatoragent.calculator.Category;
import com.linlay.calculatoragent.calculator.ParameterSet;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class AlgebraTool extends AbstractCalculatorTool {

    public AlgebraTool(CalculatorEngine engine) {
        super(engine);
    }

    @Override
    public String name() {
        return "algebra";
    }

    @Override
    public String description() {
        return "Factors, expands or simplifies an algebraic expression.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return objectSchema(Map.of(
                "operation", enumProperty("Algebraic operation", List.of("factor", "expand", "simplify")),
                "expression", stringProperty("Expression such as '(x + 1)^2'")
        ), List.of("expression"));
    }

    @Override
    public JsonNode invoke(Map<String, Object> args) {
        ParameterSet params = ParameterSet.builder()
                .put(ParameterSet.OPERATION, readOperation(args, "simplify"))
                .put(ParameterSet.EXPRESSION, readString(args, "expression"))
                .build();
        return run(Category.ALGEBRA, params);
    }
}
