package com.linlay.calculatoragent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.calculatoragent.calculator.CalculatorEngine;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class CalculatorTool extends AbstractCalculatorTool {

    public CalculatorTool(CalculatorEngine engine) {
        super(engine);
    }

    @Override
    public String name() {
        return "calculator";
    }

    @Override
    public String description() {
        return "Answers a math question written in plain English: arithmetic, matrices, statistics, "
                + "algebra, calculus or equations.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return objectSchema(Map.of("query", stringProperty("The math question, e.g. 'solve x^2 - 5x + 6 = 0 for x'")),
                List.of("query"));
    }

    @Override
    public JsonNode invoke(Map<String, Object> args) {
        CalculatorEngine.Evaluation evaluation = engine.evaluateDetailed(readString(args, "query"));
        ObjectNode root = OBJECT_MAPPER.createObjectNode();
        root.put("category", evaluation.category().value());
        root.put("answer", evaluation.answer());
        root.put("ok", evaluation.ok());
        return root;
    }
}
