package com.linlay.calculatoragent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.calculatoragent.calculator.CalculatorEngine;
import com.linlay.calculatoragent.calculator.Category;
import com.linlay.calculatoragent.calculator.ParameterSet;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class StatisticsTool extends AbstractCalculatorTool {

    private static final List<String> OPERATIONS =
            List.of("mean", "median", "variance", "std", "correlation", "summary");

    public StatisticsTool(CalculatorEngine engine) {
        super(engine);
    }

    @Override
    public String name() {
        return "statistics";
    }

    @Override
    public String description() {
        return "Mean, median, population variance or standard deviation, half-split correlation, "
                + "or a summary with quartiles of a list of numbers.";
    }

    @Override
    public String afterCallHint() {
        return "Correlation pairs the first half of the data with the second half.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return objectSchema(Map.of(
                "operation", enumProperty("Statistic to compute", OPERATIONS),
                "data", Map.of(
                        "description", "Numbers as an array or a comma-separated string",
                        "type", List.of("array", "string"),
                        "items", Map.of("type", "number"))
        ), List.of("data"));
    }

    @Override
    public JsonNode invoke(Map<String, Object> args) {
        String operation = readOperation(args, "summary");
        List<Double> data = new ArrayList<>();
        Object raw = args == null ? null : args.get("data");
        List<?> items = raw instanceof List<?> list ? list
                : raw == null ? List.of() : List.of(String.valueOf(raw).split("[,;\\s]+"));
        for (Object item : items) {
            if (item instanceof Number number) {
                data.add(number.doubleValue());
                continue;
            }
            String text = item == null ? "" : String.valueOf(item).trim();
            if (text.isEmpty()) {
                continue;
            }
            try {
                data.add(Double.parseDouble(text));
            } catch (NumberFormatException e) {
                return rejected(operation, "Invalid data value: '" + text + "'");
            }
        }
        ParameterSet.Builder params = ParameterSet.builder().put(ParameterSet.OPERATION, operation);
        if (!data.isEmpty()) {
            params.put(ParameterSet.DATA, data);
        }
        return run(Category.STATISTICS, params.build());
    }
}
