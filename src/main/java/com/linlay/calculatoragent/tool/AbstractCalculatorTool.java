package com.linlay.calculatoragent.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.calculatoragent.calculator.CalculatorEngine;
import com.linlay.calculatoragent.calculator.Category;
import com.linlay.calculatoragent.calculator.OperationResult;
import com.linlay.calculatoragent.calculator.ParameterSet;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Base of the tools that call one operation handler directly with structured arguments.
 */
public abstract class AbstractCalculatorTool implements BaseTool {

    protected static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    protected final CalculatorEngine engine;

    protected AbstractCalculatorTool(CalculatorEngine engine) {
        this.engine = engine;
    }

    protected ObjectNode run(Category category, ParameterSet params) {
        OperationResult result = engine.dispatcher().dispatch(category, params);
        ObjectNode root = OBJECT_MAPPER.createObjectNode();
        root.put("operation", params.text(ParameterSet.OPERATION, category.value()));
        root.put("answer", engine.formatter().format(result, category));
        root.put("ok", !result.isFailure());
        return root;
    }

    protected ObjectNode rejected(String operation, String message) {
        ObjectNode root = OBJECT_MAPPER.createObjectNode();
        root.put("operation", operation);
        root.put("answer", message);
        root.put("ok", false);
        return root;
    }

    protected static String readString(Map<String, Object> args, String key) {
        if (args == null) {
            return null;
        }
        Object value = args.get(key);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    protected static String readOperation(Map<String, Object> args, String fallback) {
        String operation = readString(args, "operation");
        return operation == null ? fallback : operation.toLowerCase(Locale.ROOT);
    }

    protected static Map<String, Object> stringProperty(String description) {
        return Map.of("type", "string", "description", description);
    }

    protected static Map<String, Object> enumProperty(String description, List<String> values) {
        return Map.of("type", "string", "description", description, "enum", values);
    }

    protected static Map<String, Object> objectSchema(Map<String, Object> properties, List<String> required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        schema.put("additionalProperties", false);
        return schema;
    }
}
