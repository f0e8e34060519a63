package com.linlay.calculatoragent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.calculatoragent.calculator.CalculatorEngine;
import com.linlay.calculatoragent.calculator.Category;
import com.linlay.calculatoragent.calculator.ParameterSet;
import com.linlay.calculatoragent.calculator.matrix.MatrixLiteralException;
import com.linlay.calculatoragent.calculator.matrix.MatrixLiteralParser;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class MatrixOperationTool extends AbstractCalculatorTool {

    private static final List<String> OPERATIONS = List.of("determinant", "inverse", "eigenvalues", "info");

    private final MatrixLiteralParser matrixLiteralParser;

    public MatrixOperationTool(CalculatorEngine engine, MatrixLiteralParser matrixLiteralParser) {
        super(engine);
        this.matrixLiteralParser = matrixLiteralParser;
    }

    @Override
    public String name() {
        return "matrix_operation";
    }

    @Override
    public String description() {
        return "Determinant, inverse, eigenvalues or a shape/rank/norm summary of a matrix.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return objectSchema(Map.of(
                "operation", enumProperty("Matrix operation", OPERATIONS),
                "matrix", Map.of(
                        "description", "Rows of the matrix, as nested arrays or a literal such as [[1, 2], [3, 4]]",
                        "type", List.of("array", "string"))
        ), List.of("operation", "matrix"));
    }

    @Override
    public JsonNode invoke(Map<String, Object> args) {
        String operation = readOperation(args, "info");
        ParameterSet.Builder params = ParameterSet.builder().put(ParameterSet.OPERATION, operation);
        Object matrix = args == null ? null : args.get("matrix");
        if (matrix != null) {
            try {
                params.put(ParameterSet.VALUES, toMatrix(matrix));
            } catch (MatrixLiteralException e) {
                params.put(ParameterSet.LITERAL_ERROR, e.getMessage());
            }
        }
        return run(Category.MATRIX, params.build());
    }

    private double[][] toMatrix(Object value) {
        String literal = value instanceof String text ? text : OBJECT_MAPPER.valueToTree(value).toString();
        return matrixLiteralParser.parse(literal);
    }
}
