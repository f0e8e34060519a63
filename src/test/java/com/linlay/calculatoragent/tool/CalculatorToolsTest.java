package com.linlay.calculatoragent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.calculatoragent.calculator.CalculatorEngine;
import com.linlay.calculatoragent.calculator.CalculatorFixtures;
import com.linlay.calculatoragent.calculator.matrix.MatrixLiteralParser;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CalculatorToolsTest {

    private final CalculatorEngine engine = CalculatorFixtures.engine();

    @Test
    void shouldRunWholePipelineFromCalculatorTool() {
        JsonNode result = new CalculatorTool(engine).invoke(Map.of("query", "solve x^2 - 5x + 6 = 0 for x"));

        assertThat(result.path("category").asText()).isEqualTo("equation");
        assertThat(result.path("answer").asText()).isEqualTo("Result: x = [2, 3]");
        assertThat(result.path("ok").asBoolean()).isTrue();
    }

    @Test
    void shouldTolerateMissingQueryInCalculatorTool() {
        JsonNode result = new CalculatorTool(engine).invoke(Map.of());

        assertThat(result.path("answer").asText()).isNotBlank();
        assertThat(result.path("ok").asBoolean()).isFalse();
    }

    @Test
    void shouldAcceptNestedListsAndLiteralsForMatrix() {
        MatrixOperationTool tool = new MatrixOperationTool(engine, new MatrixLiteralParser());

        JsonNode fromList = tool.invoke(Map.of("operation", "determinant", "matrix", List.of(List.of(1, 2), List.of(3, 4))));
        JsonNode fromText = tool.invoke(Map.of("operation", "Determinant", "matrix", "[[1, 2], [3, 4]]"));

        assertThat(fromList.path("answer").asText()).isEqualTo("Result: -2");
        assertThat(fromText).isEqualTo(fromList);
        assertThat(fromList.path("operation").asText()).isEqualTo("determinant");
    }

    @Test
    void shouldReportBadMatrixArgument() {
        JsonNode result = new MatrixOperationTool(engine, new MatrixLiteralParser())
                .invoke(Map.of("operation", "inverse", "matrix", List.of(List.of(1, "x"))));

        assertThat(result.path("ok").asBoolean()).isFalse();
        assertThat(result.path("answer").asText()).startsWith("Could not read the matrix literal");
    }

    @Test
    void shouldAcceptArraysAndStringsForStatistics() {
        StatisticsTool tool = new StatisticsTool(engine);

        assertThat(tool.invoke(Map.of("operation", "mean", "data", List.of(1, 2, 3, 4))).path("answer").asText())
                .isEqualTo("Result: 2.5");
        assertThat(tool.invoke(Map.of("operation", "median", "data", "5, 1, 3")).path("answer").asText())
                .isEqualTo("Result: 3");
        assertThat(tool.invoke(Map.of("data", List.of(1, 2, 3, 4))).path("answer").asText())
                .startsWith("Mean: 2.5\nMedian: 2.5\n");
    }

    @Test
    void shouldRejectNonNumericStatisticsData() {
        JsonNode result = new StatisticsTool(engine).invoke(Map.of("operation", "mean", "data", "1, two, 3"));

        assertThat(result.path("ok").asBoolean()).isFalse();
        assertThat(result.path("answer").asText()).isEqualTo("Invalid data value: 'two'");
    }

    @Test
    void shouldDefaultSymbolicToolArguments() {
        assertThat(new SolveEquationTool(engine).invoke(Map.of("equation", "2x - 8")).path("answer").asText())
                .isEqualTo("Result: x = 4");
        assertThat(new AlgebraTool(engine).invoke(Map.of("operation", "expand", "expression", "(x - 1)^2"))
                .path("answer").asText()).isEqualTo("Result: x**2 - 2*x + 1");

        Map<String, Object> limit = new HashMap<>();
        limit.put("operation", "limit");
        limit.put("expression", "(x^2 - 9)/(x - 3)");
        limit.put("approach", 3);
        assertThat(new CalculusTool(engine).invoke(limit).path("answer").asText()).isEqualTo("Result: 6");
        assertThat(new CalculusTool(engine).invoke(Map.of("expression", "t^2", "variable", "t"))
                .path("answer").asText()).isEqualTo("Result: 2*t");
    }

    @Test
    void shouldNotThrowOnMissingExpression() {
        JsonNode result = new AlgebraTool(engine).invoke(Map.of("operation", "factor"));

        assertThat(result.path("ok").asBoolean()).isFalse();
        assertThat(result.path("answer").asText()).isEqualTo("No expression provided for algebraic operation");
    }
}
