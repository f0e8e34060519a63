package com.linlay.calculatoragent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.calculatoragent.calculator.CalculatorEngine;
import com.linlay.calculatoragent.calculator.CalculatorFixtures;
import com.linlay.calculatoragent.calculator.matrix.MatrixLiteralParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolRegistryTest {

    private final CalculatorEngine engine = CalculatorFixtures.engine();
    private final ToolRegistry registry = new ToolRegistry(List.of(
            new CalculatorTool(engine),
            new MatrixOperationTool(engine, new MatrixLiteralParser()),
            new StatisticsTool(engine),
            new SolveEquationTool(engine),
            new CalculusTool(engine),
            new AlgebraTool(engine)
    ));

    @Test
    void shouldListToolsSortedByName() {
        assertThat(registry.list()).extracting(BaseTool::name).containsExactly(
                "algebra", "calculator", "calculus", "matrix_operation", "solve_equation", "statistics");
    }

    @Test
    void shouldNormalizeToolNameOnInvoke() {
        JsonNode result = registry.invoke(" Calculator ", Map.of("query", "2 + 2"));

        assertThat(result.path("answer").asText()).isEqualTo("Result: 4");
    }

    @Test
    void shouldRejectUnknownTool() {
        assertThatThrownBy(() -> registry.invoke("weather", Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown tool: weather");
        assertThat(registry.find("weather")).isEmpty();
    }

    @Test
    void shouldRejectDuplicateToolNames() {
        assertThatThrownBy(() -> new ToolRegistry(List.of(new AlgebraTool(engine), new AlgebraTool(engine))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldDescribeArgumentsOfEveryTool() {
        for (BaseTool tool : registry.list()) {
            assertThat(tool.description()).as(tool.name()).isNotBlank();
            assertThat(tool.parametersSchema()).as(tool.name()).containsEntry("type", "object").containsKey("properties");
        }
    }

    @Test
    void shouldOnlyGiveAfterCallHintWhereOneIsDefined() {
        assertThat(registry.list())
                .filteredOn(tool -> !tool.afterCallHint().isEmpty())
                .extracting(BaseTool::name)
                .containsExactly("statistics");
    }
}
