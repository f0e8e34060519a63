package com.linlay.calculatoragent.calculator.matrix;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatrixLiteralParserTest {

    private final MatrixLiteralParser parser = new MatrixLiteralParser();

    @Test
    void shouldReadJsonStyleLiteral() {
        assertThat(parser.parse("[[1, 2], [3, 4]]")).isDeepEqualTo(new double[][]{{1, 2}, {3, 4}});
        assertThat(parser.parse("[[1.5, -2e3]]")).isDeepEqualTo(new double[][]{{1.5, -2000}});
    }

    @Test
    void shouldAcceptTrailingCommasAndUnderscores() {
        assertThat(parser.parse("[[1, 2,], [3, 4],]")).isDeepEqualTo(new double[][]{{1, 2}, {3, 4}});
        assertThat(parser.parse("[[1_000, 2]]")).isDeepEqualTo(new double[][]{{1000, 2}});
    }

    @Test
    void shouldRejectRaggedRows() {
        assertThatThrownBy(() -> parser.parse("[[1, 2], [3]]"))
                .isInstanceOf(MatrixLiteralException.class)
                .hasMessageContaining("must all have 2 values");
    }

    @Test
    void shouldNeverEvaluateExpressions() {
        assertThatThrownBy(() -> parser.parse("[[1 + 1, 2], [3, 4]]"))
                .isInstanceOf(MatrixLiteralException.class);
        assertThatThrownBy(() -> parser.parse("[[__import__('os'), 2]]"))
                .isInstanceOf(MatrixLiteralException.class);
    }

    @Test
    void shouldRejectEmptyInput() {
        assertThatThrownBy(() -> parser.parse("[]")).isInstanceOf(MatrixLiteralException.class);
        assertThatThrownBy(() -> parser.parse(" ")).isInstanceOf(MatrixLiteralException.class);
    }
}
