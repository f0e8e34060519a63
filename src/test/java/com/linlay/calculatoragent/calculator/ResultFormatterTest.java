package com.linlay.calculatoragent.calculator;

import com.linlay.calculatoragent.config.CalculatorProperties;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResultFormatterTest {

    private final ResultFormatter formatter = new ResultFormatter(new CalculatorProperties());

    @Test
    void shouldHideFloatingPointNoiseInScalars() {
        assertThat(formatter.format(new OperationResult.Scalar(-2.0000000000000004), Category.MATRIX)).isEqualTo("Result: -2");
        assertThat(formatter.format(new OperationResult.Scalar(0.1 + 0.2), Category.ARITHMETIC)).isEqualTo("Result: 0.3");
        assertThat(formatter.format(new OperationResult.Scalar(4.0), Category.ARITHMETIC)).isEqualTo("Result: 4");
        assertThat(formatter.format(new OperationResult.Scalar(1e20), Category.ARITHMETIC))
                .isEqualTo("Result: 100000000000000000000");
    }

    @Test
    void shouldSpellNonFiniteScalars() {
        assertThat(formatter.scalar(Double.NaN)).isEqualTo("nan");
        assertThat(formatter.scalar(Double.NEGATIVE_INFINITY)).isEqualTo("-inf");
        assertThat(formatter.scalar(-0.0)).isEqualTo("0");
    }

    @Test
    void shouldUseFixedDecimalsAndAlignGridColumns() {
        String text = formatter.format(new OperationResult.Grid(new double[][]{{-2, 1}, {1.5, -0.5}}), Category.MATRIX);

        assertThat(text).isEqualTo("Result:\n[[-2.0000  1.0000]\n [ 1.5000 -0.5000]]");
    }

    @Test
    void shouldSuppressTinyGridValues() {
        String text = formatter.format(new OperationResult.Grid(new double[][]{{1e-17, -1e-12}}), Category.MATRIX);

        assertThat(text).isEqualTo("Result:\n[[0.0000 0.0000]]");
    }

    @Test
    void shouldRenderRealAndComplexVectors() {
        assertThat(formatter.format(new OperationResult.Vector(List.of(new Complex(2, 0), new Complex(3, 0))), Category.MATRIX))
                .isEqualTo("Result:\n[2.0000 3.0000]");
        assertThat(formatter.format(new OperationResult.Vector(List.of(new Complex(0, -1), new Complex(0, 1))), Category.MATRIX))
                .isEqualTo("Result:\n[0.0000 - 1.0000i, 0.0000 + 1.0000i]");
    }

    @Test
    void shouldRenderOneCapitalizedLinePerNamedValue() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("mean", 2.5);
        values.put("q1", 1.75);
        values.put("max", 4.0);

        assertThat(formatter.format(new OperationResult.NamedValues(values), Category.STATISTICS))
                .isEqualTo("Mean: 2.5\nQ1: 1.75\nMax: 4");
    }

    @Test
    void shouldPrefixTextButNotSentences() {
        assertThat(formatter.format(new OperationResult.Text("x = [2, 3]"), Category.EQUATION)).isEqualTo("Result: x = [2, 3]");
        assertThat(formatter.format(new OperationResult.Report("No solution found for the equation x = x + 1"), Category.EQUATION))
                .isEqualTo("No solution found for the equation x = x + 1");
        assertThat(formatter.format(new OperationResult.Failure(ErrorKind.DOMAIN_VIOLATION, "Matrix is singular, cannot compute inverse"),
                Category.MATRIX)).isEqualTo("Matrix is singular, cannot compute inverse");
    }

    @Test
    void shouldNeverFormatEmptyOutput() {
        assertThat(formatter.format(null, Category.ARITHMETIC)).isEqualTo("Result: None");
        assertThat(formatter.format(new OperationResult.Report(""), Category.ALGEBRA)).isNotBlank();
        assertThat(formatter.format(new OperationResult.Text(""), null)).isNotBlank();
    }

    @Test
    void shouldHonourConfiguredDisplayPrecision() {
        CalculatorProperties properties = new CalculatorProperties();
        properties.setDisplayPrecision(2);
        ResultFormatter twoDecimals = new ResultFormatter(properties);

        assertThat(twoDecimals.format(new OperationResult.Grid(new double[][]{{1.0 / 3}}), Category.MATRIX))
                .isEqualTo("Result:\n[[0.33]]");
    }
}
