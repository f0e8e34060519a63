package com.linlay.calculatoragent.calculator.handler;

import com.linlay.calculatoragent.calculator.ErrorKind;
import com.linlay.calculatoragent.calculator.OperationResult;
import com.linlay.calculatoragent.calculator.ParameterSet;
import com.linlay.calculatoragent.config.CalculatorProperties;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MatrixHandlerTest {

    private final MatrixHandler handler = new MatrixHandler(new CalculatorProperties());

    @Test
    void shouldComputeDeterminantByLuDecomposition() {
        OperationResult result = handler.handle(params("determinant", new double[][]{{1, 2}, {3, 4}}));

        assertThat(result).isInstanceOf(OperationResult.Scalar.class);
        assertThat(((OperationResult.Scalar) result).value()).isCloseTo(-2.0, within(1e-12));
    }

    @Test
    void shouldReturnInverseAsGrid() {
        OperationResult result = handler.handle(params("inverse", new double[][]{{4, 7}, {2, 6}}));

        assertThat(result).isInstanceOf(OperationResult.Grid.class);
        double[][] inverse = ((OperationResult.Grid) result).values();
        assertThat(inverse[0][0]).isCloseTo(0.6, within(1e-12));
        assertThat(inverse[0][1]).isCloseTo(-0.7, within(1e-12));
        assertThat(inverse[1][0]).isCloseTo(-0.2, within(1e-12));
        assertThat(inverse[1][1]).isCloseTo(0.4, within(1e-12));
    }

    @Test
    void shouldRejectInverseOfSingularMatrix() {
        OperationResult result = handler.handle(params("inverse", new double[][]{{1, 2}, {2, 4}}));

        assertThat(result).isEqualTo(new OperationResult.Failure(
                ErrorKind.DOMAIN_VIOLATION, "Matrix is singular, cannot compute inverse"));
    }

    @Test
    void shouldRejectSquareOnlyOperationsOnNonSquareMatrix() {
        double[][] wide = {{1, 2, 3}, {4, 5, 6}};

        assertThat(handler.handle(params("determinant", wide))).isEqualTo(new OperationResult.Failure(
                ErrorKind.DOMAIN_VIOLATION, "Cannot calculate determinant of non-square matrix"));
        assertThat(handler.handle(params("inverse", wide))).isEqualTo(new OperationResult.Failure(
                ErrorKind.DOMAIN_VIOLATION, "Cannot calculate inverse of non-square matrix"));
        assertThat(handler.handle(params("eigenvalues", wide))).isEqualTo(new OperationResult.Failure(
                ErrorKind.DOMAIN_VIOLATION, "Cannot calculate eigenvalues of non-square matrix"));
    }

    @Test
    void shouldSortEigenvaluesIncludingComplexOnes() {
        List<Complex> real = ((OperationResult.Vector) handler.handle(
                params("eigenvalues", new double[][]{{3, 0}, {0, 2}}))).values();
        assertThat(real).hasSize(2);
        assertThat(real.get(0).getReal()).isCloseTo(2.0, within(1e-12));
        assertThat(real.get(1).getReal()).isCloseTo(3.0, within(1e-12));

        List<Complex> rotation = ((OperationResult.Vector) handler.handle(
                params("eigenvalues", new double[][]{{0, -1}, {1, 0}}))).values();
        assertThat(rotation).hasSize(2);
        assertThat(rotation.get(0).getImaginary()).isCloseTo(-1.0, within(1e-12));
        assertThat(rotation.get(1).getImaginary()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void shouldReportShapeRankAndNormForInfo() {
        OperationResult result = handler.handle(params("info", new double[][]{{1, 2}, {2, 4}}));

        assertThat(result).isEqualTo(new OperationResult.Report(
                "Matrix information:\nShape: (2, 2)\nRank: 1\nFrobenius Norm: 5.0000"));
    }

    @Test
    void shouldHonourRandomMatrixDimensions() {
        ParameterSet params = ParameterSet.builder()
                .put(ParameterSet.OPERATION, "info")
                .put(ParameterSet.ROWS, 2)
                .put(ParameterSet.COLS, 5)
                .build();

        OperationResult result = handler.handle(params);

        assertThat(((OperationResult.Report) result).text()).contains("Shape: (2, 5)");
    }

    @Test
    void shouldRejectZeroDimension() {
        ParameterSet params = ParameterSet.builder()
                .put(ParameterSet.ROWS, 0)
                .put(ParameterSet.COLS, 3)
                .build();

        OperationResult result = handler.handle(params);

        assertThat(result).isInstanceOf(OperationResult.Failure.class);
        assertThat(((OperationResult.Failure) result).kind()).isEqualTo(ErrorKind.DOMAIN_VIOLATION);
    }

    @Test
    void shouldReportMissingMatrixAsExtractionGap() {
        assertThat(handler.handle(ParameterSet.builder().put(ParameterSet.OPERATION, "determinant").build()))
                .isEqualTo(new OperationResult.Failure(ErrorKind.EXTRACTION_GAP, "Insufficient matrix information provided"));
    }

    @Test
    void shouldReportUnreadableLiteralAsParseFailure() {
        ParameterSet params = ParameterSet.builder()
                .put(ParameterSet.OPERATION, "determinant")
                .put(ParameterSet.LITERAL_ERROR, "expected a number")
                .build();

        OperationResult result = handler.handle(params);

        assertThat(((OperationResult.Failure) result).kind()).isEqualTo(ErrorKind.PARSE_FAILURE);
    }

    private static ParameterSet params(String operation, double[][] values) {
        return ParameterSet.builder()
                .put(ParameterSet.OPERATION, operation)
                .put(ParameterSet.VALUES, values)
                .build();
    }
}
