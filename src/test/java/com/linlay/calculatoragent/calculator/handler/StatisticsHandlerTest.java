package com.linlay.calculatoragent.calculator.handler;

import com.linlay.calculatoragent.calculator.ErrorKind;
import com.linlay.calculatoragent.calculator.OperationResult;
import com.linlay.calculatoragent.calculator.ParameterSet;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.within;

class StatisticsHandlerTest {

    private final StatisticsHandler handler = new StatisticsHandler();

    @Test
    void shouldComputePopulationStatistics() {
        List<Double> data = List.of(2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0);

        assertThat(scalar("mean", data)).isEqualTo(5.0);
        assertThat(scalar("variance", data)).isCloseTo(4.0, within(1e-12));
        assertThat(scalar("std", data)).isCloseTo(2.0, within(1e-12));
        assertThat(scalar("median", List.of(3.0, 1.0, 2.0))).isEqualTo(2.0);
        assertThat(scalar("median", List.of(4.0, 1.0, 3.0, 2.0))).isEqualTo(2.5);
    }

    @Test
    void shouldListSummaryStatisticsInOrder() {
        OperationResult result = handler.handle(params("summary", List.of(1.0, 2.0, 3.0, 4.0)));

        assertThat(((OperationResult.NamedValues) result).values())
                .containsExactly(
                        entry("mean", 2.5),
                        entry("median", 2.5),
                        entry("std", Math.sqrt(1.25)),
                        entry("min", 1.0),
                        entry("max", 4.0),
                        entry("q1", 1.75),
                        entry("q3", 3.25));
    }

    @Test
    void shouldCorrelateTheTwoHalves() {
        assertThat(scalar("correlation", List.of(1.0, 2.0, 3.0, 4.0))).isCloseTo(1.0, within(1e-12));
        assertThat(scalar("correlation", List.of(1.0, 2.0, 3.0, 6.0, 4.0, 2.0))).isCloseTo(-1.0, within(1e-12));
    }

    @Test
    void shouldRejectUnusableCorrelationData() {
        assertThat(handler.handle(params("correlation", List.of(5.0)))).isEqualTo(
                new OperationResult.Failure(ErrorKind.DOMAIN_VIOLATION, "Need at least two datasets for correlation"));
        assertThat(kind(handler.handle(params("correlation", List.of(1.0, 2.0, 3.0))))).isEqualTo(ErrorKind.DOMAIN_VIOLATION);
        assertThat(kind(handler.handle(params("correlation", List.of(1.0, 2.0))))).isEqualTo(ErrorKind.DOMAIN_VIOLATION);
        assertThat(kind(handler.handle(params("correlation", List.of(1.0, 1.0, 2.0, 3.0))))).isEqualTo(ErrorKind.DOMAIN_VIOLATION);
    }

    @Test
    void shouldReportMissingDataAsExtractionGap() {
        assertThat(handler.handle(ParameterSet.builder().put(ParameterSet.OPERATION, "mean").build())).isEqualTo(
                new OperationResult.Failure(ErrorKind.EXTRACTION_GAP, "No data provided for statistical analysis"));
    }

    private double scalar(String operation, List<Double> data) {
        OperationResult result = handler.handle(params(operation, data));
        assertThat(result).isInstanceOf(OperationResult.Scalar.class);
        return ((OperationResult.Scalar) result).value();
    }

    private static ErrorKind kind(OperationResult result) {
        return ((OperationResult.Failure) result).kind();
    }

    private static ParameterSet params(String operation, List<Double> data) {
        return ParameterSet.builder()
                .put(ParameterSet.OPERATION, operation)
                .put(ParameterSet.DATA, data)
                .build();
    }
}
