package com.linlay.calculatoragent.calculator;

import org.apache.commons.math3.complex.Complex;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw output of an operation handler, before formatting.
 */
public sealed interface OperationResult permits
        OperationResult.Scalar,
        OperationResult.Vector,
        OperationResult.Grid,
        OperationResult.NamedValues,
        OperationResult.Text,
        OperationResult.Report,
        OperationResult.Failure {

    default boolean isFailure() {
        return this instanceof Failure;
    }

    record Scalar(double value) implements OperationResult {
    }

    /**
     * One-dimensional array, possibly complex (eigenvalues).
     */
    record Vector(List<Complex> values) implements OperationResult {
        public Vector {
            values = List.copyOf(values);
        }
    }

    /**
     * Two-dimensional numeric array (matrix inverse).
     */
    record Grid(double[][] values) implements OperationResult {
    }

    /**
     * Named statistics in insertion order.
     */
    record NamedValues(Map<String, Double> values) implements OperationResult {
        public NamedValues {
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }
    }

    /**
     * A value rendered as text, e.g. a symbolic expression or {@code x = [2, 3]}.
     */
    record Text(String text) implements OperationResult {
    }

    /**
     * A complete sentence that is shown without a {@code Result:} prefix.
     */
    record Report(String text) implements OperationResult {
    }

    record Failure(ErrorKind kind, String message) implements OperationResult {
    }

    static Failure failure(ErrorKind kind, String message) {
        return new Failure(kind, message);
    }
}
