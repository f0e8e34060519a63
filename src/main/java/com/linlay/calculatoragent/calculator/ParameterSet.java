package com.linlay.calculatoragent.calculator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parameters extracted from a request. Which keys are present depends on the {@link Category};
 * a missing key is a normal outcome that the handler reports as an extraction gap.
 */
public final class ParameterSet {

    public static final String OPERATION = "operation";
    public static final String VALUES = "values";
    public static final String ROWS = "rows";
    public static final String COLS = "cols";
    public static final String LITERAL_ERROR = "literalError";
    public static final String DATA = "data";
    public static final String EXPRESSION = "expression";
    public static final String VARIABLE = "variable";
    public static final String APPROACH = "approach";
    public static final String EQUATION = "equation";
    public static final String QUERY = "query";

    private static final ParameterSet EMPTY = new ParameterSet(Map.of());

    private final Map<String, Object> values;

    private ParameterSet(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static ParameterSet empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Optional<String> text(String key) {
        Object value = values.get(key);
        return value instanceof String text ? Optional.of(text) : Optional.empty();
    }

    public String text(String key, String fallback) {
        return text(key).filter(value -> !value.isBlank()).orElse(fallback);
    }

    public Optional<Integer> integer(String key) {
        Object value = values.get(key);
        return value instanceof Integer number ? Optional.of(number) : Optional.empty();
    }

    @SuppressWarnings("unchecked")
    public Optional<List<Double>> numbers(String key) {
        Object value = values.get(key);
        return value instanceof List<?> list ? Optional.of((List<Double>) list) : Optional.empty();
    }

    public Optional<double[][]> matrix(String key) {
        Object value = values.get(key);
        return value instanceof double[][] matrix ? Optional.of(matrix) : Optional.empty();
    }

    @Override
    public String toString() {
        return "ParameterSet" + values.keySet();
    }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, Object value) {
            if (value != null) {
                values.put(key, value instanceof List<?> list ? List.copyOf(list) : value);
            }
            return this;
        }

        public ParameterSet build() {
            return new ParameterSet(new LinkedHashMap<>(values));
        }
    }
}
