package com.linlay.calculatoragent.calculator.handler;

import com.linlay.calculatoragent.calculator.Category;
import com.linlay.calculatoragent.calculator.ErrorKind;
import com.linlay.calculatoragent.calculator.OperationResult;
import com.linlay.calculatoragent.calculator.ParameterSet;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Descriptive statistics over the numbers of a request. Variance and standard deviation are
 * population statistics; percentiles interpolate linearly between closest ranks.
 */
public class StatisticsHandler implements OperationHandler {

    private static final Logger log = LoggerFactory.getLogger(StatisticsHandler.class);

    @Override
    public Category category() {
        return Category.STATISTICS;
    }

    @Override
    public OperationResult handle(ParameterSet params) {
        List<Double> numbers = params.numbers(ParameterSet.DATA).orElse(List.of());
        if (numbers.isEmpty()) {
            return new OperationResult.Failure(ErrorKind.EXTRACTION_GAP, "No data provided for statistical analysis");
        }
        double[] data = numbers.stream().mapToDouble(Double::doubleValue).toArray();
        String operation = params.text(ParameterSet.OPERATION, "summary").toLowerCase(Locale.ROOT);
        try {
            return switch (operation) {
                case "mean" -> new OperationResult.Scalar(StatUtils.mean(data));
                case "median" -> new OperationResult.Scalar(percentile(data, 50));
                case "variance" -> new OperationResult.Scalar(new Variance(false).evaluate(data));
                case "std" -> new OperationResult.Scalar(new StandardDeviation(false).evaluate(data));
                case "correlation" -> correlation(data);
                default -> summary(data);
            };
        } catch (RuntimeException e) {
            log.warn("Statistics {} failed: {}", operation, e.getMessage());
            return new OperationResult.Failure(ErrorKind.COMPUTATION_FAILURE,
                    "Error performing statistics calculation: " + e.getMessage());
        }
    }

    /**
     * Correlates the first half of the data with the second half.
     */
    private static OperationResult correlation(double[] data) {
        if (data.length < 2) {
            return new OperationResult.Failure(ErrorKind.DOMAIN_VIOLATION, "Need at least two datasets for correlation");
        }
        if (data.length % 2 != 0) {
            return new OperationResult.Failure(ErrorKind.DOMAIN_VIOLATION,
                    "Correlation needs an even number of values to split into two equal datasets, got " + data.length);
        }
        int mid = data.length / 2;
        if (mid < 2) {
            return new OperationResult.Failure(ErrorKind.DOMAIN_VIOLATION,
                    "Each dataset needs at least two values for correlation");
        }
        double[] first = Arrays.copyOfRange(data, 0, mid);
        double[] second = Arrays.copyOfRange(data, mid, data.length);
        double coefficient = new PearsonsCorrelation().correlation(first, second);
        if (Double.isNaN(coefficient)) {
            return new OperationResult.Failure(ErrorKind.DOMAIN_VIOLATION,
                    "Correlation is undefined when a dataset has no variance");
        }
        return new OperationResult.Scalar(coefficient);
    }

    private static OperationResult summary(double[] data) {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("mean", StatUtils.mean(data));
        values.put("median", percentile(data, 50));
        values.put("std", new StandardDeviation(false).evaluate(data));
        values.put("min", StatUtils.min(data));
        values.put("max", StatUtils.max(data));
        values.put("q1", percentile(data, 25));
        values.put("q3", percentile(data, 75));
        return new OperationResult.NamedValues(values);
    }

    private static double percentile(double[] data, double quantile) {
        return new Percentile(quantile)
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(data);
    }
}
