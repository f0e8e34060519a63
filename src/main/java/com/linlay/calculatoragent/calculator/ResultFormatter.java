package com.linlay.calculatoragent.calculator;

import com.linlay.calculatoragent.config.CalculatorProperties;
import org.apache.commons.math3.complex.Complex;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders an {@link OperationResult} as the user-facing answer. Scalars keep a fixed number of
 * significant digits, arrays a fixed number of decimals; sentences and failures are shown as they
 * are.
 */
public class ResultFormatter {

    private final int precision;
    private final MathContext significant;

    public ResultFormatter(CalculatorProperties properties) {
        this.precision = properties.getDisplayPrecision();
        this.significant = new MathContext(properties.getScalarSignificantDigits(), RoundingMode.HALF_EVEN);
    }

    public String format(OperationResult result, Category category) {
        if (result == null) {
            return "Result: None";
        }
        String text;
        if (result instanceof OperationResult.Scalar scalar) {
            text = "Result: " + scalar(scalar.value());
        } else if (result instanceof OperationResult.Vector vector) {
            text = "Result:\n" + vector(vector.values());
        } else if (result instanceof OperationResult.Grid grid) {
            text = "Result:\n" + grid(grid.values());
        } else if (result instanceof OperationResult.NamedValues named) {
            text = namedValues(named.values());
        } else if (result instanceof OperationResult.Text value) {
            text = "Result: " + value.text();
        } else if (result instanceof OperationResult.Report report) {
            text = report.text();
        } else {
            text = ((OperationResult.Failure) result).message();
        }
        if (text == null || text.isBlank()) {
            return "Result: " + (category == null ? "None" : "no output for " + category.value() + " request");
        }
        return text;
    }

    public String scalar(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0) {
            return "0";
        }
        BigDecimal rounded = new BigDecimal(value).round(significant).stripTrailingZeros();
        return rounded.signum() == 0 ? "0" : rounded.toPlainString();
    }

    private String namedValues(Map<String, Double> values) {
        StringJoiner lines = new StringJoiner("\n");
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            lines.add(capitalize(entry.getKey()) + ": " + scalar(entry.getValue()));
        }
        return lines.toString();
    }

    private String vector(List<Complex> values) {
        boolean real = values.stream().allMatch(value -> isNegligible(value.getImaginary()));
        List<String> cells = new ArrayList<>();
        for (Complex value : values) {
            cells.add(real ? fixed(value.getReal()) : complex(value));
        }
        return real ? row(pad(cells)) : "[" + String.join(", ", cells) + "]";
    }

    private String grid(double[][] values) {
        List<String> cells = new ArrayList<>();
        for (double[] row : values) {
            for (double value : row) {
                cells.add(fixed(value));
            }
        }
        List<String> padded = pad(cells);
        StringJoiner rows = new StringJoiner("\n ", "[", "]");
        int index = 0;
        for (double[] row : values) {
            rows.add(row(padded.subList(index, index + row.length)));
            index += row.length;
        }
        return rows.toString();
    }

    private static String row(List<String> cells) {
        return "[" + String.join(" ", cells) + "]";
    }

    private static List<String> pad(List<String> cells) {
        int width = cells.stream().mapToInt(String::length).max().orElse(0);
        List<String> padded = new ArrayList<>(cells.size());
        for (String cell : cells) {
            padded.add(" ".repeat(width - cell.length()) + cell);
        }
        return padded;
    }

    private String complex(Complex value) {
        double imaginary = value.getImaginary();
        String sign = imaginary < 0 ? " - " : " + ";
        return fixed(value.getReal()) + sign + fixed(Math.abs(imaginary)) + "i";
    }

    /**
     * Fixed-point with the configured decimals; values that round to zero print without a sign.
     */
    private String fixed(double value) {
        if (!Double.isFinite(value)) {
            return scalar(value);
        }
        String text = String.format(Locale.ROOT, "%." + precision + "f", value);
        return isNegligible(value) || text.matches("-0(?:\\.0*)?") ? text.replace("-", "") : text;
    }

    private boolean isNegligible(double value) {
        return Math.abs(value) < 0.5 * Math.pow(10, -precision);
    }

    private static String capitalize(String key) {
        if (key.isEmpty()) {
            return key;
        }
        return key.substring(0, 1).toUpperCase(Locale.ROOT) + key.substring(1).toLowerCase(Locale.ROOT);
    }
}
