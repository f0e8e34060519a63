package com.linlay.calculatoragent.calculator.matrix;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads a nested-list matrix literal such as {@code [[1, 2], [3, 4]]}. The text is first read as
 * JSON (single quotes turned into double quotes); when that fails, a literal-only grammar accepting
 * numbers, brackets, commas and trailing commas is tried. Nothing is ever evaluated.
 */
public class MatrixLiteralParser {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    public double[][] parse(String literal) {
        if (literal == null || literal.isBlank()) {
            throw new MatrixLiteralException("empty matrix literal");
        }
        double[][] rows;
        try {
            rows = OBJECT_MAPPER.readValue(literal.replace('\'', '"'), double[][].class);
        } catch (JsonProcessingException e) {
            rows = new LiteralReader(literal.replaceAll("\\s+", "")).read();
        }
        return requireRectangular(rows);
    }

    private static double[][] requireRectangular(double[][] rows) {
        if (rows == null || rows.length == 0 || rows[0] == null || rows[0].length == 0) {
            throw new MatrixLiteralException("matrix literal has no values");
        }
        int width = rows[0].length;
        for (double[] row : rows) {
            if (row == null || row.length != width) {
                throw new MatrixLiteralException("matrix rows must all have " + width + " values");
            }
        }
        return rows;
    }

    /**
     * list := '[' (row (',' row)* ','?)? ']' ; row := '[' (number (',' number)* ','?)? ']'
     */
    private static final class LiteralReader {
        private final String text;
        private int pos;

        private LiteralReader(String text) {
            this.text = text;
        }

        double[][] read() {
            expect('[');
            List<double[]> rows = new ArrayList<>();
            while (peek() == '[') {
                rows.add(row());
                if (!accept(',')) {
                    break;
                }
            }
            expect(']');
            if (pos != text.length()) {
                throw error("unexpected text after matrix literal");
            }
            return rows.toArray(new double[0][]);
        }

        private double[] row() {
            expect('[');
            List<Double> values = new ArrayList<>();
            while (peek() != ']') {
                values.add(number());
                if (!accept(',')) {
                    break;
                }
            }
            expect(']');
            double[] row = new double[values.size()];
            for (int i = 0; i < row.length; i++) {
                row[i] = values.get(i);
            }
            return row;
        }

        private double number() {
            int start = pos;
            while (pos < text.length() && "+-.0123456789eE_".indexOf(text.charAt(pos)) >= 0) {
                pos++;
            }
            String token = text.substring(start, pos).replace("_", "");
            if (token.isEmpty()) {
                throw error("expected a number");
            }
            try {
                return Double.parseDouble(token);
            } catch (NumberFormatException e) {
                throw new MatrixLiteralException("invalid number '" + token + "' in matrix literal", e);
            }
        }

        private char peek() {
            return pos < text.length() ? text.charAt(pos) : '\0';
        }

        private boolean accept(char c) {
            if (peek() == c) {
                pos++;
                return true;
            }
            return false;
        }

        private void expect(char c) {
            if (!accept(c)) {
                throw error("expected '" + c + "'");
            }
        }

        private MatrixLiteralException error(String message) {
            return new MatrixLiteralException(message + " at position " + pos + " of matrix literal");
        }
    }
}
