package com.linlay.calculatoragent.calculator;

import com.linlay.calculatoragent.calculator.matrix.MatrixLiteralException;
import com.linlay.calculatoragent.calculator.matrix.MatrixLiteralParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the parameters each category needs out of the request text. Extraction never fails: a
 * pattern that does not match simply leaves its key out.
 */
public class ParameterExtractor {

    private static final Pattern MATRIX_SIZE = Pattern.compile(
            "matrix\\s+of\\s+(?:size\\s+)?(\\d+)(?:\\s*[xX]\\s*|\\s+by\\s+)(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern MATRIX_LITERAL = Pattern.compile(
            "\\[\\s*\\[(.*?)\\](?:\\s*,\\s*\\[(.*?)\\])*\\s*\\]", Pattern.DOTALL);

    private static final Pattern NUMBER = Pattern.compile("(?<![\\w.])[-+]?(?:\\d*\\.\\d+|\\d+)");

    private static final Pattern EQUATION_KEYWORD = Pattern.compile(
            "\\b(?:solve|equation)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern EQUATION_LEAD = Pattern.compile(
            "^\\s*(?::\\s*)?(?:the\\s+)?(?:equation\\s*)?(?:for\\s+[a-zA-Z]\\b\\s*)?[:,]?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern FIND_VARIABLE = Pattern.compile(
            "\\bfind\\s+([xy])\\b\\s*(?:if\\b|such\\s+that\\b|where\\b|when\\b|:)?(.*)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern FOR_VARIABLE = Pattern.compile(
            "\\bfor\\s+([a-zA-Z])\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern CALCULUS_LEAD = Pattern.compile(
            "\\b(?:of|expression)\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern CALCULUS_KEYWORD = Pattern.compile(
            "\\b(?:integrate|differentiate|derivative|limit)\\b\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern CALCULUS_STOP = Pattern.compile(
            "\\s+(?:with\\s+respect\\b|regarding\\b|as\\b|for\\s+[a-zA-Z]\\b|approach(?:es|ing)?\\b|when\\b)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CALCULUS_VARIABLE = Pattern.compile(
            "(?:with\\s+respect\\s+to|regarding|for)\\s+([a-zA-Z])\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LIMIT_VARIABLE = Pattern.compile(
            "\\bas\\s+([a-zA-Z])\\s+(?:approach|tend|goe)", Pattern.CASE_INSENSITIVE);
    private static final Pattern APPROACH = Pattern.compile(
            "approach(?:es|ing)?\\s+(?:to\\s+)?([-+]?\\d*\\.\\d+|[-+]?\\d+|[-+]?infinity)", Pattern.CASE_INSENSITIVE);

    private static final Pattern ALGEBRA_LEAD = Pattern.compile(
            "\\b(?:expression|polynomial)\\s*:?\\s+(.+)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern ALGEBRA_KEYWORD = Pattern.compile(
            "\\b(?:factor(?:ize)?|expand|simplify)\\s+(?:the\\s+)?(.+)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s.?!,;:]+$");

    private final MatrixLiteralParser matrixLiteralParser;

    public ParameterExtractor(MatrixLiteralParser matrixLiteralParser) {
        this.matrixLiteralParser = matrixLiteralParser;
    }

    public ParameterSet extract(String request, Category category) {
        String text = request == null ? "" : request;
        return switch (category) {
            case MATRIX -> matrix(text);
            case STATISTICS -> statistics(text);
            case ALGEBRA -> algebra(text);
            case CALCULUS -> calculus(text);
            case EQUATION -> equation(text);
            case ARITHMETIC -> ParameterSet.builder().put(ParameterSet.QUERY, text).build();
        };
    }

    private ParameterSet matrix(String text) {
        ParameterSet.Builder params = ParameterSet.builder();
        Matcher size = MATRIX_SIZE.matcher(text);
        if (size.find()) {
            params.put(ParameterSet.ROWS, dimension(size.group(1)));
            params.put(ParameterSet.COLS, dimension(size.group(2)));
        }
        Matcher literal = MATRIX_LITERAL.matcher(text);
        if (literal.find()) {
            try {
                params.put(ParameterSet.VALUES, matrixLiteralParser.parse(literal.group()));
            } catch (MatrixLiteralException e) {
                params.put(ParameterSet.LITERAL_ERROR, e.getMessage());
            }
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String operation;
        if (lower.contains("determinant")) {
            operation = "determinant";
        } else if (lower.contains("inverse")) {
            operation = "inverse";
        } else if (lower.contains("eigenvalue")) {
            operation = "eigenvalues";
        } else {
            operation = "info";
        }
        return params.put(ParameterSet.OPERATION, operation).build();
    }

    private static Integer dimension(String digits) {
        String trimmed = digits.replaceFirst("^0+(?=\\d)", "");
        return trimmed.length() > 9 ? Integer.MAX_VALUE : Integer.valueOf(trimmed);
    }

    private ParameterSet statistics(String text) {
        List<Double> data = new ArrayList<>();
        Matcher number = NUMBER.matcher(text);
        while (number.find()) {
            data.add(Double.parseDouble(number.group()));
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String operation;
        if (lower.contains("mean")) {
            operation = "mean";
        } else if (lower.contains("median")) {
            operation = "median";
        } else if (lower.contains("variance")) {
            operation = "variance";
        } else if (lower.contains("standard deviation")) {
            operation = "std";
        } else if (lower.contains("correlation")) {
            operation = "correlation";
        } else {
            operation = "summary";
        }
        ParameterSet.Builder params = ParameterSet.builder().put(ParameterSet.OPERATION, operation);
        if (!data.isEmpty()) {
            params.put(ParameterSet.DATA, data);
        }
        return params.build();
    }

    private ParameterSet equation(String text) {
        String equation = null;
        String variable = null;
        Matcher keyword = EQUATION_KEYWORD.matcher(text);
        int keywordEnd = -1;
        while (keyword.find()) {
            keywordEnd = keyword.end();
        }
        if (keywordEnd >= 0) {
            String rest = text.substring(keywordEnd);
            Matcher lead = EQUATION_LEAD.matcher(rest);
            if (lead.find()) {
                Matcher leadVariable = FOR_VARIABLE.matcher(lead.group());
                if (leadVariable.find()) {
                    variable = leadVariable.group(1);
                }
                rest = rest.substring(lead.end());
            }
            equation = cutAtVariableClause(rest);
        } else {
            Matcher find = FIND_VARIABLE.matcher(text);
            if (find.find()) {
                variable = find.group(1).toLowerCase(Locale.ROOT);
                equation = cutAtVariableClause(find.group(2));
            }
        }
        if (variable == null) {
            Matcher forVariable = FOR_VARIABLE.matcher(text);
            variable = forVariable.find() ? forVariable.group(1) : "x";
        }
        ParameterSet.Builder params = ParameterSet.builder().put(ParameterSet.VARIABLE, variable);
        if (equation != null && !equation.isBlank()) {
            params.put(ParameterSet.EQUATION, equation);
        }
        return params.build();
    }

    private static String cutAtVariableClause(String text) {
        Matcher forVariable = FOR_VARIABLE.matcher(text);
        String cut = forVariable.find() ? text.substring(0, forVariable.start()) : text;
        return stripTrailing(cut);
    }

    private ParameterSet calculus(String text) {
        ParameterSet.Builder params = ParameterSet.builder();
        String expression = null;
        Matcher lead = CALCULUS_LEAD.matcher(text);
        if (lead.find()) {
            expression = untilStop(text.substring(lead.end()));
        } else {
            Matcher keyword = CALCULUS_KEYWORD.matcher(text);
            if (keyword.find()) {
                expression = untilStop(text.substring(keyword.end()));
            }
        }
        if (expression != null && !expression.isBlank()) {
            params.put(ParameterSet.EXPRESSION, expression);
        }

        Matcher variable = CALCULUS_VARIABLE.matcher(text);
        Matcher limitVariable = LIMIT_VARIABLE.matcher(text);
        if (variable.find()) {
            params.put(ParameterSet.VARIABLE, variable.group(1));
        } else if (limitVariable.find()) {
            params.put(ParameterSet.VARIABLE, limitVariable.group(1));
        } else {
            params.put(ParameterSet.VARIABLE, "x");
        }

        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("derivative") || lower.contains("differentiate")) {
            params.put(ParameterSet.OPERATION, "derivative");
        } else if (lower.contains("integrate")) {
            params.put(ParameterSet.OPERATION, "integrate");
        } else if (lower.contains("limit")) {
            params.put(ParameterSet.OPERATION, "limit");
            Matcher approach = APPROACH.matcher(text);
            if (approach.find()) {
                params.put(ParameterSet.APPROACH, approach.group(1).toLowerCase(Locale.ROOT));
            }
        }
        return params.build();
    }

    private static String untilStop(String text) {
        Matcher stop = CALCULUS_STOP.matcher(text);
        return stripTrailing(stop.find() ? text.substring(0, stop.start()) : text);
    }

    private ParameterSet algebra(String text) {
        ParameterSet.Builder params = ParameterSet.builder();
        Matcher lead = ALGEBRA_LEAD.matcher(text);
        Matcher keyword = ALGEBRA_KEYWORD.matcher(text);
        String expression = null;
        if (lead.find()) {
            expression = stripTrailing(lead.group(1));
        } else if (keyword.find()) {
            expression = stripTrailing(keyword.group(1));
        }
        if (expression != null && !expression.isBlank()) {
            params.put(ParameterSet.EXPRESSION, expression);
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String operation;
        if (lower.contains("factor")) {
            operation = "factor";
        } else if (lower.contains("expand")) {
            operation = "expand";
        } else {
            operation = "simplify";
        }
        return params.put(ParameterSet.OPERATION, operation).build();
    }

    private static String stripTrailing(String text) {
        return TRAILING_PUNCTUATION.matcher(text.trim()).replaceAll("").trim();
    }
}
