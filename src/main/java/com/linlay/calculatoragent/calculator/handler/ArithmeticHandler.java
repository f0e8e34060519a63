package com.linlay.calculatoragent.calculator.handler;

import com.linlay.calculatoragent.calculator.Category;
import com.linlay.calculatoragent.calculator.ErrorKind;
import com.linlay.calculatoragent.calculator.OperationResult;
import com.linlay.calculatoragent.calculator.ParameterSet;
import com.linlay.calculatoragent.calculator.arithmetic.RestrictedArithmeticEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fallback handler. Everything except digits, decimal points, parentheses and the operators
 * {@code + - * / ^} is dropped from the request before evaluation, so no identifier is ever resolved.
 */
public class ArithmeticHandler implements OperationHandler {

    public static final String UNPARSEABLE = "I couldn't parse a valid calculation from your request.";

    private static final Logger log = LoggerFactory.getLogger(ArithmeticHandler.class);
    private static final Pattern ALLOWED = Pattern.compile("[+\\-*/^().\\d\\s]");
    private static final Pattern DIGIT = Pattern.compile("\\d");

    private final RestrictedArithmeticEvaluator evaluator;

    public ArithmeticHandler(RestrictedArithmeticEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public Category category() {
        return Category.ARITHMETIC;
    }

    @Override
    public OperationResult handle(ParameterSet params) {
        String cleaned = clean(params.text(ParameterSet.QUERY).orElse(""));
        if (cleaned.isEmpty()) {
            return new OperationResult.Failure(ErrorKind.PARSE_FAILURE, UNPARSEABLE);
        }
        try {
            return new OperationResult.Scalar(evaluator.evaluate(cleaned));
        } catch (IllegalArgumentException e) {
            return new OperationResult.Failure(ErrorKind.PARSE_FAILURE, "Error evaluating expression: " + e.getMessage());
        } catch (ArithmeticException e) {
            return new OperationResult.Failure(ErrorKind.DOMAIN_VIOLATION, "Error evaluating expression: " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Evaluating '{}' failed", cleaned, e);
            return new OperationResult.Failure(ErrorKind.COMPUTATION_FAILURE,
                    "Error evaluating expression: " + e.getMessage());
        }
    }

    /**
     * The arithmetic characters of the query with whitespace removed and {@code ^} spelled
     * {@code **}; empty when there is no digit or the parentheses do not balance.
     */
    static String clean(String query) {
        StringBuilder kept = new StringBuilder();
        Matcher allowed = ALLOWED.matcher(query);
        while (allowed.find()) {
            kept.append(allowed.group());
        }
        String expression = kept.toString().replace("^", "**").replaceAll("\\s+", "");
        if (expression.isEmpty() || !DIGIT.matcher(expression).find()) {
            return "";
        }
        long open = expression.chars().filter(c -> c == '(').count();
        long close = expression.chars().filter(c -> c == ')').count();
        return open == close ? expression : "";
    }
}
