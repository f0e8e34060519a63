package com.linlay.calculatoragent.calculator;

import com.linlay.calculatoragent.config.CalculatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Natural-language calculator: classify, extract, dispatch and format. {@link #evaluate(String)}
 * is total; every request, including {@code null}, yields a non-empty answer.
 */
public class CalculatorEngine {

    private static final Logger log = LoggerFactory.getLogger(CalculatorEngine.class);
    private static final int LOGGED_REQUEST_CHARS = 200;

    private final RequestClassifier classifier;
    private final ParameterExtractor extractor;
    private final OperationDispatcher dispatcher;
    private final ResultFormatter formatter;
    private final CalculatorProperties properties;

    public CalculatorEngine(
            RequestClassifier classifier,
            ParameterExtractor extractor,
            OperationDispatcher dispatcher,
            ResultFormatter formatter,
            CalculatorProperties properties
    ) {
        this.classifier = classifier;
        this.extractor = extractor;
        this.dispatcher = dispatcher;
        this.formatter = formatter;
        this.properties = properties;
    }

    public String evaluate(String request) {
        return evaluateDetailed(request).answer();
    }

    public Evaluation evaluateDetailed(String request) {
        String text = request == null ? "" : request;
        Category category = classifier.classify(text);
        if (text.length() > properties.getMaxRequestLength()) {
            return new Evaluation(category, "Request is too long: " + text.length()
                    + " characters, at most " + properties.getMaxRequestLength() + " are accepted", false);
        }
        try {
            ParameterSet params = extractor.extract(text, category);
            log.debug("Classified '{}' as {} with parameters {}", abbreviate(text), category.value(), params.keys());
            OperationResult result = dispatcher.dispatch(category, params);
            return new Evaluation(category, formatter.format(result, category), !result.isFailure());
        } catch (RuntimeException e) {
            log.warn("Evaluating '{}' as {} failed", abbreviate(text), category.value(), e);
            return new Evaluation(category,
                    "Error performing " + category.value() + " calculation: " + e.getMessage(), false);
        }
    }

    public OperationDispatcher dispatcher() {
        return dispatcher;
    }

    public ResultFormatter formatter() {
        return formatter;
    }

    private static String abbreviate(String text) {
        return text.length() <= LOGGED_REQUEST_CHARS ? text : text.substring(0, LOGGED_REQUEST_CHARS) + "...";
    }

    /**
     * Answer of one request together with the category it was routed to.
     */
    public record Evaluation(Category category, String answer, boolean ok) {
    }
}
