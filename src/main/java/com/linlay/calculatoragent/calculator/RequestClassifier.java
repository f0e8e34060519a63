package com.linlay.calculatoragent.calculator;

import java.util.Locale;

public class RequestClassifier {

    public Category classify(String request) {
        if (request == null || request.isBlank()) {
            return Category.ARITHMETIC;
        }
        String lower = request.toLowerCase(Locale.ROOT);
        for (Category category : Category.values()) {
            if (category != Category.ARITHMETIC && category.matches(lower)) {
                return category;
            }
        }
        return Category.ARITHMETIC;
    }
}
