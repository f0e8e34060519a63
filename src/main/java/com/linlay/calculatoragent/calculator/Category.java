package com.linlay.calculatoragent.calculator;

import java.util.List;
import java.util.Locale;

/**
 * Operation family of a request. Declaration order is classification priority: the first category
 * with a matching keyword wins and {@link #ARITHMETIC} is the fallback.
 */
public enum Category {

    MATRIX(List.of("matrix", "determinant", "eigenvalue", "inverse")),
    STATISTICS(List.of("mean", "median", "variance", "standard deviation", "correlation")),
    ALGEBRA(List.of("factor", "expand", "simplify", "polynomial")),
    CALCULUS(List.of("integrate", "derivative", "differentiate", "limit")),
    EQUATION(List.of("solve", "equation", "find x", "find y")),
    ARITHMETIC(List.of());

    private final List<String> keywords;

    Category(List<String> keywords) {
        this.keywords = keywords;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    boolean matches(String lowerCaseRequest) {
        for (String keyword : keywords) {
            if (lowerCaseRequest.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
