package com.linlay.calculatoragent.calculator;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RequestClassifierTest {

    private final RequestClassifier classifier = new RequestClassifier();

    @Test
    void shouldRouteByKeyword() {
        assertThat(classifier.classify("What is the determinant of [[1,2],[3,4]]?")).isEqualTo(Category.MATRIX);
        assertThat(classifier.classify("Find the median of 3, 1, 2")).isEqualTo(Category.STATISTICS);
        assertThat(classifier.classify("Expand (x + 1)^2")).isEqualTo(Category.ALGEBRA);
        assertThat(classifier.classify("Differentiate x^2")).isEqualTo(Category.CALCULUS);
        assertThat(classifier.classify("find x if 2x = 4")).isEqualTo(Category.EQUATION);
        assertThat(classifier.classify("What is 2 + 2?")).isEqualTo(Category.ARITHMETIC);
    }

    @Test
    void shouldBeCaseInsensitive() {
        assertThat(classifier.classify("SOLVE X + 1 = 2")).isEqualTo(Category.EQUATION);
        assertThat(classifier.classify("Standard Deviation of 1, 2, 3")).isEqualTo(Category.STATISTICS);
    }

    @Test
    void shouldPreferEarlierCategoryWhenKeywordsOverlap() {
        assertThat(classifier.classify("solve for the inverse of the matrix [[1,2],[3,4]]")).isEqualTo(Category.MATRIX);
        assertThat(classifier.classify("simplify the derivative")).isEqualTo(Category.ALGEBRA);
        assertThat(classifier.classify("mean value of the limit")).isEqualTo(Category.STATISTICS);
    }

    @Test
    void shouldFallBackToArithmeticForBlankOrMissingRequest() {
        assertThat(classifier.classify(null)).isEqualTo(Category.ARITHMETIC);
        assertThat(classifier.classify("   ")).isEqualTo(Category.ARITHMETIC);
    }
}
