package com.linlay.calculatoragent.calculator.arithmetic;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RestrictedArithmeticEvaluatorTest {

    private final RestrictedArithmeticEvaluator evaluator = new RestrictedArithmeticEvaluator();

    @Test
    void shouldRespectOperatorPrecedence() {
        assertThat(evaluator.evaluate("2+3*4")).isEqualTo(14.0);
        assertThat(evaluator.evaluate("(2+3)*4")).isEqualTo(20.0);
        assertThat(evaluator.evaluate("7/2")).isEqualTo(3.5);
        assertThat(evaluator.evaluate("10-4-3")).isEqualTo(3.0);
    }

    @Test
    void shouldEvaluatePowersRightAssociativeAndTighterThanUnaryMinus() {
        assertThat(evaluator.evaluate("2**3**2")).isEqualTo(512.0);
        assertThat(evaluator.evaluate("2^10")).isEqualTo(1024.0);
        assertThat(evaluator.evaluate("-2**2")).isEqualTo(-4.0);
        assertThat(evaluator.evaluate("2**-1")).isEqualTo(0.5);
    }

    @Test
    void shouldAcceptLooseDecimalLiterals() {
        assertThat(evaluator.evaluate(".5*2")).isEqualTo(1.0);
        assertThat(evaluator.evaluate("5.+1")).isEqualTo(6.0);
        assertThat(evaluator.evaluate("0.1+0.2")).isCloseTo(0.3, within(1e-12));
    }

    @Test
    void shouldRaiseArithmeticErrorOnDivisionByZero() {
        assertThatThrownBy(() -> evaluator.evaluate("1/0"))
                .isInstanceOf(ArithmeticException.class)
                .hasMessage("division by zero");
        assertThatThrownBy(() -> evaluator.evaluate("0**-1"))
                .isInstanceOf(ArithmeticException.class);
    }

    @Test
    void shouldReportPositionOfMalformedInput() {
        assertThatThrownBy(() -> evaluator.evaluate("2+"))
                .isInstanceOf(ArithmeticParseException.class)
                .hasMessage("unexpected end of expression at position 2");
        assertThatThrownBy(() -> evaluator.evaluate("(1+2"))
                .isInstanceOf(ArithmeticParseException.class)
                .hasMessageContaining("expected ')'");
        assertThatThrownBy(() -> evaluator.evaluate("1..2"))
                .isInstanceOf(ArithmeticParseException.class)
                .satisfies(error -> assertThat(((ArithmeticParseException) error).position()).isEqualTo(2));
    }

    @Test
    void shouldNeverResolveIdentifiers() {
        assertThatThrownBy(() -> evaluator.evaluate("__import__"))
                .isInstanceOf(ArithmeticParseException.class);
    }

    @Test
    void shouldRejectOverflow() {
        assertThatThrownBy(() -> evaluator.evaluate("10**400"))
                .isInstanceOf(ArithmeticException.class)
                .hasMessage("result is not a finite number");
    }

    @Test
    void shouldRejectNestingDeeperThanConfigured() {
        RestrictedArithmeticEvaluator shallow = new RestrictedArithmeticEvaluator(3);

        assertThat(shallow.evaluate("((1+1))")).isEqualTo(2.0);
        assertThatThrownBy(() -> shallow.evaluate("(((1)))"))
                .isInstanceOf(ArithmeticParseException.class)
                .hasMessageStartingWith("expression nested deeper than 3 levels");
        assertThatThrownBy(() -> shallow.evaluate("---1"))
                .isInstanceOf(ArithmeticParseException.class);
        assertThatThrownBy(() -> evaluator.evaluate("(".repeat(1900) + "1" + ")".repeat(1900)))
                .isInstanceOf(ArithmeticParseException.class)
                .hasMessageStartingWith("expression nested deeper than 200 levels");
    }
}
