package com.linlay.calculatoragent.calculator.symbolic;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SymbolicEngineTest {

    private final SymbolicEngine engine = new SymbolicEngine();

    @Test
    void shouldDistributeProductsOnExpand() {
        assertThat(engine.expand("(x + 1)^2").toString()).isEqualTo("x**2 + 2*x + 1");
        assertThat(engine.expand("(x + 1)*(x - 1)").toString()).isEqualTo("x**2 - 1");
    }

    @Test
    void shouldCancelCommonFactorsOnSimplify() {
        assertThat(engine.simplify("(x^2 - 1)/(x - 1)").toString()).isEqualTo("x + 1");
        assertThat(engine.simplify("x + x + 2").toString()).isEqualTo("2*x + 2");
    }

    @Test
    void shouldSplitOffRationalLinearFactors() {
        String factored = engine.factor("x^2 - 1").toString();
        assertThat(factored).contains("(x - 1)").contains("(x + 1)");

        String withContent = engine.factor("2x^2 + 4x").toString();
        assertThat(withContent).startsWith("2*x").contains("(x + 2)");
    }

    @Test
    void shouldApplyProductAndChainRules() {
        assertThat(engine.derivative("x^3", "x").toString()).isEqualTo("3*x**2");
        assertThat(engine.derivative("sin(x)", "x").toString()).isEqualTo("cos(x)");
        assertThat(engine.derivative("exp(2x)", "x").toString()).isEqualTo("2*exp(2*x)");
        assertThat(engine.derivative("x*y", "y").toString()).isEqualTo("x");
        assertThat(engine.derivative("5", "x").toString()).isEqualTo("0");
    }

    @Test
    void shouldIntegrateWithTableOfAntiderivatives() {
        assertThat(engine.integrate("x^2", "x")).isEqualTo("x**3/3");
        assertThat(engine.integrate("cos(x)", "x")).isEqualTo("sin(x)");
        assertThat(engine.integrate("1/x", "x")).isEqualTo("log(x)");
        assertThat(engine.integrate("x*exp(x)", "x")).contains("x*exp(x)").contains("- exp(x)");
    }

    @Test
    void shouldLeaveUnknownIntegralsUnevaluated() {
        assertThat(engine.integrate("sin(x)/x", "x")).isEqualTo("Integral(sin(x)/x, x)");
    }

    @Test
    void shouldResolveIndeterminateLimits() {
        assertThat(engine.limit("sin(x)/x", "x", engine.limitPoint("0")).toString()).isEqualTo("1");
        assertThat(engine.limit("(x^2 - 1)/(x - 1)", "x", engine.limitPoint("1")).toString()).isEqualTo("2");
        assertThat(engine.limit("x^2 + 1", "x", engine.limitPoint(null)).toString()).isEqualTo("1");
    }

    @Test
    void shouldTakeLimitsAtInfinityAndPoles() {
        assertThat(engine.limit("1/x", "x", engine.limitPoint("infinity")).toString()).isEqualTo("0");
        assertThat(engine.limit("(2x^2 + 1)/x^2", "x", engine.limitPoint("oo")).toString()).isEqualTo("2");
        assertThat(engine.limit("x^3", "x", engine.limitPoint("-infinity")).toString()).isEqualTo("-oo");
        assertThat(engine.limit("1/x", "x", engine.limitPoint("0")).toString()).isEqualTo("oo");
    }

    @Test
    void shouldReadInfinitySpellingsAsLimitPoints() {
        assertThat(engine.limitPoint("+oo")).isEqualTo(LimitPoint.POSITIVE_INFINITY);
        assertThat(engine.limitPoint("-oo")).isEqualTo(LimitPoint.NEGATIVE_INFINITY);
        assertThat(engine.limitPoint(" ").value().isZero()).isTrue();
    }

    @Test
    void shouldSurfaceParseErrorsAsExpressionParseException() {
        assertThatThrownBy(() -> engine.simplify("x +* 2")).isInstanceOf(ExpressionParseException.class);
    }

    @Test
    void shouldRefuseExactPowersWithHugeResults() {
        assertThat(engine.simplify("2^4096").toString()).hasSize(1234);
        assertThat(engine.simplify("1^100000").toString()).isEqualTo("1");
        assertThatThrownBy(() -> engine.simplify("2^100000"))
                .isInstanceOf(UnsupportedSymbolicOperationException.class)
                .hasMessage("power too large: 2^100000 exceeds 4096 bits");
        assertThatThrownBy(() -> engine.limit("x^1000000", "x", engine.limitPoint("2")))
                .isInstanceOf(UnsupportedSymbolicOperationException.class);
    }
}
