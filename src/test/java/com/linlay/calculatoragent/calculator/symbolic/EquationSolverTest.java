package com.linlay.calculatoragent.calculator.symbolic;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EquationSolverTest {

    private final SymbolicEngine engine = new SymbolicEngine();

    @Test
    void shouldSolveQuadraticWithRationalRoots() {
        assertThat(roots("x^2 - 5x + 6 = 0", "x")).containsExactly("2", "3");
    }

    @Test
    void shouldSolveLinearEquationWithBothSides() {
        assertThat(roots("2x + 3 = 7", "x")).containsExactly("2");
        assertThat(roots("2x + 4", "x")).containsExactly("-2");
    }

    @Test
    void shouldReturnExactRadicalsAndComplexRoots() {
        assertThat(roots("x^2 - 2 = 0", "x")).containsExactly("-sqrt(2)", "sqrt(2)");
        assertThat(roots("x^2 + 1 = 0", "x")).containsExactly("-I", "I");
    }

    @Test
    void shouldFindAllRootsOfACubic() {
        assertThat(roots("x^3 - 6x^2 + 11x - 6 = 0", "x")).containsExactly("1", "2", "3");
    }

    @Test
    void shouldFallBackToNumericRootsForIrreducibleCubics() {
        List<Root> solution = ((EquationSolution.Roots) engine.solve("x^3 - 2x - 5 = 0", "x")).roots();

        assertThat(solution).hasSize(3);
        assertThat(solution.get(0).isExact()).isFalse();
        assertThat(solution.get(0).toString()).startsWith("2.09455148");
    }

    @Test
    void shouldSolveLinearEquationWithSymbolicCoefficients() {
        assertThat(roots("a*x + b = 0", "x")).containsExactly("-b/a");
    }

    @Test
    void shouldDropRootsThatZeroADenominator() {
        assertThat(roots("(x^2 - 1)/(x - 1) = 0", "x")).containsExactly("-1");
    }

    @Test
    void shouldRecogniseIdentitiesAndContradictions() {
        assertThat(engine.solve("x + 1 = x + 1", "x")).isInstanceOf(EquationSolution.Identity.class);
        assertThat(roots("x + 1 = x + 2", "x")).isEmpty();
    }

    @Test
    void shouldRejectNonPolynomialEquations() {
        assertThatThrownBy(() -> engine.solve("sin(x) = 0", "x"))
                .isInstanceOf(UnsupportedSymbolicOperationException.class)
                .hasMessageContaining("only polynomial equations in x");
    }

    private List<String> roots(String equation, String variable) {
        EquationSolution solution = engine.solve(equation, variable);
        assertThat(solution).isInstanceOf(EquationSolution.Roots.class);
        return ((EquationSolution.Roots) solution).roots().stream().map(Root::toString).toList();
    }

    @Test
    void shouldRefuseEquationsAboveTheDegreeLimit() {
        SymbolicEngine limited = new SymbolicEngine(ExpressionParser.DEFAULT_MAX_NESTING_DEPTH, 4);

        assertThat(((EquationSolution.Roots) limited.solve("x^4 - 1 = 0", "x")).roots()).hasSize(4);
        assertThatThrownBy(() -> limited.solve("x^5 - x - 1 = 0", "x"))
                .isInstanceOf(UnsupportedSymbolicOperationException.class)
                .hasMessage("equation has degree 5, at most 4 is supported");
    }

    @Test
    void shouldFindNumericRootsUpToTheDefaultDegree() {
        List<Root> solution = ((EquationSolution.Roots) engine.solve("x^20 + x + 1 = 0", "x")).roots();

        assertThat(solution).hasSize(20).noneMatch(Root::isExact);
    }
}
