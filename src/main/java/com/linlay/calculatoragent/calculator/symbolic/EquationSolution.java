package com.linlay.calculatoragent.calculator.symbolic;

import java.util.List;

public sealed interface EquationSolution permits EquationSolution.Roots, EquationSolution.Identity {

    /**
     * Solutions in ascending order of their real part; empty when there are none.
     */
    record Roots(List<Root> roots) implements EquationSolution {
        public Roots {
            roots = List.copyOf(roots);
        }
    }

    /**
     * Both sides are equal for every value of the variable.
     */
    record Identity() implements EquationSolution {
    }
}
