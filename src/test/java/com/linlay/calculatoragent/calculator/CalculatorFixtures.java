package com.linlay.calculatoragent.calculator;

import com.linlay.calculatoragent.calculator.arithmetic.RestrictedArithmeticEvaluator;
import com.linlay.calculatoragent.calculator.handler.AlgebraHandler;
import com.linlay.calculatoragent.calculator.handler.ArithmeticHandler;
import com.linlay.calculatoragent.calculator.handler.CalculusHandler;
import com.linlay.calculatoragent.calculator.handler.EquationHandler;
import com.linlay.calculatoragent.calculator.handler.MatrixHandler;
import com.linlay.calculatoragent.calculator.handler.StatisticsHandler;
import com.linlay.calculatoragent.calculator.matrix.MatrixLiteralParser;
import com.linlay.calculatoragent.calculator.symbolic.SymbolicEngine;
import com.linlay.calculatoragent.config.CalculatorProperties;

import java.util.List;

public final class CalculatorFixtures {

    private CalculatorFixtures() {
    }

    public static CalculatorEngine engine() {
        return engine(new CalculatorProperties());
    }

    public static CalculatorEngine engine(CalculatorProperties properties) {
        SymbolicEngine symbolicEngine = new SymbolicEngine(
                properties.getMaxNestingDepth(), properties.getMaxPolynomialDegree());
        OperationDispatcher dispatcher = new OperationDispatcher(List.of(
                new MatrixHandler(properties),
                new StatisticsHandler(),
                new AlgebraHandler(symbolicEngine),
                new CalculusHandler(symbolicEngine),
                new EquationHandler(symbolicEngine),
                new ArithmeticHandler(new RestrictedArithmeticEvaluator(properties.getMaxNestingDepth()))
        ));
        return new CalculatorEngine(
                new RequestClassifier(),
                new ParameterExtractor(new MatrixLiteralParser()),
                dispatcher,
                new ResultFormatter(properties),
                properties
        );
    }
}
