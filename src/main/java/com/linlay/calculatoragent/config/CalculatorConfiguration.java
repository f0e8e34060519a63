package com.linlay.calculatoragent.config;

import com.linlay.calculatoragent.calculator.CalculatorEngine;
import com.linlay.calculatoragent.calculator.OperationDispatcher;
import com.linlay.calculatoragent.calculator.ParameterExtractor;
import com.linlay.calculatoragent.calculator.RequestClassifier;
import com.linlay.calculatoragent.calculator.ResultFormatter;
import com.linlay.calculatoragent.calculator.arithmetic.RestrictedArithmeticEvaluator;
import com.linlay.calculatoragent.calculator.handler.AlgebraHandler;
import com.linlay.calculatoragent.calculator.handler.ArithmeticHandler;
import com.linlay.calculatoragent.calculator.handler.CalculusHandler;
import com.linlay.calculatoragent.calculator.handler.EquationHandler;
import com.linlay.calculatoragent.calculator.handler.MatrixHandler;
import com.linlay.calculatoragent.calculator.handler.StatisticsHandler;
import com.linlay.calculatoragent.calculator.matrix.MatrixLiteralParser;
import com.linlay.calculatoragent.calculator.symbolic.SymbolicEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the calculator core, which is plain Java and carries no Spring annotations.
 */
@Configuration
public class CalculatorConfiguration {

    @Bean
    public SymbolicEngine symbolicEngine(CalculatorProperties properties) {
        return new SymbolicEngine(properties.getMaxNestingDepth(), properties.getMaxPolynomialDegree());
    }

    @Bean
    public MatrixLiteralParser matrixLiteralParser() {
        return new MatrixLiteralParser();
    }

    @Bean
    public OperationDispatcher operationDispatcher(CalculatorProperties properties, SymbolicEngine symbolicEngine) {
        return new OperationDispatcher(List.of(
                new MatrixHandler(properties),
                new StatisticsHandler(),
                new AlgebraHandler(symbolicEngine),
                new CalculusHandler(symbolicEngine),
                new EquationHandler(symbolicEngine),
                new ArithmeticHandler(new RestrictedArithmeticEvaluator(properties.getMaxNestingDepth()))
        ));
    }

    @Bean
    public CalculatorEngine calculatorEngine(
            CalculatorProperties properties,
            MatrixLiteralParser matrixLiteralParser,
            OperationDispatcher operationDispatcher
    ) {
        return new CalculatorEngine(
                new RequestClassifier(),
                new ParameterExtractor(matrixLiteralParser),
                operationDispatcher,
                new ResultFormatter(properties),
                properties
        );
    }
}
