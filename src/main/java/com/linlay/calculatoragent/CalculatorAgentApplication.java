package com.linlay.calculatoragent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CalculatorAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(CalculatorAgentApplication.class, args);
    }
}
