package com.linlay.calculatoragent.calculator.symbolic;

import org.apache.commons.math3.fraction.BigFraction;

record Term(BigFraction coefficient, Monomial monomial) {

    Term scale(BigFraction factor) {
        return new Term(coefficient.multiply(factor), monomial);
    }
}
