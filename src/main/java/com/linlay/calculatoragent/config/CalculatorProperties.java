package com.linlay.calculatoragent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "calculator")
public class CalculatorProperties {

    private int displayPrecision = 4;
    private int scalarSignificantDigits = 12;
    private int maxRandomMatrixDimension = 50;
    private int maxRequestLength = 4000;
    private double singularityThreshold = 1e-11;
    private int maxNestingDepth = 200;
    private int maxPolynomialDegree = 20;
    /**
     * Seed for randomly generated matrices; unset means a fresh random source per request.
     */
    private Long randomSeed;

    public int getDisplayPrecision() {
        return displayPrecision;
    }

    public void setDisplayPrecision(int displayPrecision) {
        this.displayPrecision = Math.max(0, displayPrecision);
    }

    public int getScalarSignificantDigits() {
        return scalarSignificantDigits;
    }

    public void setScalarSignificantDigits(int scalarSignificantDigits) {
        this.scalarSignificantDigits = Math.max(1, scalarSignificantDigits);
    }

    public int getMaxRandomMatrixDimension() {
        return maxRandomMatrixDimension;
    }

    public void setMaxRandomMatrixDimension(int maxRandomMatrixDimension) {
        this.maxRandomMatrixDimension = maxRandomMatrixDimension;
    }

    public int getMaxRequestLength() {
        return maxRequestLength;
    }

    public void setMaxRequestLength(int maxRequestLength) {
        this.maxRequestLength = maxRequestLength;
    }

    public double getSingularityThreshold() {
        return singularityThreshold;
    }

    public void setSingularityThreshold(double singularityThreshold) {
        this.singularityThreshold = singularityThreshold;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public void setMaxNestingDepth(int maxNestingDepth) {
        this.maxNestingDepth = Math.max(1, maxNestingDepth);
    }

    public int getMaxPolynomialDegree() {
        return maxPolynomialDegree;
    }

    public void setMaxPolynomialDegree(int maxPolynomialDegree) {
        this.maxPolynomialDegree = Math.max(2, maxPolynomialDegree);
    }

    public Long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(Long randomSeed) {
        this.randomSeed = randomSeed;
    }
}
