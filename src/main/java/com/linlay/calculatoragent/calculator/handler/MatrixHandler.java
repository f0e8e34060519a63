package com.linlay.calculatoragent.calculator.handler;

import com.linlay.calculatoragent.calculator.Category;
import com.linlay.calculatoragent.calculator.ErrorKind;
import com.linlay.calculatoragent.calculator.OperationResult;
import com.linlay.calculatoragent.calculator.ParameterSet;
import com.linlay.calculatoragent.config.CalculatorProperties;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;

public class MatrixHandler implements OperationHandler {

    private static final Logger log = LoggerFactory.getLogger(MatrixHandler.class);

    private final CalculatorProperties properties;

    public MatrixHandler(CalculatorProperties properties) {
        this.properties = properties;
    }

    @Override
    public Category category() {
        return Category.MATRIX;
    }

    @Override
    public OperationResult handle(ParameterSet params) {
        String operation = params.text(ParameterSet.OPERATION, "info").toLowerCase(Locale.ROOT);
        Optional<double[][]> values = params.matrix(ParameterSet.VALUES);
        RealMatrix matrix;
        if (values.isPresent()) {
            matrix = new Array2DRowRealMatrix(values.get());
        } else if (params.text(ParameterSet.LITERAL_ERROR).isPresent()) {
            return new OperationResult.Failure(ErrorKind.PARSE_FAILURE,
                    "Could not read the matrix literal: " + params.text(ParameterSet.LITERAL_ERROR).get());
        } else if (params.integer(ParameterSet.ROWS).isPresent() && params.integer(ParameterSet.COLS).isPresent()) {
            int rows = params.integer(ParameterSet.ROWS).get();
            int cols = params.integer(ParameterSet.COLS).get();
            int limit = properties.getMaxRandomMatrixDimension();
            if (rows < 1 || cols < 1 || rows > limit || cols > limit) {
                return new OperationResult.Failure(ErrorKind.DOMAIN_VIOLATION,
                        "Matrix dimensions must be between 1 and " + limit + ", got " + rows + "x" + cols);
            }
            matrix = randomMatrix(rows, cols);
        } else {
            return new OperationResult.Failure(ErrorKind.EXTRACTION_GAP, "Insufficient matrix information provided");
        }

        try {
            return switch (operation) {
                case "determinant" -> determinant(matrix);
                case "inverse" -> inverse(matrix);
                case "eigenvalues" -> eigenvalues(matrix);
                default -> info(matrix);
            };
        } catch (RuntimeException e) {
            log.warn("Matrix {} failed: {}", operation, e.getMessage());
            return new OperationResult.Failure(ErrorKind.COMPUTATION_FAILURE,
                    "Error performing matrix calculation: " + e.getMessage());
        }
    }

    private OperationResult determinant(RealMatrix matrix) {
        if (!matrix.isSquare()) {
            return nonSquare("determinant");
        }
        return new OperationResult.Scalar(new LUDecomposition(matrix).getDeterminant());
    }

    private OperationResult inverse(RealMatrix matrix) {
        if (!matrix.isSquare()) {
            return nonSquare("inverse");
        }
        DecompositionSolver solver = new LUDecomposition(matrix, properties.getSingularityThreshold()).getSolver();
        if (!solver.isNonSingular()) {
            return new OperationResult.Failure(ErrorKind.DOMAIN_VIOLATION, "Matrix is singular, cannot compute inverse");
        }
        return new OperationResult.Grid(solver.getInverse().getData());
    }

    private OperationResult eigenvalues(RealMatrix matrix) {
        if (!matrix.isSquare()) {
            return nonSquare("eigenvalues");
        }
        EigenDecomposition decomposition = new EigenDecomposition(matrix);
        double[] real = decomposition.getRealEigenvalues();
        double[] imaginary = decomposition.getImagEigenvalues();
        List<Complex> eigenvalues = new ArrayList<>();
        for (int i = 0; i < real.length; i++) {
            eigenvalues.add(new Complex(real[i], imaginary[i]));
        }
        eigenvalues.sort(Comparator.comparingDouble(Complex::getReal).thenComparingDouble(Complex::getImaginary));
        return new OperationResult.Vector(eigenvalues);
    }

    private OperationResult info(RealMatrix matrix) {
        int rank = new SingularValueDecomposition(matrix).getRank();
        return new OperationResult.Report(String.format(Locale.ROOT,
                "Matrix information:\nShape: (%d, %d)\nRank: %d\nFrobenius Norm: %.4f",
                matrix.getRowDimension(), matrix.getColumnDimension(), rank, matrix.getFrobeniusNorm()));
    }

    private RealMatrix randomMatrix(int rows, int cols) {
        Random random = properties.getRandomSeed() == null ? new Random() : new Random(properties.getRandomSeed());
        double[][] data = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                data[r][c] = random.nextDouble();
            }
        }
        return new Array2DRowRealMatrix(data, false);
    }

    private static OperationResult.Failure nonSquare(String operation) {
        return new OperationResult.Failure(ErrorKind.DOMAIN_VIOLATION,
                "Cannot calculate " + operation + " of non-square matrix");
    }
}
