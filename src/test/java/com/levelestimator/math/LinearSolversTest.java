package com.levelestimator.math;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class LinearSolversTest {

    @Test
    void gaussSolvesWellConditionedSystem() {
        RealMatrix a = new Array2DRowRealMatrix(new double[][] { { 2, 1 }, { 1, 3 } });
        RealVector x = LinearSolvers.gaussSolve(a, new ArrayRealVector(new double[] { 3, 5 }));
        assertNotNull(x);
        assertEquals(0.8, x.getEntry(0), 1e-14);
        assertEquals(1.4, x.getEntry(1), 1e-14);
    }

    @Test
    void gaussPivotsOnZeroDiagonal() {
        RealMatrix a = new Array2DRowRealMatrix(new double[][] { { 0, 1 }, { 1, 0 } });
        RealVector x = LinearSolvers.gaussSolve(a, new ArrayRealVector(new double[] { 2, 3 }));
        assertNotNull(x);
        assertEquals(3.0, x.getEntry(0), 1e-15);
        assertEquals(2.0, x.getEntry(1), 1e-15);
    }

    @Test
    void gaussReportsSingularSystem() {
        RealMatrix a = new Array2DRowRealMatrix(new double[][] { { 1, 2 }, { 2, 4 } });
        assertNull(LinearSolvers.gaussSolve(a, new ArrayRealVector(new double[] { 3, 6 })));
    }

    @Test
    void gaussOnEmptySystem() {
        RealVector x = LinearSolvers.gaussSolve(new Array2DRowRealMatrix(1, 1), new ArrayRealVector(0));
        assertEquals(0, x.getDimension());
    }

    @Test
    void gaussMatchesReferenceOnLargerSystem() {
        RealMatrix a = new Array2DRowRealMatrix(new double[][] {
                { 4, -2, 1, 0 },
                { -2, 4, -2, 1 },
                { 1, -2, 4, -2 },
                { 0, 1, -2, 4 } });
        RealVector expected = new ArrayRealVector(new double[] { 1, -1, 2, 0.5 });
        RealVector x = LinearSolvers.gaussSolve(a, a.operate(expected));
        assertNotNull(x);
        assertEquals(0.0, x.subtract(expected).getLInfNorm(), 1e-12);
    }

    @Test
    void nnlsClampsNegativeComponent() {
        RealMatrix a = new Array2DRowRealMatrix(new double[][] { { 1, 0 }, { 0, 1 } });
        RealVector x = LinearSolvers.nnls(a, new ArrayRealVector(new double[] { 2, -1 }));
        assertEquals(2.0, x.getEntry(0), 1e-12);
        assertEquals(0.0, x.getEntry(1));
    }

    @Test
    void nnlsEqualsLeastSquaresWhenUnconstrainedOptimumIsPositive() {
        RealMatrix a = new Array2DRowRealMatrix(new double[][] { { 1, 0 }, { 1, 1 }, { 1, 2 }, { 1, 3 } });
        RealVector truth = new ArrayRealVector(new double[] { 2.0, 0.5 });
        RealVector x = LinearSolvers.nnls(a, a.operate(truth));
        assertEquals(2.0, x.getEntry(0), 1e-9);
        assertEquals(0.5, x.getEntry(1), 1e-9);
    }

    @Test
    void nnlsIsAlwaysNonNegative() {
        Random random = new Random(42);
        for (int trial = 0; trial < 50; trial++) {
            int rows = 6 + random.nextInt(10);
            int cols = 1 + random.nextInt(6);
            RealMatrix a = new Array2DRowRealMatrix(rows, cols);
            RealVector b = new ArrayRealVector(rows);
            for (int i = 0; i < rows; i++) {
                for (int j = 0; j < cols; j++) {
                    a.setEntry(i, j, random.nextGaussian());
                }
                b.setEntry(i, random.nextGaussian() * 3);
            }
            RealVector x = LinearSolvers.nnls(a, b);
            assertEquals(cols, x.getDimension());
            for (int j = 0; j < cols; j++) {
                assertTrue(x.getEntry(j) >= 0, "trial " + trial + " component " + j);
            }
            // Never worse than the zero solution
            double fitted = b.subtract(a.operate(x)).getNorm();
            assertTrue(fitted <= b.getNorm() + 1e-9);
        }
    }

    @Test
    void nnlsLeavesAnticorrelatedColumnAtZero() {
        RealMatrix a = new Array2DRowRealMatrix(new double[][] { { 1 }, { 2 } });
        RealVector x = LinearSolvers.nnls(a, new ArrayRealVector(new double[] { -1, -2 }));
        assertEquals(0.0, x.getEntry(0));
    }

    @Test
    void meanSquare() {
        assertEquals(12.5, LinearSolvers.meanSquare(new ArrayRealVector(new double[] { 3, 4 })), 1e-12);
        assertEquals(0.0, LinearSolvers.meanSquare(new ArrayRealVector(0)));
    }
}
