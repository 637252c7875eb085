package com.levelestimator.math;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.ArrayList;
import java.util.List;

/**
 * Small dense solvers used by the cycle fit: Gaussian elimination with partial
 * pivoting and Lawson-Hanson non-negative least squares.
 */
public final class LinearSolvers {

    /** Pivots smaller than this mark the system as singular. */
    public static final double PIVOT_TOLERANCE = 1e-14;

    private static final double GRADIENT_TOLERANCE = 1e-10;
    private static final double ZERO_TOLERANCE = 1e-12;

    private LinearSolvers() {
    }

    /**
     * Solve {@code a x = b} for square {@code a}.
     *
     * @return the solution, or null if a pivot falls below {@link #PIVOT_TOLERANCE}
     */
    public static RealVector gaussSolve(RealMatrix a, RealVector b) {
        int n = b.getDimension();
        if (n == 0) {
            return new ArrayRealVector(0);
        }
        if (a.getRowDimension() != n || a.getColumnDimension() != n) {
            throw new IllegalArgumentException("Expected a " + n + "x" + n + " matrix, got "
                    + a.getRowDimension() + "x" + a.getColumnDimension());
        }

        // Augmented matrix [a | b]
        double[][] m = new double[n][n + 1];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                m[i][j] = a.getEntry(i, j);
            }
            m[i][n] = b.getEntry(i);
        }

        for (int col = 0; col < n; col++) {
            int pivotRow = col;
            double pivot = Math.abs(m[col][col]);
            for (int row = col + 1; row < n; row++) {
                if (Math.abs(m[row][col]) > pivot) {
                    pivot = Math.abs(m[row][col]);
                    pivotRow = row;
                }
            }
            if (pivot < PIVOT_TOLERANCE) {
                return null;
            }
            if (pivotRow != col) {
                double[] tmp = m[col];
                m[col] = m[pivotRow];
                m[pivotRow] = tmp;
            }
            for (int row = col + 1; row < n; row++) {
                double factor = m[row][col] / m[col][col];
                for (int j = col; j <= n; j++) {
                    m[row][j] -= factor * m[col][j];
                }
            }
        }

        double[] x = new double[n];
        for (int i = n - 1; i >= 0; i--) {
            if (Math.abs(m[i][i]) < PIVOT_TOLERANCE) {
                return null;
            }
            double sum = m[i][n];
            for (int j = i + 1; j < n; j++) {
                sum -= m[i][j] * x[j];
            }
            x[i] = sum / m[i][i];
        }
        return new ArrayRealVector(x, false);
    }

    /**
     * Non-negative least squares: minimise {@code ||a x - b||} subject to {@code x >= 0}.
     * Columns of {@code a} are the candidate basis vectors. Stops once no zero-bound
     * variable has a positive gradient, or after {@code 3k + 1} outer iterations.
     *
     * @return x with one non-negative entry per column of {@code a}
     */
    public static RealVector nnls(RealMatrix a, RealVector b) {
        int k = a.getColumnDimension();
        RealVector x = new ArrayRealVector(k);
        if (k == 0) {
            return x;
        }
        boolean[] free = new boolean[k];
        int maxIterations = 3 * k + 1;

        for (int outer = 0; outer < maxIterations; outer++) {
            RealVector residual = b.subtract(a.operate(x));
            RealVector gradient = a.transpose().operate(residual);

            int best = -1;
            double bestGradient = GRADIENT_TOLERANCE;
            for (int j = 0; j < k; j++) {
                if (!free[j] && gradient.getEntry(j) > bestGradient) {
                    bestGradient = gradient.getEntry(j);
                    best = j;
                }
            }
            if (best < 0) {
                break;
            }
            free[best] = true;

            for (int inner = 0; inner < maxIterations; inner++) {
                int[] freeIdx = indices(free);
                if (freeIdx.length == 0) {
                    break;
                }
                RealVector s = solveFreeSet(a, b, freeIdx);
                if (s == null) {
                    break;
                }

                boolean feasible = true;
                for (int i = 0; i < s.getDimension(); i++) {
                    if (s.getEntry(i) < 0) {
                        feasible = false;
                        break;
                    }
                }
                if (feasible) {
                    for (int i = 0; i < freeIdx.length; i++) {
                        x.setEntry(freeIdx[i], s.getEntry(i));
                    }
                    break;
                }

                // Step from x towards s until the first free variable hits zero
                double alpha = 1.0;
                for (int i = 0; i < freeIdx.length; i++) {
                    double xj = x.getEntry(freeIdx[i]);
                    double sj = s.getEntry(i);
                    if (sj <= 0 && xj > 0) {
                        alpha = Math.min(alpha, xj / (xj - sj));
                    }
                }
                for (int i = 0; i < freeIdx.length; i++) {
                    int j = freeIdx[i];
                    double xj = x.getEntry(j) + alpha * (s.getEntry(i) - x.getEntry(j));
                    if (xj <= ZERO_TOLERANCE) {
                        free[j] = false;
                        xj = 0.0;
                    }
                    x.setEntry(j, xj);
                }
            }
        }
        return x;
    }

    /**
     * Design matrix whose columns are the given vectors.
     */
    public static RealMatrix columns(List<RealVector> columns, int rows) {
        RealMatrix m = new Array2DRowRealMatrix(rows, columns.size());
        for (int j = 0; j < columns.size(); j++) {
            m.setColumnVector(j, columns.get(j));
        }
        return m;
    }

    public static double meanSquare(RealVector v) {
        int n = v.getDimension();
        return n == 0 ? 0.0 : v.dotProduct(v) / n;
    }

    // Unconstrained least squares over the free columns via the normal equations
    private static RealVector solveFreeSet(RealMatrix a, RealVector b, int[] freeIdx) {
        List<RealVector> cols = new ArrayList<>(freeIdx.length);
        for (int j : freeIdx) {
            cols.add(a.getColumnVector(j));
        }
        RealMatrix sub = columns(cols, a.getRowDimension());
        RealMatrix normal = sub.transpose().multiply(sub);
        RealVector rhs = sub.transpose().operate(b);
        return gaussSolve(normal, rhs);
    }

    private static int[] indices(boolean[] flags) {
        int count = 0;
        for (boolean flag : flags) {
            if (flag) {
                count++;
            }
        }
        int[] out = new int[count];
        int i = 0;
        for (int j = 0; j < flags.length; j++) {
            if (flags[j]) {
                out[i++] = j;
            }
        }
        return out;
    }
}
