package org.cpoanalyzer.statistics;

import org.cpoanalyzer.projection.LambertGrid;

/**
 * Smoothed orientation density of axial unit vectors on a {@link LambertGrid}, using the
 * spherical Gaussian weighting function of Robin and Jowett (1986), "Computerized
 * contouring and statistical evaluation of orientation data using contouring circles
 * and continuous weighting functions", Tectonophysics.
 * <p>
 * The kernel concentration {@code k = min(100, 2 * (1 + n / 9))} grows with the number of
 * vectors and is capped at 100. The summed weights are divided by three standard
 * deviations of the count expected for a uniform distribution, so the result is in
 * "multiples of 3 sigma". Both constants define the output units and must not change.
 * <p>
 * The absolute value of the dot product makes the statistic antipodal-symmetric: a
 * crystal axis and its opposite contribute equally.
 * <p>
 * Every grid cell is evaluated, including cells outside the projected disk; masking
 * is left to the consumer.
 * <p>
 * <strong>Thread Safety:</strong> Stateless and thread-safe.
 */
public final class GaussianOrientationDensity {

    /** Upper bound of the kernel concentration parameter. */
    public static final double MAX_CONCENTRATION = 100.0;

    private GaussianOrientationDensity() {
    }

    /**
     * Kernel concentration for {@code n} vectors (Robin and Jowett, table 3).
     *
     * @param n number of vectors, at least 1.
     * @return {@code min(100, 2 * (1 + n / 9))}.
     */
    public static double concentration(int n) {
        return Math.min(MAX_CONCENTRATION, 2.0 * (1.0 + n / 9.0));
    }

    /**
     * Standard deviation of the count for a uniform distribution (Robin and Jowett, eq. 13b).
     *
     * @param n number of vectors.
     * @param k kernel concentration, strictly greater than 2.
     * @return {@code sqrt(n * (k / 2 - 1) / k^2)}.
     */
    public static double standardDeviation(int n, double k) {
        return Math.sqrt(n * (k / 2.0 - 1.0) / (k * k));
    }

    /**
     * Computes the density field.
     *
     * @param vectors unit vectors, one {@code {x, y, z}} triple per grain.
     * @param grid    the sampling grid.
     * @return a {@code size x size} matrix indexed like the grid.
     * @throws IllegalArgumentException if {@code vectors} is empty or a vector is not three-dimensional.
     */
    public static double[][] estimate(double[][] vectors, LambertGrid grid) {
        int n = vectors.length;
        if (n < 1) {
            throw new IllegalArgumentException("Density estimation needs at least one vector");
        }
        for (double[] v : vectors) {
            if (v.length != 3) {
                throw new IllegalArgumentException("Orientation vectors must have 3 components, got: " + v.length);
            }
        }

        double k = concentration(n);
        double normalization = 3.0 * standardDeviation(n, k);

        int size = grid.size();
        double[][] counts = new double[size][size];
        for (int cell = 0; cell < grid.cellCount(); cell++) {
            double gx = grid.component(cell, 0);
            double gy = grid.component(cell, 1);
            double gz = grid.component(cell, 2);

            double sum = 0.0;
            for (double[] v : vectors) {
                double cosAlpha = Math.abs(v[0] * gx + v[1] * gy + v[2] * gz);
                sum += Math.exp(k * (cosAlpha - 1.0));
            }
            counts[cell / size][cell % size] = sum / normalization;
        }
        return counts;
    }

    /**
     * Maximum entry over the cells inside the projected disk.
     *
     * @param counts density matrix from {@link #estimate(double[][], LambertGrid)}.
     * @param grid   the grid the matrix was computed on.
     * @return the maximum, or 0 if no cell is valid.
     */
    public static double maxValid(double[][] counts, LambertGrid grid) {
        double max = 0.0;
        for (int row = 0; row < grid.size(); row++) {
            for (int col = 0; col < grid.size(); col++) {
                if (grid.isValid(row, col) && counts[row][col] > max) {
                    max = counts[row][col];
                }
            }
        }
        return max;
    }
}
