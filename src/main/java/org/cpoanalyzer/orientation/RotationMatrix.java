package org.cpoanalyzer.orientation;

import java.util.Arrays;

/**
 * Immutable 3x3 rotation matrix whose rows are the crystal a-, b- and c-axis unit vectors
 * expressed in the sample reference frame.
 * <p>
 * Instances built by {@link EulerRotations#toRotation(EulerAngles)} are orthonormal with
 * determinant +1. Instances built through {@link #of(double[][])} are taken as given;
 * the converter never validates its input.
 * <p>
 * <strong>Thread Safety:</strong> Immutable and thread-safe.
 */
public final class RotationMatrix {

    private final double[][] m;

    private RotationMatrix(double[][] m) {
        this.m = m;
    }

    /**
     * Creates a matrix from row-major values. The array is copied.
     *
     * @param values 3x3 row-major values.
     * @return the matrix.
     * @throws IllegalArgumentException if {@code values} is not 3x3.
     */
    public static RotationMatrix of(double[][] values) {
        if (values.length != 3) {
            throw new IllegalArgumentException("Rotation matrix must have 3 rows, got: " + values.length);
        }
        double[][] copy = new double[3][];
        for (int i = 0; i < 3; i++) {
            if (values[i].length != 3) {
                throw new IllegalArgumentException("Rotation matrix row " + i + " must have 3 columns, got: " + values[i].length);
            }
            copy[i] = values[i].clone();
        }
        return new RotationMatrix(copy);
    }

    /**
     * Returns one matrix entry.
     *
     * @param row    row index 0..2.
     * @param column column index 0..2.
     * @return the entry.
     */
    public double get(int row, int column) {
        return m[row][column];
    }

    /**
     * Returns a copy of one row. Row 0 is the a-axis, row 1 the b-axis, row 2 the c-axis.
     *
     * @param row row index 0..2.
     * @return a fresh three-element array.
     */
    public double[] row(int row) {
        return m[row].clone();
    }

    public double determinant() {
        return m[0][0] * (m[1][1] * m[2][2] - m[1][2] * m[2][1])
             - m[0][1] * (m[1][0] * m[2][2] - m[1][2] * m[2][0])
             + m[0][2] * (m[1][0] * m[2][1] - m[1][1] * m[2][0]);
    }

    /**
     * Largest absolute entry-wise difference to another matrix.
     *
     * @param other the matrix to compare with.
     * @return max |this[i][j] - other[i][j]|.
     */
    public double maxAbsDifference(RotationMatrix other) {
        double max = 0.0;
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                max = Math.max(max, Math.abs(m[i][j] - other.m[i][j]));
            }
        }
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RotationMatrix)) return false;
        return Arrays.deepEquals(m, ((RotationMatrix) o).m);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(m);
    }

    @Override
    public String toString() {
        return "RotationMatrix" + Arrays.deepToString(m);
    }
}
