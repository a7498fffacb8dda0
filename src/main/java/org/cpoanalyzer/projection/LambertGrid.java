package org.cpoanalyzer.projection;

/**
 * Square sampling grid in the Lambert equal-area projection together with the
 * corresponding unit vectors on one hemisphere.
 * <p>
 * The grid spans {@code [-sqrt(2), sqrt(2)]} along both planar axes, which is exactly the
 * projected disk of the full unit sphere. Cells outside that disk keep their position in
 * the arrays (downstream code indexes by row and column) but are flagged invalid by
 * {@link #isValid(int, int)}.
 * <p>
 * Row 0 is the top of the figure: the planar Z coordinate decreases with the row index
 * while the planar X coordinate increases with the column index.
 * <p>
 * <strong>Thread Safety:</strong> Immutable after construction. One instance is shared
 * read-only across all experiments, particles and axes of a run.
 */
public final class LambertGrid {

    /** Radius of the projected unit sphere. */
    public static final double PLANE_RADIUS = Math.sqrt(2.0);

    /** Slack added to {@link #PLANE_RADIUS} when deciding whether a cell is inside the disk. */
    public static final double MASK_EPSILON = 0.001;

    private final int size;
    private final Hemisphere hemisphere;
    private final double[] xPlane;
    private final double[] zPlane;
    private final double[] x;
    private final double[] y;
    private final double[] z;
    private final boolean[] valid;

    private LambertGrid(int size, Hemisphere hemisphere, double[] xPlane, double[] zPlane,
                        double[] x, double[] y, double[] z, boolean[] valid) {
        this.size = size;
        this.hemisphere = hemisphere;
        this.xPlane = xPlane;
        this.zPlane = zPlane;
        this.x = x;
        this.y = y;
        this.z = z;
        this.valid = valid;
    }

    /**
     * Builds an {@code n x n} grid and maps it onto the requested hemisphere.
     *
     * @param n          number of sphere points per side, at least 2.
     * @param hemisphere target hemisphere.
     * @return the grid.
     * @throws IllegalArgumentException if {@code n < 2}.
     */
    public static LambertGrid build(int n, Hemisphere hemisphere) {
        if (n < 2) {
            throw new IllegalArgumentException("Sphere points must be at least 2, got: " + n);
        }
        int cells = n * n;
        double[] xPlane = new double[cells];
        double[] zPlane = new double[cells];
        double[] x = new double[cells];
        double[] y = new double[cells];
        double[] z = new double[cells];
        boolean[] valid = new boolean[cells];

        double step = 2.0 * PLANE_RADIUS / (n - 1);
        // the lower hemisphere mirrors both y and the planar z axis
        double sign = hemisphere == Hemisphere.UPPER ? 1.0 : -1.0;

        for (int row = 0; row < n; row++) {
            // last row/column pinned to the edge so the mesh is symmetric
            double planeZ = row == n - 1 ? -PLANE_RADIUS : PLANE_RADIUS - row * step;
            for (int col = 0; col < n; col++) {
                double planeX = col == n - 1 ? PLANE_RADIUS : -PLANE_RADIUS + col * step;
                int idx = row * n + col;
                xPlane[idx] = planeX;
                zPlane[idx] = planeZ;

                double r2 = planeX * planeX + planeZ * planeZ;
                double scale = Math.sqrt(Math.max(0.0, 1.0 - r2 / 4.0));

                double px = scale * planeX;
                double py = sign * (1.0 - r2 / 2.0);
                double pz = scale * sign * planeZ;

                double magnitude = Math.sqrt(px * px + py * py + pz * pz);
                x[idx] = px / magnitude;
                y[idx] = py / magnitude;
                z[idx] = pz / magnitude;

                valid[idx] = Math.sqrt(r2) < PLANE_RADIUS + MASK_EPSILON;
            }
        }
        return new LambertGrid(n, hemisphere, xPlane, zPlane, x, y, z, valid);
    }

    public int size() {
        return size;
    }

    public int cellCount() {
        return size * size;
    }

    public Hemisphere hemisphere() {
        return hemisphere;
    }

    public double planeX(int row, int col) {
        return xPlane[index(row, col)];
    }

    public double planeZ(int row, int col) {
        return zPlane[index(row, col)];
    }

    /**
     * Returns the unit vector of a cell.
     *
     * @param row row index.
     * @param col column index.
     * @return fresh {@code {x, y, z}} array.
     */
    public double[] point(int row, int col) {
        int idx = index(row, col);
        return new double[] {x[idx], y[idx], z[idx]};
    }

    /**
     * Unit vector component by flat cell index ({@code row * size + col}), for tight loops.
     *
     * @param cell      flat index.
     * @param component 0 = x, 1 = y, 2 = z.
     * @return the component.
     */
    public double component(int cell, int component) {
        return switch (component) {
            case 0 -> x[cell];
            case 1 -> y[cell];
            case 2 -> z[cell];
            default -> throw new IndexOutOfBoundsException("Component must be 0..2, got: " + component);
        };
    }

    /**
     * Whether the cell lies inside the projected disk and therefore takes part in plots.
     */
    public boolean isValid(int row, int col) {
        return valid[index(row, col)];
    }

    private int index(int row, int col) {
        if (row < 0 || row >= size || col < 0 || col >= size) {
            throw new IndexOutOfBoundsException("Cell (" + row + ", " + col + ") outside " + size + "x" + size + " grid");
        }
        return row * size + col;
    }
}
