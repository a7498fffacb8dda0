package org.cpoanalyzer.orientation;

/**
 * Conversion between Z-X-Z Euler angles and rotation matrices.
 * <p>
 * The forward direction is used for every grain orientation read from the shard files.
 * The inverse exists for round-trip checks and for tools that need angles back from a
 * matrix. It never fails: in the gimbal-lock configurations ({@code theta} equal to
 * 0 or pi) one degree of freedom is lost, so {@code phi1} is fixed at 0 and {@code phi2}
 * absorbs the whole in-plane rotation. The recomposed matrix still matches the input.
 * <p>
 * <strong>Thread Safety:</strong> Stateless and thread-safe.
 */
public final class EulerRotations {

    /**
     * {@code sin(theta)} below this value is treated as a degenerate configuration.
     * Dividing by a smaller sine amplifies round-off in the generic formulas.
     */
    static final double DEGENERACY_TOLERANCE = 1e-12;

    private static final double TWO_PI = 2.0 * Math.PI;

    private EulerRotations() {
    }

    /**
     * Classification of {@code theta} that selects the inverse formula.
     */
    public enum ThetaClass {
        /** theta == 0: both Z rotations act about the same axis. */
        ZERO,
        /** theta == pi: the Z rotations act about opposite axes. */
        PI,
        /** Any other theta: all three angles are recoverable. */
        GENERIC;

        /**
         * Classifies a theta value in [0, pi].
         *
         * @param theta the angle in radians.
         * @return the class.
         */
        public static ThetaClass of(double theta) {
            if (Math.abs(Math.sin(theta)) > DEGENERACY_TOLERANCE) {
                return GENERIC;
            }
            return theta < Math.PI / 2 ? ZERO : PI;
        }
    }

    /**
     * Builds the rotation matrix for the given angles.
     *
     * @param angles Z-X-Z angles in radians.
     * @return the rotation matrix; rows are the a-, b- and c-axes.
     */
    public static RotationMatrix toRotation(EulerAngles angles) {
        double c1 = Math.cos(angles.phi1());
        double s1 = Math.sin(angles.phi1());
        double ct = Math.cos(angles.theta());
        double st = Math.sin(angles.theta());
        double c2 = Math.cos(angles.phi2());
        double s2 = Math.sin(angles.phi2());

        return RotationMatrix.of(new double[][] {
            {c2 * c1 - ct * s1 * s2, -c2 * s1 - ct * c1 * s2, -s2 * st},
            {s2 * c1 + ct * s1 * c2, -s2 * s1 + ct * c1 * c2, c2 * st},
            {-st * s1, -st * c1, ct}
        });
    }

    /**
     * Recovers Z-X-Z angles from a rotation matrix. All returned angles lie in [0, 2pi).
     *
     * @param rotation the matrix.
     * @return angles that recompose to {@code rotation}.
     */
    public static EulerAngles fromRotation(RotationMatrix rotation) {
        // atan2 keeps theta accurate near 0 and pi, where acos(m22) rounds to the boundary
        double theta = Math.atan2(Math.hypot(rotation.get(2, 0), rotation.get(2, 1)), rotation.get(2, 2));
        double phi1;
        double phi2;

        switch (ThetaClass.of(theta)) {
            case GENERIC -> {
                phi1 = Math.atan2(-rotation.get(2, 0), -rotation.get(2, 1));
                phi2 = Math.atan2(-rotation.get(0, 2), rotation.get(1, 2));
            }
            case ZERO -> {
                phi1 = 0.0;
                phi2 = -Math.atan2(rotation.get(0, 1), rotation.get(0, 0));
            }
            case PI -> {
                phi1 = 0.0;
                phi2 = Math.atan2(rotation.get(0, 1), rotation.get(0, 0));
            }
            default -> throw new IllegalStateException("Unhandled theta class");
        }

        return new EulerAngles(normalize(phi1), normalize(theta), normalize(phi2));
    }

    /**
     * Wraps an angle into [0, 2pi).
     */
    static double normalize(double angle) {
        double wrapped = angle - TWO_PI * Math.floor(angle / TWO_PI);
        // floor() round-off can land exactly on 2pi
        return wrapped >= TWO_PI ? 0.0 : wrapped;
    }
}
