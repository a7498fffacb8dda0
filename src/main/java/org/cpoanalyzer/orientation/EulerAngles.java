package org.cpoanalyzer.orientation;

/**
 * Proper Euler angles in the Z-X-Z convention, all in radians.
 *
 * @param phi1  first rotation about Z.
 * @param theta rotation about the intermediate X axis.
 * @param phi2  second rotation about Z.
 */
public record EulerAngles(double phi1, double theta, double phi2) {

    private static final double DEG_TO_RAD = Math.PI / 180.0;

    /**
     * Creates Euler angles from values recorded in degrees, as found in grain shard files.
     *
     * @param phi1Deg  first angle in degrees.
     * @param thetaDeg second angle in degrees.
     * @param phi2Deg  third angle in degrees.
     * @return the angles converted to radians.
     */
    public static EulerAngles ofDegrees(double phi1Deg, double thetaDeg, double phi2Deg) {
        return new EulerAngles(phi1Deg * DEG_TO_RAD, thetaDeg * DEG_TO_RAD, phi2Deg * DEG_TO_RAD);
    }
}
