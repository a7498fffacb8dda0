package org.cpoanalyzer.polefigure;

/**
 * Density field of one (crystal axis, mineral) pair.
 * <p>
 * {@code maxCount} starts as the maximum of {@code counts} inside the projected disk and is
 * replaced by the shared maximum of the mineral's row once the grid is assembled.
 * The counts matrix is not copied and must not be modified after construction.
 *
 * @param axis     crystal axis.
 * @param mineral  mineral phase.
 * @param counts   density matrix indexed like the sampling grid.
 * @param maxCount maximum used for the color scale.
 */
public record PoleFigure(CrystalAxis axis, Mineral mineral, double[][] counts, double maxCount) {

    /**
     * Returns a copy that reports a different color-scale maximum.
     *
     * @param sharedMax the new maximum.
     * @return a pole figure sharing the same counts.
     */
    public PoleFigure withMaxCount(double sharedMax) {
        return new PoleFigure(axis, mineral, counts, sharedMax);
    }
}
