package org.cpoanalyzer.polefigure;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.cpoanalyzer.data.GrainRecord;
import org.cpoanalyzer.orientation.EulerRotations;
import org.cpoanalyzer.orientation.RotationMatrix;

/**
 * Crystal axis unit vectors of all grains of one particle, grouped by mineral and axis.
 * <p>
 * Every grain's Euler angles are turned into a rotation matrix once; row {@code i} of that
 * matrix is the vector for {@link CrystalAxis} with {@code matrixRow() == i}.
 */
public final class GrainAxisVectors {

    private final Map<Mineral, double[][][]> byMineral;
    private final int grainCount;

    private GrainAxisVectors(Map<Mineral, double[][][]> byMineral, int grainCount) {
        this.byMineral = byMineral;
        this.grainCount = grainCount;
    }

    /**
     * Converts the grains of one particle.
     *
     * @param grains   grain records, all of the same particle.
     * @param minerals minerals to convert; every grain must carry angles for them.
     * @return the vectors.
     * @throws IllegalArgumentException if a grain lacks angles for a requested mineral.
     */
    public static GrainAxisVectors fromGrains(List<GrainRecord> grains, List<Mineral> minerals) {
        Map<Mineral, double[][][]> byMineral = new EnumMap<>(Mineral.class);
        int n = grains.size();
        for (Mineral mineral : minerals) {
            if (byMineral.containsKey(mineral)) {
                continue;
            }
            double[][][] axes = new double[CrystalAxis.values().length][n][];
            for (int g = 0; g < n; g++) {
                GrainRecord grain = grains.get(g);
                if (!grain.hasMineral(mineral)) {
                    throw new IllegalArgumentException("Grain of particle " + grain.particleId()
                            + " has no Euler angles for " + mineral.label());
                }
                RotationMatrix rotation = EulerRotations.toRotation(grain.angles(mineral));
                for (CrystalAxis axis : CrystalAxis.values()) {
                    axes[axis.matrixRow()][g] = rotation.row(axis.matrixRow());
                }
            }
            byMineral.put(mineral, axes);
        }
        return new GrainAxisVectors(byMineral, n);
    }

    /**
     * Axis vectors of one mineral, {@code n x 3}.
     *
     * @throws IllegalArgumentException if the mineral was not converted.
     */
    public double[][] vectors(Mineral mineral, CrystalAxis axis) {
        double[][][] axes = byMineral.get(mineral);
        if (axes == null) {
            throw new IllegalArgumentException("No vectors converted for " + mineral.label());
        }
        return axes[axis.matrixRow()];
    }

    public int grainCount() {
        return grainCount;
    }
}
