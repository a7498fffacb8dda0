package org.cpoanalyzer.data;

import java.util.List;

import org.cpoanalyzer.orientation.EulerAngles;
import org.cpoanalyzer.polefigure.Mineral;

/**
 * Orientation of one mineral grain of a particle: one Euler angle triple per recorded
 * mineral phase, indexed by {@link Mineral#columnIndex()}.
 *
 * @param particleId   owning particle.
 * @param mineralAngles angles in radians, in mineral column order.
 */
public record GrainRecord(long particleId, List<EulerAngles> mineralAngles) {

    public GrainRecord {
        mineralAngles = List.copyOf(mineralAngles);
    }

    public boolean hasMineral(Mineral mineral) {
        return mineral.columnIndex() < mineralAngles.size();
    }

    /**
     * @throws IllegalArgumentException if the grain file had no columns for the mineral.
     */
    public EulerAngles angles(Mineral mineral) {
        if (!hasMineral(mineral)) {
            throw new IllegalArgumentException("No Euler angles recorded for " + mineral.label());
        }
        return mineralAngles.get(mineral.columnIndex());
    }
}
