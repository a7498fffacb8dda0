package org.cpoanalyzer.polefigure;

import java.util.List;

import org.cpoanalyzer.projection.LambertGrid;
import org.cpoanalyzer.statistics.GaussianOrientationDensity;

/**
 * Builds the {@code [axis][mineral]} grid of pole figures for one particle at one timestep
 * and gives all axes of a mineral a common color scale.
 */
public final class PoleFigureAssembler {

    private PoleFigureAssembler() {
    }

    /**
     * Estimates one density field per (axis, mineral) pair and shares the color scale.
     *
     * @param axes     axes in layout column order.
     * @param minerals minerals in layout row order.
     * @param vectors  grain axis vectors of the particle; must contain every mineral.
     * @param grid     the shared sampling grid.
     * @return the assembled grid.
     */
    public static PoleFigureGrid assemble(List<CrystalAxis> axes, List<Mineral> minerals,
                                          GrainAxisVectors vectors, LambertGrid grid) {
        PoleFigure[][] figures = new PoleFigure[axes.size()][minerals.size()];
        for (int a = 0; a < axes.size(); a++) {
            for (int m = 0; m < minerals.size(); m++) {
                CrystalAxis axis = axes.get(a);
                Mineral mineral = minerals.get(m);
                double[][] counts = GaussianOrientationDensity.estimate(vectors.vectors(mineral, axis), grid);
                figures[a][m] = new PoleFigure(axis, mineral, counts, GaussianOrientationDensity.maxValid(counts, grid));
            }
        }
        return new PoleFigureGrid(axes, minerals, shareColorScale(figures), vectors.grainCount());
    }

    /**
     * For every mineral, replaces {@code maxCount} of each of its figures with the largest
     * {@code maxCount} over all axes of that mineral. Pure: the input array is not modified.
     *
     * @param figures {@code figures[axisIndex][mineralIndex]}, rectangular.
     * @return a new array with shared maxima.
     */
    public static PoleFigure[][] shareColorScale(PoleFigure[][] figures) {
        int axisCount = figures.length;
        int mineralCount = axisCount == 0 ? 0 : figures[0].length;
        PoleFigure[][] shared = new PoleFigure[axisCount][mineralCount];

        for (int m = 0; m < mineralCount; m++) {
            double max = 0.0;
            for (int a = 0; a < axisCount; a++) {
                max = Math.max(max, figures[a][m].maxCount());
            }
            for (int a = 0; a < axisCount; a++) {
                shared[a][m] = figures[a][m].withMaxCount(max);
            }
        }
        return shared;
    }
}
