package org.cpoanalyzer.cli.rendering;

import org.cpoanalyzer.data.ParticleRecord;
import org.cpoanalyzer.polefigure.PoleFigureGrid;
import org.cpoanalyzer.projection.LambertGrid;

/**
 * Everything the renderer needs for one (timestep, particle) figure.
 *
 * @param figures  assembled pole figures with shared color scales.
 * @param grid     sampling grid the densities were computed on.
 * @param particle particle metadata.
 * @param timestep resolved timestep.
 * @param time     model time of the timestep.
 * @param options  display options.
 */
public record PoleFigurePlot(PoleFigureGrid figures, LambertGrid grid, ParticleRecord particle,
                             long timestep, double time, RenderOptions options) {
}
