package org.cpoanalyzer.cli.rendering;

import org.cpoanalyzer.polefigure.ColorScaleMethod;

/**
 * Display options handed to the renderer with every plot.
 *
 * @param smallFigure       500 px instead of 800 px per pole figure.
 * @param noDescriptionText omit mineral and axis labels.
 * @param elasticityHeader  draw the particle/elasticity header.
 * @param gradient          color gradient.
 * @param maxCountMethod    color scale top derived from the shared maximum.
 * @param gamma             power-law exponent applied to normalized densities.
 */
public record RenderOptions(boolean smallFigure, boolean noDescriptionText, boolean elasticityHeader,
                            ColorGradient gradient, ColorScaleMethod maxCountMethod, double gamma) {
}
