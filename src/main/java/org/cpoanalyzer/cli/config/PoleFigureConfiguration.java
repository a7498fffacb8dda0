package org.cpoanalyzer.cli.config;

import java.util.ArrayList;
import java.util.List;

import org.cpoanalyzer.cli.rendering.ColorGradient;
import org.cpoanalyzer.polefigure.ColorScaleMethod;
import org.cpoanalyzer.polefigure.CrystalAxis;
import org.cpoanalyzer.polefigure.Mineral;
import org.cpoanalyzer.projection.Hemisphere;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Typed view of the {@code pole-figures} configuration section.
 *
 * @param timeDataFile           statistics file relative to the experiment directory.
 * @param timeDataMarker         token marking rows with particle output in the statistics file.
 * @param particleDataFilePrefix prefix of the particle metadata shards.
 * @param grainDataFilePrefix    prefix of the grain orientation shards.
 * @param shardFileExtension     extension of both shard kinds.
 * @param figureOutputDir        output directory relative to the experiment directory.
 * @param figureOutputPrefix     file name prefix of the figures.
 * @param colorScale             color gradient.
 * @param maxCountMethod         how the color scale top is derived from the shared maximum.
 * @param gamma                  power-law exponent applied before color lookup.
 * @param spherePoints           grid resolution per side.
 * @param hemisphere             projected hemisphere.
 * @param elasticityHeader       whether to draw the elasticity header.
 * @param smallFigure            500 px instead of 800 px per pole figure.
 * @param noDescriptionText      omit mineral and axis labels.
 * @param times                  requested model times.
 * @param particleIds            requested particles.
 * @param axes                   crystal axes, horizontal layout order.
 * @param minerals               minerals, vertical layout order.
 */
public record PoleFigureConfiguration(
        String timeDataFile,
        String timeDataMarker,
        String particleDataFilePrefix,
        String grainDataFilePrefix,
        String shardFileExtension,
        String figureOutputDir,
        String figureOutputPrefix,
        ColorGradient colorScale,
        ColorScaleMethod maxCountMethod,
        double gamma,
        int spherePoints,
        Hemisphere hemisphere,
        boolean elasticityHeader,
        boolean smallFigure,
        boolean noDescriptionText,
        List<Double> times,
        List<Long> particleIds,
        List<CrystalAxis> axes,
        List<Mineral> minerals) {

    public PoleFigureConfiguration {
        times = List.copyOf(times);
        particleIds = List.copyOf(particleIds);
        axes = List.copyOf(axes);
        minerals = List.copyOf(minerals);
    }

    /**
     * Reads the section. Every key must be present; defaults are merged in by
     * {@link AnalyzerConfiguration#fromConfig(Config)}.
     *
     * @param section the merged {@code pole-figures} section.
     * @return the typed view.
     * @throws ConfigException.Missing  if a key is absent.
     * @throws ConfigException.BadValue if an enum-like value is unknown.
     */
    public static PoleFigureConfiguration fromConfig(Config section) {
        List<CrystalAxis> axes = new ArrayList<>();
        for (String name : section.getStringList("axes")) {
            axes.add(parse(section, "axes", () -> CrystalAxis.fromConfigName(name)));
        }
        List<Mineral> minerals = new ArrayList<>();
        for (String name : section.getStringList("minerals")) {
            minerals.add(parse(section, "minerals", () -> Mineral.fromConfigName(name)));
        }
        List<Long> particleIds = new ArrayList<>();
        for (Number id : section.getNumberList("particle-ids")) {
            particleIds.add(id.longValue());
        }
        String colorScale = section.getString("color-scale");
        String hemisphere = section.getString("hemisphere");

        int spherePoints = section.getInt("sphere-points");
        if (spherePoints < 2) {
            throw new ConfigException.BadValue(section.origin(), "sphere-points",
                    "must be at least 2, got " + spherePoints);
        }

        return new PoleFigureConfiguration(
                section.getString("time-data-file"),
                section.getString("time-data-marker"),
                section.getString("particle-data-file-prefix"),
                section.getString("grain-data-file-prefix"),
                section.getString("shard-file-extension"),
                section.getString("figure-output-dir"),
                section.getString("figure-output-prefix"),
                parse(section, "color-scale", () -> ColorGradient.fromConfigName(colorScale)),
                ColorScaleMethod.fromConfigName(section.getString("max-count-method")),
                section.getDouble("gamma"),
                spherePoints,
                parse(section, "hemisphere", () -> Hemisphere.fromConfigValue(hemisphere)),
                section.getBoolean("elasticity-header"),
                section.getBoolean("small-figure"),
                section.getBoolean("no-description-text"),
                section.getDoubleList("times"),
                particleIds,
                axes,
                minerals);
    }

    private interface ValueParser<T> {
        T parse();
    }

    private static <T> T parse(Config section, String path, ValueParser<T> parser) {
        try {
            return parser.parse();
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(section.origin(), path, e.getMessage(), e);
        }
    }
}
