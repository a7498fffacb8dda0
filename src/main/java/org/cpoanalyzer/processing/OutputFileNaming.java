package org.cpoanalyzer.processing;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.cpoanalyzer.cli.config.PoleFigureConfiguration;
import org.cpoanalyzer.polefigure.CrystalAxis;
import org.cpoanalyzer.polefigure.Mineral;

/**
 * Names of the figure files of one experiment:
 * <pre>
 * &lt;experiment&gt;&lt;output-dir&gt;&lt;prefix&gt;_&lt;elastic_|no-elastic_&gt;&lt;oli_ens_&gt;&lt;A-B-C-&gt;Axis_&lt;Scale&gt;_g&lt;gamma&gt;_sp&lt;n&gt;_t&lt;timestep:5&gt;.&lt;particle:5&gt;.png
 * </pre>
 *
 * @param experimentPath experiment directory including its trailing separator.
 * @param configuration  pole figure settings.
 */
public record OutputFileNaming(String experimentPath, PoleFigureConfiguration configuration) {

    public Path outputDirectory() {
        return Paths.get(experimentPath + configuration.figureOutputDir());
    }

    public Path figureFile(long timestep, long particleId) {
        StringBuilder minerals = new StringBuilder();
        for (Mineral mineral : configuration.minerals()) {
            minerals.append(mineral.fileTag()).append('_');
        }
        StringBuilder axes = new StringBuilder();
        for (CrystalAxis axis : configuration.axes()) {
            axes.append(axis.fileTag()).append('-');
        }
        String name = String.format("%s_%s%s%sAxis_%s_g%s_sp%d_t%05d.%05d.png",
                configuration.figureOutputPrefix(),
                configuration.elasticityHeader() ? "elastic_" : "no-elastic_",
                minerals,
                axes,
                configuration.colorScale().configName(),
                formatGamma(configuration.gamma()),
                configuration.spherePoints(),
                timestep,
                particleId);
        return Paths.get(experimentPath + configuration.figureOutputDir() + name);
    }

    /**
     * Integral values print without fraction ({@code 1}), others in shortest form ({@code 0.5}).
     */
    static String formatGamma(double gamma) {
        if (gamma == Math.rint(gamma) && !Double.isInfinite(gamma) && Math.abs(gamma) < 1e15) {
            return Long.toString((long) gamma);
        }
        return Double.toString(gamma);
    }
}
