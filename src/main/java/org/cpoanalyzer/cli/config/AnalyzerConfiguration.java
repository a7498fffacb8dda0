package org.cpoanalyzer.cli.config;

import java.util.List;
import java.util.Optional;

import com.typesafe.config.Config;

/**
 * Typed view of the {@code cpo-analyzer} configuration block.
 *
 * @param baseDir        directory that all experiment directories are relative to.
 * @param experimentDirs experiment directories; each is processed independently.
 * @param compressed     whether grain shards are zlib-compressed.
 * @param threads        worker pool size, 0 for the number of available processors.
 * @param poleFigures    pole figure settings, empty if the section is absent.
 */
public record AnalyzerConfiguration(String baseDir, List<String> experimentDirs, boolean compressed,
                                    int threads, Optional<PoleFigureConfiguration> poleFigures) {

    public static final String ROOT_PATH = "cpo-analyzer";
    private static final String POLE_FIGURES = "pole-figures";
    private static final String POLE_FIGURE_DEFAULTS = "pole-figure-defaults";

    public AnalyzerConfiguration {
        experimentDirs = List.copyOf(experimentDirs);
    }

    /**
     * Reads the {@code cpo-analyzer} block. A user {@code pole-figures} section is merged over
     * {@code pole-figure-defaults} from {@code reference.conf}.
     *
     * @param config the application config.
     * @return the typed view.
     * @throws com.typesafe.config.ConfigException if keys are missing or have the wrong type.
     */
    public static AnalyzerConfiguration fromConfig(Config config) {
        Config root = config.getConfig(ROOT_PATH);
        Optional<PoleFigureConfiguration> poleFigures = Optional.empty();
        if (root.hasPath(POLE_FIGURES)) {
            Config section = root.getConfig(POLE_FIGURES).withFallback(root.getConfig(POLE_FIGURE_DEFAULTS));
            poleFigures = Optional.of(PoleFigureConfiguration.fromConfig(section));
        }
        return new AnalyzerConfiguration(
                root.getString("base-dir"),
                root.getStringList("experiment-dirs"),
                root.getBoolean("compressed"),
                root.getInt("threads"),
                poleFigures);
    }

    /**
     * The user {@code pole-figures} section merged over the defaults, or the defaults alone
     * if the user configured none.
     *
     * @param config the application config.
     * @return the pole figure settings.
     */
    public static PoleFigureConfiguration poleFiguresOrDefaults(Config config) {
        Config root = config.getConfig(ROOT_PATH);
        Config defaults = root.getConfig(POLE_FIGURE_DEFAULTS);
        return PoleFigureConfiguration.fromConfig(
                root.hasPath(POLE_FIGURES) ? root.getConfig(POLE_FIGURES).withFallback(defaults) : defaults);
    }

    /**
     * Full path prefix of one experiment: {@code baseDir + experimentDir}.
     */
    public String experimentPath(String experimentDir) {
        return baseDir + experimentDir;
    }
}
