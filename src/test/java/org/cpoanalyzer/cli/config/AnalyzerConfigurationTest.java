package org.cpoanalyzer.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.Map;

import org.cpoanalyzer.cli.rendering.ColorGradient;
import org.cpoanalyzer.polefigure.ColorScaleMethod;
import org.cpoanalyzer.polefigure.CrystalAxis;
import org.cpoanalyzer.polefigure.Mineral;
import org.cpoanalyzer.projection.Hemisphere;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

@Tag("unit")
class AnalyzerConfigurationTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    private static Config withDefaults(String hocon) {
        return ConfigFactory.parseString(hocon).withFallback(ConfigFactory.defaultReferenceUnresolved()).resolve();
    }

    @Test
    void fromConfig_readsUserSectionOverDefaults() {
        AnalyzerConfiguration configuration = AnalyzerConfiguration.fromConfig(
                ConfigLoader.load(ConfigLoaderTest.testResource("test-config.conf"), Map.of(), Path.of("")).config());

        assertThat(configuration.baseDir()).isEqualTo("/data/runs/");
        assertThat(configuration.experimentDirs()).containsExactly("run_1/", "run_2/");
        assertThat(configuration.compressed()).isTrue();
        assertThat(configuration.threads()).isEqualTo(3);
        assertThat(configuration.experimentPath("run_1/")).isEqualTo("/data/runs/run_1/");

        PoleFigureConfiguration poleFigures = configuration.poleFigures().orElseThrow();
        assertThat(poleFigures.times()).containsExactly(1e5, 2.5e5);
        assertThat(poleFigures.particleIds()).containsExactly(0L, 12L);
        assertThat(poleFigures.axes()).containsExactly(CrystalAxis.C_AXIS, CrystalAxis.A_AXIS);
        assertThat(poleFigures.minerals()).containsExactly(Mineral.OLIVINE);
        assertThat(poleFigures.colorScale()).isEqualTo(ColorGradient.VIK);
        assertThat(poleFigures.maxCountMethod()).isEqualTo(ColorScaleMethod.DIVIDE_2);
        assertThat(poleFigures.gamma()).isEqualTo(0.5);
        assertThat(poleFigures.spherePoints()).isEqualTo(101);
        assertThat(poleFigures.hemisphere()).isEqualTo(Hemisphere.LOWER);
        // defaults
        assertThat(poleFigures.timeDataFile()).isEqualTo("statistics");
        assertThat(poleFigures.timeDataMarker()).isEqualTo("particle_LPO");
        assertThat(poleFigures.grainDataFilePrefix()).isEqualTo("particle_CPO/weighted_CPO");
        assertThat(poleFigures.particleDataFilePrefix()).isEqualTo("particle_CPO/particles");
        assertThat(poleFigures.figureOutputDir()).isEqualTo("CPO_figures/");
        assertThat(poleFigures.figureOutputPrefix()).isEqualTo("weighted_LPO");
        assertThat(poleFigures.elasticityHeader()).isTrue();
        assertThat(poleFigures.smallFigure()).isFalse();
        assertThat(poleFigures.noDescriptionText()).isFalse();
    }

    @Test
    void fromConfig_withoutPoleFigureSection_isEmpty() {
        AnalyzerConfiguration configuration = AnalyzerConfiguration.fromConfig(withDefaults("{}"));

        assertThat(configuration.poleFigures()).isEmpty();
        assertThat(configuration.threads()).isZero();
    }

    @Test
    void poleFiguresOrDefaults_fallsBackToDefaults() {
        PoleFigureConfiguration defaults = AnalyzerConfiguration.poleFiguresOrDefaults(withDefaults("{}"));

        assertThat(defaults.colorScale()).isEqualTo(ColorGradient.BATLOW);
        assertThat(defaults.axes()).containsExactly(CrystalAxis.A_AXIS, CrystalAxis.B_AXIS, CrystalAxis.C_AXIS);
        assertThat(defaults.minerals()).containsExactly(Mineral.OLIVINE, Mineral.ENSTATITE);
        assertThat(defaults.hemisphere()).isEqualTo(Hemisphere.UPPER);
        assertThat(defaults.spherePoints()).isEqualTo(301);
    }

    @Test
    void fromConfig_unknownColorScale_isBadValue() {
        Config config = withDefaults("cpo-analyzer.pole-figures.color-scale = Jet");

        assertThatThrownBy(() -> AnalyzerConfiguration.fromConfig(config))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("color-scale");
    }

    @Test
    void fromConfig_unknownAxis_isBadValue() {
        Config config = withDefaults("cpo-analyzer.pole-figures.axes = [AAxis, DAxis]");

        assertThatThrownBy(() -> AnalyzerConfiguration.fromConfig(config))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("DAxis");
    }

    @Test
    void fromConfig_tooFewSpherePoints_isBadValue() {
        Config config = withDefaults("cpo-analyzer.pole-figures.sphere-points = 1");

        assertThatThrownBy(() -> AnalyzerConfiguration.fromConfig(config))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("sphere-points");
    }

    @Test
    void fromConfig_wrongType_isWrongType() {
        Config config = withDefaults("cpo-analyzer.pole-figures.gamma = steep");

        assertThatThrownBy(() -> AnalyzerConfiguration.fromConfig(config))
                .isInstanceOf(ConfigException.WrongType.class);
    }
}
