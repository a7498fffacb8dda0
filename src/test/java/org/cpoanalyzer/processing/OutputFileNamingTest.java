package org.cpoanalyzer.processing;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Paths;

import org.cpoanalyzer.cli.config.AnalyzerConfiguration;
import org.cpoanalyzer.cli.config.PoleFigureConfiguration;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
class OutputFileNamingTest {

    private static PoleFigureConfiguration configuration(String hocon) {
        return AnalyzerConfiguration.poleFiguresOrDefaults(ConfigFactory.parseString(hocon)
                .withFallback(ConfigFactory.defaultReferenceUnresolved()).resolve());
    }

    @Test
    void figureFile_defaultSettings() {
        OutputFileNaming naming = new OutputFileNaming("examples/example_experiment_1/", configuration("{}"));

        assertThat(naming.figureFile(1, 0)).isEqualTo(Paths.get("examples/example_experiment_1/CPO_figures/"
                + "weighted_LPO_elastic_oli_ens_A-B-C-Axis_Batlow_g1_sp301_t00001.00000.png"));
        assertThat(naming.outputDirectory()).isEqualTo(Paths.get("examples/example_experiment_1/CPO_figures/"));
    }

    @Test
    void figureFile_reflectsSelectionAndDisplaySettings() {
        OutputFileNaming naming = new OutputFileNaming("/data/run/", configuration("""
                cpo-analyzer.pole-figures {
                  elasticity-header = false
                  minerals = [Enstatite]
                  axes = [CAxis, AAxis]
                  color-scale = Roma
                  gamma = 0.5
                  sphere-points = 101
                  figure-output-dir = "figs/"
                  figure-output-prefix = "cpo"
                }
                """));

        assertThat(naming.figureFile(123, 45678)).isEqualTo(Paths.get(
                "/data/run/figs/cpo_no-elastic_ens_C-A-Axis_Roma_g0.5_sp101_t00123.45678.png"));
    }

    @Test
    void formatGamma_dropsFractionOfIntegralValues() {
        assertThat(OutputFileNaming.formatGamma(1.0)).isEqualTo("1");
        assertThat(OutputFileNaming.formatGamma(2.0)).isEqualTo("2");
        assertThat(OutputFileNaming.formatGamma(0.25)).isEqualTo("0.25");
        assertThat(OutputFileNaming.formatGamma(1.5)).isEqualTo("1.5");
    }
}
